package io.intellixity.vartopic.schema.parse;

import java.util.Optional;

/** Recognises a single field declaration line of a schema. */
@FunctionalInterface
public interface LineMatcher {
  /** The declared field, or empty for blank, comment, constant or unrecognised lines. */
  Optional<FieldMatch> match(String line);
}

package io.intellixity.vartopic.schema.checksum;

import io.intellixity.vartopic.schema.SchemaIdentity;

/** Computes the content checksum of a resolved schema. */
@FunctionalInterface
public interface ChecksumCalculator {
  /** A 32 character checksum for a resolved, non-empty {@code identity}. */
  String compute(SchemaIdentity identity);
}

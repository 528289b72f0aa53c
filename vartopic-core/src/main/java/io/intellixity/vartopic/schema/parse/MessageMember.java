package io.intellixity.vartopic.schema.parse;

/** A declared member of a message: a field or a constant. */
public interface MessageMember {
  String name();

  /** Declared type, including any array suffix. */
  String type();
}

package io.intellixity.vartopic.schema.parse;

import io.intellixity.vartopic.error.InvalidMessageMemberException;

/** A constant declaration; {@code value} is the literal text as written. */
public record MessageConstant(String name, String type, String value) implements MessageMember {
  public MessageConstant {
    if (name == null || name.isBlank() || type == null || type.isBlank()) {
      throw new InvalidMessageMemberException();
    }
    value = value == null ? "" : value;
  }
}

package io.intellixity.vartopic.schema.parse;

import io.intellixity.vartopic.error.InvalidMessageMemberException;

public record MessageField(String name, String elementType, boolean array, int arraySize) implements MessageMember {
  public MessageField {
    if (name == null || name.isBlank() || elementType == null || elementType.isBlank()) {
      throw new InvalidMessageMemberException();
    }
  }

  static MessageField of(FieldMatch m) {
    return new MessageField(m.memberName(), m.memberType(), m.array(), m.arraySize());
  }

  @Override
  public String type() {
    return new FieldMatch(elementType, name, array, arraySize).declaredType();
  }
}

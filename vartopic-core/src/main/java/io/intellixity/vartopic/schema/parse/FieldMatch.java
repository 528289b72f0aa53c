package io.intellixity.vartopic.schema.parse;

/**
 * A recognised field declaration: {@code type name} or {@code type[size] name}.
 *
 * @param memberType referenced type without array suffix
 * @param arraySize  fixed array length, or 0 for unbounded arrays and scalars
 */
public record FieldMatch(String memberType, String memberName, boolean array, int arraySize) {
  public static FieldMatch scalar(String memberType, String memberName) {
    return new FieldMatch(memberType, memberName, false, 0);
  }

  public static FieldMatch array(String memberType, String memberName, int arraySize) {
    return new FieldMatch(memberType, memberName, true, arraySize);
  }

  /** Declared type as written, including any array suffix. */
  public String declaredType() {
    if (!array) return memberType;
    return memberType + "[" + (arraySize > 0 ? Integer.toString(arraySize) : "") + "]";
  }
}

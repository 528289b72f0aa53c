package io.intellixity.vartopic.error;

public final class InvalidDataTypeException extends VartopicException {
  public InvalidDataTypeException() {
    super("Attempted use of an invalid data type");
  }

  public InvalidDataTypeException(String detail, Throwable cause) {
    super("Attempted use of an invalid data type: " + detail, cause);
  }
}

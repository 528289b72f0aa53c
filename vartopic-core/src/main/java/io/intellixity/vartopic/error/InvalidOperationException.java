package io.intellixity.vartopic.error;

public final class InvalidOperationException extends VartopicException {
  public InvalidOperationException() {
    super("Attempted execution of an invalid operation");
  }

  public InvalidOperationException(String detail) {
    super("Attempted execution of an invalid operation: " + detail);
  }
}

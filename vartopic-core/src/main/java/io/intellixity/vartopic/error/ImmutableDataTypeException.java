package io.intellixity.vartopic.error;

public final class ImmutableDataTypeException extends VartopicException {
  public ImmutableDataTypeException() {
    super("Attempted modification of an immutable data type");
  }
}

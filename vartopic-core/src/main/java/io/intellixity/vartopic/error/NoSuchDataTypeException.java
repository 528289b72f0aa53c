package io.intellixity.vartopic.error;

public final class NoSuchDataTypeException extends VartopicException {
  private final String identifier;

  public NoSuchDataTypeException(String identifier) {
    super("Data type [" + identifier + "] does not exist");
    this.identifier = identifier;
  }

  public String identifier() { return identifier; }
}

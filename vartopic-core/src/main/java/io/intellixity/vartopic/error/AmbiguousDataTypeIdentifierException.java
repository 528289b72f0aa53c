package io.intellixity.vartopic.error;

public final class AmbiguousDataTypeIdentifierException extends VartopicException {
  private final String identifier;

  public AmbiguousDataTypeIdentifierException(String identifier) {
    super("Data type identifier [" + identifier + "] is used ambiguously");
    this.identifier = identifier;
  }

  public String identifier() { return identifier; }
}

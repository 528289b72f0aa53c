package io.intellixity.vartopic.error;

public final class DefinitionParseException extends VartopicException {
  private final String dataType;
  private final String line;
  private final String reason;

  public DefinitionParseException(String dataType, String line, String reason) {
    super("Error parsing the definition for [" + dataType + "]: " + reason + "\n" + line);
    this.dataType = dataType;
    this.line = line;
    this.reason = reason;
  }

  public String dataType() { return dataType; }
  public String line() { return line; }
  public String reason() { return reason; }
}

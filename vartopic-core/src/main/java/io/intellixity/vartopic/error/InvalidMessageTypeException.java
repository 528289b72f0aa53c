package io.intellixity.vartopic.error;

public final class InvalidMessageTypeException extends VartopicException {
  private final String messageType;

  public InvalidMessageTypeException(String messageType) {
    super("Message type [" + messageType + "] is invalid");
    this.messageType = messageType;
  }

  public String messageType() { return messageType; }
}

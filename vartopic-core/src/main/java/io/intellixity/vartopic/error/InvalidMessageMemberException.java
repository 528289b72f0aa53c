package io.intellixity.vartopic.error;

public final class InvalidMessageMemberException extends VartopicException {
  public InvalidMessageMemberException() {
    super("Attempted use of an invalid message member");
  }
}

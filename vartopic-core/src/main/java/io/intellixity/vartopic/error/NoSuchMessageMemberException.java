package io.intellixity.vartopic.error;

public final class NoSuchMessageMemberException extends VartopicException {
  private final int index;

  public NoSuchMessageMemberException(int index) {
    super("Member with index [" + index + "] does not exist");
    this.index = index;
  }

  public int index() { return index; }
}

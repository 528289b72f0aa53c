package io.intellixity.vartopic.error;

/** Lookup of a message field by index or by name failed; exactly one of the two is set. */
public final class NoSuchMessageFieldException extends VartopicException {
  private final Integer index;
  private final String name;

  public NoSuchMessageFieldException(int index) {
    super("Field with index [" + index + "] does not exist");
    this.index = index;
    this.name = null;
  }

  public NoSuchMessageFieldException(String name) {
    super("Field with name [" + name + "] does not exist");
    this.index = null;
    this.name = name;
  }

  /** Index of the missing field, or null when looked up by name. */
  public Integer index() { return index; }

  /** Name of the missing field, or null when looked up by index. */
  public String name() { return name; }
}

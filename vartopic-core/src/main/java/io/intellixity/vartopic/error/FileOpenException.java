package io.intellixity.vartopic.error;

public final class FileOpenException extends VartopicException {
  private final String filename;

  public FileOpenException(String filename) {
    super("Error opening file [" + filename + "]");
    this.filename = filename;
  }

  public FileOpenException(String filename, Throwable cause) {
    super("Error opening file [" + filename + "]", cause);
    this.filename = filename;
  }

  public String filename() { return filename; }
}

package io.intellixity.vartopic.error;

/** The checksum of a resolved schema differs from the one a peer or recording announced. */
public final class ChecksumMismatchException extends VartopicException {
  private final String expected;
  private final String provided;

  public ChecksumMismatchException(String expected, String provided) {
    super("Provided MD5 sum [" + provided + "] mismatches expected MD5 sum [" + expected + "]");
    this.expected = expected;
    this.provided = provided;
  }

  public String expected() { return expected; }
  public String provided() { return provided; }
}

package io.intellixity.vartopic.error;

public final class DataTypeMismatchException extends VartopicException {
  private final String expected;
  private final String provided;

  public DataTypeMismatchException(String expected, String provided) {
    super("Provided data type [" + provided + "] mismatches expected data type [" + expected + "]");
    this.expected = expected;
    this.provided = provided;
  }

  public String expected() { return expected; }
  public String provided() { return provided; }
}

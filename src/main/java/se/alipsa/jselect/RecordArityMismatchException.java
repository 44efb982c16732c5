package se.alipsa.jselect;

/**
 * Raised when a record line has a different number of tokens than the schema
 * it is decoded against. The stream is aborted when this happens.
 */
public class RecordArityMismatchException extends DecodeException {

  private static final long serialVersionUID = 1L;

  private final long lineNumber;
  private final int expected;
  private final int actual;

  /**
   * Create a new exception.
   *
   * @param lineNumber
   *          1-based line number in the response stream
   * @param expected
   *          number of fields in the schema
   * @param actual
   *          number of tokens found on the line
   */
  public RecordArityMismatchException(long lineNumber, int expected, int actual) {
    super("Record at line " + lineNumber + " has " + actual + " tokens, expected " + expected);
    this.lineNumber = lineNumber;
    this.expected = expected;
    this.actual = actual;
  }

  public long lineNumber() {
    return lineNumber;
  }

  public int expected() {
    return expected;
  }

  public int actual() {
    return actual;
  }
}

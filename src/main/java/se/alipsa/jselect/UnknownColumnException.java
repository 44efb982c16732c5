package se.alipsa.jselect;

/** Raised when a column name does not match any field of the schema. */
public class UnknownColumnException extends TranslationException {

  private static final long serialVersionUID = 1L;

  private final String column;

  /**
   * Create a new exception for the missing column.
   *
   * @param column
   *          the name that could not be resolved
   */
  public UnknownColumnException(String column) {
    super("Unknown column: " + column);
    this.column = column;
  }

  public String column() {
    return column;
  }
}

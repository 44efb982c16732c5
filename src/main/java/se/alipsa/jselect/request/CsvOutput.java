package se.alipsa.jselect.request;

/**
 * Output serialization of the query result.
 *
 * @param recordDelimiter
 *          the record delimiter
 * @param fieldDelimiter
 *          the field delimiter
 */
public record CsvOutput(char recordDelimiter, char fieldDelimiter) {

  /**
   * Validates the components.
   *
   * @param recordDelimiter
   *          record delimiter
   * @param fieldDelimiter
   *          field delimiter
   */
  public CsvOutput {
    if (recordDelimiter == fieldDelimiter) {
      throw new IllegalArgumentException("Record and field delimiter must differ");
    }
  }

  /**
   * Newline separated records with the given field delimiter.
   *
   * @param fieldDelimiter
   *          field delimiter
   * @return the output serialization
   */
  public static CsvOutput of(char fieldDelimiter) {
    return new CsvOutput('\n', fieldDelimiter);
  }
}

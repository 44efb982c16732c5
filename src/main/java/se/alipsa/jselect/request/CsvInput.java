package se.alipsa.jselect.request;

import java.util.Objects;

/**
 * Input serialization of a delimited text object.
 *
 * @param headerInfo
 *          whether the first line is a header
 * @param recordDelimiter
 *          the record delimiter
 * @param fieldDelimiter
 *          the field delimiter
 */
public record CsvInput(HeaderInfo headerInfo, char recordDelimiter, char fieldDelimiter) {

  /**
   * Validates the components.
   *
   * @param headerInfo
   *          header mode
   * @param recordDelimiter
   *          record delimiter
   * @param fieldDelimiter
   *          field delimiter
   */
  public CsvInput {
    Objects.requireNonNull(headerInfo, "headerInfo");
    if (recordDelimiter == fieldDelimiter) {
      throw new IllegalArgumentException("Record and field delimiter must differ");
    }
  }

  /**
   * Newline separated records with the given field delimiter.
   *
   * @param headerInfo
   *          header mode
   * @param fieldDelimiter
   *          field delimiter
   * @return the input serialization
   */
  public static CsvInput of(HeaderInfo headerInfo, char fieldDelimiter) {
    return new CsvInput(headerInfo, '\n', fieldDelimiter);
  }
}

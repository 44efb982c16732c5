package se.alipsa.jselect.engine;

import java.util.List;
import java.util.Objects;
import se.alipsa.jselect.model.Row;

/**
 * {@link RecordReader} implementation backed by an in-memory list of rows.
 */
public final class InMemoryRecordReader implements RecordReader {

  private final List<Row> rows;
  private int index;

  /**
   * Create a new reader that iterates over the provided rows.
   *
   * @param rows
   *          the rows to expose through the reader
   */
  public InMemoryRecordReader(List<Row> rows) {
    this.rows = List.copyOf(Objects.requireNonNull(rows, "rows"));
  }

  @Override
  public Row read() {
    if (index >= rows.size()) {
      return null;
    }
    return rows.get(index++);
  }

  @Override
  public void close() {
    index = rows.size();
  }
}

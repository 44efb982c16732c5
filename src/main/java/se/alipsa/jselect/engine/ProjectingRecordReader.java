package se.alipsa.jselect.engine;

import java.io.IOException;
import java.util.Objects;
import se.alipsa.jselect.model.Row;
import se.alipsa.jselect.model.Schema;

/**
 * {@link RecordReader} decorator that narrows rows decoded with a wider schema
 * back to the caller's projection.
 */
public final class ProjectingRecordReader implements RecordReader {

  private final RecordReader delegate;
  private final int[] positions;

  /**
   * Create a projecting reader.
   *
   * @param delegate
   *          the source of rows
   * @param source
   *          schema the rows of {@code delegate} are decoded with
   * @param target
   *          the schema rows are narrowed to
   */
  public ProjectingRecordReader(RecordReader delegate, Schema source, Schema target) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.positions = SchemaPruner.positions(source, target);
  }

  /**
   * Wrap a reader with a projection, or return it unchanged when both schemas
   * are equal.
   *
   * @param reader
   *          the source of rows
   * @param source
   *          schema of the rows
   * @param target
   *          wanted schema
   * @return the projecting reader, or {@code reader} itself
   */
  public static RecordReader wrap(RecordReader reader, Schema source, Schema target) {
    if (source.equals(target)) {
      return reader;
    }
    return new ProjectingRecordReader(reader, source, target);
  }

  @Override
  public Row read() throws IOException {
    Row row = delegate.read();
    return row == null ? null : row.project(positions);
  }

  @Override
  public void close() throws IOException {
    delegate.close();
  }
}

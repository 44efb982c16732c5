package se.alipsa.jselect.engine;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import se.alipsa.jselect.model.Predicate;
import se.alipsa.jselect.model.Row;
import se.alipsa.jselect.model.Schema;

/**
 * {@link RecordReader} decorator that drops rows failing any of a list of
 * residual predicates, evaluated locally with {@link PredicateEvaluator}.
 */
public final class FilteringRecordReader implements RecordReader {

  private final RecordReader delegate;
  private final Schema schema;
  private final List<Predicate> predicates;

  /**
   * Create a filtering reader.
   *
   * @param delegate
   *          the source of rows
   * @param schema
   *          schema the rows of {@code delegate} are decoded with
   * @param predicates
   *          predicates combined with AND
   */
  public FilteringRecordReader(RecordReader delegate, Schema schema, List<Predicate> predicates) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.schema = Objects.requireNonNull(schema, "schema");
    this.predicates = List.copyOf(predicates);
  }

  /**
   * Wrap a reader with a filter, or return it unchanged when there is nothing
   * to filter.
   *
   * @param reader
   *          the source of rows
   * @param schema
   *          schema of the rows
   * @param predicates
   *          residual predicates, may be empty
   * @return the filtering reader, or {@code reader} itself
   */
  public static RecordReader wrap(RecordReader reader, Schema schema, List<Predicate> predicates) {
    if (predicates == null || predicates.isEmpty()) {
      return reader;
    }
    return new FilteringRecordReader(reader, schema, predicates);
  }

  @Override
  public Row read() throws IOException {
    Row row = delegate.read();
    while (row != null && !matches(row)) {
      row = delegate.read();
    }
    return row;
  }

  private boolean matches(Row row) {
    for (Predicate p : predicates) {
      if (!PredicateEvaluator.test(schema, row, p)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public void close() throws IOException {
    delegate.close();
  }
}

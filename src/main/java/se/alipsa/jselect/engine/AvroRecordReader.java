package se.alipsa.jselect.engine;

import java.io.Closeable;
import java.io.IOException;
import java.util.Objects;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericRecord;
import se.alipsa.jselect.model.Row;

/**
 * Adapts a {@link RecordReader} of rows to a reader of Avro
 * {@link GenericRecord}s.
 */
public final class AvroRecordReader implements Closeable {

  private final RecordReader delegate;
  private final se.alipsa.jselect.model.Schema schema;
  private final Schema avroSchema;

  /**
   * Create a new adapter.
   *
   * @param delegate
   *          the reader to adapt
   * @param schema
   *          the schema rows of {@code delegate} are delivered in
   */
  public AvroRecordReader(RecordReader delegate, se.alipsa.jselect.model.Schema schema) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.schema = Objects.requireNonNull(schema, "schema");
    this.avroSchema = AvroRows.toAvroSchema(schema);
  }

  public Schema avroSchema() {
    return avroSchema;
  }

  /**
   * Read the next record.
   *
   * @return the next {@link GenericRecord}, or {@code null} when exhausted
   * @throws IOException
   *           if reading fails
   */
  public GenericRecord read() throws IOException {
    Row row = delegate.read();
    return row == null ? null : AvroRows.toRecord(schema, avroSchema, row);
  }

  @Override
  public void close() throws IOException {
    delegate.close();
  }
}

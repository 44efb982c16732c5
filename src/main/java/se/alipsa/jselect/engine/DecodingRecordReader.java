package se.alipsa.jselect.engine;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jselect.CastException;
import se.alipsa.jselect.model.Field;
import se.alipsa.jselect.model.Row;
import se.alipsa.jselect.model.Schema;

/**
 * {@link RecordReader} that turns the token arrays of a
 * {@link RecordStreamDecoder} into typed rows using {@link TypeCaster}.
 *
 * <p>
 * A token that cannot be cast aborts the stream: the exception names the
 * field, the raw token and the line, and no further rows are returned.
 */
public final class DecodingRecordReader implements RecordReader {

  private static final Logger log = LoggerFactory.getLogger(DecodingRecordReader.class);

  private final RecordStreamDecoder decoder;
  private final Schema schema;
  private long rows;

  /**
   * Create a reader over an existing decoder.
   *
   * @param decoder
   *          the token source, must expect {@code schema.size()} tokens per line
   * @param schema
   *          the schema every row is decoded with
   */
  public DecodingRecordReader(RecordStreamDecoder decoder, Schema schema) {
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.schema = Objects.requireNonNull(schema, "schema");
  }

  /**
   * Create a reader decoding {@code in} with {@code schema}.
   *
   * @param in
   *          the response stream; owned by the reader from now on
   * @param delimiter
   *          the field delimiter
   * @param schema
   *          the (pruned) schema every row is decoded with
   * @return the reader
   */
  public static DecodingRecordReader open(InputStream in, char delimiter, Schema schema) {
    return new DecodingRecordReader(new RecordStreamDecoder(in, delimiter, schema.size()), schema);
  }

  public Schema schema() {
    return schema;
  }

  @Override
  public Row read() throws IOException {
    String[] tokens = decoder.next();
    if (tokens == null) {
      return null;
    }
    Object[] values = new Object[tokens.length];
    for (int i = 0; i < tokens.length; i++) {
      Field f = schema.field(i);
      try {
        values[i] = TypeCaster.cast(tokens[i], f.type(), f.nullable());
      } catch (CastException e) {
        CastException located = e.withContext(f.name(), decoder.lineNumber());
        decoder.abort(located);
        throw located;
      }
    }
    rows++;
    return Row.of(values);
  }

  @Override
  public void close() throws IOException {
    log.debug("Decoded {} row(s)", rows);
    decoder.close();
  }
}

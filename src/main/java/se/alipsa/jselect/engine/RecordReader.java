package se.alipsa.jselect.engine;

import java.io.Closeable;
import java.io.IOException;
import se.alipsa.jselect.model.Row;

/**
 * Minimal abstraction for sequential, single-pass access to decoded
 * {@link Row}s. Instances are not safe for use by several threads.
 */
public interface RecordReader extends Closeable {

  /**
   * Read the next available row.
   *
   * @return the next {@link Row}, or {@code null} when exhausted
   * @throws IOException
   *           if reading the underlying stream fails
   */
  Row read() throws IOException;

  @Override
  void close() throws IOException;
}

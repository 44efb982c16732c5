package se.alipsa.jselect;

import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jselect.client.SelectClient;
import se.alipsa.jselect.engine.RecordReader;
import se.alipsa.jselect.model.Row;

/**
 * Outermost reader of a scan. Owns the client of the scan and closes it after
 * the reader chain, when the rows are exhausted, when any reader in the chain
 * fails, or when the caller closes it.
 */
final class ScanRecordReader implements RecordReader {

  private static final Logger log = LoggerFactory.getLogger(ScanRecordReader.class);

  private final RecordReader delegate;
  private final SelectClient client;
  private boolean closed;
  private boolean failed;

  ScanRecordReader(RecordReader delegate, SelectClient client) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public Row read() throws IOException {
    if (failed) {
      throw new IllegalStateException("Scan was aborted by an earlier failure");
    }
    if (closed) {
      return null;
    }
    Row row;
    try {
      row = delegate.read();
    } catch (IOException | RuntimeException e) {
      failed = true;
      releaseAfterFailure(e);
      throw e;
    }
    if (row == null) {
      close();
    }
    return row;
  }

  private void releaseAfterFailure(Exception primary) {
    try {
      close();
    } catch (IOException e) {
      primary.addSuppressed(e);
    }
  }

  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    log.debug("Releasing client after scan");
    try {
      delegate.close();
    } finally {
      client.close();
    }
  }
}

package se.alipsa.jselect.client;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import se.alipsa.jselect.request.SelectRequest;

/**
 * Connection to a remote service able to run one select request and stream the
 * records back. Implementations wrap a concrete object store client.
 */
public interface SelectClient extends Closeable {

  /**
   * Execute the request.
   *
   * @param request
   *          the request to run
   * @return the record payload: newline separated records, fields separated by
   *         the request's output field delimiter. The caller closes it.
   * @throws IOException
   *           if the request fails
   */
  InputStream select(SelectRequest request) throws IOException;

  @Override
  void close() throws IOException;
}

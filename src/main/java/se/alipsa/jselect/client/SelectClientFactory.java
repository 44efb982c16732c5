package se.alipsa.jselect.client;

import java.io.IOException;
import se.alipsa.jselect.JSelectOptions;
import se.alipsa.jselect.auth.Credentials;

/** Creates a {@link SelectClient} for each scan. */
@FunctionalInterface
public interface SelectClientFactory {

  /**
   * Open a client.
   *
   * @param options
   *          endpoint, region and addressing options
   * @param credentials
   *          the resolved credentials
   * @return a client owned by the caller
   * @throws IOException
   *           if the client cannot be created
   */
  SelectClient open(JSelectOptions options, Credentials credentials) throws IOException;
}

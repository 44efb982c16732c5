package se.alipsa.jselect.auth;

import java.util.Optional;

/**
 * One place credentials may come from. A source either yields credentials or
 * declines by returning an empty optional.
 */
public interface CredentialSource {

  /**
   * Try to resolve credentials.
   *
   * @return the credentials, or empty if this source has none
   */
  Optional<Credentials> resolve();

  /**
   * Short name used in log and error messages.
   *
   * @return the source name
   */
  String name();
}

package se.alipsa.jselect.auth;

import java.util.Objects;

/**
 * Access key pair, optionally with a session token.
 *
 * @param accessKey
 *          the access key id
 * @param secretKey
 *          the secret access key
 * @param sessionToken
 *          session token for temporary credentials, may be {@code null}
 */
public record Credentials(String accessKey, String secretKey, String sessionToken) {

  /**
   * Validates the components.
   *
   * @param accessKey
   *          the access key id
   * @param secretKey
   *          the secret access key
   * @param sessionToken
   *          the session token or {@code null}
   */
  public Credentials {
    Objects.requireNonNull(accessKey, "accessKey");
    Objects.requireNonNull(secretKey, "secretKey");
  }

  /**
   * Create long lived credentials without session token.
   *
   * @param accessKey
   *          the access key id
   * @param secretKey
   *          the secret access key
   * @return the credentials
   */
  public static Credentials of(String accessKey, String secretKey) {
    return new Credentials(accessKey, secretKey, null);
  }

  @Override
  public String toString() {
    return "Credentials{accessKey=" + accessKey + ", secretKey=****" + (sessionToken == null ? "" : ", session")
        + "}";
  }
}

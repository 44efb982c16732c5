package se.alipsa.jselect.auth;

import java.util.Optional;

/** Credentials configured with the {@code access_key} and {@code secret_key} options. */
public final class StaticCredentialSource implements CredentialSource {

  private final String accessKey;
  private final String secretKey;

  /**
   * Create a static source.
   *
   * @param accessKey
   *          the access key, may be {@code null}
   * @param secretKey
   *          the secret key, may be {@code null}
   */
  public StaticCredentialSource(String accessKey, String secretKey) {
    this.accessKey = accessKey;
    this.secretKey = secretKey;
  }

  @Override
  public Optional<Credentials> resolve() {
    if (accessKey == null || secretKey == null) {
      return Optional.empty();
    }
    return Optional.of(Credentials.of(accessKey, secretKey));
  }

  @Override
  public String name() {
    return "static";
  }
}

package se.alipsa.jselect.auth;

import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Credentials from the {@code aws.accessKeyId} and {@code aws.secretKey} system
 * properties.
 */
public final class SystemPropertyCredentialSource implements CredentialSource {

  public static final String ACCESS_KEY_PROPERTY = "aws.accessKeyId";
  public static final String SECRET_KEY_PROPERTY = "aws.secretKey";

  private final Properties properties;

  /** Read from the JVM system properties. */
  public SystemPropertyCredentialSource() {
    this(System.getProperties());
  }

  /**
   * Read from the given properties instead of the system properties.
   *
   * @param properties
   *          the properties
   */
  public SystemPropertyCredentialSource(Properties properties) {
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  @Override
  public Optional<Credentials> resolve() {
    String access = properties.getProperty(ACCESS_KEY_PROPERTY);
    String secret = properties.getProperty(SECRET_KEY_PROPERTY);
    if (access == null || access.isBlank() || secret == null || secret.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(Credentials.of(access.trim(), secret.trim()));
  }

  @Override
  public String name() {
    return "system properties";
  }
}

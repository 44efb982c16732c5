package se.alipsa.jselect.auth;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Credentials from the {@code AWS_ACCESS_KEY_ID}, {@code AWS_SECRET_ACCESS_KEY}
 * and optional {@code AWS_SESSION_TOKEN} environment variables.
 */
public final class EnvironmentCredentialSource implements CredentialSource {

  public static final String ACCESS_KEY_VAR = "AWS_ACCESS_KEY_ID";
  public static final String SECRET_KEY_VAR = "AWS_SECRET_ACCESS_KEY";
  public static final String SESSION_TOKEN_VAR = "AWS_SESSION_TOKEN";

  private final Map<String, String> environment;

  /** Read from the process environment. */
  public EnvironmentCredentialSource() {
    this(System.getenv());
  }

  /**
   * Read from the given variables instead of the process environment.
   *
   * @param environment
   *          variable names to values
   */
  public EnvironmentCredentialSource(Map<String, String> environment) {
    this.environment = Objects.requireNonNull(environment, "environment");
  }

  @Override
  public Optional<Credentials> resolve() {
    String access = nonBlank(environment.get(ACCESS_KEY_VAR));
    String secret = nonBlank(environment.get(SECRET_KEY_VAR));
    if (access == null || secret == null) {
      return Optional.empty();
    }
    return Optional.of(new Credentials(access, secret, nonBlank(environment.get(SESSION_TOKEN_VAR))));
  }

  private static String nonBlank(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }

  @Override
  public String name() {
    return "environment";
  }
}

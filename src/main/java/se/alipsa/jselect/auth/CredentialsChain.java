package se.alipsa.jselect.auth;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jselect.CredentialsException;
import se.alipsa.jselect.JSelectOptions;

/**
 * Ranked list of {@link CredentialSource}s. The first source that yields
 * credentials wins; if every source declines, resolution fails.
 */
public final class CredentialsChain {

  private static final Logger log = LoggerFactory.getLogger(CredentialsChain.class);

  private final List<CredentialSource> sources;

  /**
   * Create a chain.
   *
   * @param sources
   *          sources in the order they are tried, must not be empty
   */
  public CredentialsChain(List<CredentialSource> sources) {
    if (sources == null || sources.isEmpty()) {
      throw new IllegalArgumentException("A credentials chain needs at least one source");
    }
    this.sources = List.copyOf(sources);
  }

  /**
   * The default chain: static options, then environment variables, then system
   * properties.
   *
   * @param options
   *          the relation options
   * @return the chain
   */
  public static CredentialsChain defaultChain(JSelectOptions options) {
    return new CredentialsChain(List.of(new StaticCredentialSource(options.accessKey(), options.secretKey()),
        new EnvironmentCredentialSource(), new SystemPropertyCredentialSource()));
  }

  public List<CredentialSource> sources() {
    return sources;
  }

  /**
   * Resolve credentials from the first source that has them.
   *
   * @return the credentials
   * @throws CredentialsException
   *           if every source declined
   */
  public Credentials resolve() {
    List<String> declined = new ArrayList<>(sources.size());
    for (CredentialSource source : sources) {
      Optional<Credentials> credentials = source.resolve();
      if (credentials.isPresent()) {
        log.debug("Using credentials from {}", source.name());
        return credentials.get();
      }
      declined.add(source.name());
    }
    throw new CredentialsException("No credentials found, tried: " + String.join(", ", declined));
  }
}

package se.alipsa.jselect.request;

import java.util.Locale;
import java.util.Objects;
import se.alipsa.jselect.ConfigurationException;

/**
 * Bucket and key of the queried object.
 *
 * @param bucket
 *          the bucket name
 * @param key
 *          the object key, without leading slash
 */
public record ObjectLocation(String bucket, String key) {

  /**
   * Validates the components.
   *
   * @param bucket
   *          the bucket name
   * @param key
   *          the object key
   */
  public ObjectLocation {
    Objects.requireNonNull(bucket, "bucket");
    Objects.requireNonNull(key, "key");
  }

  /**
   * Parse an {@code s3://bucket/key} style location. The {@code s3a} and
   * {@code s3n} schemes are accepted as well.
   *
   * @param location
   *          the location string
   * @return the parsed location
   * @throws ConfigurationException
   *           if the scheme is not recognised or bucket or key is missing
   */
  public static ObjectLocation parse(String location) {
    if (location == null || location.isBlank()) {
      throw new ConfigurationException("Object location is missing");
    }
    String trimmed = location.trim();
    int schemeEnd = trimmed.indexOf("://");
    if (schemeEnd < 0) {
      throw new ConfigurationException("Object location has no scheme: " + location);
    }
    String scheme = trimmed.substring(0, schemeEnd).toLowerCase(Locale.ROOT);
    if (!scheme.equals("s3") && !scheme.equals("s3a") && !scheme.equals("s3n")) {
      throw new ConfigurationException("Unsupported object location scheme '" + scheme + "' in " + location);
    }
    String rest = trimmed.substring(schemeEnd + 3);
    int slash = rest.indexOf('/');
    String bucket = slash < 0 ? rest : rest.substring(0, slash);
    String key = slash < 0 ? "" : rest.substring(slash + 1);
    if (bucket.isEmpty()) {
      throw new ConfigurationException("Object location has no bucket: " + location);
    }
    if (key.isEmpty()) {
      throw new ConfigurationException("Object location has no key: " + location);
    }
    return new ObjectLocation(bucket, key);
  }

  @Override
  public String toString() {
    return "s3://" + bucket + "/" + key;
  }
}

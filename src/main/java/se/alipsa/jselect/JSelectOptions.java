package se.alipsa.jselect;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jselect.helper.JSelectUtil;
import se.alipsa.jselect.request.CompressionType;
import se.alipsa.jselect.request.HeaderInfo;
import se.alipsa.jselect.request.ObjectLocation;

/**
 * Validated relation options.
 *
 * <p>
 * Recognised options (camelCase spellings such as {@code pathStyleAccess} are
 * accepted too):
 * <ul>
 * <li>{@code endpoint}: service endpoint, required</li>
 * <li>{@code region}: signing region, default {@value #DEFAULT_REGION}</li>
 * <li>{@code path_style_access}: {@code true}/{@code false}, default
 * {@code false}</li>
 * <li>{@code access_key} / {@code secret_key}: static credentials, both or
 * neither</li>
 * <li>{@code compression}: {@code none}, {@code gzip} or {@code bzip2}, default
 * {@code none}</li>
 * <li>{@code header}: {@code true} if the first line names the columns, default
 * {@code true}</li>
 * <li>{@code delimiter}: single field delimiter character, default
 * {@code ,}</li>
 * <li>{@code local_filter}: {@code true} to evaluate predicates that cannot be
 * pushed down on the decoded rows, default {@code true}</li>
 * <li>{@code path}: object location such as {@code s3://bucket/key},
 * optional</li>
 * </ul>
 * A URL of the form {@code jselect:s3://bucket/key?endpoint=...} can be parsed
 * with {@link #fromUrl(String, Properties)}.
 */
public final class JSelectOptions {

  private static final Logger log = LoggerFactory.getLogger(JSelectOptions.class);

  public static final String URL_PREFIX = "jselect:";
  public static final String DEFAULT_REGION = "us-east-1";
  public static final char DEFAULT_DELIMITER = ',';

  public static final String ENDPOINT = "endpoint";
  public static final String REGION = "region";
  public static final String PATH_STYLE_ACCESS = "path_style_access";
  public static final String ACCESS_KEY = "access_key";
  public static final String SECRET_KEY = "secret_key";
  public static final String COMPRESSION = "compression";
  public static final String HEADER = "header";
  public static final String DELIMITER = "delimiter";
  public static final String LOCAL_FILTER = "local_filter";
  public static final String PATH = "path";

  private static final List<String> KNOWN = List.of(ENDPOINT, REGION, PATH_STYLE_ACCESS, ACCESS_KEY, SECRET_KEY,
      COMPRESSION, HEADER, DELIMITER, LOCAL_FILTER, PATH);

  private final String endpoint;
  private final String region;
  private final boolean pathStyleAccess;
  private final String accessKey;
  private final String secretKey;
  private final CompressionType compression;
  private final boolean header;
  private final char delimiter;
  private final boolean localFilter;
  private final ObjectLocation location;

  private JSelectOptions(String endpoint, String region, boolean pathStyleAccess, String accessKey,
      String secretKey, CompressionType compression, boolean header, char delimiter, boolean localFilter,
      ObjectLocation location) {
    this.endpoint = endpoint;
    this.region = region;
    this.pathStyleAccess = pathStyleAccess;
    this.accessKey = accessKey;
    this.secretKey = secretKey;
    this.compression = compression;
    this.header = header;
    this.delimiter = delimiter;
    this.localFilter = localFilter;
    this.location = location;
  }

  /**
   * Validate and parse options.
   *
   * @param params
   *          option names to values
   * @return the validated options
   * @throws ConfigurationException
   *           listing every invalid or missing option
   */
  public static JSelectOptions parse(Map<String, String> params) {
    Map<String, String> p = normalize(Objects.requireNonNull(params, "params"));
    List<String> problems = new ArrayList<>();

    String endpoint = trimToNull(p.get(ENDPOINT));
    if (endpoint == null) {
      problems.add("Endpoint missing from configuration");
    }
    String region = trimToNull(p.get(REGION));
    boolean pathStyle = bool(p, PATH_STYLE_ACCESS, false, problems);
    String accessKey = trimToNull(p.get(ACCESS_KEY));
    String secretKey = trimToNull(p.get(SECRET_KEY));
    if ((accessKey == null) != (secretKey == null)) {
      problems.add("access_key and secret_key must be given together");
    }
    CompressionType compression = CompressionType.NONE;
    String compressionValue = p.get(COMPRESSION);
    if (compressionValue != null) {
      compression = CompressionType.fromOption(compressionValue);
      if (compression == null) {
        problems.add("Unrecognized compression '" + compressionValue + "', expected none, gzip or bzip2");
      }
    }
    boolean header = bool(p, HEADER, true, problems);
    char delimiter = DEFAULT_DELIMITER;
    String delimiterValue = p.get(DELIMITER);
    if (delimiterValue != null) {
      if (delimiterValue.length() != 1) {
        problems.add("delimiter must be a single character, got '" + delimiterValue + "'");
      } else if (delimiterValue.charAt(0) == '\n' || delimiterValue.charAt(0) == '\r') {
        problems.add("delimiter cannot be a line terminator");
      } else {
        delimiter = delimiterValue.charAt(0);
      }
    }
    boolean localFilter = bool(p, LOCAL_FILTER, true, problems);
    ObjectLocation location = null;
    String path = trimToNull(p.get(PATH));
    if (path != null) {
      try {
        location = ObjectLocation.parse(path);
      } catch (ConfigurationException e) {
        problems.add(e.getMessage());
      }
    }
    if (!problems.isEmpty()) {
      throw new ConfigurationException(problems);
    }
    return new JSelectOptions(endpoint, region == null ? DEFAULT_REGION : region, pathStyle, accessKey, secretKey,
        compression, header, delimiter, localFilter, location);
  }

  /**
   * Validate and parse options held in a {@link Properties} object.
   *
   * @param props
   *          the properties
   * @return the validated options
   * @throws ConfigurationException
   *           listing every invalid or missing option
   */
  public static JSelectOptions parse(Properties props) {
    Map<String, String> params = new LinkedHashMap<>();
    for (String name : props.stringPropertyNames()) {
      params.put(name, props.getProperty(name));
    }
    return parse(params);
  }

  /**
   * Parse a URL such as {@code jselect:s3://bucket/key?endpoint=http://host:9000}.
   * Entries in {@code props} override the URL query string.
   *
   * @param url
   *          the URL
   * @param props
   *          additional options, may be {@code null}
   * @return the validated options with {@link #location()} set
   * @throws ConfigurationException
   *           if the URL or any option is invalid
   */
  public static JSelectOptions fromUrl(String url, Properties props) {
    if (url == null || !url.startsWith(URL_PREFIX)) {
      throw new ConfigurationException("URL must start with " + URL_PREFIX + ": " + url);
    }
    String path = url.substring(URL_PREFIX.length());
    Map<String, String> params = new LinkedHashMap<>();
    int q = path.indexOf('?');
    if (q >= 0) {
      params.putAll(JSelectUtil.parseUrlQuery(path.substring(q + 1)));
      path = path.substring(0, q);
    }
    params.put(PATH, path);
    if (props != null) {
      for (String name : props.stringPropertyNames()) {
        params.put(name, props.getProperty(name));
      }
    }
    return parse(params);
  }

  private static Map<String, String> normalize(Map<String, String> params) {
    Map<String, String> out = new LinkedHashMap<>();
    for (Map.Entry<String, String> e : params.entrySet()) {
      if (e.getKey() == null) {
        continue;
      }
      String key = JSelectUtil.toSnakeCase(e.getKey().trim());
      if (!KNOWN.contains(key)) {
        log.debug("Ignoring unrecognized option {}", e.getKey());
        continue;
      }
      out.put(key, e.getValue());
    }
    return out;
  }

  private static boolean bool(Map<String, String> p, String name, boolean defaultValue, List<String> problems) {
    String value = p.get(name);
    if (value == null) {
      return defaultValue;
    }
    String v = value.trim().toLowerCase(Locale.ROOT);
    if (v.equals("true")) {
      return true;
    }
    if (v.equals("false")) {
      return false;
    }
    problems.add(name + " must be true or false, got '" + value + "'");
    return defaultValue;
  }

  private static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String t = value.trim();
    return t.isEmpty() ? null : t;
  }

  public String endpoint() {
    return endpoint;
  }

  public String region() {
    return region;
  }

  public boolean pathStyleAccess() {
    return pathStyleAccess;
  }

  /**
   * Static access key.
   *
   * @return the access key, or {@code null} when credentials come from the
   *         environment
   */
  public String accessKey() {
    return accessKey;
  }

  /**
   * Static secret key.
   *
   * @return the secret key, or {@code null} when credentials come from the
   *         environment
   */
  public String secretKey() {
    return secretKey;
  }

  public CompressionType compression() {
    return compression;
  }

  public boolean header() {
    return header;
  }

  public HeaderInfo headerInfo() {
    return header ? HeaderInfo.USE : HeaderInfo.NONE;
  }

  public char delimiter() {
    return delimiter;
  }

  public boolean localFilter() {
    return localFilter;
  }

  /**
   * The object location given with the {@code path} option.
   *
   * @return the location, or {@code null} if none was configured
   */
  public ObjectLocation location() {
    return location;
  }

  @Override
  public String toString() {
    return "JSelectOptions{endpoint=" + endpoint + ", region=" + region + ", pathStyleAccess=" + pathStyleAccess
        + ", staticCredentials=" + (accessKey != null) + ", compression=" + compression + ", header=" + header
        + ", delimiter='" + delimiter + "', localFilter=" + localFilter + ", location=" + location + "}";
  }
}

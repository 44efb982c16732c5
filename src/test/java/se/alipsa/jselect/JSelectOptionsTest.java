package se.alipsa.jselect;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import se.alipsa.jselect.request.CompressionType;
import se.alipsa.jselect.request.HeaderInfo;

class JSelectOptionsTest {

  @Test
  void appliesDefaults() {
    JSelectOptions options = JSelectOptions.parse(Map.of("endpoint", " http://localhost:9000 "));
    assertEquals("http://localhost:9000", options.endpoint());
    assertEquals(JSelectOptions.DEFAULT_REGION, options.region());
    assertFalse(options.pathStyleAccess());
    assertNull(options.accessKey());
    assertNull(options.secretKey());
    assertEquals(CompressionType.NONE, options.compression());
    assertTrue(options.header());
    assertEquals(HeaderInfo.USE, options.headerInfo());
    assertEquals(',', options.delimiter());
    assertTrue(options.localFilter());
    assertNull(options.location());
  }

  @Test
  void readsEveryOption() {
    Map<String, String> params = new HashMap<>();
    params.put("endpoint", "https://s3.example.com");
    params.put("region", "eu-north-1");
    params.put("path_style_access", "TRUE");
    params.put("access_key", "AK");
    params.put("secret_key", "SK");
    params.put("compression", "bzip2");
    params.put("header", "false");
    params.put("delimiter", "\t");
    params.put("local_filter", "false");
    params.put("path", "s3a://bucket/logs/day.tsv");
    JSelectOptions options = JSelectOptions.parse(params);
    assertEquals("eu-north-1", options.region());
    assertTrue(options.pathStyleAccess());
    assertEquals("AK", options.accessKey());
    assertEquals("SK", options.secretKey());
    assertEquals(CompressionType.BZIP2, options.compression());
    assertFalse(options.header());
    assertEquals(HeaderInfo.NONE, options.headerInfo());
    assertEquals('\t', options.delimiter());
    assertFalse(options.localFilter());
    assertEquals("bucket", options.location().bucket());
    assertEquals("logs/day.tsv", options.location().key());
  }

  @Test
  void acceptsCamelCaseNames() {
    JSelectOptions options = JSelectOptions.parse(Map.of(
        "endpoint", "http://h",
        "pathStyleAccess", "true",
        "localFilter", "false",
        "accessKey", "AK",
        "secretKey", "SK"));
    assertTrue(options.pathStyleAccess());
    assertFalse(options.localFilter());
    assertEquals("AK", options.accessKey());
  }

  @Test
  void missingEndpointIsReported() {
    ConfigurationException e = assertThrows(ConfigurationException.class, () -> JSelectOptions.parse(Map.of()));
    assertEquals("Endpoint missing from configuration", e.getMessage());
    assertEquals(List.of("Endpoint missing from configuration"), e.problems());
    assertThrows(ConfigurationException.class, () -> JSelectOptions.parse(Map.of("endpoint", "  ")));
  }

  @Test
  void collectsEveryProblem() {
    ConfigurationException e = assertThrows(ConfigurationException.class, () -> JSelectOptions.parse(Map.of(
        "compression", "zip",
        "header", "maybe",
        "delimiter", ";;",
        "access_key", "AK")));
    assertEquals(5, e.problems().size(), e.problems().toString());
    assertTrue(e.getMessage().startsWith("Invalid configuration: "));
    assertTrue(e.getMessage().contains("Unrecognized compression 'zip'"));
  }

  @Test
  void rejectsBadLocationAndDelimiter() {
    ConfigurationException e = assertThrows(ConfigurationException.class, () -> JSelectOptions.parse(Map.of(
        "endpoint", "http://h", "path", "ftp://bucket/key")));
    assertTrue(e.getMessage().contains("ftp"));
    assertThrows(ConfigurationException.class,
        () -> JSelectOptions.parse(Map.of("endpoint", "http://h", "delimiter", "\n")));
    assertThrows(ConfigurationException.class,
        () -> JSelectOptions.parse(Map.of("endpoint", "http://h", "local_filter", "yes")));
  }

  @Test
  void ignoresUnknownOptions() {
    JSelectOptions options = JSelectOptions.parse(Map.of("endpoint", "http://h", "colour", "blue"));
    assertEquals("http://h", options.endpoint());
  }

  @Test
  void parsesProperties() {
    Properties props = new Properties();
    props.setProperty("endpoint", "http://h");
    props.setProperty("compression", "gzip");
    assertEquals(CompressionType.GZIP, JSelectOptions.parse(props).compression());
  }

  @Test
  void parsesUrl() {
    Properties props = new Properties();
    props.setProperty("region", "eu-north-1");
    props.setProperty("header", "true");
    JSelectOptions options = JSelectOptions.fromUrl(
        "jselect:s3://bucket/dir/file.csv?endpoint=http%3A%2F%2Flocalhost%3A9000&header=false", props);
    assertEquals("http://localhost:9000", options.endpoint());
    assertEquals("eu-north-1", options.region());
    assertTrue(options.header(), "properties override the query string");
    assertEquals("s3://bucket/dir/file.csv", options.location().toString());
  }

  @Test
  void urlWithoutQueryNeedsEndpointFromProperties() {
    assertThrows(ConfigurationException.class, () -> JSelectOptions.fromUrl("jselect:s3://b/k", null));
    Properties props = new Properties();
    props.setProperty("endpoint", "http://h");
    assertEquals("k", JSelectOptions.fromUrl("jselect:s3://b/k", props).location().key());
  }

  @Test
  void rejectsForeignUrl() {
    assertThrows(ConfigurationException.class, () -> JSelectOptions.fromUrl("jdbc:h2:mem:test", null));
    assertThrows(ConfigurationException.class, () -> JSelectOptions.fromUrl(null, null));
  }

  @Test
  void toStringHidesSecrets() {
    JSelectOptions options = JSelectOptions.parse(Map.of("endpoint", "http://h", "access_key", "AK",
        "secret_key", "VERYSECRET"));
    assertFalse(options.toString().contains("VERYSECRET"));
    assertTrue(options.toString().contains("staticCredentials=true"));
  }
}

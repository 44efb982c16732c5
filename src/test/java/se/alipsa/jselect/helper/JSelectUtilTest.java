package se.alipsa.jselect.helper;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JSelectUtilTest {

  @Test
  void parsesQueryString() {
    Map<String, String> params = JSelectUtil.parseUrlQuery("?endpoint=http%3A%2F%2Fh%3A9000&header=false&flag&=x");
    assertEquals(List.of("endpoint", "header", "flag"), List.copyOf(params.keySet()));
    assertEquals("http://h:9000", params.get("endpoint"));
    assertEquals("", params.get("flag"));
    assertTrue(JSelectUtil.parseUrlQuery(null).isEmpty());
    assertTrue(JSelectUtil.parseUrlQuery("").isEmpty());
  }

  @Test
  void convertsCamelCase() {
    assertEquals("path_style_access", JSelectUtil.toSnakeCase("pathStyleAccess"));
    assertEquals("local_filter", JSelectUtil.toSnakeCase("localFilter"));
    assertEquals("endpoint", JSelectUtil.toSnakeCase("Endpoint"));
    assertEquals("secret_key", JSelectUtil.toSnakeCase("secret_key"));
  }
}

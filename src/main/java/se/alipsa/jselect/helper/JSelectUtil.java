package se.alipsa.jselect.helper;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/** Utility methods. */
public final class JSelectUtil {

  private JSelectUtil() {
  }

  /**
   * Parses a URL query string into an ordered map.
   *
   * @param qs
   *          the query string, with or without the leading {@code ?}
   * @return the decoded key-value pairs
   */
  public static Map<String, String> parseUrlQuery(String qs) {
    Map<String, String> p = new LinkedHashMap<>();
    if (qs == null || qs.isEmpty()) {
      return p;
    }
    String s = qs.charAt(0) == '?' ? qs.substring(1) : qs;
    for (String kv : s.split("&")) {
      if (kv.isEmpty()) {
        continue;
      }
      String[] arr = kv.split("=", 2);
      String k = URLDecoder.decode(arr[0], StandardCharsets.UTF_8);
      String v = arr.length == 2 ? URLDecoder.decode(arr[1], StandardCharsets.UTF_8) : "";
      if (!k.isEmpty()) {
        p.put(k, v);
      }
    }
    return p;
  }

  /**
   * Convert a camelCase option name to its snake_case form.
   *
   * @param name
   *          the option name
   * @return the name with every upper case letter lower cased and, unless it
   *         starts the name, preceded by {@code _}
   */
  public static String toSnakeCase(String name) {
    StringBuilder sb = new StringBuilder(name.length() + 4);
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (Character.isUpperCase(c)) {
        if (i > 0 && name.charAt(i - 1) != '_') {
          sb.append('_');
        }
        sb.append(Character.toLowerCase(c));
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }
}

package se.alipsa.jselect.request;

import java.util.Locale;

/** Compression of the queried object. */
public enum CompressionType {
  NONE,
  GZIP,
  BZIP2;

  /**
   * Parse a configuration value.
   *
   * @param value
   *          {@code none}, {@code gzip} or {@code bzip2}, case-insensitive
   * @return the matching type, or {@code null} if unrecognized
   */
  public static CompressionType fromOption(String value) {
    if (value == null) {
      return null;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "none" -> NONE;
      case "gzip" -> GZIP;
      case "bzip2" -> BZIP2;
      default -> null;
    };
  }
}

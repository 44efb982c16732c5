package se.alipsa.jselect.engine;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;
import se.alipsa.jselect.CastException;
import se.alipsa.jselect.model.FieldType;

/**
 * Converts single text tokens to typed values and back.
 *
 * <p>
 * Canonical formats: dates are ISO-8601 local dates ({@code 2024-02-03}),
 * timestamps are ISO-8601 local date-times without zone
 * ({@code 2024-02-03T10:11:12.5}), booleans are {@code true}/{@code false}
 * (case-insensitive when cast), numbers use {@code .} as decimal separator.
 * Any other spelling fails with a {@link CastException}; no alternative
 * formats are tried.
 *
 * <p>
 * Cast results: BOOLEAN {@link Boolean}, INT32 {@link Integer}, INT64
 * {@link Long}, FLOAT64 {@link Double}, DECIMAL {@link BigDecimal}, DATE
 * {@link LocalDate}, TIMESTAMP {@link LocalDateTime}, STRING {@link String}.
 */
public final class TypeCaster {

  /** Format used for DATE tokens. */
  public static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;
  /** Format used for TIMESTAMP tokens. */
  public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

  private static final Pattern INTEGER = Pattern.compile("[+-]?[0-9]+");
  private static final Pattern DECIMAL_NUMBER = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

  private TypeCaster() {
  }

  /**
   * Cast a token to the given type.
   *
   * @param token
   *          the raw text, never {@code null}
   * @param type
   *          the target type
   * @param nullable
   *          whether an empty token may become {@code null}
   * @return the typed value, {@code null} only for an empty token of a
   *         nullable field
   * @throws CastException
   *           if the token is not a valid value of {@code type}, or is empty and
   *           the field is not nullable
   */
  public static Object cast(String token, FieldType type, boolean nullable) {
    if (token.isEmpty()) {
      if (nullable) {
        return null;
      }
      throw new CastException(token, type, "empty value for non-nullable field", null);
    }
    return switch (type) {
      case STRING -> token;
      case BOOLEAN -> castBoolean(token);
      case INT32 -> castInt(token);
      case INT64 -> castLong(token);
      case FLOAT64 -> castDouble(token);
      case DECIMAL -> castDecimal(token);
      case DATE -> castDate(token);
      case TIMESTAMP -> castTimestamp(token);
    };
  }

  /**
   * Render a typed value in the canonical text form that {@link #cast} accepts.
   *
   * @param value
   *          the value, may be {@code null}
   * @param type
   *          the type of the value
   * @return the text form; the empty string for {@code null}
   * @throws IllegalArgumentException
   *           if the value does not belong to {@code type}
   */
  public static String format(Object value, FieldType type) {
    if (value == null) {
      return "";
    }
    try {
      return switch (type) {
        case STRING -> (String) value;
        case BOOLEAN -> ((Boolean) value).toString();
        case INT32 -> ((Integer) value).toString();
        case INT64 -> ((Long) value).toString();
        case FLOAT64 -> formatDouble((Double) value);
        case DECIMAL -> ((BigDecimal) value).toPlainString();
        case DATE -> ((LocalDate) value).format(DATE_FORMAT);
        case TIMESTAMP -> ((LocalDateTime) value).format(TIMESTAMP_FORMAT);
      };
    } catch (ClassCastException e) {
      throw new IllegalArgumentException(value.getClass().getSimpleName() + " is not a value of " + type, e);
    }
  }

  /**
   * Render a finite double in plain decimal notation.
   *
   * @param d
   *          the value
   * @return plain notation for finite values, {@code NaN}/{@code Infinity}
   *         otherwise
   */
  static String formatDouble(double d) {
    if (Double.isNaN(d) || Double.isInfinite(d)) {
      return Double.toString(d);
    }
    return BigDecimal.valueOf(d).toPlainString();
  }

  private static Boolean castBoolean(String token) {
    if ("true".equalsIgnoreCase(token)) {
      return Boolean.TRUE;
    }
    if ("false".equalsIgnoreCase(token)) {
      return Boolean.FALSE;
    }
    throw new CastException(token, FieldType.BOOLEAN, "expected true or false", null);
  }

  private static Integer castInt(String token) {
    if (!INTEGER.matcher(token).matches()) {
      throw new CastException(token, FieldType.INT32, "not a 32-bit integer", null);
    }
    try {
      return Integer.parseInt(token);
    } catch (NumberFormatException e) {
      throw new CastException(token, FieldType.INT32, "not a 32-bit integer", e);
    }
  }

  private static Long castLong(String token) {
    if (!INTEGER.matcher(token).matches()) {
      throw new CastException(token, FieldType.INT64, "not a 64-bit integer", null);
    }
    try {
      return Long.parseLong(token);
    } catch (NumberFormatException e) {
      throw new CastException(token, FieldType.INT64, "not a 64-bit integer", e);
    }
  }

  private static Double castDouble(String token) {
    switch (token) {
      case "NaN":
        return Double.NaN;
      case "Infinity", "+Infinity":
        return Double.POSITIVE_INFINITY;
      case "-Infinity":
        return Double.NEGATIVE_INFINITY;
      default:
        break;
    }
    if (!DECIMAL_NUMBER.matcher(token).matches()) {
      throw new CastException(token, FieldType.FLOAT64, "not a decimal number", null);
    }
    double d = Double.parseDouble(token);
    if (Double.isInfinite(d)) {
      throw new CastException(token, FieldType.FLOAT64, "value out of range", null);
    }
    return d;
  }

  private static BigDecimal castDecimal(String token) {
    if (!DECIMAL_NUMBER.matcher(token).matches()) {
      throw new CastException(token, FieldType.DECIMAL, "not a decimal number", null);
    }
    try {
      return new BigDecimal(token);
    } catch (NumberFormatException e) {
      throw new CastException(token, FieldType.DECIMAL, "exponent out of range", e);
    }
  }

  private static LocalDate castDate(String token) {
    try {
      return LocalDate.parse(token, DATE_FORMAT);
    } catch (DateTimeParseException e) {
      throw new CastException(token, FieldType.DATE, "expected yyyy-MM-dd", e);
    }
  }

  private static LocalDateTime castTimestamp(String token) {
    try {
      return LocalDateTime.parse(token, TIMESTAMP_FORMAT);
    } catch (DateTimeParseException e) {
      throw new CastException(token, FieldType.TIMESTAMP, "expected yyyy-MM-dd'T'HH:mm[:ss[.f]]", e);
    }
  }
}

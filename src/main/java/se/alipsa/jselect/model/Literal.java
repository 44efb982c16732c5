package se.alipsa.jselect.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * A constant operand of a {@link Predicate}.
 */
public sealed interface Literal permits Literal.StringLiteral, Literal.IntegerLiteral, Literal.FloatLiteral,
    Literal.DecimalLiteral, Literal.BooleanLiteral, Literal.NullLiteral {

  /** The singleton null literal. */
  Literal NULL = new NullLiteral();

  /**
   * The literal as a plain Java value.
   *
   * @return the value, {@code null} for {@link NullLiteral}
   */
  Object value();

  /**
   * Convert a Java value to a literal. Dates and timestamps become string
   * literals in the canonical ISO-8601 format.
   *
   * @param value
   *          the value to convert, may be {@code null}
   * @return the literal
   * @throws IllegalArgumentException
   *           if the value has no literal representation
   */
  static Literal of(Object value) {
    if (value == null) {
      return NULL;
    }
    if (value instanceof Literal l) {
      return l;
    }
    if (value instanceof String s) {
      return new StringLiteral(s);
    }
    if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
      return new IntegerLiteral(((Number) value).longValue());
    }
    if (value instanceof Float || value instanceof Double) {
      return new FloatLiteral(((Number) value).doubleValue());
    }
    if (value instanceof BigDecimal bd) {
      return new DecimalLiteral(bd);
    }
    if (value instanceof BigInteger bi) {
      return new IntegerLiteral(bi.longValueExact());
    }
    if (value instanceof Boolean b) {
      return new BooleanLiteral(b);
    }
    if (value instanceof LocalDate d) {
      return new StringLiteral(d.format(DateTimeFormatter.ISO_LOCAL_DATE));
    }
    if (value instanceof LocalDateTime ts) {
      return new StringLiteral(ts.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
    }
    throw new IllegalArgumentException("No literal representation for " + value.getClass().getName());
  }

  /** A character string constant. */
  record StringLiteral(String value) implements Literal {
    public StringLiteral {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
      return "'" + value + "'";
    }
  }

  /** A whole number constant. */
  record IntegerLiteral(long longValue) implements Literal {
    @Override
    public Object value() {
      return longValue;
    }

    @Override
    public String toString() {
      return Long.toString(longValue);
    }
  }

  /** A binary floating point constant. */
  record FloatLiteral(double doubleValue) implements Literal {
    @Override
    public Object value() {
      return doubleValue;
    }

    @Override
    public String toString() {
      return Double.toString(doubleValue);
    }
  }

  /** An exact decimal constant. */
  record DecimalLiteral(BigDecimal value) implements Literal {
    public DecimalLiteral {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
      return value.toPlainString();
    }
  }

  /** A boolean constant. */
  record BooleanLiteral(boolean booleanValue) implements Literal {
    @Override
    public Object value() {
      return booleanValue;
    }

    @Override
    public String toString() {
      return Boolean.toString(booleanValue);
    }
  }

  /** The SQL null constant. */
  record NullLiteral() implements Literal {
    @Override
    public Object value() {
      return null;
    }

    @Override
    public String toString() {
      return "NULL";
    }
  }
}

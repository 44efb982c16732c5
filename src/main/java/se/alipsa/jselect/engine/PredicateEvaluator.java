package se.alipsa.jselect.engine;

import java.math.BigDecimal;
import se.alipsa.jselect.CastException;
import se.alipsa.jselect.UnknownColumnException;
import se.alipsa.jselect.UnsupportedPredicateException;
import se.alipsa.jselect.model.Field;
import se.alipsa.jselect.model.FieldType;
import se.alipsa.jselect.model.Literal;
import se.alipsa.jselect.model.Literal.BooleanLiteral;
import se.alipsa.jselect.model.Literal.DecimalLiteral;
import se.alipsa.jselect.model.Literal.FloatLiteral;
import se.alipsa.jselect.model.Literal.IntegerLiteral;
import se.alipsa.jselect.model.Literal.NullLiteral;
import se.alipsa.jselect.model.Literal.StringLiteral;
import se.alipsa.jselect.model.Predicate;
import se.alipsa.jselect.model.Predicate.And;
import se.alipsa.jselect.model.Predicate.Comparison;
import se.alipsa.jselect.model.Predicate.In;
import se.alipsa.jselect.model.Predicate.IsNotNull;
import se.alipsa.jselect.model.Predicate.IsNull;
import se.alipsa.jselect.model.Predicate.Not;
import se.alipsa.jselect.model.Predicate.Or;
import se.alipsa.jselect.model.Predicate.StringMatch;
import se.alipsa.jselect.model.Row;
import se.alipsa.jselect.model.Schema;

/**
 * Evaluates predicates against decoded rows, used for the predicates that
 * could not be pushed down.
 *
 * <p>
 * Uses SQL three-valued logic: any comparison involving {@code null} is
 * unknown, and a row only matches when the predicate is definitely true.
 */
public final class PredicateEvaluator {

  private PredicateEvaluator() {
  }

  /**
   * Test whether a row satisfies a predicate.
   *
   * @param schema
   *          the schema the row was decoded with
   * @param row
   *          the row
   * @param predicate
   *          the predicate
   * @return true only if the predicate evaluates to true
   * @throws UnknownColumnException
   *           if the predicate references a field not in {@code schema}
   * @throws UnsupportedPredicateException
   *           if a literal cannot be compared with its field
   */
  public static boolean test(Schema schema, Row row, Predicate predicate) {
    return Boolean.TRUE.equals(eval(schema, row, predicate));
  }

  /**
   * Verify that a predicate can be evaluated against rows of {@code schema}
   * without reading any row.
   *
   * @param schema
   *          the schema rows will be decoded with
   * @param predicate
   *          the predicate
   * @throws UnknownColumnException
   *           if the predicate references a field not in {@code schema}
   * @throws UnsupportedPredicateException
   *           if a literal cannot be compared with its field
   */
  public static void check(Schema schema, Predicate predicate) {
    if (predicate instanceof And and) {
      check(schema, and.left());
      check(schema, and.right());
    } else if (predicate instanceof Or or) {
      check(schema, or.left());
      check(schema, or.right());
    } else if (predicate instanceof Not not) {
      check(schema, not.child());
    } else if (predicate instanceof IsNull n) {
      field(schema, n.field());
    } else if (predicate instanceof IsNotNull n) {
      field(schema, n.field());
    } else if (predicate instanceof Comparison c) {
      coerce(predicate, field(schema, c.field()), c.literal());
    } else if (predicate instanceof In in) {
      Field f = field(schema, in.field());
      for (Literal l : in.values()) {
        coerce(predicate, f, l);
      }
    } else if (predicate instanceof StringMatch m) {
      Field f = field(schema, m.field());
      if (f.type() != FieldType.STRING) {
        throw new UnsupportedPredicateException(predicate, "string match on " + f.type() + " column");
      }
    } else {
      throw new UnsupportedPredicateException(predicate, "unknown predicate kind");
    }
  }

  /**
   * Evaluate a predicate.
   *
   * @return {@code TRUE}, {@code FALSE} or {@code null} for unknown
   */
  static Boolean eval(Schema schema, Row row, Predicate p) {
    if (p instanceof And and) {
      Boolean l = eval(schema, row, and.left());
      if (Boolean.FALSE.equals(l)) {
        return Boolean.FALSE;
      }
      Boolean r = eval(schema, row, and.right());
      if (Boolean.FALSE.equals(r)) {
        return Boolean.FALSE;
      }
      return l == null || r == null ? null : Boolean.TRUE;
    }
    if (p instanceof Or or) {
      Boolean l = eval(schema, row, or.left());
      if (Boolean.TRUE.equals(l)) {
        return Boolean.TRUE;
      }
      Boolean r = eval(schema, row, or.right());
      if (Boolean.TRUE.equals(r)) {
        return Boolean.TRUE;
      }
      return l == null || r == null ? null : Boolean.FALSE;
    }
    if (p instanceof Not not) {
      Boolean inner = eval(schema, row, not.child());
      return inner == null ? null : !inner;
    }
    if (p instanceof IsNull n) {
      return value(schema, row, n.field()) == null;
    }
    if (p instanceof IsNotNull n) {
      return value(schema, row, n.field()) != null;
    }
    if (p instanceof Comparison c) {
      Field f = field(schema, c.field());
      Object v = row.get(schema.indexOf(f.name()));
      Object lit = coerce(p, f, c.literal());
      if (v == null || lit == null) {
        return null;
      }
      Integer cmp = compare(f.type(), v, lit);
      if (cmp == null) {
        return null;
      }
      return switch (c.operator()) {
        case EQUALS -> cmp == 0;
        case NOT_EQUALS -> cmp != 0;
        case GREATER_THAN -> cmp > 0;
        case GREATER_OR_EQUAL -> cmp >= 0;
        case LESS_THAN -> cmp < 0;
        case LESS_OR_EQUAL -> cmp <= 0;
      };
    }
    if (p instanceof In in) {
      Field f = field(schema, in.field());
      Object v = row.get(schema.indexOf(f.name()));
      boolean sawUnknown = v == null;
      for (Literal l : in.values()) {
        Object lit = coerce(p, f, l);
        if (lit == null || v == null) {
          sawUnknown = true;
          continue;
        }
        Integer cmp = compare(f.type(), v, lit);
        if (cmp == null) {
          sawUnknown = true;
        } else if (cmp == 0) {
          return Boolean.TRUE;
        }
      }
      return sawUnknown ? null : Boolean.FALSE;
    }
    if (p instanceof StringMatch m) {
      Field f = field(schema, m.field());
      if (f.type() != FieldType.STRING) {
        throw new UnsupportedPredicateException(p, "string match on " + f.type() + " column");
      }
      Object v = row.get(schema.indexOf(f.name()));
      if (v == null) {
        return null;
      }
      String s = (String) v;
      return switch (m.kind()) {
        case STARTS_WITH -> s.startsWith(m.value());
        case ENDS_WITH -> s.endsWith(m.value());
        case CONTAINS -> s.contains(m.value());
      };
    }
    throw new UnsupportedPredicateException(p, "unknown predicate kind");
  }

  private static Field field(Schema schema, String name) {
    Field f = schema.field(name);
    if (f == null) {
      throw new UnknownColumnException(name);
    }
    return f;
  }

  private static Object value(Schema schema, Row row, String name) {
    return row.get(schema.indexOf(field(schema, name).name()));
  }

  /**
   * Convert a literal to the Java type the caster produces for the field, or a
   * BigDecimal for numeric fields.
   */
  private static Object coerce(Predicate p, Field f, Literal lit) {
    if (lit instanceof NullLiteral) {
      return null;
    }
    FieldType type = f.type();
    if (type.isNumeric()) {
      if (lit instanceof IntegerLiteral i) {
        return BigDecimal.valueOf(i.longValue());
      }
      if (lit instanceof FloatLiteral d) {
        double dv = d.doubleValue();
        return Double.isNaN(dv) || Double.isInfinite(dv) ? dv : BigDecimal.valueOf(dv);
      }
      if (lit instanceof DecimalLiteral dec) {
        return dec.value();
      }
    } else if (type == FieldType.BOOLEAN) {
      if (lit instanceof BooleanLiteral b) {
        return b.booleanValue();
      }
    } else if (lit instanceof StringLiteral s) {
      if (type == FieldType.STRING) {
        return s.value();
      }
      try {
        return TypeCaster.cast(s.value(), type, false);
      } catch (CastException e) {
        throw new UnsupportedPredicateException(p, "'" + s.value() + "' is not a " + type + " value");
      }
    }
    throw new UnsupportedPredicateException(p,
        lit.getClass().getSimpleName() + " cannot be compared with " + type + " column " + f.name());
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private static Integer compare(FieldType type, Object value, Object literal) {
    if (type.isNumeric()) {
      if (value instanceof Double d && (d.isNaN() || d.isInfinite()) || literal instanceof Double) {
        double a = ((Number) value).doubleValue();
        double b = ((Number) literal).doubleValue();
        if (Double.isNaN(a) || Double.isNaN(b)) {
          return null;
        }
        return Double.compare(a, b);
      }
      return toBigDecimal(value).compareTo((BigDecimal) literal);
    }
    return ((Comparable) value).compareTo(literal);
  }

  private static BigDecimal toBigDecimal(Object value) {
    if (value instanceof BigDecimal bd) {
      return bd;
    }
    if (value instanceof Double d) {
      return BigDecimal.valueOf(d);
    }
    return BigDecimal.valueOf(((Number) value).longValue());
  }
}

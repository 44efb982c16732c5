package se.alipsa.jselect.model;

import java.util.ArrayList;
import java.util.List;
import se.alipsa.jselect.model.Predicate.And;
import se.alipsa.jselect.model.Predicate.Comparison;
import se.alipsa.jselect.model.Predicate.In;
import se.alipsa.jselect.model.Predicate.IsNotNull;
import se.alipsa.jselect.model.Predicate.IsNull;
import se.alipsa.jselect.model.Predicate.MatchKind;
import se.alipsa.jselect.model.Predicate.Not;
import se.alipsa.jselect.model.Predicate.Operator;
import se.alipsa.jselect.model.Predicate.Or;
import se.alipsa.jselect.model.Predicate.StringMatch;

/** Factory methods for building {@link Predicate} trees. */
public final class Predicates {

  private Predicates() {
  }

  public static Predicate eq(String field, Object value) {
    return new Comparison(field, Operator.EQUALS, Literal.of(value));
  }

  public static Predicate notEq(String field, Object value) {
    return new Comparison(field, Operator.NOT_EQUALS, Literal.of(value));
  }

  public static Predicate gt(String field, Object value) {
    return new Comparison(field, Operator.GREATER_THAN, Literal.of(value));
  }

  public static Predicate gtEq(String field, Object value) {
    return new Comparison(field, Operator.GREATER_OR_EQUAL, Literal.of(value));
  }

  public static Predicate lt(String field, Object value) {
    return new Comparison(field, Operator.LESS_THAN, Literal.of(value));
  }

  public static Predicate ltEq(String field, Object value) {
    return new Comparison(field, Operator.LESS_OR_EQUAL, Literal.of(value));
  }

  /**
   * Create an {@code IN} predicate.
   *
   * @param field
   *          the referenced field
   * @param values
   *          candidate values, converted with {@link Literal#of(Object)}
   * @return the predicate
   */
  public static Predicate in(String field, Object... values) {
    List<Literal> literals = new ArrayList<>(values.length);
    for (Object v : values) {
      literals.add(Literal.of(v));
    }
    return new In(field, literals);
  }

  public static Predicate isNull(String field) {
    return new IsNull(field);
  }

  public static Predicate isNotNull(String field) {
    return new IsNotNull(field);
  }

  public static Predicate startsWith(String field, String prefix) {
    return new StringMatch(field, MatchKind.STARTS_WITH, prefix);
  }

  public static Predicate endsWith(String field, String suffix) {
    return new StringMatch(field, MatchKind.ENDS_WITH, suffix);
  }

  public static Predicate contains(String field, String part) {
    return new StringMatch(field, MatchKind.CONTAINS, part);
  }

  public static Predicate and(Predicate left, Predicate right) {
    return new And(left, right);
  }

  public static Predicate or(Predicate left, Predicate right) {
    return new Or(left, right);
  }

  public static Predicate not(Predicate child) {
    return new Not(child);
  }
}

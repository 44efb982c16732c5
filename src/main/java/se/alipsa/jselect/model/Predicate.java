package se.alipsa.jselect.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Engine level filter expression. Predicates are immutable trees; every field
 * reference must name a field of the schema they are translated or evaluated
 * against.
 */
public sealed interface Predicate permits Predicate.Comparison, Predicate.In, Predicate.IsNull,
    Predicate.IsNotNull, Predicate.StringMatch, Predicate.And, Predicate.Or, Predicate.Not {

  /**
   * Names of all fields referenced anywhere in this predicate, in first-seen
   * order.
   *
   * @return the referenced field names
   */
  default Set<String> referencedFields() {
    Set<String> names = new LinkedHashSet<>();
    collectFields(this, names);
    return names;
  }

  private static void collectFields(Predicate p, Set<String> names) {
    if (p instanceof Comparison c) {
      names.add(c.field());
    } else if (p instanceof In in) {
      names.add(in.field());
    } else if (p instanceof IsNull n) {
      names.add(n.field());
    } else if (p instanceof IsNotNull n) {
      names.add(n.field());
    } else if (p instanceof StringMatch m) {
      names.add(m.field());
    } else if (p instanceof And and) {
      collectFields(and.left(), names);
      collectFields(and.right(), names);
    } else if (p instanceof Or or) {
      collectFields(or.left(), names);
      collectFields(or.right(), names);
    } else if (p instanceof Not not) {
      collectFields(not.child(), names);
    }
  }

  /** Binary comparison operators. */
  enum Operator {
    EQUALS("="),
    NOT_EQUALS("<>"),
    GREATER_THAN(">"),
    GREATER_OR_EQUAL(">="),
    LESS_THAN("<"),
    LESS_OR_EQUAL("<=");

    private final String symbol;

    Operator(String symbol) {
      this.symbol = symbol;
    }

    /**
     * The operator as written in query text.
     *
     * @return the SQL symbol
     */
    public String symbol() {
      return symbol;
    }

    /**
     * Whether the operator orders its operands rather than testing equality.
     *
     * @return true for the four ordering operators
     */
    public boolean isOrdering() {
      return this != EQUALS && this != NOT_EQUALS;
    }
  }

  /** Kinds of substring match. */
  enum MatchKind {
    STARTS_WITH,
    ENDS_WITH,
    CONTAINS
  }

  /**
   * {@code field <op> literal}.
   *
   * @param field
   *          the referenced field
   * @param operator
   *          the comparison operator
   * @param literal
   *          the constant operand
   */
  record Comparison(String field, Operator operator, Literal literal) implements Predicate {
    public Comparison {
      Objects.requireNonNull(field, "field");
      Objects.requireNonNull(operator, "operator");
      Objects.requireNonNull(literal, "literal");
    }

    @Override
    public String toString() {
      return field + " " + operator.symbol() + " " + literal;
    }
  }

  /**
   * {@code field IN (literals...)}.
   *
   * @param field
   *          the referenced field
   * @param values
   *          the candidate constants
   */
  record In(String field, List<Literal> values) implements Predicate {
    public In {
      Objects.requireNonNull(field, "field");
      values = List.copyOf(new ArrayList<>(values));
    }

    @Override
    public String toString() {
      return field + " IN " + values;
    }
  }

  /**
   * {@code field IS NULL}.
   *
   * @param field
   *          the referenced field
   */
  record IsNull(String field) implements Predicate {
    public IsNull {
      Objects.requireNonNull(field, "field");
    }

    @Override
    public String toString() {
      return field + " IS NULL";
    }
  }

  /**
   * {@code field IS NOT NULL}.
   *
   * @param field
   *          the referenced field
   */
  record IsNotNull(String field) implements Predicate {
    public IsNotNull {
      Objects.requireNonNull(field, "field");
    }

    @Override
    public String toString() {
      return field + " IS NOT NULL";
    }
  }

  /**
   * Prefix, suffix or substring match on a text field.
   *
   * @param field
   *          the referenced field
   * @param kind
   *          the kind of match
   * @param value
   *          the text to look for, matched literally
   */
  record StringMatch(String field, MatchKind kind, String value) implements Predicate {
    public StringMatch {
      Objects.requireNonNull(field, "field");
      Objects.requireNonNull(kind, "kind");
      Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
      return kind.name().toLowerCase(java.util.Locale.ROOT) + "(" + field + ", '" + value + "')";
    }
  }

  /**
   * Logical conjunction.
   *
   * @param left
   *          left operand
   * @param right
   *          right operand
   */
  record And(Predicate left, Predicate right) implements Predicate {
    public And {
      Objects.requireNonNull(left, "left");
      Objects.requireNonNull(right, "right");
    }

    @Override
    public String toString() {
      return "(" + left + " AND " + right + ")";
    }
  }

  /**
   * Logical disjunction.
   *
   * @param left
   *          left operand
   * @param right
   *          right operand
   */
  record Or(Predicate left, Predicate right) implements Predicate {
    public Or {
      Objects.requireNonNull(left, "left");
      Objects.requireNonNull(right, "right");
    }

    @Override
    public String toString() {
      return "(" + left + " OR " + right + ")";
    }
  }

  /**
   * Logical negation.
   *
   * @param child
   *          the negated predicate
   */
  record Not(Predicate child) implements Predicate {
    public Not {
      Objects.requireNonNull(child, "child");
    }

    @Override
    public String toString() {
      return "(NOT " + child + ")";
    }
  }
}

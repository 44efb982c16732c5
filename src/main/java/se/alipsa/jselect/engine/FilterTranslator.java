package se.alipsa.jselect.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jselect.CastException;
import se.alipsa.jselect.TranslationException;
import se.alipsa.jselect.UnknownColumnException;
import se.alipsa.jselect.UnsupportedPredicateException;
import se.alipsa.jselect.helper.SqlText;
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
import se.alipsa.jselect.model.Schema;

/**
 * Translator from engine {@link Predicate}s and a schema to a
 * {@code SELECT ... FROM S3Object s WHERE ...} query.
 *
 * <p>
 * Every column reference is alias-qualified and wrapped in
 * {@code NULLIF(col, '')} so that empty fields compare like SQL NULL, the same
 * way {@link TypeCaster} turns empty tokens into {@code null}. Non-text columns
 * are additionally cast to their dialect type so that numbers and timestamps
 * compare by value instead of lexicographically. Compound predicates are always
 * parenthesized.
 */
public final class FilterTranslator {

  private static final Logger log = LoggerFactory.getLogger(FilterTranslator.class);

  /** Table name the remote dialect uses for the queried object. */
  public static final String SOURCE = "S3Object";
  /** Alias every column reference is qualified with. */
  public static final String ALIAS = "s";

  private static final FilterTranslator NAMED = new FilterTranslator(ColumnNaming.BY_NAME);
  private static final FilterTranslator POSITIONAL = new FilterTranslator(ColumnNaming.BY_POSITION);

  private final ColumnNaming naming;

  private FilterTranslator(ColumnNaming naming) {
    this.naming = naming;
  }

  /**
   * Get the translator for the given column naming.
   *
   * @param naming
   *          how columns are referenced
   * @return a shared, stateless translator
   */
  public static FilterTranslator of(ColumnNaming naming) {
    return Objects.requireNonNull(naming, "naming") == ColumnNaming.BY_NAME ? NAMED : POSITIONAL;
  }

  public ColumnNaming naming() {
    return naming;
  }

  /**
   * Render a query projecting every field of {@code schema}, filtered by the
   * conjunction of {@code predicates}.
   *
   * @param schema
   *          the (possibly pruned) schema; predicates may only reference its
   *          fields
   * @param predicates
   *          predicates combined with AND; empty means no WHERE clause
   * @return the query text
   * @throws UnsupportedPredicateException
   *           if any predicate cannot be expressed in the dialect
   * @throws UnknownColumnException
   *           if a predicate references a field that is not in {@code schema}
   */
  public String translate(Schema schema, List<Predicate> predicates) {
    return translate(schema, schema, predicates);
  }

  /**
   * Render a query projecting {@code projection}, filtered by the conjunction of
   * {@code predicates} resolved against {@code source}.
   *
   * @param source
   *          schema of the queried object; predicates are resolved against it
   *          and positional references count within it
   * @param projection
   *          the columns to return, in order
   * @param predicates
   *          predicates combined with AND; empty means no WHERE clause
   * @return the query text
   * @throws UnsupportedPredicateException
   *           if any predicate cannot be expressed in the dialect
   * @throws UnknownColumnException
   *           if a predicate or projected column is not in {@code source}
   */
  public String translate(Schema source, Schema projection, List<Predicate> predicates) {
    return query(source, projection, where(source, predicates));
  }

  /**
   * Render the conjunction of {@code predicates} as a WHERE expression.
   *
   * @param schema
   *          schema the predicates are resolved against
   * @param predicates
   *          predicates combined with AND
   * @return the expression without the {@code WHERE} keyword, empty if there
   *         are no predicates
   * @throws UnsupportedPredicateException
   *           if any predicate cannot be expressed in the dialect
   */
  public String where(Schema schema, List<Predicate> predicates) {
    List<String> fragments = new ArrayList<>();
    for (Predicate p : predicates == null ? List.<Predicate>of() : predicates) {
      fragments.add(render(schema, p));
    }
    return String.join(" AND ", fragments);
  }

  /**
   * Push down what the dialect can express and hand back the rest. Top-level
   * conjunctions are split so that one unsupported conjunct does not prevent
   * the others from being pushed.
   *
   * @param schema
   *          schema the predicates are resolved against
   * @param predicates
   *          predicates combined with AND
   * @return the pushed and residual predicates with the rendered expression
   * @throws UnknownColumnException
   *           if a predicate references a field that is not in {@code schema}
   */
  public PushdownResult split(Schema schema, List<Predicate> predicates) {
    List<Predicate> pushed = new ArrayList<>();
    List<Predicate> residual = new ArrayList<>();
    List<String> fragments = new ArrayList<>();
    List<Predicate> conjuncts = new ArrayList<>();
    for (Predicate p : predicates == null ? List.<Predicate>of() : predicates) {
      flattenAnd(p, conjuncts);
    }
    for (Predicate p : conjuncts) {
      try {
        fragments.add(render(schema, p));
        pushed.add(p);
      } catch (UnsupportedPredicateException e) {
        log.warn("Predicate {} not pushed down, evaluating locally: {}", p, e.reason());
        residual.add(p);
      }
    }
    String where = String.join(" AND ", fragments);
    log.debug("Pushed {} predicate(s), {} residual", pushed.size(), residual.size());
    return new PushdownResult(pushed, residual, where);
  }

  /**
   * Check whether a predicate can be expressed in the dialect.
   *
   * @param schema
   *          schema the predicate is resolved against
   * @param predicate
   *          the predicate to check
   * @return true if {@link #where} would render it
   * @throws UnknownColumnException
   *           if the predicate references a field that is not in {@code schema}
   */
  public boolean supports(Schema schema, Predicate predicate) {
    try {
      render(schema, predicate);
      return true;
    } catch (UnsupportedPredicateException e) {
      return false;
    }
  }

  /**
   * Assemble a query from a projection and an already rendered WHERE
   * expression.
   *
   * @param source
   *          schema of the queried object
   * @param projection
   *          the columns to return, must not be empty
   * @param whereExpression
   *          rendered filter, empty or {@code null} for none
   * @return the query text
   */
  public String query(Schema source, Schema projection, String whereExpression) {
    if (projection.isEmpty()) {
      throw new TranslationException("Cannot render a query without projected columns");
    }
    StringBuilder sb = new StringBuilder("SELECT ");
    for (int i = 0; i < projection.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(reference(source, projection.field(i).name()));
    }
    sb.append(" FROM ").append(SOURCE).append(' ').append(ALIAS);
    if (whereExpression != null && !whereExpression.isEmpty()) {
      sb.append(" WHERE ").append(whereExpression);
    }
    return sb.toString();
  }

  private static void flattenAnd(Predicate p, List<Predicate> out) {
    if (p instanceof And and) {
      flattenAnd(and.left(), out);
      flattenAnd(and.right(), out);
    } else {
      out.add(p);
    }
  }

  private String render(Schema schema, Predicate p) {
    if (p instanceof And and) {
      return "(" + render(schema, and.left()) + " AND " + render(schema, and.right()) + ")";
    }
    if (p instanceof Or or) {
      return "(" + render(schema, or.left()) + " OR " + render(schema, or.right()) + ")";
    }
    if (p instanceof Not not) {
      return "(NOT " + render(schema, not.child()) + ")";
    }
    if (p instanceof Comparison c) {
      Field f = resolve(schema, c.field());
      if (f.type() == FieldType.BOOLEAN && c.operator().isOrdering()) {
        throw new UnsupportedPredicateException(p, "boolean columns have no ordering");
      }
      return valueRef(schema, f) + " " + c.operator().symbol() + " " + literal(p, f, c.literal());
    }
    if (p instanceof In in) {
      Field f = resolve(schema, in.field());
      if (in.values().isEmpty()) {
        throw new UnsupportedPredicateException(p, "empty IN list");
      }
      List<String> values = new ArrayList<>(in.values().size());
      for (Literal lit : in.values()) {
        values.add(literal(p, f, lit));
      }
      return valueRef(schema, f) + " IN (" + String.join(", ", values) + ")";
    }
    if (p instanceof IsNull n) {
      return textRef(schema, resolve(schema, n.field())) + " IS NULL";
    }
    if (p instanceof IsNotNull n) {
      return textRef(schema, resolve(schema, n.field())) + " IS NOT NULL";
    }
    if (p instanceof StringMatch m) {
      Field f = resolve(schema, m.field());
      if (f.type() != FieldType.STRING) {
        throw new UnsupportedPredicateException(p, "string match on " + f.type() + " column");
      }
      String escaped = SqlText.escapeLike(m.value());
      String pattern = switch (m.kind()) {
        case STARTS_WITH -> escaped + "%";
        case ENDS_WITH -> "%" + escaped;
        case CONTAINS -> "%" + escaped + "%";
      };
      return textRef(schema, f) + " LIKE " + SqlText.quoteString(pattern) + " ESCAPE "
          + SqlText.quoteString(String.valueOf(SqlText.LIKE_ESCAPE));
    }
    throw new UnsupportedPredicateException(p, "unknown predicate kind");
  }

  private static Field resolve(Schema schema, String name) {
    Field f = schema.field(name);
    if (f == null) {
      throw new UnknownColumnException(name);
    }
    return f;
  }

  private String reference(Schema schema, String name) {
    int idx = schema.indexOf(name);
    if (idx < 0) {
      throw new UnknownColumnException(name);
    }
    if (naming == ColumnNaming.BY_POSITION) {
      return ALIAS + "._" + (idx + 1);
    }
    return ALIAS + "." + SqlText.quoteIdentifier(name);
  }

  private String textRef(Schema schema, Field f) {
    return "NULLIF(" + reference(schema, f.name()) + ", '')";
  }

  private String valueRef(Schema schema, Field f) {
    String text = textRef(schema, f);
    String castType = f.type().castType();
    return castType == null ? text : "CAST(" + text + " AS " + castType + ")";
  }

  /**
   * Render a literal compared against field {@code f}.
   */
  private static String literal(Predicate p, Field f, Literal lit) {
    if (lit instanceof NullLiteral) {
      throw new UnsupportedPredicateException(p, "comparison with NULL is never true");
    }
    FieldType type = f.type();
    if (type == FieldType.STRING) {
      if (lit instanceof StringLiteral s) {
        return SqlText.quoteString(s.value());
      }
      throw mismatch(p, f, lit);
    }
    if (type == FieldType.BOOLEAN) {
      if (lit instanceof BooleanLiteral b) {
        return Boolean.toString(b.booleanValue());
      }
      throw mismatch(p, f, lit);
    }
    if (type.isNumeric()) {
      if (lit instanceof IntegerLiteral i) {
        return Long.toString(i.longValue());
      }
      if (lit instanceof FloatLiteral d) {
        if (Double.isNaN(d.doubleValue()) || Double.isInfinite(d.doubleValue())) {
          throw new UnsupportedPredicateException(p, "non-finite number " + d.doubleValue());
        }
        return TypeCaster.formatDouble(d.doubleValue());
      }
      if (lit instanceof DecimalLiteral dec) {
        return dec.value().toPlainString();
      }
      throw mismatch(p, f, lit);
    }
    if (type.isTemporal()) {
      if (lit instanceof StringLiteral s) {
        Object value;
        try {
          value = TypeCaster.cast(s.value(), type, false);
        } catch (CastException e) {
          throw new UnsupportedPredicateException(p, "'" + s.value() + "' is not a canonical " + type + " value");
        }
        return "CAST(" + SqlText.quoteString(TypeCaster.format(value, type)) + " AS " + type.castType() + ")";
      }
      throw mismatch(p, f, lit);
    }
    throw mismatch(p, f, lit);
  }

  private static UnsupportedPredicateException mismatch(Predicate p, Field f, Literal lit) {
    return new UnsupportedPredicateException(p,
        lit.getClass().getSimpleName() + " cannot be compared with " + f.type() + " column " + f.name());
  }
}

package se.alipsa.jselect.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jselect.ConfigurationException;
import se.alipsa.jselect.JSelectOptions;
import se.alipsa.jselect.model.Predicate;
import se.alipsa.jselect.model.Schema;
import se.alipsa.jselect.request.CsvInput;
import se.alipsa.jselect.request.CsvOutput;
import se.alipsa.jselect.request.ObjectLocation;
import se.alipsa.jselect.request.SelectRequest;

/**
 * Combines schema pruning and predicate translation into a complete
 * {@link SelectRequest}.
 *
 * <p>
 * Predicates are resolved against the full schema, so filtering on a column
 * that is not projected still pushes down. When local filtering is enabled,
 * columns needed by residual predicates are added to the requested projection
 * and removed again after filtering.
 */
public final class QueryRequestBuilder {

  private static final Logger log = LoggerFactory.getLogger(QueryRequestBuilder.class);

  private QueryRequestBuilder() {
  }

  /**
   * Build the request for one scan.
   *
   * @param options
   *          validated relation options
   * @param location
   *          the queried object
   * @param schema
   *          the full schema of the object
   * @param columns
   *          requested columns in output order, empty or {@code null} for all
   * @param predicates
   *          predicates combined with AND, may be empty or {@code null}
   * @return the prepared query
   * @throws ConfigurationException
   *           if the schema is missing or empty
   * @throws se.alipsa.jselect.UnknownColumnException
   *           if a column or predicate names an unknown field
   * @throws se.alipsa.jselect.UnsupportedPredicateException
   *           if local filtering is enabled and a residual predicate cannot be
   *           evaluated locally either
   * @throws se.alipsa.jselect.TranslationException
   *           if the rendered query is not valid
   */
  public static PreparedQuery build(JSelectOptions options, ObjectLocation location, Schema schema,
      List<String> columns, List<Predicate> predicates) {
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(location, "location");
    if (schema == null || schema.isEmpty()) {
      throw new ConfigurationException("Schema cannot be empty");
    }
    Schema pruned = SchemaPruner.prune(schema, columns);
    FilterTranslator translator = FilterTranslator
        .of(options.header() ? ColumnNaming.BY_NAME : ColumnNaming.BY_POSITION);
    PushdownResult pushdown = translator.split(schema, predicates);

    Schema decodeSchema = pruned;
    if (options.localFilter() && !pushdown.complete()) {
      List<String> needed = new ArrayList<>();
      for (Predicate p : pushdown.residual()) {
        PredicateEvaluator.check(schema, p);
        needed.addAll(p.referencedFields());
      }
      decodeSchema = SchemaPruner.prune(schema, SchemaPruner.widen(pruned.fieldNames(), needed));
    }

    String query = translator.query(schema, decodeSchema, pushdown.whereExpression());
    QueryValidator.validate(query);
    log.debug("Query for {}: {}", location, query);

    SelectRequest request = SelectRequest.builder()
        .location(location)
        .expression(query)
        .input(CsvInput.of(options.headerInfo(), options.delimiter()))
        .compression(options.compression())
        .output(CsvOutput.of(options.delimiter()))
        .build();
    return new PreparedQuery(request, pruned, decodeSchema, pushdown);
  }
}

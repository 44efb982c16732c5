package se.alipsa.jselect.engine;

import java.util.List;
import java.util.Objects;
import se.alipsa.jselect.model.Predicate;
import se.alipsa.jselect.model.Schema;
import se.alipsa.jselect.request.SelectRequest;

/**
 * A request ready to be sent together with what is needed to decode its
 * response.
 *
 * @param request
 *          the outbound request
 * @param schema
 *          the pruned schema rows are delivered in
 * @param decodeSchema
 *          the schema the response is decoded with; wider than {@code schema}
 *          when residual predicates need extra columns
 * @param pushdown
 *          which predicates were pushed and which remain
 */
public record PreparedQuery(SelectRequest request, Schema schema, Schema decodeSchema, PushdownResult pushdown) {

  /**
   * Validates the components.
   *
   * @param request
   *          the request
   * @param schema
   *          the output schema
   * @param decodeSchema
   *          the decode schema
   * @param pushdown
   *          the pushdown split
   */
  public PreparedQuery {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(decodeSchema, "decodeSchema");
    Objects.requireNonNull(pushdown, "pushdown");
  }

  /**
   * Predicates the remote service does not evaluate.
   *
   * @return the residual predicates
   */
  public List<Predicate> residual() {
    return pushdown.residual();
  }
}

package se.alipsa.jselect.engine;

import java.util.List;
import se.alipsa.jselect.model.Predicate;

/**
 * Outcome of splitting predicates into the part the remote service evaluates
 * and the part that must be evaluated locally.
 *
 * @param pushed
 *          predicates rendered into {@code whereExpression}
 * @param residual
 *          predicates the dialect cannot express; the caller must apply them to
 *          the decoded rows
 * @param whereExpression
 *          conjunction of the pushed predicates, empty when nothing was pushed
 */
public record PushdownResult(List<Predicate> pushed, List<Predicate> residual, String whereExpression) {

  /**
   * Copies the lists.
   *
   * @param pushed
   *          the pushed predicates
   * @param residual
   *          the residual predicates
   * @param whereExpression
   *          the rendered expression
   */
  public PushdownResult {
    pushed = List.copyOf(pushed);
    residual = List.copyOf(residual);
  }

  /**
   * Whether every predicate was pushed down.
   *
   * @return true when there is no residual predicate
   */
  public boolean complete() {
    return residual.isEmpty();
  }

  /**
   * Whether the rendered query has a WHERE clause.
   *
   * @return true when at least one predicate was pushed
   */
  public boolean hasWhere() {
    return !whereExpression.isEmpty();
  }
}

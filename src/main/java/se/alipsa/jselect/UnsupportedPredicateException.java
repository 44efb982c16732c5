package se.alipsa.jselect;

import se.alipsa.jselect.model.Predicate;

/**
 * Raised when a predicate has no equivalent in the remote query dialect. The
 * caller is expected to evaluate such a predicate locally.
 */
public class UnsupportedPredicateException extends TranslationException {

  private static final long serialVersionUID = 1L;

  private final transient Predicate predicate;
  private final String reason;

  /**
   * Create a new exception for the given predicate.
   *
   * @param predicate
   *          the predicate that cannot be pushed down
   * @param reason
   *          why the predicate cannot be expressed
   */
  public UnsupportedPredicateException(Predicate predicate, String reason) {
    super("Unsupported predicate " + predicate + ": " + reason);
    this.predicate = predicate;
    this.reason = reason;
  }

  public Predicate predicate() {
    return predicate;
  }

  public String reason() {
    return reason;
  }
}

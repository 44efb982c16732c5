package se.alipsa.jselect;

/** Raised when predicates or projections cannot be rendered as query text. */
public class TranslationException extends JSelectException {

  private static final long serialVersionUID = 1L;

  /**
   * Create a new translation exception.
   *
   * @param message
   *          description of the failure
   */
  public TranslationException(String message) {
    super(message);
  }

  /**
   * Create a new translation exception with a cause.
   *
   * @param message
   *          description of the failure
   * @param cause
   *          the underlying failure
   */
  public TranslationException(String message, Throwable cause) {
    super(message, cause);
  }
}

package se.alipsa.jselect;

/**
 * Base type for every error raised while translating a query, decoding a
 * response or configuring a relation.
 */
public class JSelectException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /**
   * Create a new exception with the supplied message.
   *
   * @param message
   *          description of the failure
   */
  public JSelectException(String message) {
    super(message);
  }

  /**
   * Create a new exception with the supplied message and cause.
   *
   * @param message
   *          description of the failure
   * @param cause
   *          the underlying failure
   */
  public JSelectException(String message, Throwable cause) {
    super(message, cause);
  }
}

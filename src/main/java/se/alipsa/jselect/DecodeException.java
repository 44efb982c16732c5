package se.alipsa.jselect;

/** Raised when the response stream does not match the expected record layout. */
public class DecodeException extends JSelectException {

  private static final long serialVersionUID = 1L;

  /**
   * Create a new decode exception.
   *
   * @param message
   *          description of the failure
   */
  public DecodeException(String message) {
    super(message);
  }

  /**
   * Create a new decode exception with a cause.
   *
   * @param message
   *          description of the failure
   * @param cause
   *          the underlying failure
   */
  public DecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}

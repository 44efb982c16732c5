package se.alipsa.jselect;

/** Raised when no credential source could supply credentials. */
public class CredentialsException extends JSelectException {

  private static final long serialVersionUID = 1L;

  /**
   * Create a new credentials exception.
   *
   * @param message
   *          description of the failure
   */
  public CredentialsException(String message) {
    super(message);
  }
}

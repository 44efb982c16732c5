package se.alipsa.jselect;

import se.alipsa.jselect.model.FieldType;

/**
 * Raised when a token cannot be converted to the type of its field. Carries
 * enough context to locate the offending value.
 */
public class CastException extends JSelectException {

  private static final long serialVersionUID = 1L;

  private final String fieldName;
  private final String token;
  private final FieldType type;
  private final long lineNumber;
  private final String reason;

  /**
   * Create a cast exception without field or line context.
   *
   * @param token
   *          the raw token
   * @param type
   *          the target type
   * @param reason
   *          why the cast failed
   * @param cause
   *          the parse failure, may be {@code null}
   */
  public CastException(String token, FieldType type, String reason, Throwable cause) {
    this(null, token, type, -1, reason, cause);
  }

  private CastException(String fieldName, String token, FieldType type, long lineNumber, String reason,
      Throwable cause) {
    super(message(fieldName, token, type, lineNumber, reason), cause);
    this.fieldName = fieldName;
    this.token = token;
    this.type = type;
    this.lineNumber = lineNumber;
    this.reason = reason;
  }

  /**
   * Return a copy of this exception that also names the field and line.
   *
   * @param field
   *          the name of the field being decoded
   * @param line
   *          1-based line number in the response stream
   * @return a new exception carrying the extra context
   */
  public CastException withContext(String field, long line) {
    CastException e = new CastException(field, token, type, line, reason, getCause());
    e.setStackTrace(getStackTrace());
    return e;
  }

  private static String message(String fieldName, String token, FieldType type, long lineNumber, String reason) {
    StringBuilder sb = new StringBuilder("Cannot cast '").append(token).append("' to ").append(type);
    if (fieldName != null) {
      sb.append(" for field ").append(fieldName);
    }
    if (lineNumber > 0) {
      sb.append(" at line ").append(lineNumber);
    }
    return sb.append(": ").append(reason).toString();
  }

  public String fieldName() {
    return fieldName;
  }

  public String token() {
    return token;
  }

  public FieldType type() {
    return type;
  }

  /**
   * The line the token was read from.
   *
   * @return the 1-based line number, or -1 when unknown
   */
  public long lineNumber() {
    return lineNumber;
  }
}

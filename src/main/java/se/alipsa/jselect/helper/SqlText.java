package se.alipsa.jselect.helper;

/** Quoting and escaping rules for the remote query dialect. */
public final class SqlText {

  /** Escape character declared in every rendered {@code LIKE} clause. */
  public static final char LIKE_ESCAPE = '!';

  private SqlText() {
  }

  /**
   * Quote an identifier with double quotes, doubling embedded quotes.
   *
   * @param name
   *          the raw identifier
   * @return the quoted identifier
   */
  public static String quoteIdentifier(String name) {
    return '"' + name.replace("\"", "\"\"") + '"';
  }

  /**
   * Quote a string constant with single quotes, doubling embedded quotes.
   *
   * @param value
   *          the raw text
   * @return the quoted string literal
   */
  public static String quoteString(String value) {
    return '\'' + value.replace("'", "''") + '\'';
  }

  /**
   * Escape the {@code LIKE} wildcards and the escape character itself so the
   * text is matched literally.
   *
   * @param text
   *          the raw text
   * @return the escaped pattern fragment
   */
  public static String escapeLike(String text) {
    StringBuilder sb = new StringBuilder(text.length() + 8);
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
        sb.append(LIKE_ESCAPE);
      }
      sb.append(c);
    }
    return sb.toString();
  }
}

package se.alipsa.jselect.engine;

import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.PlainSelect;
import se.alipsa.jselect.TranslationException;

/**
 * Checks rendered query text with JSqlParser before it is sent, so malformed
 * text is reported as a {@link TranslationException} instead of a remote error.
 */
public final class QueryValidator {

  private QueryValidator() {
  }

  /**
   * Validate a rendered query.
   *
   * @param query
   *          the query text
   * @return the parsed statement
   * @throws TranslationException
   *           if the text does not parse, or is not a single plain SELECT from
   *           {@value FilterTranslator#SOURCE}
   */
  public static PlainSelect validate(String query) {
    Statement stmt;
    try {
      stmt = CCJSqlParserUtil.parse(query);
    } catch (JSQLParserException e) {
      throw new TranslationException("Rendered query does not parse: " + query, e);
    }
    if (!(stmt instanceof PlainSelect plain)) {
      throw new TranslationException("Rendered query is not a plain SELECT: " + query);
    }
    if (!(plain.getFromItem() instanceof Table table) || !FilterTranslator.SOURCE.equals(table.getName())) {
      throw new TranslationException("Rendered query does not select from " + FilterTranslator.SOURCE + ": " + query);
    }
    if (plain.getJoins() != null && !plain.getJoins().isEmpty()) {
      throw new TranslationException("Rendered query contains a join: " + query);
    }
    return plain;
  }
}

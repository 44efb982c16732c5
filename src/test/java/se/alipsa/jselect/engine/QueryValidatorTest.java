package se.alipsa.jselect.engine;

import static org.junit.jupiter.api.Assertions.*;

import net.sf.jsqlparser.statement.select.PlainSelect;
import org.junit.jupiter.api.Test;
import se.alipsa.jselect.TranslationException;

class QueryValidatorTest {

  @Test
  void acceptsRenderedSelect() {
    PlainSelect select = QueryValidator
        .validate("SELECT s.\"a\", s._2 FROM S3Object s WHERE CAST(NULLIF(s.\"a\", '') AS INT) > 3");
    assertEquals(2, select.getSelectItems().size());
    assertNotNull(select.getWhere());
  }

  @Test
  void rejectsText() {
    assertThrows(TranslationException.class, () -> QueryValidator.validate("SELECT FROM WHERE"));
  }

  @Test
  void rejectsOtherStatements() {
    assertThrows(TranslationException.class, () -> QueryValidator.validate("DELETE FROM S3Object"));
    assertThrows(TranslationException.class,
        () -> QueryValidator.validate("SELECT s.a FROM S3Object s UNION SELECT t.a FROM S3Object t"));
  }

  @Test
  void rejectsOtherSources() {
    assertThrows(TranslationException.class, () -> QueryValidator.validate("SELECT t.a FROM other t"));
    assertThrows(TranslationException.class,
        () -> QueryValidator.validate("SELECT a.x FROM S3Object a JOIN S3Object b ON a.x = b.x"));
  }
}

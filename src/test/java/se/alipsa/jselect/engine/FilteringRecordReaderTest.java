package se.alipsa.jselect.engine;

import static org.junit.jupiter.api.Assertions.*;
import static se.alipsa.jselect.model.Predicates.*;

import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;
import se.alipsa.jselect.model.Field;
import se.alipsa.jselect.model.FieldType;
import se.alipsa.jselect.model.Row;
import se.alipsa.jselect.model.Schema;

class FilteringRecordReaderTest {

  private static final Schema SCHEMA = Schema.of(
      Field.required("id", FieldType.INT32),
      Field.nullable("active", FieldType.BOOLEAN),
      Field.nullable("name", FieldType.STRING));

  private static List<Row> rows() {
    return List.of(Row.of(1, true, "a"), Row.of(2, false, "b"), Row.of(3, null, "c"), Row.of(4, true, "d"));
  }

  @Test
  void keepsOnlyMatchingRows() throws IOException {
    RecordReader reader = FilteringRecordReader.wrap(new InMemoryRecordReader(rows()), SCHEMA,
        List.of(gt("active", false), gt("id", 1)));
    assertEquals(Row.of(4, true, "d"), reader.read());
    assertNull(reader.read());
  }

  @Test
  void noPredicatesReturnsSameReader() {
    RecordReader source = new InMemoryRecordReader(rows());
    assertSame(source, FilteringRecordReader.wrap(source, SCHEMA, List.of()));
    assertSame(source, FilteringRecordReader.wrap(source, SCHEMA, null));
  }

  @Test
  void projectionNarrowsAfterFiltering() throws IOException {
    RecordReader filtered = FilteringRecordReader.wrap(new InMemoryRecordReader(rows()), SCHEMA,
        List.of(eq("active", true)));
    Schema target = SchemaPruner.prune(SCHEMA, List.of("name", "id"));
    try (RecordReader reader = ProjectingRecordReader.wrap(filtered, SCHEMA, target)) {
      assertEquals(Row.of("a", 1), reader.read());
      assertEquals(Row.of("d", 4), reader.read());
      assertNull(reader.read());
    }
  }

  @Test
  void equalSchemasNeedNoProjection() {
    RecordReader source = new InMemoryRecordReader(rows());
    assertSame(source, ProjectingRecordReader.wrap(source, SCHEMA, SchemaPruner.prune(SCHEMA, List.of())));
  }
}

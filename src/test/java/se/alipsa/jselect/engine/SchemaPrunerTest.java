package se.alipsa.jselect.engine;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;
import se.alipsa.jselect.UnknownColumnException;
import se.alipsa.jselect.model.Field;
import se.alipsa.jselect.model.FieldType;
import se.alipsa.jselect.model.Schema;

/** Unit tests for {@link SchemaPruner}. */
class SchemaPrunerTest {

  private static final Schema FULL = Schema.of(
      Field.required("id", FieldType.INT32),
      Field.nullable("name", FieldType.STRING),
      Field.nullable("born", FieldType.DATE),
      Field.nullable("score", FieldType.FLOAT64));

  @Test
  void outputFollowsRequestedOrder() {
    Schema pruned = SchemaPruner.prune(FULL, List.of("score", "id"));
    assertEquals(List.of("score", "id"), pruned.fieldNames());
    assertEquals(FieldType.FLOAT64, pruned.field(0).type());
    assertFalse(pruned.field(1).nullable());
  }

  @Test
  void noColumnsMeansFullSchema() {
    assertSame(FULL, SchemaPruner.prune(FULL, List.of()));
    assertSame(FULL, SchemaPruner.prune(FULL, null));
  }

  @Test
  void unknownColumnFails() {
    UnknownColumnException e = assertThrows(UnknownColumnException.class,
        () -> SchemaPruner.prune(FULL, List.of("id", "missing")));
    assertEquals("missing", e.column());
  }

  @Test
  void pruningIsIdempotent() {
    Schema once = SchemaPruner.prune(FULL, List.of("name", "born"));
    Schema twice = SchemaPruner.prune(once, once.fieldNames());
    assertEquals(once, twice);
  }

  @Test
  void widenAppendsOnlyMissingNames() {
    assertEquals(List.of("name", "id", "score"),
        SchemaPruner.widen(List.of("name", "id"), List.of("id", "score")));
  }

  @Test
  void positionsMapTargetFieldsIntoSource() {
    Schema target = Schema.of(FULL.field("score"), FULL.field("id"));
    assertArrayEquals(new int[]{3, 0}, SchemaPruner.positions(FULL, target));
  }
}

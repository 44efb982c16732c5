package se.alipsa.jselect.engine;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;
import se.alipsa.jselect.CastException;
import se.alipsa.jselect.RecordArityMismatchException;
import se.alipsa.jselect.TrackingInputStream;
import se.alipsa.jselect.model.Field;
import se.alipsa.jselect.model.FieldType;
import se.alipsa.jselect.model.Row;
import se.alipsa.jselect.model.Schema;

class DecodingRecordReaderTest {

  private static final Schema SCHEMA = Schema.of(
      Field.required("id", FieldType.INT32),
      Field.nullable("name", FieldType.STRING));

  @Test
  void decodesTypedRows() throws IOException {
    TrackingInputStream in = new TrackingInputStream("1,Alice\n2,Bob\n");
    try (DecodingRecordReader reader = DecodingRecordReader.open(in, ',', SCHEMA)) {
      assertEquals(Row.of(1, "Alice"), reader.read());
      assertEquals(Row.of(2, "Bob"), reader.read());
      assertNull(reader.read());
      assertTrue(in.isClosed());
    }
  }

  @Test
  void emptyNullableTokenBecomesNull() throws IOException {
    DecodingRecordReader reader = DecodingRecordReader.open(new TrackingInputStream("7,\n"), ',', SCHEMA);
    Row row = reader.read();
    assertEquals(7, row.get(0));
    assertNull(row.get(1));
  }

  @Test
  void castFailureNamesFieldAndLineAndAborts() throws IOException {
    TrackingInputStream in = new TrackingInputStream("1,Alice\nx,Bob\n3,Carol\n");
    DecodingRecordReader reader = DecodingRecordReader.open(in, ',', SCHEMA);
    assertNotNull(reader.read());
    CastException e = assertThrows(CastException.class, reader::read);
    assertEquals("id", e.fieldName());
    assertEquals("x", e.token());
    assertEquals(FieldType.INT32, e.type());
    assertEquals(2, e.lineNumber());
    assertTrue(e.getMessage().startsWith("Cannot cast 'x' to INT32 for field id at line 2"), e.getMessage());
    assertTrue(in.isClosed());
    assertThrows(IllegalStateException.class, reader::read);
  }

  @Test
  void emptyRequiredTokenFails() {
    DecodingRecordReader reader = DecodingRecordReader.open(new TrackingInputStream(",Alice\n"), ',', SCHEMA);
    CastException e = assertThrows(CastException.class, reader::read);
    assertEquals("id", e.fieldName());
    assertEquals(1, e.lineNumber());
  }

  @Test
  void arityMismatchPropagates() {
    DecodingRecordReader reader = DecodingRecordReader.open(new TrackingInputStream("1,Alice,extra\n"), ',',
        SCHEMA);
    assertThrows(RecordArityMismatchException.class, reader::read);
  }

  @Test
  void loneCarriageReturnStaysInsideTheRow() throws IOException {
    Schema schema = Schema.of(Field.nullable("text", FieldType.STRING));
    DecodingRecordReader reader = DecodingRecordReader.open(new TrackingInputStream("a\rb\n"), ',', schema);
    assertEquals(Row.of("a\rb"), reader.read());
    assertNull(reader.read());
  }

  @Test
  void decodesDates() throws IOException {
    Schema schema = Schema.of(Field.nullable("born", FieldType.DATE));
    DecodingRecordReader reader = DecodingRecordReader.open(new TrackingInputStream("1999-12-31\n\n"), ',', schema);
    assertEquals(Row.of(LocalDate.of(1999, 12, 31)), reader.read());
    assertEquals(1, reader.read().size());
    assertNull(reader.read());
  }
}

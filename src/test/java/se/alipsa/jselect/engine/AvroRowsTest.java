package se.alipsa.jselect.engine;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import org.apache.avro.LogicalTypes;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.junit.jupiter.api.Test;
import se.alipsa.jselect.model.Field;
import se.alipsa.jselect.model.FieldType;
import se.alipsa.jselect.model.Row;
import se.alipsa.jselect.model.Schema;

class AvroRowsTest {

  private static final Schema SCHEMA = Schema.of(
      Field.required("id", FieldType.INT32),
      Field.nullable("name", FieldType.STRING),
      Field.nullable("born", FieldType.DATE),
      Field.nullable("seen", FieldType.TIMESTAMP),
      Field.nullable("amount", FieldType.DECIMAL),
      Field.nullable("score", FieldType.FLOAT64),
      Field.nullable("active", FieldType.BOOLEAN),
      Field.nullable("big", FieldType.INT64));

  @Test
  void derivesRecordSchema() {
    org.apache.avro.Schema avro = AvroRows.toAvroSchema(SCHEMA);
    assertEquals(AvroRows.RECORD_NAME, avro.getName());
    assertEquals("se.alipsa.jselect", avro.getNamespace());
    assertEquals(SCHEMA.size(), avro.getFields().size());
    assertEquals(org.apache.avro.Schema.Type.INT, avro.getField("id").schema().getType());
    assertFalse(avro.getField("id").hasDefaultValue());

    org.apache.avro.Schema name = avro.getField("name").schema();
    assertEquals(org.apache.avro.Schema.Type.UNION, name.getType());
    assertEquals(org.apache.avro.Schema.Type.NULL, name.getTypes().get(0).getType());
    assertEquals(org.apache.avro.Schema.Type.STRING, name.getTypes().get(1).getType());
    assertTrue(avro.getField("name").hasDefaultValue());
  }

  @Test
  void mapsLogicalTypes() {
    assertEquals(LogicalTypes.date(), AvroRows.avroType(FieldType.DATE).getLogicalType());
    assertEquals(LogicalTypes.timestampMicros(), AvroRows.avroType(FieldType.TIMESTAMP).getLogicalType());
    assertEquals(org.apache.avro.Schema.Type.STRING, AvroRows.avroType(FieldType.DECIMAL).getType());
    assertEquals(org.apache.avro.Schema.Type.LONG, AvroRows.avroType(FieldType.INT64).getType());
  }

  @Test
  void convertsValues() {
    org.apache.avro.Schema avro = AvroRows.toAvroSchema(SCHEMA);
    Row row = Row.of(1, "Alice", LocalDate.of(1970, 1, 2), LocalDateTime.of(1970, 1, 1, 0, 0, 1, 500_000),
        new BigDecimal("12.30"), 2.5, true, 5_000_000_000L);
    GenericRecord record = AvroRows.toRecord(SCHEMA, avro, row);
    assertEquals(1, record.get("id"));
    assertEquals("Alice", record.get("name"));
    assertEquals(1, record.get("born"));
    assertEquals(1_000_500L, record.get("seen"));
    assertEquals("12.30", record.get("amount"));
    assertEquals(2.5, record.get("score"));
    assertEquals(true, record.get("active"));
    assertEquals(5_000_000_000L, record.get("big"));
    assertTrue(GenericData.get().validate(avro, record));
  }

  @Test
  void nullsStayNull() {
    org.apache.avro.Schema avro = AvroRows.toAvroSchema(SCHEMA);
    GenericRecord record = AvroRows.toRecord(SCHEMA, avro, Row.of(3, null, null, null, null, null, null, null));
    assertNull(record.get("born"));
    assertNull(record.get("amount"));
    assertTrue(GenericData.get().validate(avro, record));
  }

  @Test
  void timestampsBeforeEpochAreNegative() {
    assertEquals(-1_000_000L, AvroRows.avroValue(FieldType.TIMESTAMP, LocalDateTime.of(1969, 12, 31, 23, 59, 59)));
    assertEquals(-1, AvroRows.avroValue(FieldType.DATE, LocalDate.of(1969, 12, 31)));
  }

  @Test
  void readerAdaptsRows() throws IOException {
    Schema schema = Schema.of(Field.required("id", FieldType.INT32), Field.nullable("name", FieldType.STRING));
    try (AvroRecordReader reader = new AvroRecordReader(
        new InMemoryRecordReader(List.of(Row.of(1, "a"), Row.of(2, null))), schema)) {
      assertEquals(schema.size(), reader.avroSchema().getFields().size());
      assertEquals("a", reader.read().get("name"));
      GenericRecord second = reader.read();
      assertEquals(2, second.get("id"));
      assertNull(second.get("name"));
      assertNull(reader.read());
    }
  }
}

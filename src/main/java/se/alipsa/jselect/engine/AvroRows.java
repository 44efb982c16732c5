package se.alipsa.jselect.engine;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import se.alipsa.jselect.model.Field;
import se.alipsa.jselect.model.FieldType;
import se.alipsa.jselect.model.Row;

/**
 * Converts decoded rows and their schema to Avro, for engines that consume
 * {@link GenericRecord}s.
 *
 * <p>
 * DATE maps to {@code int/date}, TIMESTAMP to {@code long/timestamp-micros}
 * (UTC) and DECIMAL to its plain string form, since no precision is declared.
 * Nullable fields become {@code ["null", T]} unions with a null default.
 */
public final class AvroRows {

  /** Record name of generated Avro schemas. */
  public static final String RECORD_NAME = "SelectRecord";

  private AvroRows() {
  }

  /**
   * Derive an Avro record schema.
   *
   * @param schema
   *          the row schema; field names must be valid Avro names
   * @return the Avro record schema
   */
  public static Schema toAvroSchema(se.alipsa.jselect.model.Schema schema) {
    List<Schema.Field> fields = new ArrayList<>(schema.size());
    for (Field f : schema) {
      Schema type = avroType(f.type());
      if (f.nullable()) {
        fields.add(new Schema.Field(f.name(), Schema.createUnion(Schema.create(Schema.Type.NULL), type), null,
            Schema.Field.NULL_DEFAULT_VALUE));
      } else {
        fields.add(new Schema.Field(f.name(), type, null, (Object) null));
      }
    }
    Schema record = Schema.createRecord(RECORD_NAME, null, "se.alipsa.jselect", false);
    record.setFields(fields);
    return record;
  }

  static Schema avroType(FieldType type) {
    return switch (type) {
      case BOOLEAN -> Schema.create(Schema.Type.BOOLEAN);
      case INT32 -> Schema.create(Schema.Type.INT);
      case INT64 -> Schema.create(Schema.Type.LONG);
      case FLOAT64 -> Schema.create(Schema.Type.DOUBLE);
      case STRING, DECIMAL -> Schema.create(Schema.Type.STRING);
      case DATE -> LogicalTypes.date().addToSchema(Schema.create(Schema.Type.INT));
      case TIMESTAMP -> LogicalTypes.timestampMicros().addToSchema(Schema.create(Schema.Type.LONG));
    };
  }

  /**
   * Convert a row to a record of the given Avro schema.
   *
   * @param schema
   *          the row schema
   * @param avroSchema
   *          the schema returned by {@link #toAvroSchema} for {@code schema}
   * @param row
   *          the row
   * @return the record
   */
  public static GenericRecord toRecord(se.alipsa.jselect.model.Schema schema, Schema avroSchema, Row row) {
    GenericData.Record record = new GenericData.Record(avroSchema);
    for (int i = 0; i < schema.size(); i++) {
      record.put(i, avroValue(schema.field(i).type(), row.get(i)));
    }
    return record;
  }

  static Object avroValue(FieldType type, Object value) {
    if (value == null) {
      return null;
    }
    return switch (type) {
      case DATE -> Math.toIntExact(((LocalDate) value).toEpochDay());
      case TIMESTAMP -> {
        LocalDateTime ts = (LocalDateTime) value;
        long seconds = ts.toEpochSecond(ZoneOffset.UTC);
        yield Math.addExact(Math.multiplyExact(seconds, 1_000_000L), ts.getNano() / 1_000L);
      }
      case DECIMAL -> ((BigDecimal) value).toPlainString();
      default -> value;
    };
  }
}

package se.alipsa.jselect.model;

/**
 * Logical column types understood by the translator and the type caster.
 */
public enum FieldType {
  BOOLEAN("BOOL"),
  INT32("INT"),
  INT64("INT"),
  FLOAT64("FLOAT"),
  STRING(null),
  DATE("TIMESTAMP"),
  TIMESTAMP("TIMESTAMP"),
  DECIMAL("DECIMAL");

  private final String castType;

  FieldType(String castType) {
    this.castType = castType;
  }

  /**
   * The type name used in {@code CAST(... AS <type>)} by the remote dialect.
   *
   * @return the dialect type name, or {@code null} for text columns that are
   *         compared without a cast
   */
  public String castType() {
    return castType;
  }

  /**
   * Whether values of this type are numbers.
   *
   * @return true for integral, floating and decimal types
   */
  public boolean isNumeric() {
    return this == INT32 || this == INT64 || this == FLOAT64 || this == DECIMAL;
  }

  /**
   * Whether values of this type are calendar values.
   *
   * @return true for DATE and TIMESTAMP
   */
  public boolean isTemporal() {
    return this == DATE || this == TIMESTAMP;
  }
}

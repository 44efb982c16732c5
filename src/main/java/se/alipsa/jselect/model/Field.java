package se.alipsa.jselect.model;

import java.util.Objects;

/**
 * A named, typed column of a {@link Schema}.
 *
 * @param name
 *          the column name, unique within its schema
 * @param type
 *          the logical type of the column
 * @param nullable
 *          whether empty tokens may decode to {@code null}
 */
public record Field(String name, FieldType type, boolean nullable) {

  /**
   * Validates the components.
   *
   * @param name
   *          the column name
   * @param type
   *          the logical type
   * @param nullable
   *          nullability flag
   */
  public Field {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    if (name.isBlank()) {
      throw new IllegalArgumentException("Field name must not be blank");
    }
  }

  /**
   * Create a nullable field.
   *
   * @param name
   *          the column name
   * @param type
   *          the logical type
   * @return a nullable field
   */
  public static Field nullable(String name, FieldType type) {
    return new Field(name, type, true);
  }

  /**
   * Create a non-nullable field.
   *
   * @param name
   *          the column name
   * @param type
   *          the logical type
   * @return a required field
   */
  public static Field required(String name, FieldType type) {
    return new Field(name, type, false);
  }

  @Override
  public String toString() {
    return name + ":" + type + (nullable ? "" : " not null");
  }
}

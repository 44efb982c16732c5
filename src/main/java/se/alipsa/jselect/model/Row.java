package se.alipsa.jselect.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A decoded record: typed values positionally aligned with the schema used to
 * decode it. Values may be {@code null}.
 */
public final class Row {

  private final Object[] values;

  private Row(Object[] values) {
    this.values = values;
  }

  /**
   * Create a row holding a copy of the supplied values.
   *
   * @param values
   *          the row values in schema order
   * @return the row
   */
  public static Row of(Object... values) {
    return new Row(values.clone());
  }

  /**
   * Create a row from a list of values.
   *
   * @param values
   *          the row values in schema order
   * @return the row
   */
  public static Row of(List<?> values) {
    return new Row(values.toArray());
  }

  public int size() {
    return values.length;
  }

  public Object get(int index) {
    return values[index];
  }

  /**
   * Build a new row from selected positions of this row.
   *
   * @param positions
   *          positions to keep, in output order
   * @return the projected row
   */
  public Row project(int[] positions) {
    Object[] out = new Object[positions.length];
    for (int i = 0; i < positions.length; i++) {
      out[i] = values[positions[i]];
    }
    return new Row(out);
  }

  /**
   * The values as an unmodifiable list.
   *
   * @return the row values
   */
  public List<Object> values() {
    return Collections.unmodifiableList(Arrays.asList(values));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Row other && Arrays.equals(values, other.values);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    return Arrays.toString(values);
  }
}

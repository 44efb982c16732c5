package se.alipsa.jselect.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, ordered sequence of {@link Field}s. Field order defines the
 * positional correspondence with decoded tokens and row values.
 */
public final class Schema implements Iterable<Field> {

  private final List<Field> fields;
  private final Map<String, Integer> positions;

  private Schema(List<Field> fields) {
    Map<String, Integer> idx = new LinkedHashMap<>();
    for (int i = 0; i < fields.size(); i++) {
      Field f = Objects.requireNonNull(fields.get(i), "field");
      if (idx.putIfAbsent(f.name(), i) != null) {
        throw new IllegalArgumentException("Duplicate field name: " + f.name());
      }
    }
    this.fields = List.copyOf(fields);
    this.positions = Collections.unmodifiableMap(idx);
  }

  /**
   * Create a schema from the supplied fields.
   *
   * @param fields
   *          fields in positional order; names must be unique
   * @return the schema
   */
  public static Schema of(List<Field> fields) {
    return new Schema(Objects.requireNonNull(fields, "fields"));
  }

  /**
   * Create a schema from the supplied fields.
   *
   * @param fields
   *          fields in positional order; names must be unique
   * @return the schema
   */
  public static Schema of(Field... fields) {
    return new Schema(List.of(fields));
  }

  public List<Field> fields() {
    return fields;
  }

  public int size() {
    return fields.size();
  }

  public boolean isEmpty() {
    return fields.isEmpty();
  }

  public Field field(int index) {
    return fields.get(index);
  }

  /**
   * Look up a field by its exact name.
   *
   * @param name
   *          the field name
   * @return the field, or {@code null} if absent
   */
  public Field field(String name) {
    Integer idx = positions.get(name);
    return idx == null ? null : fields.get(idx);
  }

  /**
   * Position of the named field.
   *
   * @param name
   *          the field name
   * @return the zero-based position, or -1 if absent
   */
  public int indexOf(String name) {
    Integer idx = positions.get(name);
    return idx == null ? -1 : idx;
  }

  public boolean contains(String name) {
    return positions.containsKey(name);
  }

  /**
   * Field names in schema order.
   *
   * @return immutable list of names
   */
  public List<String> fieldNames() {
    List<String> names = new ArrayList<>(fields.size());
    for (Field f : fields) {
      names.add(f.name());
    }
    return Collections.unmodifiableList(names);
  }

  @Override
  public Iterator<Field> iterator() {
    return fields.iterator();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Schema other && fields.equals(other.fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return fields.toString();
  }
}

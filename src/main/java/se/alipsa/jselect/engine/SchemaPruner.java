package se.alipsa.jselect.engine;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import se.alipsa.jselect.UnknownColumnException;
import se.alipsa.jselect.model.Field;
import se.alipsa.jselect.model.Schema;

/** Narrows a schema to the columns a scan actually needs. */
public final class SchemaPruner {

  private SchemaPruner() {
  }

  /**
   * Project {@code schema} down to the named columns.
   *
   * @param schema
   *          the full schema
   * @param columnNames
   *          requested columns in output order; {@code null} or empty means all
   *          columns
   * @return a schema whose field order follows {@code columnNames}, or
   *         {@code schema} itself when no columns are requested
   * @throws UnknownColumnException
   *           if a requested name is not a field of {@code schema}
   */
  public static Schema prune(Schema schema, List<String> columnNames) {
    if (columnNames == null || columnNames.isEmpty()) {
      return schema;
    }
    List<Field> fields = new ArrayList<>(columnNames.size());
    for (String name : columnNames) {
      Field f = schema.field(name);
      if (f == null) {
        throw new UnknownColumnException(name);
      }
      fields.add(f);
    }
    return Schema.of(fields);
  }

  /**
   * Extend a column list with extra names that are not already present.
   *
   * @param columnNames
   *          the requested columns, in order
   * @param extra
   *          additional columns to append, in order
   * @return the combined list, requested names first
   */
  static List<String> widen(List<String> columnNames, Iterable<String> extra) {
    Set<String> combined = new LinkedHashSet<>(columnNames);
    for (String name : extra) {
      combined.add(name);
    }
    return List.copyOf(combined);
  }

  /**
   * Positions of {@code target}'s fields within {@code source}.
   *
   * @param source
   *          the schema rows are decoded with
   * @param target
   *          the schema rows should be projected to
   * @return for each target field, its index in {@code source}
   */
  static int[] positions(Schema source, Schema target) {
    int[] out = new int[target.size()];
    for (int i = 0; i < out.length; i++) {
      String name = target.field(i).name();
      int idx = source.indexOf(name);
      if (idx < 0) {
        throw new UnknownColumnException(name);
      }
      out[i] = idx;
    }
    return out;
  }
}

package se.alipsa.jselect.engine;

/** How column references are written in the rendered query. */
public enum ColumnNaming {
  /** {@code s."name"}: the object carries a header row naming its columns. */
  BY_NAME,
  /** {@code s._N}: 1-based column position, for objects without a header row. */
  BY_POSITION
}

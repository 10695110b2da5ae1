package io.intellixity.tabula.exec;

/** Read-only view over the current row of a result. */
public interface RowAdapter {
  boolean isNull(String column);
  Object raw(String column);

  default String string(String column) {
    Object v = raw(column);
    return v == null ? null : String.valueOf(v);
  }

  default long longValue(String column) {
    Object v = raw(column);
    if (v == null) return 0L;
    if (v instanceof Number n) return n.longValue();
    return Long.parseLong(String.valueOf(v).trim());
  }
}

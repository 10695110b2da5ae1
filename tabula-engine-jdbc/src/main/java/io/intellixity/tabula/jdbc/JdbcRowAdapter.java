package io.intellixity.tabula.jdbc;

import io.intellixity.tabula.EngineException;
import io.intellixity.tabula.exec.RowAdapter;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/** {@link RowAdapter} over the current row of a {@link ResultSet}; column lookup is case-insensitive. */
public final class JdbcRowAdapter implements RowAdapter {
  private final ResultSet rs;
  private Map<String, Integer> colIndex;

  public JdbcRowAdapter(ResultSet rs) {
    this.rs = rs;
  }

  @Override public boolean isNull(String column) { return raw(column) == null; }

  @Override
  public Object raw(String column) {
    try {
      return rs.getObject(indexOf(column));
    } catch (SQLException e) {
      throw new EngineException("Failed to read column '" + column + "'", e);
    }
  }

  private int indexOf(String column) throws SQLException {
    if (colIndex == null) {
      ResultSetMetaData md = rs.getMetaData();
      Map<String, Integer> m = new HashMap<>();
      for (int i = 1; i <= md.getColumnCount(); i++) {
        m.putIfAbsent(md.getColumnLabel(i).toLowerCase(Locale.ROOT), i);
      }
      colIndex = m;
    }
    Integer idx = colIndex.get(column.toLowerCase(Locale.ROOT));
    if (idx == null) throw new EngineException("Unknown column '" + column + "' in result");
    return idx;
  }
}

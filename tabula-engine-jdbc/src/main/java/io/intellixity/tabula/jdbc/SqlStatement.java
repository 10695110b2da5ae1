package io.intellixity.tabula.jdbc;

import io.intellixity.tabula.spi.sql.NativeStatement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** SQL text with positional {@code ?} parameters. */
public record SqlStatement(String sql, List<Object> binds, ExecKind execKind) implements NativeStatement {
  public enum ExecKind {
    /** Execute via PreparedStatement.executeQuery(). */
    QUERY,
    /** Execute via PreparedStatement.executeUpdate(). */
    UPDATE
  }

  public SqlStatement {
    // List.copyOf rejects null elements, and SQL NULL is a legal bind
    binds = binds == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(binds));
    execKind = (execKind == null) ? ExecKind.QUERY : execKind;
  }

  public static SqlStatement query(String sql, List<?> binds) {
    return new SqlStatement(sql, binds == null ? null : new ArrayList<>(binds), ExecKind.QUERY);
  }

  public static SqlStatement update(String sql, List<?> binds) {
    return new SqlStatement(sql, binds == null ? null : new ArrayList<>(binds), ExecKind.UPDATE);
  }
}

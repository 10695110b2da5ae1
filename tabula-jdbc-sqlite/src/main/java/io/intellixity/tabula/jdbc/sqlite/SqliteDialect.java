package io.intellixity.tabula.jdbc.sqlite;

import io.intellixity.tabula.jdbc.SqlStatement;
import io.intellixity.tabula.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.tabula.jdbc.dialect.JdbcDialect;

import java.util.List;
import java.util.Locale;

/**
 * SQLite dialect implementation for JDBC.
 *
 * Keeps only SQLite-specific overrides; generic SQL rendering lives in {@link AbstractJdbcSqlDialect}.
 * Insertion order comes from the implicit {@code rowid}, which grows on every insert into a table that
 * never sees deletes; history files written by other tools carry it as well.
 */
public final class SqliteDialect extends AbstractJdbcSqlDialect implements JdbcDialect {
  @Override public String id() { return "sqlite"; }

  @Override
  protected String insertionOrderExpr() {
    return "rowid";
  }

  /** Triggers keeping {@code history} append-only. */
  @Override
  public List<SqlStatement> guardHistory() {
    return List.of(rejectOn("UPDATE", "history_no_update"), rejectOn("DELETE", "history_no_delete"));
  }

  private SqlStatement rejectOn(String event, String triggerName) {
    String sql = "CREATE TRIGGER IF NOT EXISTS " + quoteIdent(triggerName)
        + " BEFORE " + event + " ON " + quoteIdent(HISTORY)
        + " BEGIN SELECT RAISE(ABORT, 'history is append-only'); END";
    return SqlStatement.update(sql, List.of());
  }

  @Override
  public SqlStatement listTables() {
    return SqlStatement.query("SELECT name FROM sqlite_master WHERE type = 'table' ORDER BY name", List.of());
  }

  @Override
  public boolean isInternalTable(String tableName) {
    if (super.isInternalTable(tableName)) return true;
    return tableName != null && tableName.toLowerCase(Locale.ROOT).startsWith("sqlite_");
  }
}

package io.intellixity.tabula.jdbc.dialect;

import io.intellixity.tabula.history.HistoryKind;
import io.intellixity.tabula.jdbc.SqlStatement;
import io.intellixity.tabula.schema.ColumnSpec;
import io.intellixity.tabula.schema.TableSchema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JDBC-generic SQL dialect base.
 *
 * Values always travel as {@code ?} binds. Identifiers cannot be bound, so they are quoted with
 * {@link #quoteIdent(String)}; declared column types are validated by {@link TableSchema} and spliced as-is.
 *
 * DB-specific dialects override hooks for quoting, limits, table listing and the insertion-order column.
 */
public abstract class AbstractJdbcSqlDialect implements JdbcDialect {
  protected static final String HISTORY = TableSchema.HISTORY_TABLE;

  /** Expression yielding a value that grows with every insert into the history table. */
  protected abstract String insertionOrderExpr();

  @Override
  public SqlStatement createTable(TableSchema schema) {
    Objects.requireNonNull(schema, "schema");
    List<String> cols = new ArrayList<>(schema.columns().size());
    for (ColumnSpec c : schema.columns()) {
      cols.add(c.declaredType().isEmpty() ? quoteIdent(c.name()) : quoteIdent(c.name()) + " " + c.declaredType());
    }
    String sql = "CREATE TABLE " + quoteIdent(schema.name()) + " (" + String.join(", ", cols) + ")";
    return SqlStatement.update(sql, List.of());
  }

  @Override
  public SqlStatement dropTableIfExists(String tableName) {
    return SqlStatement.update("DROP TABLE IF EXISTS " + quoteIdent(tableName), List.of());
  }

  @Override
  public SqlStatement createHistoryTable() {
    String sql = "CREATE TABLE IF NOT EXISTS " + quoteIdent(HISTORY) + " ("
        + quoteIdent("time") + " INT, "
        + quoteIdent("type") + " TEXT, "
        + quoteIdent("event") + " TEXT)";
    return SqlStatement.update(sql, List.of());
  }

  @Override
  public SqlStatement insertHistory(long epochSeconds, HistoryKind kind, String event) {
    String sql = "INSERT INTO " + quoteIdent(HISTORY) + " ("
        + quoteIdent("time") + ", " + quoteIdent("type") + ", " + quoteIdent("event") + ") VALUES (?, ?, ?)";
    List<Object> binds = new ArrayList<>(3);
    binds.add(epochSeconds);
    binds.add(kind.text());
    binds.add(event);
    return SqlStatement.update(sql, binds);
  }

  @Override
  public SqlStatement selectHistory(HistoryKind kind) {
    StringBuilder sql = new StringBuilder(historyProjection());
    List<Object> binds = new ArrayList<>();
    if (kind != null) {
      sql.append(" WHERE ").append(quoteIdent("type")).append(" = ?");
      binds.add(kind.text());
    }
    sql.append(" ORDER BY ").append(insertionOrderExpr()).append(" ASC");
    return SqlStatement.query(sql.toString(), binds);
  }

  @Override
  public SqlStatement selectLatest(HistoryKind kind) {
    Objects.requireNonNull(kind, "kind");
    String sql = historyProjection()
        + " WHERE " + quoteIdent("type") + " = ?"
        + " ORDER BY " + quoteIdent("time") + " DESC, " + insertionOrderExpr() + " DESC";
    return SqlStatement.query(applyLimit(sql, 1), List.of(kind.text()));
  }

  @Override
  public SqlStatement raw(String sql, List<?> params) {
    String head = sql.stripLeading();
    boolean returnsRows = startsWithIgnoreCase(head, "SELECT")
        || startsWithIgnoreCase(head, "WITH")
        || startsWithIgnoreCase(head, "PRAGMA")
        || startsWithIgnoreCase(head, "VALUES");
    return returnsRows ? SqlStatement.query(sql, params) : SqlStatement.update(sql, params);
  }

  @Override
  public boolean isInternalTable(String tableName) {
    return TableSchema.isReserved(tableName);
  }

  protected String historyProjection() {
    return "SELECT " + insertionOrderExpr() + " AS seq, "
        + quoteIdent("time") + " AS time, "
        + quoteIdent("type") + " AS type, "
        + quoteIdent("event") + " AS event FROM " + quoteIdent(HISTORY);
  }

  protected String applyLimit(String sql, int limit) {
    return sql + " LIMIT " + limit;
  }

  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  private static boolean startsWithIgnoreCase(String s, String prefix) {
    return s.regionMatches(true, 0, prefix, 0, prefix.length());
  }
}

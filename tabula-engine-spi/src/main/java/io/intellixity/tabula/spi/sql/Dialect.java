package io.intellixity.tabula.spi.sql;

import io.intellixity.tabula.history.HistoryKind;
import io.intellixity.tabula.schema.TableSchema;

import java.util.List;

/**
 * Backend-agnostic SPI: renders the statements a storage engine runs.
 *
 * History selects must project the columns {@code seq, time, type, event}; {@link #listTables()} must project
 * {@code name}.
 */
public interface Dialect<S extends NativeStatement> {
  String id();

  S listTables();

  S createTable(TableSchema schema);

  S dropTableIfExists(String tableName);

  S createHistoryTable();

  /**
   * Statements that make the history table reject UPDATE and DELETE. Must be idempotent; run after
   * {@link #createHistoryTable()} and again whenever an existing file is opened. Empty when the backend cannot
   * enforce it.
   */
  default List<S> guardHistory() {
    return List.of();
  }

  S insertHistory(long epochSeconds, HistoryKind kind, String event);

  /** Entries of {@code kind} (every kind if null) in insertion order. */
  S selectHistory(HistoryKind kind);

  /** At most one row: the newest entry of {@code kind} by (time desc, insertion order desc). */
  S selectLatest(HistoryKind kind);

  /** Caller-supplied statement with positional parameters. */
  S raw(String sql, List<?> params);

  /** True for tables the engine keeps for itself and callers never see. */
  boolean isInternalTable(String tableName);
}

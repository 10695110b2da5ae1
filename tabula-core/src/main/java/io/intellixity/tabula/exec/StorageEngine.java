package io.intellixity.tabula.exec;

import io.intellixity.tabula.exec.handle.EngineHandle;
import io.intellixity.tabula.history.HistoryEntry;
import io.intellixity.tabula.history.HistoryKind;
import io.intellixity.tabula.schema.TableSchema;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Adapter over one connection to an embedded transactional engine.
 *
 * Every failure raised by the engine surfaces as {@link io.intellixity.tabula.EngineException}.
 */
public interface StorageEngine<H extends EngineHandle<?>> extends AutoCloseable {
  /** Returns the engine handle used by this instance. */
  H handle();

  /** Default transaction propagation for this engine instance (used by {@link #inTx(Supplier)}). */
  Propagation defaultPropagation();

  /** Run work within a transaction boundary using the given propagation behavior. */
  <T> T inTx(Propagation propagation, Supplier<T> work);

  /** Run work using this engine instance's {@link #defaultPropagation()}. */
  default <T> T inTx(Supplier<T> work) {
    return inTx(defaultPropagation(), work);
  }

  /** Names of all user-visible tables, engine-internal tables excluded. */
  Set<String> tableNames();

  void createTable(TableSchema schema);

  void dropTableIfExists(String name);

  /** Create the reserved history table if it does not exist yet, together with its append-only guards. */
  void createHistoryTable();

  /** Install the append-only guards on an existing history table; a no-op when they are present. */
  void guardHistory();

  void insertHistory(long epochSeconds, HistoryKind kind, String event);

  /** History entries in insertion order; {@code kind == null} selects every kind. */
  List<HistoryEntry> selectHistory(HistoryKind kind);

  /** Newest entry of {@code kind} by (time desc, insertion order desc). */
  Optional<HistoryEntry> selectLatest(HistoryKind kind);

  /** Raw parameterized statement (DDL/DML); returns the update count. */
  long execute(String sql, List<?> params);

  /** Raw parameterized query. */
  <T> List<T> query(String sql, List<?> params, RowReader<T> reader);

  /** Release the connection. Calling it more than once has no effect. */
  @Override
  void close();
}

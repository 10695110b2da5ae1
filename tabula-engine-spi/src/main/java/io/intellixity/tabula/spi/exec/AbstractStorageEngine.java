package io.intellixity.tabula.spi.exec;

import io.intellixity.tabula.EngineException;
import io.intellixity.tabula.exec.Propagation;
import io.intellixity.tabula.exec.RowAdapter;
import io.intellixity.tabula.exec.RowReader;
import io.intellixity.tabula.exec.StorageEngine;
import io.intellixity.tabula.exec.handle.EngineHandle;
import io.intellixity.tabula.history.HistoryEntry;
import io.intellixity.tabula.history.HistoryKind;
import io.intellixity.tabula.schema.TableSchema;
import io.intellixity.tabula.spi.sql.Dialect;
import io.intellixity.tabula.spi.sql.NativeStatement;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Template-method orchestrator for one engine connection.
 *
 * Responsibilities:
 * - Transaction scoping via {@link #inTx(Propagation, java.util.function.Supplier)}
 * - Build native statements using {@link Dialect}
 * - Delegate execution to backend-specific hooks
 *
 * Not thread-safe: one engine serves one store on one thread.
 */
public abstract class AbstractStorageEngine<S extends NativeStatement, H extends EngineHandle<?>> implements StorageEngine<H> {
  private final H handle;
  private final Dialect<S> dialect;
  private final Propagation defaultPropagation;

  /** Engine-scoped transaction slot; the engine owns a single connection so at most one tx is live. */
  private TxHandle current;
  private volatile boolean closed;

  protected AbstractStorageEngine(Dialect<S> dialect, H handle, Propagation defaultPropagation) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.defaultPropagation = (defaultPropagation == null) ? Propagation.REQUIRED : defaultPropagation;
  }

  protected AbstractStorageEngine(Dialect<S> dialect, H handle) {
    this(dialect, handle, Propagation.REQUIRED);
  }

  /** Backend-specific transaction begin. */
  protected abstract TxHandle begin();

  /** Backend-specific transaction commit (paired with {@link #begin()}). */
  protected abstract void commit(TxHandle tx);

  /** Backend-specific transaction rollback (paired with {@link #begin()}). */
  protected abstract void rollback(TxHandle tx);

  /** Run a statement that returns rows; {@code txOrNull == null} means auto-commit. */
  protected abstract <T> List<T> executeQuery(TxHandle txOrNull, S stmt, RowReader<T> reader);

  /** Run a statement that returns an update count; {@code txOrNull == null} means auto-commit. */
  protected abstract long executeUpdate(TxHandle txOrNull, S stmt);

  /** Release the native client. Called at most once. */
  protected abstract void release();

  @Override
  public final Propagation defaultPropagation() {
    return defaultPropagation;
  }

  @Override
  public final H handle() { return handle; }

  protected final Dialect<S> dialect() { return dialect; }

  protected final TxHandle currentTxOrNull() {
    return current;
  }

  public final boolean isClosed() { return closed; }

  @Override
  public <T> T inTx(Supplier<T> work) {
    return inTx(defaultPropagation, work);
  }

  @Override
  public final <T> T inTx(Propagation propagation, Supplier<T> work) {
    Objects.requireNonNull(propagation, "propagation");
    Objects.requireNonNull(work, "work");
    ensureOpen();
    TxHandle existing = currentTxOrNull();
    return switch (propagation) {
      case REQUIRED -> (existing != null) ? work.get() : runInNewTx(work);
      case SUPPORTS -> work.get();
      case MANDATORY -> {
        if (existing == null) throw new IllegalStateException("No existing transaction for propagation=MANDATORY");
        yield work.get();
      }
      case NEVER -> {
        if (existing != null) throw new IllegalStateException("Existing transaction found for propagation=NEVER");
        yield work.get();
      }
    };
  }

  private <T> T runInNewTx(Supplier<T> work) {
    TxHandle tx = begin();
    current = tx;
    try {
      T result = work.get();
      current = null;
      commit(tx);
      return result;
    } catch (Throwable t) {
      current = null;
      try {
        rollback(tx);
      } catch (RuntimeException re) {
        t.addSuppressed(re);
      }
      if (t instanceof RuntimeException re) throw re;
      if (t instanceof Error e) throw e;
      throw new EngineException("Transaction failed on " + handle.id(), t);
    }
  }

  // --- Reads (no tx creation) ---

  @Override
  public final Set<String> tableNames() {
    ensureOpen();
    List<String> names = executeQuery(currentTxOrNull(), dialect.listTables(), row -> row.string("name"));
    Set<String> out = new TreeSet<>();
    for (String n : names) {
      if (n != null && !dialect.isInternalTable(n)) out.add(n);
    }
    return out;
  }

  @Override
  public final List<HistoryEntry> selectHistory(HistoryKind kind) {
    ensureOpen();
    return executeQuery(currentTxOrNull(), dialect.selectHistory(kind), AbstractStorageEngine::historyEntry);
  }

  @Override
  public final Optional<HistoryEntry> selectLatest(HistoryKind kind) {
    Objects.requireNonNull(kind, "kind");
    ensureOpen();
    List<HistoryEntry> rows = executeQuery(currentTxOrNull(), dialect.selectLatest(kind), AbstractStorageEngine::historyEntry);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public final <T> List<T> query(String sql, List<?> params, RowReader<T> reader) {
    Objects.requireNonNull(sql, "sql");
    Objects.requireNonNull(reader, "reader");
    ensureOpen();
    return executeQuery(currentTxOrNull(), dialect.raw(sql, params), reader);
  }

  // --- Writes (join the current tx or run in a new one) ---

  @Override
  public final void createTable(TableSchema schema) {
    Objects.requireNonNull(schema, "schema");
    write(dialect.createTable(schema));
  }

  @Override
  public final void dropTableIfExists(String name) {
    Objects.requireNonNull(name, "name");
    write(dialect.dropTableIfExists(name));
  }

  @Override
  public final void createHistoryTable() {
    inTx(Propagation.REQUIRED, () -> {
      executeUpdate(currentTxOrNull(), dialect.createHistoryTable());
      for (S guard : dialect.guardHistory()) executeUpdate(currentTxOrNull(), guard);
      return null;
    });
  }

  @Override
  public final void guardHistory() {
    ensureOpen();
    List<S> guards = dialect.guardHistory();
    if (guards.isEmpty()) return;
    inTx(Propagation.REQUIRED, () -> {
      for (S guard : guards) executeUpdate(currentTxOrNull(), guard);
      return null;
    });
  }

  @Override
  public final void insertHistory(long epochSeconds, HistoryKind kind, String event) {
    Objects.requireNonNull(kind, "kind");
    write(dialect.insertHistory(epochSeconds, kind, event));
  }

  @Override
  public final long execute(String sql, List<?> params) {
    Objects.requireNonNull(sql, "sql");
    return write(dialect.raw(sql, params));
  }

  private long write(S stmt) {
    return inTx(Propagation.REQUIRED, () -> executeUpdate(currentTxOrNull(), stmt));
  }

  @Override
  public final void close() {
    if (closed) return;
    closed = true;
    TxHandle tx = current;
    current = null;
    try {
      if (tx != null) rollback(tx);
    } finally {
      release();
    }
  }

  protected final void ensureOpen() {
    if (closed) throw new EngineException("Engine " + handle.id() + " is closed");
  }

  private static HistoryEntry historyEntry(RowAdapter row) {
    return new HistoryEntry(
        row.longValue("seq"),
        row.longValue("time"),
        HistoryKind.fromText(row.string("type")),
        row.string("event"));
  }
}

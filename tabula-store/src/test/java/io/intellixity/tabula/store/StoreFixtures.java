package io.intellixity.tabula.store;

import io.intellixity.tabula.exec.EngineConnector;
import io.intellixity.tabula.exec.Propagation;
import io.intellixity.tabula.exec.RowReader;
import io.intellixity.tabula.exec.StorageEngine;
import io.intellixity.tabula.exec.handle.EngineHandle;
import io.intellixity.tabula.gate.ConfirmationGate;
import io.intellixity.tabula.gate.ConfirmationGates;
import io.intellixity.tabula.history.HistoryEntry;
import io.intellixity.tabula.history.HistoryKind;
import io.intellixity.tabula.jdbc.sqlite.SqliteConnector;
import io.intellixity.tabula.schema.TableSchema;
import io.intellixity.tabula.spi.exec.AbstractStorageEngine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/** Stores wired with a settable clock, a captured chatter sink and a recording SQLite connector. */
final class StoreFixtures {
  final AtomicLong clock = new AtomicLong(1_700_000_000L);
  final List<String> chatter = new ArrayList<>();
  final RecordingConnector connector = new RecordingConnector();

  Store store() {
    return store(ConfirmationGates.deny());
  }

  Store store(ConfirmationGate gate) {
    return new Store(StoreOptions.builder()
        .gate(gate)
        .connector(connector)
        .clock(clock::get)
        .chatterSink(chatter::add)
        .build());
  }

  /** A store file at {@code path} stamped with {@code version}, left closed. */
  Path createdStore(Path path, String version) {
    Store s = store();
    s.create(path, version, true);
    s.close();
    return path;
  }

  long rowCount(Store s, String table) {
    return s.query("SELECT COUNT(*) AS n FROM \"" + table + "\"", List.of(), r -> r.longValue("n")).get(0);
  }

  static final class RecordingConnector implements EngineConnector {
    private final SqliteConnector delegate = new SqliteConnector();
    final List<CountingEngine> engines = new ArrayList<>();

    @Override public String id() { return "recording"; }

    @Override
    public StorageEngine<?> connect(Path path, boolean createIfMissing) {
      CountingEngine e = new CountingEngine(delegate.connect(path, createIfMissing));
      engines.add(e);
      return e;
    }

    /** True when every engine handed out so far has been released. */
    boolean allClosed() {
      for (CountingEngine e : engines) {
        if (!((AbstractStorageEngine<?, ?>) e.delegate).isClosed()) return false;
      }
      return true;
    }

    int closeCalls() {
      int n = 0;
      for (CountingEngine e : engines) n += e.closeCalls.get();
      return n;
    }
  }

  /** Delegates everything and counts {@link #close()} calls, which may arrive on the Cleaner thread. */
  static final class CountingEngine implements StorageEngine<EngineHandle<?>> {
    final StorageEngine<?> delegate;
    final AtomicInteger closeCalls = new AtomicInteger();

    CountingEngine(StorageEngine<?> delegate) {
      this.delegate = delegate;
    }

    @Override public EngineHandle<?> handle() { return delegate.handle(); }
    @Override public Propagation defaultPropagation() { return delegate.defaultPropagation(); }
    @Override public <T> T inTx(Propagation propagation, Supplier<T> work) { return delegate.inTx(propagation, work); }
    @Override public Set<String> tableNames() { return delegate.tableNames(); }
    @Override public void createTable(TableSchema schema) { delegate.createTable(schema); }
    @Override public void dropTableIfExists(String name) { delegate.dropTableIfExists(name); }
    @Override public void createHistoryTable() { delegate.createHistoryTable(); }
    @Override public void guardHistory() { delegate.guardHistory(); }
    @Override public void insertHistory(long epochSeconds, HistoryKind kind, String event) {
      delegate.insertHistory(epochSeconds, kind, event);
    }
    @Override public List<HistoryEntry> selectHistory(HistoryKind kind) { return delegate.selectHistory(kind); }
    @Override public Optional<HistoryEntry> selectLatest(HistoryKind kind) { return delegate.selectLatest(kind); }
    @Override public long execute(String sql, List<?> params) { return delegate.execute(sql, params); }
    @Override public <T> List<T> query(String sql, List<?> params, RowReader<T> reader) {
      return delegate.query(sql, params, reader);
    }

    @Override
    public void close() {
      closeCalls.incrementAndGet();
      delegate.close();
    }
  }
}

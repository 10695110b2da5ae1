package io.intellixity.tabula.store;

import io.intellixity.tabula.AlreadyOpenException;
import io.intellixity.tabula.EngineException;
import io.intellixity.tabula.NotOpenException;
import io.intellixity.tabula.Outcome;
import io.intellixity.tabula.StoreNotFoundException;
import io.intellixity.tabula.exec.RowReader;
import io.intellixity.tabula.exec.StorageEngine;
import io.intellixity.tabula.gate.ConfirmationGate;
import io.intellixity.tabula.gate.EntityKind;
import io.intellixity.tabula.history.HistoryEntry;
import io.intellixity.tabula.history.HistoryKind;
import io.intellixity.tabula.schema.ColumnSpec;
import io.intellixity.tabula.schema.TableSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.ref.Cleaner;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One versioned store file and the single connection held on it.
 *
 * States: Closed (initial) and Open. {@link #open(Path)} and {@link #create(Path, String, boolean)} move to Open,
 * {@link #close()} moves back. Every other transition fails with {@link AlreadyOpenException} or
 * {@link NotOpenException} and changes nothing.
 *
 * Not thread-safe. A store abandoned while open has its connection released by a {@link Cleaner} action.
 */
public final class Store {
  private static final Logger log = LoggerFactory.getLogger(Store.class);
  private static final Cleaner CLEANER = Cleaner.create();

  private static final Pattern SCHEMA_CHANGE = Pattern.compile("\\s*(DROP|ALTER)\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern HISTORY_OBJECT =
      Pattern.compile("(?<![\\w$])history(_no_update|_no_delete)?(?![\\w$])", Pattern.CASE_INSENSITIVE);

  private final StoreOptions options;
  private final Chatter chatter;
  private ConfirmationGate gate;

  /** Null while Closed. */
  private Session session;

  public Store() {
    this(StoreOptions.defaults());
  }

  public Store(StoreOptions options) {
    this.options = Objects.requireNonNull(options, "options");
    this.chatter = new Chatter(options.verbosity(), options.chatterSink());
    this.gate = options.gate();
  }

  // --- Lifecycle ---

  /**
   * Open an existing store file and resolve its version.
   *
   * @throws AlreadyOpenException   if this store already holds a connection
   * @throws StoreNotFoundException if {@code path} is not an existing file
   * @throws EngineException        if the engine cannot connect or the history log cannot be read
   */
  public void open(Path path) {
    Objects.requireNonNull(path, "path");
    if (session != null) {
      throw new AlreadyOpenException("Trying to open " + path + " while " + session.path + " is already open");
    }
    if (!Files.isRegularFile(path)) throw new StoreNotFoundException(path);

    StorageEngine<?> engine = options.connector().connect(path, false);
    Session s;
    try {
      HistoryLog history = new HistoryLog(engine, options.clock());
      String version = history.resolveVersion();
      engine.guardHistory();
      s = new Session(path, engine, history, version);
    } catch (RuntimeException e) {
      releaseAfterFailure(engine, e);
      throw e;
    }
    session = s;
    log.info("tabula.store opened path={} version={}", path, s.version);
    chatter.say("File: " + path + " (version: " + s.version + ") opened successfully", Chatter.LIFECYCLE);
  }

  /** {@link #create(Path, String, boolean, ConfirmationGate)} with this store's gate. */
  public Outcome create(Path path, String version, boolean force) {
    return create(path, version, force, gate);
  }

  /**
   * Create a new store file stamped with {@code version}.
   *
   * If a file already exists at {@code path} and {@code force} is false, {@code confirm} decides whether it is
   * deleted; a refusal returns {@link Outcome#DECLINED} and leaves the file alone. {@code force} only skips the
   * question: creating while open is always rejected.
   */
  public Outcome create(Path path, String version, boolean force, ConfirmationGate confirm) {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(version, "version");
    Objects.requireNonNull(confirm, "confirm");
    if (session != null) {
      throw new AlreadyOpenException("Trying to create a new file: " + path
          + " when another file (" + session.path + ") is already open");
    }

    if (Files.exists(path)) {
      if (!force && !confirm.confirm(path.toString(), EntityKind.STORE_FILE)) {
        chatter.say("Create dbfile " + path + " operation cancelled", Chatter.LIFECYCLE);
        return Outcome.DECLINED;
      }
      chatter.say("Deleting dbfile " + path, Chatter.LIFECYCLE);
      deleteStoreFile(path);
    }

    StorageEngine<?> engine;
    try {
      engine = options.connector().connect(path, true);
    } catch (RuntimeException e) {
      discardPartialFile(path, e);
      throw e;
    }
    Session s;
    try {
      engine.createHistoryTable();
      HistoryLog history = new HistoryLog(engine, options.clock());
      history.logMessage("file created");
      history.logVersion(version);
      s = new Session(path, engine, history, history.resolveVersion());
    } catch (RuntimeException e) {
      releaseAfterFailure(engine, e);
      discardPartialFile(path, e);
      throw e;
    }
    session = s;
    log.info("tabula.store created path={} version={}", path, s.version);
    return Outcome.APPLIED;
  }

  /**
   * Release the connection and clear the cached version.
   *
   * @throws NotOpenException if no store is open
   */
  public void close() {
    if (session == null) throw new NotOpenException("Trying to close file that is not open");
    Session s = session;
    session = null;
    s.release();
    log.info("tabula.store closed path={}", s.path);
  }

  public boolean isOpen() { return session != null; }

  public Optional<Path> path() {
    return session == null ? Optional.empty() : Optional.of(session.path);
  }

  /** Cached version of the open store; empty while Closed. */
  public Optional<String> version() {
    return session == null ? Optional.empty() : Optional.of(session.version);
  }

  public int verbosity() { return chatter.verbosity(); }

  public void setVerbosity(int verbosity) { chatter.setVerbosity(verbosity); }

  public ConfirmationGate confirmationGate() { return gate; }

  public void setConfirmationGate(ConfirmationGate gate) { this.gate = Objects.requireNonNull(gate, "gate"); }

  // --- Tables ---

  /**
   * Add a table described in text form, e.g. {@code "Id INT, Name TEXT, Price INT"}.
   *
   * @throws EngineException if the column text is malformed or the engine rejects it
   */
  public Outcome addTable(String name, String columns, boolean force) {
    Objects.requireNonNull(name, "name");
    requireOpen();
    TableManager.requireCallerTableName(name);
    TableSchema schema;
    try {
      schema = TableSchema.parse(name, columns);
    } catch (IllegalArgumentException e) {
      throw new EngineException("Malformed column spec for table '" + name + "' in " + session.path, e);
    }
    return addTable(schema, force);
  }

  public Outcome addTable(String name, List<ColumnSpec> columns, boolean force) {
    return addTable(new TableSchema(name, columns), force);
  }

  /**
   * Create {@code schema.name()}, replacing an existing table of that name if the gate (or {@code force})
   * allows. Drop and create commit together; on failure the previous table is left intact.
   */
  public Outcome addTable(TableSchema schema, boolean force) {
    return requireOpen().tables.add(schema, force, gate);
  }

  /** Drop a table; missing tables are a no-op, existing ones are gated like {@link #addTable}. */
  public Outcome dropTable(String name, boolean force) {
    return requireOpen().tables.drop(name, force, gate);
  }

  /** Caller table names, sorted; the history table is not listed. */
  public Set<String> tableNames() {
    return requireOpen().tables.names();
  }

  public boolean hasTable(String name) {
    Objects.requireNonNull(name, "name");
    return requireOpen().tables.exists(name);
  }

  // --- History ---

  public void append(HistoryKind kind, String text) {
    Session s = requireOpen();
    s.history.append(kind, text);
    if (kind == HistoryKind.VERSION) s.version = s.history.resolveVersion();
  }

  public void logMessage(String message) { append(HistoryKind.MESSAGE, message); }

  public void logWarning(String warning) { append(HistoryKind.WARNING, warning); }

  public void logError(String error) { append(HistoryKind.ERROR, error); }

  public void logVersion(String version) { append(HistoryKind.VERSION, version); }

  /**
   * Read the current version from the history log.
   *
   * @throws io.intellixity.tabula.NoVersionRecordedException if no version entry exists
   */
  public String resolveVersion() {
    return requireOpen().history.resolveVersion();
  }

  /** All history entries in insertion order. */
  public List<HistoryEntry> history() {
    return requireOpen().history.entries();
  }

  public List<HistoryEntry> history(HistoryKind kind) {
    return requireOpen().history.entries(kind);
  }

  // --- Pass-through for import/export collaborators ---

  /**
   * Run a parameterized statement in its own transaction; returns the update count. UPDATE and DELETE against the
   * history log fail in the engine.
   *
   * @throws IllegalArgumentException if the statement drops or alters the history log
   */
  public long execute(String sql, List<?> params) {
    Session s = requireOpen();
    rejectHistoryDdl(sql);
    return s.engine.execute(sql, params);
  }

  public <T> List<T> query(String sql, List<?> params, RowReader<T> reader) {
    Session s = requireOpen();
    rejectHistoryDdl(sql);
    return s.engine.query(sql, params, reader);
  }

  public StoreDescriptor describe() {
    Session s = requireOpen();
    return new StoreDescriptor(s.path, s.version, new ArrayList<>(s.tables.names()), s.history.entries());
  }

  // --- internals ---

  private Session requireOpen() {
    if (session == null) throw new NotOpenException("No store file is open");
    return session;
  }

  // Row-level changes to history are refused by the engine; schema changes have to be caught here.
  private static void rejectHistoryDdl(String sql) {
    Objects.requireNonNull(sql, "sql");
    if (SCHEMA_CHANGE.matcher(sql).lookingAt() && HISTORY_OBJECT.matcher(sql).find()) {
      throw new IllegalArgumentException("The history log cannot be dropped or altered: " + sql.strip());
    }
  }

  private static void deleteStoreFile(Path path) {
    try {
      Files.delete(path);
      deleteSidecars(path);
    } catch (IOException e) {
      throw new EngineException("Cannot delete existing store file " + path, e);
    }
  }

  // Leftover sidecar files would otherwise be replayed into the next store at this path.
  private static void deleteSidecars(Path path) throws IOException {
    for (String suffix : List.of("-journal", "-wal", "-shm")) {
      Files.deleteIfExists(path.resolveSibling(path.getFileName() + suffix));
    }
  }

  /** Remove a store file whose initialisation failed; the old file, if any, is already gone. */
  private static void discardPartialFile(Path path, RuntimeException failure) {
    try {
      Files.deleteIfExists(path);
      deleteSidecars(path);
      log.debug("tabula.store discarded partial file path={}", path);
    } catch (IOException e) {
      failure.addSuppressed(e);
    }
  }

  private static void releaseAfterFailure(StorageEngine<?> engine, RuntimeException failure) {
    try {
      engine.close();
    } catch (RuntimeException closeFailure) {
      failure.addSuppressed(closeFailure);
    }
  }

  /** Everything that exists only while the store is Open. */
  private final class Session {
    final Path path;
    final StorageEngine<?> engine;
    final HistoryLog history;
    final TableManager tables;
    final EngineRelease release;
    final Cleaner.Cleanable cleanable;
    String version;

    Session(Path path, StorageEngine<?> engine, HistoryLog history, String version) {
      this.path = path;
      this.engine = engine;
      this.history = history;
      this.tables = new TableManager(engine, history, chatter);
      this.version = version;
      this.release = new EngineRelease(engine, path);
      this.cleanable = CLEANER.register(Store.this, release);
    }

    void release() {
      release.explicit = true;
      cleanable.clean();
    }
  }

  /** Cleaner action; must not reference the Store. */
  private static final class EngineRelease implements Runnable {
    private final StorageEngine<?> engine;
    private final Path path;
    volatile boolean explicit;

    EngineRelease(StorageEngine<?> engine, Path path) {
      this.engine = engine;
      this.path = path;
    }

    @Override
    public void run() {
      if (explicit) {
        engine.close();
        return;
      }
      log.warn("tabula.store abandoned while open, releasing connection path={}", path);
      try {
        engine.close();
      } catch (RuntimeException e) {
        log.warn("tabula.store failed to release abandoned connection path={}", path, e);
      }
    }
  }
}

package io.intellixity.tabula.jdbc.sqlite;

import io.intellixity.tabula.EngineException;
import io.intellixity.tabula.exec.EngineConnector;
import io.intellixity.tabula.exec.Propagation;
import io.intellixity.tabula.exec.StorageEngine;
import io.intellixity.tabula.jdbc.JdbcHandle;
import io.intellixity.tabula.jdbc.JdbcStorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteOpenMode;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicLong;

/** Opens SQLite store files through xerial sqlite-jdbc. */
public final class SqliteConnector implements EngineConnector {
  private static final Logger log = LoggerFactory.getLogger(SqliteConnector.class);

  public static final String BUSY_TIMEOUT_KEY = "tabula.sqlite.busyTimeoutMs";
  public static final int DEFAULT_BUSY_TIMEOUT_MS = 5000;

  private static final AtomicLong SEQ = new AtomicLong();

  private final int busyTimeoutMs;
  private final SqliteDialect dialect = new SqliteDialect();

  public SqliteConnector() {
    this(DEFAULT_BUSY_TIMEOUT_MS);
  }

  public SqliteConnector(int busyTimeoutMs) {
    if (busyTimeoutMs < 0) throw new IllegalArgumentException("busyTimeoutMs must be >= 0");
    this.busyTimeoutMs = busyTimeoutMs;
  }

  @Override public String id() { return "sqlite"; }

  public int busyTimeoutMs() { return busyTimeoutMs; }

  @Override
  public SqliteConnector configure(Properties settings) {
    if (settings == null) return this;
    String v = settings.getProperty(BUSY_TIMEOUT_KEY);
    if (v == null || v.isBlank()) return this;
    try {
      return new SqliteConnector(Integer.parseInt(v.trim()));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid " + BUSY_TIMEOUT_KEY + ": '" + v + "'", e);
    }
  }

  @Override
  public StorageEngine<?> connect(Path path, boolean createIfMissing) {
    Objects.requireNonNull(path, "path");
    SQLiteConfig config = new SQLiteConfig();
    config.setBusyTimeout(busyTimeoutMs);
    if (!createIfMissing) config.resetOpenMode(SQLiteOpenMode.CREATE);

    Path location = path.toAbsolutePath().normalize();
    String url = "jdbc:sqlite:" + location;
    try {
      Connection c = config.createConnection(url);
      String id = "sqlite:" + location.getFileName() + "#" + SEQ.incrementAndGet();
      log.debug("tabula.sqlite connected handleId={} location={} create={}", id, location, createIfMissing);
      return new JdbcStorageEngine(new JdbcHandle(id, c, location), dialect, Propagation.REQUIRED);
    } catch (SQLException e) {
      throw new EngineException("Cannot connect to " + location, e);
    }
  }
}

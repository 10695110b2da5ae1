package io.intellixity.tabula.jdbc;

import io.intellixity.tabula.EngineException;
import io.intellixity.tabula.exec.Propagation;
import io.intellixity.tabula.exec.RowReader;
import io.intellixity.tabula.jdbc.dialect.JdbcDialect;
import io.intellixity.tabula.spi.exec.AbstractStorageEngine;
import io.intellixity.tabula.spi.exec.TxHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/** {@link io.intellixity.tabula.exec.StorageEngine} over a single JDBC connection. */
public final class JdbcStorageEngine extends AbstractStorageEngine<SqlStatement, JdbcHandle> {
  private static final Logger log = LoggerFactory.getLogger(JdbcStorageEngine.class);
  private final Connection conn;

  public JdbcStorageEngine(JdbcHandle handle, JdbcDialect dialect, Propagation defaultPropagation) {
    super(dialect, handle, defaultPropagation);
    this.conn = handle.client();
  }

  public JdbcStorageEngine(JdbcHandle handle, JdbcDialect dialect) {
    this(handle, dialect, Propagation.REQUIRED);
  }

  @Override
  protected TxHandle begin() {
    try {
      conn.setAutoCommit(false);
      log.trace("tabula.jdbc tx=begin handleId={}", handle().id());
      return new JdbcTxHandle(conn);
    } catch (SQLException e) {
      throw new EngineException("Failed to begin transaction on " + handle().location(), e);
    }
  }

  @Override
  protected void commit(TxHandle tx) {
    JdbcTxHandle j = (JdbcTxHandle) tx;
    try {
      j.conn.commit();
      j.conn.setAutoCommit(true);
      log.trace("tabula.jdbc tx=commit handleId={}", handle().id());
    } catch (SQLException e) {
      throw new EngineException("Failed to commit on " + handle().location(), e);
    }
  }

  @Override
  protected void rollback(TxHandle tx) {
    JdbcTxHandle j = (JdbcTxHandle) tx;
    try {
      j.conn.rollback();
      j.conn.setAutoCommit(true);
      log.debug("tabula.jdbc tx=rollback handleId={}", handle().id());
    } catch (SQLException e) {
      throw new EngineException("Failed to roll back on " + handle().location(), e);
    }
  }

  @Override
  protected <T> List<T> executeQuery(TxHandle txOrNull, SqlStatement ss, RowReader<T> reader) {
    long start = System.nanoTime();
    debugSql("QUERY", ss, txOrNull != null);
    try (PreparedStatement ps = conn.prepareStatement(ss.sql())) {
      bindAll(ps, ss);
      if (ss.execKind() == SqlStatement.ExecKind.UPDATE) {
        // Caller asked for rows from a statement that returns none.
        ps.executeUpdate();
        debugDone("QUERY", ss, 0, System.nanoTime() - start);
        return List.of();
      }
      try (ResultSet rs = ps.executeQuery()) {
        List<T> out = new ArrayList<>();
        JdbcRowAdapter row = new JdbcRowAdapter(rs);
        while (rs.next()) out.add(reader.read(row));
        debugDone("QUERY", ss, out.size(), System.nanoTime() - start);
        return out;
      }
    } catch (SQLException e) {
      throw new EngineException("Query failed on " + handle().location(), e);
    }
  }

  @Override
  protected long executeUpdate(TxHandle txOrNull, SqlStatement ss) {
    long start = System.nanoTime();
    debugSql("UPDATE", ss, txOrNull != null);
    try (PreparedStatement ps = conn.prepareStatement(ss.sql())) {
      bindAll(ps, ss);
      long n;
      if (ss.execKind() == SqlStatement.ExecKind.QUERY) {
        // Row-returning statement used for its side effect (e.g. a PRAGMA).
        ps.execute();
        n = 0;
      } else {
        n = ps.executeUpdate();
      }
      debugDone("UPDATE", ss, n, System.nanoTime() - start);
      return n;
    } catch (SQLException e) {
      throw new EngineException("Statement failed on " + handle().location(), e);
    }
  }

  @Override
  protected void release() {
    try {
      conn.close();
      log.debug("tabula.jdbc released handleId={} location={}", handle().id(), handle().location());
    } catch (SQLException e) {
      throw new EngineException("Failed to close connection to " + handle().location(), e);
    }
  }

  public record JdbcTxHandle(Connection conn) implements TxHandle {}

  private static void bindAll(PreparedStatement ps, SqlStatement stmt) throws SQLException {
    for (int i = 0; i < stmt.binds().size(); i++) {
      ps.setObject(i + 1, stmt.binds().get(i));
    }
  }

  private void debugSql(String op, SqlStatement ss, boolean inTx) {
    if (!log.isDebugEnabled()) return;
    log.debug("tabula.jdbc op={} execKind={} inTx={} bindCount={} handleId={} sql={}",
        op, ss.execKind(), inTx, ss.binds().size(), handle().id(), ss.sql());

    // TRACE: bind summary only (no raw values; history text may be sensitive)
    if (log.isTraceEnabled() && !ss.binds().isEmpty()) {
      int idx = 1;
      for (Object v : ss.binds()) {
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("tabula.jdbc bind index={} valueType={} valueLen={}", idx++, vType, vLen);
      }
    }
  }

  private void debugDone(String op, SqlStatement ss, Object result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("tabula.jdbc_done op={} execKind={} durationMs={} result={}",
        op, ss.execKind(), durationNanos / 1_000_000.0, result);
  }
}

package io.intellixity.tabula.jdbc;

import io.intellixity.tabula.EngineException;
import io.intellixity.tabula.history.HistoryEntry;
import io.intellixity.tabula.history.HistoryKind;
import io.intellixity.tabula.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.tabula.schema.TableSchema;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcStorageEngineTest {

  private static final class RowidDialect extends AbstractJdbcSqlDialect {
    @Override public String id() { return "rowid"; }
    @Override protected String insertionOrderExpr() { return "rowid"; }
    @Override public SqlStatement listTables() {
      return SqlStatement.query("SELECT name FROM sqlite_master WHERE type = 'table'", List.of());
    }
    @Override public boolean isInternalTable(String tableName) {
      return super.isInternalTable(tableName) || tableName.startsWith("sqlite_");
    }
  }

  @TempDir
  Path dir;

  private JdbcStorageEngine engine;

  @BeforeEach
  void setUp() throws Exception {
    Path file = dir.resolve("engine.db");
    Connection c = DriverManager.getConnection("jdbc:sqlite:" + file);
    engine = new JdbcStorageEngine(new JdbcHandle("test", c, file), new RowidDialect());
    engine.createHistoryTable();
  }

  @AfterEach
  void tearDown() {
    engine.close();
  }

  @Test
  void historyTableIsHiddenFromTableNames() {
    engine.createTable(TableSchema.parse("people", "id INT, name TEXT"));
    assertEquals(Set.of("people"), engine.tableNames());
  }

  @Test
  void sameSecondEntriesResolveByInsertionOrder() {
    engine.insertHistory(100L, HistoryKind.VERSION, "1.0");
    engine.insertHistory(100L, HistoryKind.VERSION, "2.0");
    engine.insertHistory(100L, HistoryKind.MESSAGE, "unrelated");
    assertEquals("2.0", engine.selectLatest(HistoryKind.VERSION).orElseThrow().payload());
  }

  @Test
  void laterTimestampWinsOverLaterInsert() {
    engine.insertHistory(200L, HistoryKind.VERSION, "newer");
    engine.insertHistory(100L, HistoryKind.VERSION, "backdated");
    assertEquals("newer", engine.selectLatest(HistoryKind.VERSION).orElseThrow().payload());
  }

  @Test
  void historyComesBackInInsertionOrderWithSequence() {
    engine.insertHistory(5L, HistoryKind.MESSAGE, "a");
    engine.insertHistory(4L, HistoryKind.ERROR, "b");
    List<HistoryEntry> all = engine.selectHistory(null);
    assertEquals(List.of("a", "b"), all.stream().map(HistoryEntry::payload).toList());
    assertTrue(all.get(0).sequence() < all.get(1).sequence());
    assertEquals(List.of("b"), engine.selectHistory(HistoryKind.ERROR).stream().map(HistoryEntry::payload).toList());
  }

  @Test
  void failedCreateRollsBackTheDrop() {
    engine.createTable(TableSchema.parse("people", "id INT"));
    engine.execute("INSERT INTO people (id) VALUES (?)", List.of(7));

    assertThrows(EngineException.class, () -> engine.inTx(() -> {
      engine.dropTableIfExists("people");
      engine.createTable(TableSchema.parse("people", "id INT, id TEXT"));
      return null;
    }));

    List<Long> ids = engine.query("SELECT id FROM people", List.of(), row -> row.longValue("id"));
    assertEquals(List.of(7L), ids);
  }

  @Test
  void engineMessageIsPreserved() {
    EngineException ex = assertThrows(EngineException.class, () -> engine.execute("INSERT INTO nowhere VALUES (1)", List.of()));
    assertTrue(ex.getMessage().contains("nowhere"), ex.getMessage());
    assertTrue(ex.getMessage().contains("engine.db"), ex.getMessage());
  }
}

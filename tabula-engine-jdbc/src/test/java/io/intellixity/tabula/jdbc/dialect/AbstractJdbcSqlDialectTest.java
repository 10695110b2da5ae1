package io.intellixity.tabula.jdbc.dialect;

import io.intellixity.tabula.history.HistoryKind;
import io.intellixity.tabula.jdbc.SqlStatement;
import io.intellixity.tabula.schema.TableSchema;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class AbstractJdbcSqlDialectTest {

  private static final class TestDialect extends AbstractJdbcSqlDialect {
    @Override public String id() { return "test"; }
    @Override protected String insertionOrderExpr() { return "rowid"; }
    @Override public SqlStatement listTables() { return SqlStatement.query("SELECT name FROM tables", List.of()); }
  }

  private final TestDialect d = new TestDialect();

  @Test
  void createTableQuotesNamesAndKeepsTypes() {
    SqlStatement s = d.createTable(TableSchema.parse("people", "id INT, name TEXT, blob"));
    assertEquals("CREATE TABLE \"people\" (\"id\" INT, \"name\" TEXT, \"blob\")", s.sql());
    assertEquals(SqlStatement.ExecKind.UPDATE, s.execKind());
    assertTrue(s.binds().isEmpty());
  }

  @Test
  void historyInsertIsParameterized() {
    SqlStatement s = d.insertHistory(1700000000L, HistoryKind.WARNING, "it's 'quoted'");
    assertEquals("INSERT INTO \"history\" (\"time\", \"type\", \"event\") VALUES (?, ?, ?)", s.sql());
    assertEquals(List.of(1700000000L, "warning", "it's 'quoted'"), s.binds());
  }

  @Test
  void latestOrdersByTimeThenInsertionOrder() {
    SqlStatement s = d.selectLatest(HistoryKind.VERSION);
    assertTrue(s.sql().endsWith("WHERE \"type\" = ? ORDER BY \"time\" DESC, rowid DESC LIMIT 1"), s.sql());
    assertEquals(List.of("version"), s.binds());
  }

  @Test
  void historyWithoutKindHasNoFilter() {
    SqlStatement s = d.selectHistory(null);
    assertFalse(s.sql().contains("WHERE"));
    assertTrue(s.sql().endsWith("ORDER BY rowid ASC"));
  }

  @Test
  void rawPicksExecKindFromLeadingKeyword() {
    assertEquals(SqlStatement.ExecKind.QUERY, d.raw("  select * from people", List.of()).execKind());
    assertEquals(SqlStatement.ExecKind.QUERY, d.raw("WITH x AS (SELECT 1) SELECT * FROM x", null).execKind());
    assertEquals(SqlStatement.ExecKind.UPDATE, d.raw("INSERT INTO people VALUES (?)", List.of(1)).execKind());
  }

  @Test
  void rawKeepsNullBinds() {
    SqlStatement s = d.raw("INSERT INTO people VALUES (?, ?)", Arrays.asList(1, null));
    assertEquals(2, s.binds().size());
    assertNull(s.binds().get(1));
  }

  @Test
  void quoteIdentEscapesQuotes() {
    assertEquals("\"a\"\"b\"", d.quoteIdent("a\"b"));
    assertTrue(d.isInternalTable("History"));
    assertFalse(d.isInternalTable("people"));
  }
}

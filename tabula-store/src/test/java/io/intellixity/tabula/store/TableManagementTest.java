package io.intellixity.tabula.store;

import io.intellixity.tabula.EngineException;
import io.intellixity.tabula.Outcome;
import io.intellixity.tabula.gate.ConfirmationGates;
import io.intellixity.tabula.history.HistoryEntry;
import io.intellixity.tabula.history.HistoryKind;
import io.intellixity.tabula.schema.ColumnSpec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

final class TableManagementTest {

  @TempDir
  Path dir;

  private final StoreFixtures fx = new StoreFixtures();
  private Store store;

  @BeforeEach
  void createStore() {
    store = fx.store();
    store.create(dir.resolve("t.db"), "1.0", false);
  }

  @AfterEach
  void closeStore() {
    if (store.isOpen()) store.close();
  }

  private void insertProduct() {
    store.execute("INSERT INTO Products (Id, Name, Price) VALUES (?, ?, ?)", List.of(1, "widget", 5));
  }

  private List<String> messages() {
    return store.history(HistoryKind.MESSAGE).stream().map(HistoryEntry::payload).collect(Collectors.toList());
  }

  @Test
  void addTableCreatesAndRecordsIt() {
    assertEquals(Outcome.APPLIED, store.addTable("Products", "Id INT, Name TEXT, Price INT", false));

    assertEquals(Set.of("Products"), store.tableNames());
    assertTrue(store.hasTable("Products"));
    assertTrue(store.hasTable("products"));
    assertFalse(store.hasTable("history"));
    assertEquals(List.of("file created", "table Products created"), messages());
  }

  @Test
  void addTableFromColumnList() {
    store.addTable("Prices", List.of(new ColumnSpec("Sku", "TEXT"), new ColumnSpec("Amount", "DECIMAL(10,2)")), false);

    store.execute("INSERT INTO Prices VALUES (?, ?)", List.of("a-1", 9.5));
    assertEquals(1L, fx.rowCount(store, "Prices"));
  }

  @Test
  void declinedReplaceKeepsExistingRows() {
    store.addTable("Products", "Id INT, Name TEXT, Price INT", false);
    insertProduct();

    assertEquals(Outcome.DECLINED, store.addTable("Products", "Id INT, Name TEXT, Price INT", false));

    assertEquals(1L, fx.rowCount(store, "Products"));
    assertTrue(fx.chatter.contains("Add table Products operation cancelled"));
    assertEquals(List.of("file created", "table Products created"), messages());
  }

  @Test
  void acceptedReplaceLeavesAnEmptyTable() {
    store.addTable("Products", "Id INT, Name TEXT, Price INT", false);
    insertProduct();
    store.setConfirmationGate(ConfirmationGates.allow());

    assertEquals(Outcome.APPLIED, store.addTable("Products", "Id INT, Name TEXT, Price INT, Stock INT", false));

    assertEquals(0L, fx.rowCount(store, "Products"));
    store.execute("INSERT INTO Products (Stock) VALUES (?)", List.of(3));
  }

  @Test
  void forcedReplaceNeverAsks() {
    store.addTable("Products", "Id INT, Name TEXT, Price INT", false);
    store.setConfirmationGate(ConfirmationGates.scripted());

    assertEquals(Outcome.APPLIED, store.addTable("Products", "Id INT", true));
  }

  @Test
  void dropThenAddGivesAnEmptyTable() {
    store.addTable("Products", "Id INT, Name TEXT, Price INT", false);
    insertProduct();

    assertEquals(Outcome.APPLIED, store.dropTable("Products", true));
    assertFalse(store.hasTable("Products"));
    store.addTable("Products", "Id INT, Name TEXT, Price INT", false);

    assertEquals(0L, fx.rowCount(store, "Products"));
    assertEquals(List.of("file created", "table Products created", "table Products dropped", "table Products created"),
        messages());
  }

  @Test
  void failedReplaceRollsBackTheDrop() {
    store.addTable("Products", "Id INT, Name TEXT, Price INT", false);
    insertProduct();

    EngineException e = assertThrows(EngineException.class, () -> store.addTable("Products", "Id INT, Id TEXT", true));

    assertTrue(e.getMessage().contains("Cannot create table 'Products'"), e.getMessage());
    assertTrue(store.hasTable("Products"));
    assertEquals(1L, fx.rowCount(store, "Products"));
    assertEquals(List.of("file created", "table Products created"), messages());
    store.logMessage("still usable");
  }

  @Test
  void historyNameIsReserved() {
    assertThrows(IllegalArgumentException.class, () -> store.addTable("history", "a INT", true));
    assertThrows(IllegalArgumentException.class, () -> store.addTable("HISTORY", "a INT", true));
    assertThrows(IllegalArgumentException.class, () -> store.dropTable("History", true));
    assertEquals("1.0", store.resolveVersion());
  }

  @Test
  void malformedColumnSpecIsAnEngineError() {
    assertThrows(EngineException.class, () -> store.addTable("Bad", "", false));
    assertThrows(EngineException.class, () -> store.addTable("Bad", "Id INT, , Name TEXT", false));
    assertThrows(EngineException.class, () -> store.addTable("Bad", "Id INT); DROP TABLE history; --", false));
    assertEquals(Set.of(), store.tableNames());
  }

  @Test
  void droppingMissingTableIsANoOp() {
    store.setConfirmationGate(ConfirmationGates.scripted());

    assertEquals(Outcome.APPLIED, store.dropTable("Nothing", false));
    assertEquals(List.of("file created"), messages());
  }

  @Test
  void declinedDropKeepsTable() {
    store.addTable("Products", "Id INT", false);

    assertEquals(Outcome.DECLINED, store.dropTable("Products", false));

    assertTrue(store.hasTable("Products"));
    assertTrue(fx.chatter.contains("Drop table Products operation cancelled"));
  }

  @Test
  void acceptedDropRemovesTable() {
    store.addTable("Products", "Id INT", false);
    store.setConfirmationGate(ConfirmationGates.scripted(true));

    assertEquals(Outcome.APPLIED, store.dropTable("Products", false));

    assertEquals(Set.of(), store.tableNames());
    assertEquals("table Products dropped", messages().get(messages().size() - 1));
  }

  @Test
  void tableNamesAreSortedAndSurviveReopen() {
    store.addTable("b_items", "x INT", false);
    store.addTable("a_items", "x INT", false);
    Path file = store.path().orElseThrow();
    store.close();

    store.open(file);

    assertEquals(List.of("a_items", "b_items"), List.copyOf(store.tableNames()));
  }

  @Test
  void invalidTableNamesAreArgumentErrors() {
    IllegalArgumentException blank = assertThrows(IllegalArgumentException.class, () -> store.addTable("", "a INT", false));
    assertTrue(blank.getMessage().contains("Invalid table name"), blank.getMessage());
    assertThrows(IllegalArgumentException.class, () -> store.addTable("my table", "a INT", false));
    assertThrows(IllegalArgumentException.class,
        () -> store.addTable("my table", List.of(new ColumnSpec("a", "INT")), false));
    assertThrows(IllegalArgumentException.class, () -> store.dropTable("", false));
    assertThrows(IllegalArgumentException.class, () -> store.dropTable("my table", true));

    assertEquals(Set.of(), store.tableNames());
    assertEquals(List.of("file created"), messages());
  }

  @Test
  void malformedColumnsNameTheColumnsNotTheTable() {
    EngineException e = assertThrows(EngineException.class, () -> store.addTable("Good", "a INT, 1bad INT", false));

    assertTrue(e.getMessage().startsWith("Malformed column spec for table 'Good'"), e.getMessage());
  }
}


package io.intellixity.tabula.store;

import io.intellixity.tabula.EngineException;
import io.intellixity.tabula.Outcome;
import io.intellixity.tabula.exec.Propagation;
import io.intellixity.tabula.exec.StorageEngine;
import io.intellixity.tabula.gate.ConfirmationGate;
import io.intellixity.tabula.gate.EntityKind;
import io.intellixity.tabula.schema.TableSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

/** Gated create/replace/drop of caller tables on one open engine. */
final class TableManager {
  private static final Logger log = LoggerFactory.getLogger(TableManager.class);

  private final StorageEngine<?> engine;
  private final HistoryLog history;
  private final Chatter chatter;

  TableManager(StorageEngine<?> engine, HistoryLog history, Chatter chatter) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.history = Objects.requireNonNull(history, "history");
    this.chatter = Objects.requireNonNull(chatter, "chatter");
  }

  Set<String> names() {
    return engine.tableNames();
  }

  boolean exists(String name) {
    for (String n : engine.tableNames()) {
      if (n.equalsIgnoreCase(name)) return true;
    }
    return false;
  }

  Outcome add(TableSchema schema, boolean force, ConfirmationGate gate) {
    Objects.requireNonNull(schema, "schema");
    requireCallerTableName(schema.name());
    String name = schema.name();
    if (!force && exists(name) && !gate.confirm(name, EntityKind.TABLE)) {
      chatter.say("Add table " + name + " operation cancelled", Chatter.LIFECYCLE);
      return Outcome.DECLINED;
    }

    try {
      engine.inTx(Propagation.REQUIRED, () -> {
        engine.dropTableIfExists(name);
        engine.createTable(schema);
        return null;
      });
    } catch (EngineException e) {
      throw new EngineException("Cannot create table '" + name + "' in " + engine.handle().location(), e);
    }
    log.info("tabula.store table created name={} columns={} location={}",
        name, schema.columns().size(), engine.handle().location());
    history.logMessage("table " + name + " created");
    return Outcome.APPLIED;
  }

  Outcome drop(String name, boolean force, ConfirmationGate gate) {
    requireCallerTableName(name);
    if (!exists(name)) {
      log.debug("tabula.store drop skipped, no table name={}", name);
      return Outcome.APPLIED;
    }
    if (!force && !gate.confirm(name, EntityKind.TABLE)) {
      chatter.say("Drop table " + name + " operation cancelled", Chatter.LIFECYCLE);
      return Outcome.DECLINED;
    }

    try {
      engine.inTx(Propagation.REQUIRED, () -> {
        engine.dropTableIfExists(name);
        return null;
      });
    } catch (EngineException e) {
      throw new EngineException("Cannot drop table '" + name + "' in " + engine.handle().location(), e);
    }
    log.info("tabula.store table dropped name={} location={}", name, engine.handle().location());
    history.logMessage("table " + name + " dropped");
    return Outcome.APPLIED;
  }

  /** A caller table name must be an identifier and must not be the history table. */
  static void requireCallerTableName(String name) {
    Objects.requireNonNull(name, "name");
    if (!TableSchema.isIdentifier(name)) throw new IllegalArgumentException("Invalid table name '" + name + "'");
    if (TableSchema.isReserved(name)) {
      throw new IllegalArgumentException("Table name '" + name + "' is reserved for the history log");
    }
  }
}

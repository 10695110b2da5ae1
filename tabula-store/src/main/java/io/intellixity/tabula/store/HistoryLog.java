package io.intellixity.tabula.store;

import io.intellixity.tabula.NoVersionRecordedException;
import io.intellixity.tabula.exec.Propagation;
import io.intellixity.tabula.exec.StorageEngine;
import io.intellixity.tabula.history.HistoryEntry;
import io.intellixity.tabula.history.HistoryKind;

import java.util.List;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Append-only audit log kept in the reserved {@code history} table.
 *
 * Every append is its own committed transaction; nothing here updates or deletes rows. The store's version is
 * always derived from the log and never stored separately.
 */
public final class HistoryLog {
  private final StorageEngine<?> engine;
  private final LongSupplier epochSeconds;

  HistoryLog(StorageEngine<?> engine, LongSupplier epochSeconds) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.epochSeconds = Objects.requireNonNull(epochSeconds, "epochSeconds");
  }

  public void append(HistoryKind kind, String text) {
    Objects.requireNonNull(kind, "kind");
    String event = String.valueOf(text);
    long now = epochSeconds.getAsLong();
    // NEVER: an append must not ride along in a caller's transaction and vanish with its rollback
    engine.inTx(Propagation.NEVER, () -> {
      engine.insertHistory(now, kind, event);
      return null;
    });
  }

  public void logMessage(String message) { append(HistoryKind.MESSAGE, message); }

  public void logWarning(String warning) { append(HistoryKind.WARNING, warning); }

  public void logError(String error) { append(HistoryKind.ERROR, error); }

  public void logVersion(String version) { append(HistoryKind.VERSION, version); }

  /** Payload of the newest {@code version} entry by (time desc, insertion order desc). */
  public String resolveVersion() {
    return engine.selectLatest(HistoryKind.VERSION)
        .map(HistoryEntry::payload)
        .orElseThrow(() -> new NoVersionRecordedException(
            "No version recorded in history of " + engine.handle().location()));
  }

  public List<HistoryEntry> entries() {
    return engine.selectHistory(null);
  }

  public List<HistoryEntry> entries(HistoryKind kind) {
    Objects.requireNonNull(kind, "kind");
    return engine.selectHistory(kind);
  }
}

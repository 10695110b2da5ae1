package io.intellixity.tabula.history;

import java.util.Objects;

/**
 * One row of the history log.
 *
 * @param sequence  insertion order assigned by the engine, independent of {@code timestamp}
 * @param timestamp seconds since epoch at write time
 */
public record HistoryEntry(long sequence, long timestamp, HistoryKind kind, String payload) {
  public HistoryEntry {
    Objects.requireNonNull(kind, "kind");
    payload = payload == null ? "" : payload;
  }
}

package io.intellixity.tabula.store;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.intellixity.tabula.history.HistoryEntry;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/** Snapshot of what an open store contains: where it lives, its version, its tables and its history. */
@JsonSerialize(using = StoreDescriptorJsonSerializer.class)
public record StoreDescriptor(Path path, String version, List<String> tables, List<HistoryEntry> history) {
  public StoreDescriptor {
    Objects.requireNonNull(path, "path");
    tables = tables == null ? List.of() : List.copyOf(tables);
    history = history == null ? List.of() : List.copyOf(history);
  }
}

package io.intellixity.tabula.history;

import java.util.Locale;

/** Kind of a history entry; persisted as its lower-case {@link #text()}. */
public enum HistoryKind {
  MESSAGE,
  WARNING,
  ERROR,
  VERSION;

  public String text() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static HistoryKind fromText(String text) {
    if (text == null) throw new IllegalArgumentException("history type is null");
    for (HistoryKind k : values()) {
      if (k.text().equalsIgnoreCase(text.trim())) return k;
    }
    throw new IllegalArgumentException("Unknown history type '" + text + "'");
  }
}

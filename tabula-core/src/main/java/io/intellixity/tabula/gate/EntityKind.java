package io.intellixity.tabula.gate;

/** What a confirmation is about. */
public enum EntityKind {
  STORE_FILE("store file"),
  TABLE("table");

  private final String label;

  EntityKind(String label) { this.label = label; }

  /** Human-readable label used in prompts. */
  public String label() { return label; }
}

package io.intellixity.tabula;

/** Result of an operation guarded by a confirmation gate. */
public enum Outcome {
  /** The change was carried out. */
  APPLIED,

  /** The gate said no; nothing was changed. */
  DECLINED;

  public boolean applied() { return this == APPLIED; }
}

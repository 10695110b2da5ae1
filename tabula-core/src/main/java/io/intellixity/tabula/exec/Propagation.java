package io.intellixity.tabula.exec;

/**
 * Transaction propagation behavior for {@link StorageEngine#inTx(Propagation, java.util.function.Supplier)}.
 * <p>
 * An engine owns exactly one connection, so there is no way to suspend a running transaction;
 * {@code REQUIRES_NEW}-style behavior is therefore not offered.
 */
public enum Propagation {
  /** Support a current transaction, create a new one if none exists. */
  REQUIRED,

  /** Support a current transaction, execute non-transactionally (auto-commit) if none exists. */
  SUPPORTS,

  /** Support a current transaction, throw an exception if none exists. */
  MANDATORY,

  /** Execute non-transactionally, throw an exception if a transaction exists. */
  NEVER
}

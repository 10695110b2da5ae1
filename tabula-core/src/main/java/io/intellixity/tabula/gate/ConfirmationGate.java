package io.intellixity.tabula.gate;

/**
 * Synchronous yes/no decision taken before a destructive operation.
 * <p>
 * Returning {@code false} must always be safe: the caller treats it as a no-op.
 */
@FunctionalInterface
public interface ConfirmationGate {
  /** Returns true if {@code entity} (an existing store file or table) may be overwritten. */
  boolean confirm(String entity, EntityKind kind);
}

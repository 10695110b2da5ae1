package io.intellixity.tabula;

/**
 * Wraps any failure of the underlying engine (bad SQL, malformed schema text, disk I/O).
 * <p>
 * The engine's own message is kept in {@link #getMessage()} after the caller-supplied context.
 */
public final class EngineException extends StoreException {
  public EngineException(String message) {
    super(message);
  }

  public EngineException(String context, Throwable cause) {
    super(context + ": " + (cause == null ? "unknown error" : cause.getMessage()), cause);
  }
}

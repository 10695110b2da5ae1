package io.intellixity.tabula;

/** Raised when a store that already holds a connection is asked to open or create another file. */
public final class AlreadyOpenException extends StoreException {
  public AlreadyOpenException(String message) {
    super(message);
  }
}

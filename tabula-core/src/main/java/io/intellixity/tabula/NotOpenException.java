package io.intellixity.tabula;

/** Raised when an operation needs an open store but no connection is held. */
public final class NotOpenException extends StoreException {
  public NotOpenException(String message) {
    super(message);
  }
}

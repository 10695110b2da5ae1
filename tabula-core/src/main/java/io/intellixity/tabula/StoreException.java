package io.intellixity.tabula;

/** Base type for every failure raised by a store or its engine. */
public abstract class StoreException extends RuntimeException {
  protected StoreException(String message) {
    super(message);
  }

  protected StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}

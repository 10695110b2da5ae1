package io.intellixity.tabula;

/** Raised when the history log holds no {@code version} entry. */
public final class NoVersionRecordedException extends StoreException {
  public NoVersionRecordedException(String message) {
    super(message);
  }
}

package io.intellixity.tabula;

import java.nio.file.Path;

/** Raised by {@code open} when the path does not reference an existing store file. */
public final class StoreNotFoundException extends StoreException {
  private final Path path;

  public StoreNotFoundException(Path path) {
    super("File " + path + " could not be found");
    this.path = path;
  }

  public Path path() { return path; }
}

package io.intellixity.tabula.exec.handle;

import java.nio.file.Path;

/**
 * Resolved runtime handle for one open backing file.
 *
 * Example:
 * - JDBC: client() is the single java.sql.Connection, location() is the store file
 */
public interface EngineHandle<TClient> {
  /** Unique identifier for this handle (useful for logging). */
  String id();

  /** Native client used by an engine (Connection, etc.). */
  TClient client();

  /** Backing file this handle was opened on. */
  Path location();
}

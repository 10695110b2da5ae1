package io.intellixity.tabula.exec;

import io.intellixity.tabula.EngineException;

import java.nio.file.Path;
import java.util.Properties;

/**
 * Opens a {@link StorageEngine} on a backing file.
 *
 * Implementations are discovered through {@code META-INF/tabula.factories}
 * (see {@link io.intellixity.tabula.util.TabulaFactoriesLoader}) and must have a public no-arg constructor.
 */
public interface EngineConnector {
  /** Short engine id, e.g. {@code sqlite}. */
  String id();

  /**
   * Establish a connection to {@code path}.
   *
   * @param createIfMissing when false the engine must not create the file as a side effect
   * @throws EngineException if the engine cannot establish a connection
   */
  StorageEngine<?> connect(Path path, boolean createIfMissing);

  /** Apply engine-specific settings (keys prefixed {@code tabula.<id>.}); unknown keys are ignored. */
  default EngineConnector configure(Properties settings) {
    return this;
  }
}

package io.intellixity.tabula.jdbc;

import io.intellixity.tabula.exec.handle.EngineHandle;

import java.nio.file.Path;
import java.sql.Connection;
import java.util.Objects;

/** JDBC-family engine handle: one connection bound to one store file. */
public final class JdbcHandle implements EngineHandle<Connection> {
  private final String id;
  private final Connection client;
  private final Path location;

  public JdbcHandle(String id, Connection client, Path location) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.location = Objects.requireNonNull(location, "location");
  }

  @Override public String id() { return id; }
  @Override public Connection client() { return client; }
  @Override public Path location() { return location; }
}

package io.intellixity.tabula.spi.sql;

/** Marker for a backend-native statement rendered by a {@link Dialect}. */
public interface NativeStatement {
}

package io.intellixity.tabula.exec;

/** Maps the current row to a value. */
@FunctionalInterface
public interface RowReader<T> {
  T read(RowAdapter row);
}

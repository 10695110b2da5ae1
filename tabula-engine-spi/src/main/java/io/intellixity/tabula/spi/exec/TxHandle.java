package io.intellixity.tabula.spi.exec;

/** Backend transaction token created by {@link AbstractStorageEngine#begin()}. */
public interface TxHandle {
}

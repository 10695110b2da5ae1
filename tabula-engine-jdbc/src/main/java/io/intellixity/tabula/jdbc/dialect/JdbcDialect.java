package io.intellixity.tabula.jdbc.dialect;

import io.intellixity.tabula.jdbc.SqlStatement;
import io.intellixity.tabula.spi.sql.Dialect;

/** Dialect for JDBC engines (statement rendering only). */
public interface JdbcDialect extends Dialect<SqlStatement> {
}

package io.intellixity.relata.persistence.jdbc.dialect;

import io.intellixity.relata.persistence.jdbc.SqlStatement;
import io.intellixity.relata.persistence.jdbc.bind.JdbcBinderProvider;
import io.intellixity.relata.persistence.spi.sql.Dialect;

import java.sql.SQLException;

/** Dialect for JDBC engines: statement rendering plus the binders and error codes of the database. */
public interface JdbcDialect extends Dialect<SqlStatement> {
  JdbcBinderProvider binders();

  /** True if the failure is a unique-constraint violation (SQLState 23505 unless the database differs). */
  default boolean isUniqueViolation(SQLException e) {
    for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
      if ("23505".equals(cur.getSQLState())) return true;
    }
    return false;
  }
}

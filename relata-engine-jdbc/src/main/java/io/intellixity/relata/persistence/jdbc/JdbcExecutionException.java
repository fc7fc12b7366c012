package io.intellixity.relata.persistence.jdbc;

import java.sql.SQLException;

/** Unchecked wrapper for driver failures; keeps the SQLState for callers that branch on it. */
public final class JdbcExecutionException extends RuntimeException {
  private final String sqlState;

  public JdbcExecutionException(String message, SQLException cause) {
    super(message + ": " + cause.getMessage(), cause);
    this.sqlState = cause.getSQLState();
  }

  public String sqlState() {
    return sqlState;
  }
}

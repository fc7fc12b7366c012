package io.intellixity.relata.persistence.jdbc.bind;

import io.intellixity.relata.persistence.compile.Bind;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/** Places one encoded value into a prepared statement. The first binder that supports a value wins. */
public interface JdbcBinder {
  boolean supports(Bind bind, Object encodedValue);

  void bind(PreparedStatement ps, int position1Based, Bind bind, Object encodedValue) throws SQLException;
}

package io.intellixity.relata.persistence.jdbc.bind;

import io.intellixity.relata.persistence.compile.Bind;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * JDBC-family binder base.
 *
 * Dialect providers (e.g. postgres) extend this and add dialect binders, which are evaluated before the
 * base JDBC binders. {@link #decode(Object)} is the read-side counterpart for driver values.
 */
public class JdbcBinderProvider {
  private static final Map<String, Integer> NULL_TYPES = Map.of(
      "string", Types.VARCHAR,
      "long", Types.BIGINT,
      "int", Types.INTEGER,
      "boolean", Types.BOOLEAN,
      "double", Types.DOUBLE,
      "timestamp", Types.TIMESTAMP
  );

  private volatile List<JdbcBinder> binders;

  public String dialectId() {
    return "jdbc";
  }

  public final List<JdbcBinder> binders() {
    if (binders == null) {
      List<JdbcBinder> out = new ArrayList<>();
      out.addAll(dialectBinders());
      out.addAll(jdbcBinders());
      binders = List.copyOf(out);
    }
    return binders;
  }

  public final JdbcBinder binderFor(Bind bind, Object encodedValue) {
    for (JdbcBinder b : binders()) {
      if (b.supports(bind, encodedValue)) return b;
    }
    throw new IllegalArgumentException("No JDBC binder for type '" + bind.userTypeId() + "' in dialect " + dialectId());
  }

  /** Converts a driver value into the engine's value space (default: timestamps become {@link Instant}). */
  public Object decode(Object raw) {
    if (raw instanceof Timestamp ts) return ts.toInstant();
    return raw;
  }

  /** Dialect-specific binders (default empty). Put overriding binders here. */
  protected Collection<JdbcBinder> dialectBinders() {
    return Collections.emptyList();
  }

  /** Base JDBC binders shared by all JDBC dialects. */
  protected Collection<JdbcBinder> jdbcBinders() {
    return List.of(
        new JdbcTypedNullBinder(),
        new JdbcInstantToTimestampBinder(),
        new JdbcSetObjectBinder()
    );
  }

  /** Typed NULL for scalar types the driver cannot infer from a bare null. */
  static final class JdbcTypedNullBinder implements JdbcBinder {
    @Override
    public boolean supports(Bind bind, Object encodedValue) {
      return encodedValue == null && bind.userTypeId() != null && NULL_TYPES.containsKey(bind.userTypeId());
    }

    @Override
    public void bind(PreparedStatement ps, int pos, Bind bind, Object encodedValue) throws SQLException {
      ps.setNull(pos, NULL_TYPES.get(bind.userTypeId()));
    }
  }

  /** Instant as JDBC Timestamp (backend-specific behavior, not global type behavior). */
  static final class JdbcInstantToTimestampBinder implements JdbcBinder {
    @Override
    public boolean supports(Bind bind, Object encodedValue) {
      return encodedValue instanceof Instant;
    }

    @Override
    public void bind(PreparedStatement ps, int pos, Bind bind, Object encodedValue) throws SQLException {
      ps.setTimestamp(pos, Timestamp.from((Instant) encodedValue));
    }
  }

  static final class JdbcSetObjectBinder implements JdbcBinder {
    @Override
    public boolean supports(Bind bind, Object encodedValue) {
      return true;
    }

    @Override
    public void bind(PreparedStatement ps, int pos, Bind bind, Object encodedValue) throws SQLException {
      ps.setObject(pos, encodedValue);
    }
  }
}

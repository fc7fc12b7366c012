package io.intellixity.relata.persistence.jdbc.postgres;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.relata.persistence.compile.Bind;
import io.intellixity.relata.persistence.jdbc.bind.JdbcBinder;
import io.intellixity.relata.persistence.jdbc.bind.JdbcBinderProvider;
import org.postgresql.util.PGobject;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/** Postgres-specific JDBC binders (dialectId="postgres"): json as jsonb, typed nulls for uuid/json. */
public final class PostgresBinderProvider extends JdbcBinderProvider {
  private final ObjectMapper mapper;

  public PostgresBinderProvider(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public String dialectId() {
    return PostgresDialect.ID;
  }

  @Override
  protected Collection<JdbcBinder> dialectBinders() {
    return List.of(new PostgresJsonbBinder(), new PostgresOtherNullBinder());
  }

  /** json/jsonb columns come back as PGobject; they are parsed into maps, lists and scalars. */
  @Override
  public Object decode(Object raw) {
    if (raw instanceof PGobject pg && pg.getType() != null && pg.getType().startsWith("json")) {
      if (pg.getValue() == null) return null;
      try {
        return mapper.readValue(pg.getValue(), Object.class);
      } catch (JsonProcessingException e) {
        throw new IllegalArgumentException("Invalid " + pg.getType() + " value from database", e);
      }
    }
    return super.decode(raw);
  }

  /** A jsonb parameter; strings are taken as JSON text, anything else is serialized. */
  public PGobject jsonb(Object value) throws SQLException {
    String text;
    if (value instanceof String s) {
      text = s;
    } else {
      try {
        text = mapper.writeValueAsString(value);
      } catch (JsonProcessingException e) {
        throw new IllegalArgumentException("Value is not serializable as JSON: " + value.getClass().getName(), e);
      }
    }
    PGobject obj = new PGobject();
    obj.setType("jsonb");
    obj.setValue(text);
    return obj;
  }

  final class PostgresJsonbBinder implements JdbcBinder {
    @Override
    public boolean supports(Bind bind, Object encodedValue) {
      return encodedValue != null && "json".equalsIgnoreCase(bind.userTypeId());
    }

    @Override
    public void bind(PreparedStatement ps, int pos, Bind bind, Object encodedValue) throws SQLException {
      ps.setObject(pos, jsonb(encodedValue));
    }
  }

  static final class PostgresOtherNullBinder implements JdbcBinder {
    @Override
    public boolean supports(Bind bind, Object encodedValue) {
      return encodedValue == null && ("json".equalsIgnoreCase(bind.userTypeId()) || "uuid".equalsIgnoreCase(bind.userTypeId()));
    }

    @Override
    public void bind(PreparedStatement ps, int pos, Bind bind, Object encodedValue) throws SQLException {
      ps.setNull(pos, Types.OTHER);
    }
  }
}

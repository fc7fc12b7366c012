package io.intellixity.relata.persistence.jdbc;

import javax.sql.DataSource;
import java.util.Objects;

/**
 * Connection source of a JDBC executor (resolved by application code).
 * When a schema is set it becomes the current schema of every connection taken from the pool.
 */
public final class JdbcHandle {
  private final String id;
  private final DataSource client;
  private final String schema;

  public JdbcHandle(String id, DataSource client, String schema) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.schema = (schema == null || schema.isBlank()) ? null : schema;
  }

  public JdbcHandle(String id, DataSource client) {
    this(id, client, null);
  }

  public String id() { return id; }
  public DataSource client() { return client; }
  public String schema() { return schema; }
}

package io.intellixity.relata.persistence.jdbc.dialect;

import io.intellixity.relata.persistence.compile.Bind;
import io.intellixity.relata.persistence.dmlast.ColumnBind;
import io.intellixity.relata.persistence.dmlast.InsertAst;
import io.intellixity.relata.persistence.dmlast.SelectAst;
import io.intellixity.relata.persistence.jdbc.SqlStatement;
import io.intellixity.relata.persistence.jdbc.SqlStatement.ExecKind;
import io.intellixity.relata.persistence.jdbc.postgres.PostgresDialect;
import io.intellixity.relata.persistence.query.OffsetPage;
import io.intellixity.relata.persistence.query.QueryValidationException;
import io.intellixity.relata.persistence.query.SortField;
import io.intellixity.relata.persistence.schema.SchemaRegistry;
import io.intellixity.relata.persistence.schema.yaml.YamlSchemaLoader;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static io.intellixity.relata.persistence.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class PostgresDialectTest {
  private static final SchemaRegistry SCHEMA = new YamlSchemaLoader().registryFromResource("schema/events.yml");

  private final PostgresDialect d = new PostgresDialect();

  @Test
  void throwsOnUnknownFilterProperty() {
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> d.renderSelect(SCHEMA, SelectAst.of("Event", eq("status", "CREATED"))));
    assertTrue(ex.getMessage().contains("Unknown field 'status'"));
  }

  @Test
  void whereBindsAreCoercedToColumnTypes() {
    String id = "7f0c6a43-6f59-4b43-8d0a-2f4e5c1d9b10";
    SqlStatement stmt = d.renderSelect(SCHEMA, SelectAst.of("Event", eq("accountId", id)));

    assertTrue(stmt.sql().startsWith("SELECT \"id\", \"kind\", \"payload\", \"account_id\" AS \"accountId\" FROM \"events\""),
        stmt.sql());
    assertTrue(stmt.sql().endsWith("WHERE \"account_id\" = :b1"));
    assertEquals(UUID.fromString(id), stmt.binds().get(0).value());
    assertEquals("uuid", stmt.binds().get(0).userTypeId());
  }

  @Test
  void page_rendersLimitOffset() {
    SqlStatement stmt = d.renderSelect(SCHEMA,
        new SelectAst("Event", false, null, List.of(SortField.asc("kind")), new OffsetPage(20, 10)));

    assertTrue(stmt.sql().endsWith(" ORDER BY \"kind\" ASC NULLS FIRST LIMIT 10 OFFSET 20"), stmt.sql());
  }

  @Test
  void insert_usesReturningWithFieldAliases() {
    SqlStatement stmt = d.renderDml(SCHEMA, new InsertAst("Account", List.of(
        new ColumnBind("handle", Bind.of("ada", "string")),
        new ColumnBind("createdAt", Bind.of("2024-01-02T03:04:05Z", "timestamp"))), List.of("id", "createdAt")));

    assertEquals("INSERT INTO \"accounts\" (\"handle\", \"created_at\") VALUES (:b1, :b2)"
        + " RETURNING \"id\", \"created_at\" AS \"createdAt\"", stmt.sql());
    assertEquals(ExecKind.QUERY_RETURNING, stmt.execKind());
    assertEquals(List.of("id", "createdAt"), stmt.returningFields());
    assertEquals(Instant.parse("2024-01-02T03:04:05Z"), stmt.binds().get(1).value());
  }

  @Test
  void insertWithoutReturning_isPlainUpdate() {
    SqlStatement stmt = d.renderDml(SCHEMA, new InsertAst("Event",
        List.of(new ColumnBind("kind", Bind.of("login", "string"))), List.of()));

    assertEquals("INSERT INTO \"events\" (\"kind\") VALUES (:b1)", stmt.sql());
    assertEquals(ExecKind.UPDATE, stmt.execKind());
  }
}

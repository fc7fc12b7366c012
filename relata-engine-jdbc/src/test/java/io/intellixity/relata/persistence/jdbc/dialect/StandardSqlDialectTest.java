package io.intellixity.relata.persistence.jdbc.dialect;

import io.intellixity.relata.persistence.compile.Bind;
import io.intellixity.relata.persistence.dmlast.*;
import io.intellixity.relata.persistence.jdbc.SqlStatement;
import io.intellixity.relata.persistence.jdbc.SqlStatement.ExecKind;
import io.intellixity.relata.persistence.query.*;
import io.intellixity.relata.persistence.schema.SchemaRegistry;
import io.intellixity.relata.persistence.schema.yaml.YamlSchemaLoader;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.relata.persistence.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class StandardSqlDialectTest {
  private static final SchemaRegistry SCHEMA = new YamlSchemaLoader().registryFromResource("schema/blog-sql.yml");

  private final StandardSqlDialect d = new StandardSqlDialect();

  @Test
  void throwsOnUnknownFilterProperty() {
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> d.renderSelect(SCHEMA, SelectAst.of("User", eq("status", "CREATED"))));
    assertTrue(ex.getMessage().contains("Unknown field 'status'"));
  }

  @Test
  void select_mapsSourceAndAliasesRenamedColumns() {
    SqlStatement stmt = d.renderSelect(SCHEMA, SelectAst.of("User", eq("displayName", "One")));

    assertEquals("SELECT \"id\", \"email\", \"display_name\" AS \"displayName\" FROM \"users\" WHERE \"display_name\" = :b1",
        stmt.sql());
    assertEquals(ExecKind.QUERY, stmt.execKind());
    Bind b = stmt.binds().get(0);
    assertEquals("One", b.value());
    assertEquals("string", b.userTypeId());
  }

  @Test
  void select_coercesWireValuesToDeclaredType() {
    SqlStatement stmt = d.renderSelect(SCHEMA, SelectAst.of("Post", in("authorId", List.of(1, "2"))));

    assertEquals(List.of(1L, 2L), List.of(stmt.binds().get(0).value(), stmt.binds().get(1).value()));
    assertTrue(stmt.sql().endsWith("WHERE \"author_id\" IN (:b1, :b2)"));
  }

  @Test
  void nullComparisons_renderAsIsNull() {
    assertTrue(d.renderSelect(SCHEMA, SelectAst.of("Post", isNull("published"))).sql().endsWith("WHERE \"published\" IS NULL"));
    assertTrue(d.renderSelect(SCHEMA, SelectAst.of("Post", not(isNull("published")))).sql().endsWith("WHERE NOT (\"published\" IS NULL)"));
  }

  @Test
  void emptyInLists_renderAsConstants() {
    assertTrue(d.renderSelect(SCHEMA, SelectAst.of("Post", in("slug", List.of()))).sql().endsWith("WHERE FALSE"));
    assertTrue(d.renderSelect(SCHEMA, SelectAst.of("Post", nin("slug", List.of()))).sql().endsWith("WHERE TRUE"));
    assertTrue(d.renderSelect(SCHEMA, SelectAst.of("Post", nin("slug", List.of("a")))).sql().endsWith("WHERE NOT (\"slug\" IN (:b1))"));
  }

  @Test
  void negatedGroup_appliesDeMorgan() {
    SqlStatement stmt = d.renderSelect(SCHEMA, SelectAst.of("Post", not(and(eq("slug", "a"), eq("published", true)))));

    assertTrue(stmt.sql().endsWith("WHERE (NOT (\"slug\" = :b1) OR NOT (\"published\" = :b2))"));
    assertEquals(Boolean.TRUE, stmt.binds().get(1).value());
  }

  @Test
  void range_rendersBetween() {
    SqlStatement stmt = d.renderSelect(SCHEMA, SelectAst.of("Post", Condition.range("id", 1, 5)));

    assertTrue(stmt.sql().endsWith("WHERE \"id\" BETWEEN :b1 AND :b2"));
    assertEquals(5L, stmt.binds().get(1).value());
  }

  @Test
  void subquery_rendersSemiJoinWithAliasedInnerSource() {
    InSubquery viaJoin = new InSubquery(List.of("id"), InSubquery.Source.joinTable("post_categories"), List.of("post_id"),
        new InSubquery(List.of("category_id"), InSubquery.Source.model("Category"), List.of("id"), eq("name", "java"), false),
        false);

    SqlStatement stmt = d.renderSelect(SCHEMA, SelectAst.of("Post", viaJoin));

    assertTrue(stmt.sql().endsWith("WHERE \"id\" IN (SELECT s1.\"post_id\" FROM \"post_categories\" s1 "
        + "WHERE s1.\"category_id\" IN (SELECT s2.\"id\" FROM \"categories\" s2 WHERE s2.\"name\" = :b1))"), stmt.sql());
    assertEquals(1, stmt.binds().size());
  }

  @Test
  void negatedSubquery_rendersNotInWithoutWhere() {
    InSubquery none = new InSubquery(List.of("id"), InSubquery.Source.model("Post"), List.of("authorId"), null, true);

    SqlStatement stmt = d.renderSelect(SCHEMA, SelectAst.of("User", none));

    assertTrue(stmt.sql().endsWith("WHERE \"id\" NOT IN (SELECT s1.\"author_id\" FROM \"posts\" s1)"), stmt.sql());
  }

  @Test
  void untranslatedRelationFilter_isRejected() {
    assertThrows(QueryValidationException.class, () -> d.renderSelect(SCHEMA, SelectAst.of("User", some("posts", null))));
  }

  @Test
  void sortAndPage_useNullOrderingAndOffsetFetch() {
    SqlStatement stmt = d.renderSelect(SCHEMA,
        new SelectAst("Post", false, null, List.of(SortField.desc("slug"), SortField.asc("authorId")), new OffsetPage(10, 5)));

    assertTrue(stmt.sql().endsWith(
        " ORDER BY \"slug\" DESC NULLS LAST, \"author_id\" ASC NULLS FIRST OFFSET 10 ROWS FETCH NEXT 5 ROWS ONLY"), stmt.sql());
  }

  @Test
  void joinTableSelect_usesPhysicalColumns() {
    SqlStatement stmt = d.renderSelect(SCHEMA, SelectAst.joinRows("post_categories", eq("post_id", 3)));

    assertEquals("SELECT \"post_id\", \"category_id\" FROM \"post_categories\" WHERE \"post_id\" = :b1", stmt.sql());
    assertEquals("long", stmt.binds().get(0).userTypeId());
  }

  @Test
  void insert_requestsGeneratedKeysForReturningFields() {
    SqlStatement stmt = d.renderDml(SCHEMA, new InsertAst("Post", List.of(
        new ColumnBind("slug", Bind.of("p1", "string")),
        new ColumnBind("authorId", Bind.of(7, "long"))), List.of("id")));

    assertEquals("INSERT INTO \"posts\" (\"slug\", \"author_id\") VALUES (:b1, :b2)", stmt.sql());
    assertEquals(ExecKind.UPDATE_GENERATED_KEYS, stmt.execKind());
    assertEquals(List.of("id"), stmt.returningColumns());
    assertEquals(7L, stmt.binds().get(1).value());
  }

  @Test
  void insertWithoutColumns_usesDefaultValues() {
    SqlStatement stmt = d.renderDml(SCHEMA, new InsertAst("Category", List.of(), List.of("id")));

    assertEquals("INSERT INTO \"categories\" DEFAULT VALUES", stmt.sql());
  }

  @Test
  void updateAndDelete_numberBindsInSetThenWhereOrder() {
    SqlStatement upd = d.renderDml(SCHEMA, new UpdateAst("User",
        List.of(new ColumnBind("displayName", Bind.of("Two", "string"))), eq("email", "a@x.io")));
    SqlStatement del = d.renderDml(SCHEMA, new DeleteAst("post_categories", eq("post_id", 1L)));

    assertEquals("UPDATE \"users\" SET \"display_name\" = :b1 WHERE \"email\" = :b2", upd.sql());
    assertEquals(List.of("Two", "a@x.io"), List.of(upd.binds().get(0).value(), upd.binds().get(1).value()));
    assertEquals(ExecKind.UPDATE, upd.execKind());
    assertEquals("DELETE FROM \"post_categories\" WHERE \"post_id\" = :b1", del.sql());
  }

  @Test
  void unresolvedParam_isRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> d.renderSelect(SCHEMA, SelectAst.of("User", eq("email", QueryValues.param("email")))));
  }
}

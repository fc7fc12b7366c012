package io.intellixity.relata.persistence.filter;

import io.intellixity.relata.persistence.query.*;
import io.intellixity.relata.persistence.schema.SchemaRegistry;
import io.intellixity.relata.persistence.schema.yaml.YamlSchemaLoader;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.relata.persistence.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class RelationFilterTranslatorTest {
  private static final SchemaRegistry SCHEMA = new YamlSchemaLoader().registryFromResource("schema/blog.yml");

  private final RelationFilterTranslator translator = new RelationFilterTranslator(SCHEMA);

  @Test
  void someOnBackReference_selectsForeignKeyFromTarget() {
    InSubquery s = (InSubquery) translator.translate("User", some("posts", eq("published", true)));

    assertEquals(List.of("id"), s.properties());
    assertEquals(InSubquery.Source.model("Post"), s.source());
    assertEquals(List.of("authorId"), s.selected());
    assertFalse(s.not());
    assertEquals("published", ((Condition) s.where()).property());
  }

  @Test
  void isOnOwnedKey_selectsReferencedKey() {
    InSubquery s = (InSubquery) translator.translate("Post", is("author", eq("email", "a@x.io")));

    assertEquals(List.of("authorId"), s.properties());
    assertEquals(InSubquery.Source.model("User"), s.source());
    assertEquals(List.of("id"), s.selected());
  }

  @Test
  void isNullOnOwnedKey_isKeyIsNull() {
    Condition c = (Condition) translator.translate("Post", is("author", null));
    Condition exists = (Condition) translator.translate("Post", isNot("author", null));

    assertEquals("authorId", c.property());
    assertEquals(Operator.EQ, c.operator());
    assertNull(c.value());
    assertEquals(Operator.NE, exists.operator());
  }

  @Test
  void noneOnBackReference_guardsNullKeysInsideSubquery() {
    InSubquery s = (InSubquery) translator.translate("User", none("posts", eq("published", true)));

    assertTrue(s.not());
    LogicalGroup where = (LogicalGroup) s.where();
    assertEquals(Clause.AND, where.clause());
    Condition guard = (Condition) where.elements().get(1);
    assertEquals("authorId", guard.property());
    assertEquals(Operator.NE, guard.operator());
  }

  @Test
  void isNotOnOwnedKeyWithWhere_keepsRowsWithoutLink() {
    LogicalGroup g = (LogicalGroup) translator.translate("Post", isNot("author", eq("email", "a@x.io")));

    assertEquals(Clause.OR, g.clause());
    assertEquals("authorId", ((Condition) g.elements().get(0)).property());
    assertTrue(((InSubquery) g.elements().get(1)).not());
  }

  @Test
  void every_isNoneOfTheNegation() {
    InSubquery s = (InSubquery) translator.translate("User", every("posts", eq("published", true)));

    assertTrue(s.not());
    LogicalGroup where = (LogicalGroup) s.where();
    assertTrue(where.elements().get(0) instanceof NotElement);
  }

  @Test
  void manyToMany_goesThroughJoinTable() {
    InSubquery s = (InSubquery) translator.translate("Post", some("categories", eq("name", "java")));

    assertEquals(List.of("id"), s.properties());
    assertEquals(InSubquery.Source.joinTable("post_categories"), s.source());
    assertEquals(List.of("postId"), s.selected());
    InSubquery target = (InSubquery) s.where();
    assertEquals(List.of("categoryId"), target.properties());
    assertEquals(InSubquery.Source.model("Category"), target.source());
    assertEquals(List.of("id"), target.selected());
  }

  @Test
  void manyToManyWithoutWhere_matchesAnyJoinRow() {
    InSubquery s = (InSubquery) translator.translate("Category", none("posts", null));

    assertTrue(s.not());
    assertNull(s.where());
    assertEquals(List.of("categoryId"), s.selected());
  }

  @Test
  void nestedRelationFilters_areTranslatedAgainstTheirOwnModel() {
    InSubquery outer = (InSubquery) translator.translate("User", some("posts", some("categories", eq("name", "go"))));

    InSubquery inner = (InSubquery) outer.where();
    assertEquals(InSubquery.Source.joinTable("post_categories"), inner.source());
  }

  @Test
  void scalarConditionsAreValidatedPerModel() {
    QueryValidationException e = assertThrows(QueryValidationException.class,
        () -> translator.translate("User", some("posts", eq("email", "x"))));
    assertTrue(e.getMessage().contains("Post"));

    QueryValidationException hint = assertThrows(QueryValidationException.class,
        () -> translator.translate("User", eq("posts", 1)));
    assertTrue(hint.getMessage().contains("some/none/every/is/isNot"));
  }

  @Test
  void quantifierMustMatchCardinality() {
    assertThrows(QueryValidationException.class, () -> translator.translate("User", is("posts", null)));
    assertThrows(QueryValidationException.class, () -> translator.translate("User", some("profile", null)));
    assertThrows(QueryValidationException.class, () -> translator.translate("User", some("followers", null)));
    assertThrows(QueryValidationException.class, () -> translator.translate("User", every("posts", null)));
  }

  @Test
  void plainFilters_passThrough() {
    QueryElement f = and(eq("email", "a@x.io"), not(isNull("name")));

    LogicalGroup g = (LogicalGroup) translator.translate("User", f);
    assertEquals(2, g.elements().size());
    assertNull(translator.translate("User", null));
  }
}

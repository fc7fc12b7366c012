package io.intellixity.relata.persistence.schema;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class InMemorySchemaRegistryTest {

  @Test
  void foreignKey_isTheSameFromEitherSide() {
    SchemaRegistry schema = InMemorySchemaRegistry.of(user(), post(true));

    ForeignKeyLink fromPost = schema.foreignKey("Post", "author");
    ForeignKeyLink fromUser = schema.foreignKey("User", "posts");

    assertEquals(fromPost, fromUser);
    assertEquals("Post", fromPost.ownerModel());
    assertEquals(List.of("authorId"), fromPost.ownerFields());
    assertTrue(fromPost.nullable());
    assertFalse(fromPost.unique());
  }

  @Test
  void requiredOwnerField_makesLinkNonNullable() {
    SchemaRegistry schema = InMemorySchemaRegistry.of(user(), post(false));

    assertFalse(schema.foreignKey("User", "posts").nullable());
  }

  @Test
  void isUniqueSelector_acceptsOnlyDeclaredFieldSets() {
    SchemaRegistry schema = InMemorySchemaRegistry.of(user(), post(true));

    assertTrue(schema.isUniqueSelector("User", UniqueSelector.of("id", 1)));
    assertTrue(schema.isUniqueSelector("User", UniqueSelector.of("email", "a@x.io")));
    assertFalse(schema.isUniqueSelector("User", UniqueSelector.of("name", "A")));
    assertFalse(schema.isUniqueSelector("User", UniqueSelector.of("id", 1, "email", "a@x.io")));
    assertEquals(List.of(List.of("id"), List.of("email")), schema.uniqueConstraints("User"));
  }

  @Test
  void unknownTarget_isRejected() {
    ModelDef orphan = ModelDef.builder("Post")
        .field(ScalarField.generated("id", "long"))
        .field(ScalarField.of("authorId", "long"))
        .relation(RelationField.owning("author", "Writer", Cardinality.MANY_TO_ONE, List.of("authorId"), List.of("id"), null, false))
        .primaryKey("id")
        .build();

    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> InMemorySchemaRegistry.of(orphan));
    assertTrue(e.getMessage().contains("Writer"));
  }

  @Test
  void inversesThatDoNotPointBack_areRejected() {
    ModelDef user = ModelDef.builder("User")
        .field(ScalarField.generated("id", "long"))
        .relation(RelationField.backReference("posts", "Post", Cardinality.ONE_TO_MANY, "author"))
        .relation(RelationField.backReference("drafts", "Post", Cardinality.ONE_TO_MANY, "author"))
        .primaryKey("id")
        .build();

    assertThrows(IllegalArgumentException.class, () -> InMemorySchemaRegistry.of(user, post(true)));
  }

  @Test
  void bothSidesOwningTheKey_isRejected() {
    ModelDef a = ModelDef.builder("A")
        .field(ScalarField.generated("id", "long"))
        .field(ScalarField.optional("bId", "long"))
        .relation(RelationField.owning("b", "B", Cardinality.MANY_TO_ONE, List.of("bId"), List.of("id"), "a", true))
        .primaryKey("id")
        .build();
    ModelDef b = ModelDef.builder("B")
        .field(ScalarField.generated("id", "long"))
        .field(ScalarField.optional("aId", "long"))
        .relation(RelationField.owning("a", "A", Cardinality.MANY_TO_ONE, List.of("aId"), List.of("id"), "b", true))
        .primaryKey("id")
        .build();

    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> InMemorySchemaRegistry.of(a, b));
    assertTrue(e.getMessage().contains("own"));
  }

  @Test
  void oneToOneWithoutUniqueForeignKey_isRejected() {
    ModelDef user = ModelDef.builder("User")
        .field(ScalarField.generated("id", "long"))
        .relation(RelationField.backReference("profile", "Profile", Cardinality.ONE_TO_ONE, "user"))
        .primaryKey("id")
        .build();
    ModelDef profile = ModelDef.builder("Profile")
        .field(ScalarField.generated("id", "long"))
        .field(ScalarField.of("userId", "long"))
        .relation(RelationField.owning("user", "User", Cardinality.ONE_TO_ONE, List.of("userId"), List.of("id"), "profile", false))
        .primaryKey("id")
        .build();

    assertThrows(IllegalArgumentException.class, () -> InMemorySchemaRegistry.of(user, profile));
  }

  @Test
  void mismatchedJoinTables_areRejected() {
    ModelDef post = ModelDef.builder("Post")
        .field(ScalarField.generated("id", "long"))
        .relation(RelationField.manyToMany("tags", "Tag", new JoinTableDef("post_tags", "postId", "tagId"), "posts"))
        .primaryKey("id")
        .build();
    ModelDef tag = ModelDef.builder("Tag")
        .field(ScalarField.generated("id", "long"))
        .relation(RelationField.manyToMany("posts", "Post", new JoinTableDef("post_tags", "postId", "tagId"), "tags"))
        .primaryKey("id")
        .build();

    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> InMemorySchemaRegistry.of(post, tag));
    assertTrue(e.getMessage().contains("Join table"));
  }

  @Test
  void joinTable_isRegisteredAndNotAForeignKey() {
    ModelDef post = ModelDef.builder("Post")
        .field(ScalarField.generated("id", "long"))
        .relation(RelationField.manyToMany("tags", "Tag", new JoinTableDef("post_tags", "postId", "tagId"), "posts"))
        .primaryKey("id")
        .build();
    ModelDef tag = ModelDef.builder("Tag")
        .field(ScalarField.generated("id", "long"))
        .relation(RelationField.manyToMany("posts", "Post", new JoinTableDef("post_tags", "tagId", "postId"), "tags"))
        .primaryKey("id")
        .build();

    SchemaRegistry schema = InMemorySchemaRegistry.of(post, tag);

    assertEquals(new JoinTableDef("post_tags", "postId", "tagId"), schema.joinTable("post_tags").orElseThrow());
    assertThrows(IllegalArgumentException.class, () -> schema.foreignKey("Post", "tags"));
  }

  @Test
  void unknownModelOrRelation_isReported() {
    SchemaRegistry schema = InMemorySchemaRegistry.of(user(), post(true));

    assertThrows(IllegalArgumentException.class, () -> schema.model("Nope"));
    assertThrows(IllegalArgumentException.class, () -> schema.relation("User", "email"));
  }

  @Test
  void listRelationOwningAKey_isRejectedByTheField() {
    assertThrows(IllegalArgumentException.class, () -> RelationField.owning(
        "posts", "Post", Cardinality.ONE_TO_MANY, List.of("x"), List.of("id"), null, true));
  }

  private static ModelDef user() {
    return ModelDef.builder("User")
        .source("users")
        .field(ScalarField.generated("id", "long"))
        .field(ScalarField.of("email", "string"))
        .field(ScalarField.optional("name", "string"))
        .relation(RelationField.backReference("posts", "Post", Cardinality.ONE_TO_MANY, "author"))
        .primaryKey("id")
        .unique("email")
        .build();
  }

  private static ModelDef post(boolean optionalAuthor) {
    ScalarField authorId = optionalAuthor ? ScalarField.optional("authorId", "long") : ScalarField.of("authorId", "long");
    return ModelDef.builder("Post")
        .field(ScalarField.generated("id", "long"))
        .field(ScalarField.of("title", "string"))
        .field(authorId)
        .relation(RelationField.owning("author", "User", Cardinality.MANY_TO_ONE, List.of("authorId"), List.of("id"), "posts", optionalAuthor))
        .primaryKey("id")
        .build();
  }
}

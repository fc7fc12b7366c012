package io.intellixity.relata.persistence.schema.yaml;

import io.intellixity.relata.persistence.schema.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class YamlSchemaLoaderTest {
  private final YamlSchemaLoader loader = new YamlSchemaLoader();

  @Test
  void registryFromResource_loadsEveryDocument() {
    InMemorySchemaRegistry schema = loader.registryFromResource("schema/blog.yml");

    assertEquals(9, schema.models().size());
    assertEquals("users", schema.model("User").source());
    assertEquals(Ownership.JOIN_TABLE, schema.relation("Post", "categories").ownership());
    assertEquals(new JoinTableDef("post_categories", "categoryId", "postId"), schema.relation("Category", "posts").joinTable());
  }

  @Test
  void fieldDsl_marksOptionalAndGeneratedFields() throws IOException {
    ModelDef m = single("""
        model: Note
        primaryKey: [id]
        fields:
          id: long!
          body: string?
          created: {type: timestamp, column: created_at}
        """);

    assertTrue(m.scalar("id").autoGenerated());
    assertFalse(m.scalar("id").optional());
    assertTrue(m.scalar("body").optional());
    assertEquals("created_at", m.scalar("created").column());
    assertEquals("timestamp", m.scalar("created").userTypeId());
  }

  @Test
  void ownership_isDerivedFromDeclaredKeys() {
    SchemaRegistry schema = loader.registryFromResource("schema/blog.yml");

    RelationField author = schema.relation("Post", "author");
    assertEquals(Ownership.SELF, author.ownership());
    assertEquals(Cardinality.MANY_TO_ONE, author.cardinality());
    assertTrue(author.optional());
    assertEquals(Ownership.TARGET, schema.relation("User", "posts").ownership());
    assertFalse(schema.relation("Comment", "post").optional());
  }

  @Test
  void cardinality_acceptsDashedAndUnderscoredSpellings() {
    assertEquals(Cardinality.ONE_TO_MANY, YamlSchemaLoader.cardinality("one-to-many", "x"));
    assertEquals(Cardinality.MANY_TO_MANY, YamlSchemaLoader.cardinality("MANY_TO_MANY", "x"));
    assertThrows(IllegalArgumentException.class, () -> YamlSchemaLoader.cardinality("several", "x"));
  }

  @Test
  void unknownScalarType_isRejected() {
    assertThrows(IllegalArgumentException.class, () -> single("""
        model: Note
        primaryKey: [id]
        fields:
          id: decimal
        """));
  }

  @Test
  void relationOnUnknownField_isRejected() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> single("""
        model: Note
        primaryKey: [id]
        fields:
          id: long!
        relations:
          owner: {target: User, cardinality: many-to-one, fields: [ownerId], references: [id]}
        """));

    assertTrue(e.getMessage().contains("ownerId"));
  }

  @Test
  void loadDir_prefixesErrorsWithTheFile(@TempDir Path dir) throws IOException {
    Files.writeString(dir.resolve("a.yml"), "model: A\nprimaryKey: [id]\nfields: {id: long!}\n");
    Files.writeString(dir.resolve("b.yaml"), "model: B\nprimaryKey: [id]\nfields: {id: money}\n");
    Files.writeString(dir.resolve("notes.txt"), "ignored");

    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> loader.loadDir(dir));
    assertTrue(e.getMessage().contains("b.yaml"));

    Files.delete(dir.resolve("b.yaml"));
    assertEquals(List.of("A"), loader.loadDir(dir).stream().map(ModelDef::name).toList());
  }

  private ModelDef single(String yaml) throws IOException {
    try (InputStream in = new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))) {
      List<ModelDef> models = loader.load(in);
      assertEquals(1, models.size());
      return models.get(0);
    }
  }
}

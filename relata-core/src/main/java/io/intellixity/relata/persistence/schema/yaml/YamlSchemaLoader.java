package io.intellixity.relata.persistence.schema.yaml;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.intellixity.relata.persistence.schema.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Stream;

/**
 * Loads model definitions from YAML.
 * <p>
 * A document is one model, a list of models, or {@code {models: [...]}}; several documents may share a file.
 * <pre>{@code
 * model: Post
 * source: posts
 * primaryKey: [id]
 * unique: [[slug]]
 * fields:
 *   id: long!
 *   slug: string
 *   authorId: long?
 * relations:
 *   author: {target: User, cardinality: many-to-one, fields: [authorId], references: [id], inverse: posts}
 *   categories: {target: Category, cardinality: many-to-many, inverse: posts,
 *                joinTable: {name: post_categories, column: postId, targetColumn: categoryId}}
 * }</pre>
 * Ownership is derived: {@code fields} means the model stores the key, {@code joinTable} a join table,
 * otherwise the target stores it. An owning relation is optional iff all its key fields are nullable,
 * unless {@code optional} says otherwise.
 */
public final class YamlSchemaLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlSchemaLoader.class);

  private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

  /** Every {@code .yml}/{@code .yaml} file below {@code dir}, in path order. */
  public List<ModelDef> loadDir(Path dir) throws IOException {
    List<Path> files;
    try (Stream<Path> s = Files.walk(dir)) {
      files = s.filter(Files::isRegularFile)
          .filter(p -> p.toString().endsWith(".yml") || p.toString().endsWith(".yaml"))
          .sorted()
          .toList();
    }
    List<ModelDef> out = new ArrayList<>();
    for (Path p : files) {
      try (InputStream in = Files.newInputStream(p)) {
        out.addAll(load(in));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException(p + ": " + e.getMessage(), e);
      }
    }
    log.debug("relata.schema loaded dir={} files={} models={}", dir, files.size(), out.size());
    return out;
  }

  public List<ModelDef> load(InputStream in) throws IOException {
    List<ModelDef> out = new ArrayList<>();
    try (MappingIterator<JsonNode> docs = mapper.readerFor(JsonNode.class).readValues(in)) {
      while (docs.hasNext()) {
        JsonNode doc = docs.next();
        if (doc == null || doc.isNull() || doc.isMissingNode()) continue;
        if (doc.isObject() && doc.has("models")) doc = doc.get("models");
        if (doc.isArray()) {
          for (JsonNode m : doc) out.add(model(m));
        } else {
          out.add(model(doc));
        }
      }
    }
    return out;
  }

  /** Loads a classpath resource and builds the validated registry. */
  public InMemorySchemaRegistry registryFromResource(String resource) {
    try (InputStream in = YamlSchemaLoader.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) throw new IllegalArgumentException("Schema resource not found: " + resource);
      return new InMemorySchemaRegistry(load(in));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private ModelDef model(JsonNode n) {
    String name = text(n, "model");
    if (name == null) throw new IllegalArgumentException("model name is required: " + n);
    ModelDef.Builder b = ModelDef.builder(name).source(text(n, "source"));

    Map<String, ScalarField> scalars = new LinkedHashMap<>();
    JsonNode fields = n.get("fields");
    if (fields != null) {
      for (var it = fields.fields(); it.hasNext(); ) {
        var e = it.next();
        ScalarField f = scalar(e.getKey(), e.getValue());
        scalars.put(f.name(), f);
        b.field(f);
      }
    }
    b.primaryKey(strings(n.get("primaryKey")).toArray(new String[0]));
    JsonNode unique = n.get("unique");
    if (unique != null) {
      for (JsonNode u : unique) b.unique(strings(u).toArray(new String[0]));
    }
    JsonNode relations = n.get("relations");
    if (relations != null) {
      for (var it = relations.fields(); it.hasNext(); ) {
        var e = it.next();
        b.relation(relation(name, e.getKey(), e.getValue(), scalars));
      }
    }
    return b.build();
  }

  private static ScalarField scalar(String name, JsonNode v) {
    if (v.isTextual()) {
      FieldTypeParser.FieldType t = FieldTypeParser.parse(v.asText());
      return new ScalarField(name, t.typeId(), null, t.optional(), t.generated());
    }
    FieldTypeParser.FieldType t = FieldTypeParser.parse(text(v, "type"));
    return new ScalarField(name, t.typeId(), text(v, "column"),
        bool(v, "optional", t.optional()), bool(v, "generated", t.generated()));
  }

  private static RelationField relation(String model, String name, JsonNode v, Map<String, ScalarField> scalars) {
    String target = text(v, "target");
    Cardinality cardinality = cardinality(text(v, "cardinality"), model + "." + name);
    String inverse = text(v, "inverse");
    JsonNode jt = v.get("joinTable");
    if (jt != null && !jt.isNull()) {
      return RelationField.manyToMany(name, target,
          new JoinTableDef(text(jt, "name"), text(jt, "column"), text(jt, "targetColumn")), inverse);
    }
    List<String> fields = strings(v.get("fields"));
    if (!fields.isEmpty()) {
      boolean nullable = true;
      for (String f : fields) {
        ScalarField s = scalars.get(f);
        if (s == null) throw new IllegalArgumentException("Relation " + model + "." + name + " uses unknown field: " + f);
        nullable &= s.optional();
      }
      return RelationField.owning(name, target, cardinality, fields, strings(v.get("references")), inverse,
          bool(v, "optional", nullable));
    }
    return RelationField.backReference(name, target, cardinality, inverse);
  }

  static Cardinality cardinality(String s, String where) {
    if (s == null) throw new IllegalArgumentException("cardinality is required for relation " + where);
    String k = s.replace("-", "").replace("_", "").toUpperCase();
    for (Cardinality c : Cardinality.values()) {
      if (c.name().replace("_", "").equals(k)) return c;
    }
    throw new IllegalArgumentException("Unknown cardinality '" + s + "' for relation " + where);
  }

  private static List<String> strings(JsonNode n) {
    List<String> out = new ArrayList<>();
    if (n == null || n.isNull()) return out;
    if (n.isTextual()) {
      out.add(n.asText());
      return out;
    }
    for (JsonNode x : n) out.add(x.asText());
    return out;
  }

  private static String text(JsonNode n, String field) {
    JsonNode v = n.get(field);
    return (v == null || v.isNull()) ? null : v.asText();
  }

  private static boolean bool(JsonNode n, String field, boolean def) {
    JsonNode v = n.get(field);
    return (v == null || v.isNull()) ? def : v.asBoolean();
  }
}

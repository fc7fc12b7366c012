package io.intellixity.relata.persistence.write;

import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.relata.persistence.error.DirectiveValidationException;
import io.intellixity.relata.persistence.plan.DirectivePath;
import io.intellixity.relata.persistence.query.QueryElement;
import io.intellixity.relata.persistence.query.QueryJsonDeserializer;
import io.intellixity.relata.persistence.schema.ModelDef;
import io.intellixity.relata.persistence.schema.RelationField;
import io.intellixity.relata.persistence.schema.SchemaRegistry;
import io.intellixity.relata.persistence.schema.UniqueSelector;

import java.io.IOException;
import java.util.*;

/**
 * Schema-aware reader of the write-directive wire shape.
 * <p>
 * Keys naming a relation field of the model carry an object of operations, e.g.
 * <pre>{@code
 * {"email": "a@x.io",
 *  "profile": {"create": {"bio": "hi"}},
 *  "posts": {"connect": [{"id": 1}], "updateMany": {"where": {...}, "data": {"published": true}}}}
 * }</pre>
 * Operations of list relations accept a single value or an array; array order is directive order.
 */
public final class WriteDataJsonParser {
  private final SchemaRegistry schema;
  private final ObjectCodec codec;

  public WriteDataJsonParser(SchemaRegistry schema) {
    this(schema, new ObjectMapper());
  }

  public WriteDataJsonParser(SchemaRegistry schema, ObjectCodec codec) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  public WriteData parse(String model, JsonNode node) {
    return parseData(model, node, DirectivePath.root(model));
  }

  /** Selector object: {@code {"email": "a@x.io"}}. */
  public UniqueSelector parseSelector(JsonNode node, DirectivePath path) {
    if (node == null || !node.isObject() || node.isEmpty()) {
      throw new DirectiveValidationException("Selector must be a non-empty object: " + node, path);
    }
    Map<String, Object> values = new LinkedHashMap<>();
    for (var it = node.fields(); it.hasNext(); ) {
      var e = it.next();
      if (e.getValue().isNull()) throw new DirectiveValidationException("Selector value for '" + e.getKey() + "' is null", path);
      values.put(e.getKey(), value(e.getValue(), path));
    }
    return new UniqueSelector(values);
  }

  private WriteData parseData(String model, JsonNode node, DirectivePath path) {
    if (node == null || !node.isObject()) throw new DirectiveValidationException("Write data must be an object", path);
    ModelDef m = schema.model(model);
    Map<String, Object> scalars = new LinkedHashMap<>();
    Map<String, List<WriteDirective>> relations = new LinkedHashMap<>();
    for (var it = node.fields(); it.hasNext(); ) {
      var e = it.next();
      String key = e.getKey();
      if (m.hasRelation(key)) {
        relations.put(key, parseDirectives(m.relations().get(key), e.getValue(), path));
      } else {
        scalars.put(key, value(e.getValue(), path));
      }
    }
    return new WriteData(scalars, relations);
  }

  private List<WriteDirective> parseDirectives(RelationField r, JsonNode ops, DirectivePath path) {
    if (ops == null || !ops.isObject() || ops.isEmpty()) {
      throw new DirectiveValidationException("Relation '" + r.name() + "' expects an object of operations", path);
    }
    List<WriteDirective> out = new ArrayList<>();
    for (var it = ops.fields(); it.hasNext(); ) {
      var e = it.next();
      String kind = e.getKey();
      JsonNode body = e.getValue();
      if ("set".equals(kind)) {
        out.add(parseSet(r, body, path.child(r.name(), out.size(), kind)));
        continue;
      }
      if (body.isArray()) {
        if (!r.isList()) throw new DirectiveValidationException("Single relation '" + r.name() + "' got an array for " + kind, path);
        for (JsonNode x : body) out.add(parseOne(r, kind, x, path.child(r.name(), out.size(), kind)));
      } else {
        out.add(parseOne(r, kind, body, path.child(r.name(), out.size(), kind)));
      }
    }
    return out;
  }

  private WriteDirective parseSet(RelationField r, JsonNode body, DirectivePath path) {
    if (body == null || !body.isArray()) throw new DirectiveValidationException("set expects an array of selectors", path);
    List<UniqueSelector> members = new ArrayList<>();
    for (JsonNode x : body) members.add(parseSelector(x, path));
    return new WriteDirective.SetMembers(members);
  }

  private WriteDirective parseOne(RelationField r, String kind, JsonNode body, DirectivePath path) {
    String target = r.target();
    switch (kind) {
      case "create":
        return new WriteDirective.Create(parseData(target, body, path));
      case "connect":
        return new WriteDirective.Connect(parseSelector(body, path));
      case "connectOrCreate":
        return new WriteDirective.ConnectOrCreate(parseSelector(required(body, "where", path), path),
            parseData(target, required(body, "create", path), path));
      case "update":
        if (r.isList() || body.has("where") && body.has("data")) {
          return new WriteDirective.Update(parseSelector(required(body, "where", path), path),
              parseData(target, required(body, "data", path), path));
        }
        return new WriteDirective.Update(null, parseData(target, body, path));
      case "upsert":
        UniqueSelector where = body.hasNonNull("where") ? parseSelector(body.get("where"), path) : null;
        return new WriteDirective.Upsert(where, parseData(target, required(body, "create", path), path),
            parseData(target, required(body, "update", path), path));
      case "delete":
        return new WriteDirective.Delete(optionalSelector(body, path));
      case "disconnect":
        return new WriteDirective.Disconnect(optionalSelector(body, path));
      case "updateMany":
        return new WriteDirective.UpdateMany(filter(body.get("where"), path), parseData(target, required(body, "data", path), path));
      case "deleteMany":
        return new WriteDirective.DeleteMany(filter(body, path));
      default:
        throw new DirectiveValidationException("Unknown operation '" + kind + "' on relation '" + r.name() + "'", path);
    }
  }

  /** {@code true} addresses the linked row of a single relation; an object is a selector. */
  private UniqueSelector optionalSelector(JsonNode body, DirectivePath path) {
    if (body == null || body.isNull() || body.isBoolean() && body.booleanValue()) return null;
    return parseSelector(body, path);
  }

  private QueryElement filter(JsonNode node, DirectivePath path) {
    if (node == null || node.isNull() || node.isObject() && node.isEmpty()) return null;
    try {
      return QueryJsonDeserializer.parseFilter(node, codec);
    } catch (IOException | IllegalArgumentException e) {
      throw new DirectiveValidationException("Invalid filter: " + e.getMessage(), path);
    }
  }

  private Object value(JsonNode node, DirectivePath path) {
    try {
      return codec.treeToValue(node, Object.class);
    } catch (IOException e) {
      throw new DirectiveValidationException("Unreadable value: " + node, path);
    }
  }

  private static JsonNode required(JsonNode body, String key, DirectivePath path) {
    JsonNode n = (body == null) ? null : body.get(key);
    if (n == null || n.isNull()) throw new DirectiveValidationException("Missing '" + key + "'", path);
    return n;
  }
}

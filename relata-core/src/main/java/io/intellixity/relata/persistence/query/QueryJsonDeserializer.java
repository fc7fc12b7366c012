package io.intellixity.relata.persistence.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.*;

import java.io.IOException;
import java.util.*;

/**
 * Canonical JSON deserializer for {@link Query}.
 * <p>
 * Filter shapes:
 * <ul>
 *   <li>{@code {"and": [...]}}, {@code {"or": [...]}}, {@code {"not": {...}}}</li>
 *   <li>{@code {"eq": {"field": "email", "value": "a@x.io"}}}, {@code {"in": {"field": "id", "values": [1, 2]}}}</li>
 *   <li>{@code {"some": {"relation": "posts", "where": {...}}}} and likewise {@code none}, {@code every},
 *       {@code is}, {@code isNot}</li>
 * </ul>
 */
public final class QueryJsonDeserializer extends JsonDeserializer<Query> {
  private static final Map<String, RelationFilter.Quantifier> QUANTIFIERS = Map.of(
      "some", RelationFilter.Quantifier.SOME,
      "none", RelationFilter.Quantifier.NONE,
      "every", RelationFilter.Quantifier.EVERY,
      "is", RelationFilter.Quantifier.IS,
      "isNot", RelationFilter.Quantifier.IS_NOT
  );

  @Override
  public Query deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("Query JSON must be an object");

    Query q = new Query();

    JsonNode params = root.get("params");
    if (params != null && params.isObject()) {
      @SuppressWarnings("unchecked")
      Map<String, Object> m = codec.treeToValue(params, Map.class);
      q.withParams(m);
    }

    JsonNode filter = root.get("filter");
    if (filter != null && !filter.isNull()) {
      q.withFilter(parseFilter(filter, codec));
    }

    JsonNode page = root.get("page");
    if (page != null && page.isObject()) {
      q.withPage(OffsetPage.of(intOrNull(page.get("offset")), intOrNull(page.get("limit"))));
    }

    q.withSort(parseSort(root.get("sort")));
    return q;
  }

  /** Sort list: {@code [{"field": "title", "dir": "desc"}]}. */
  public static List<SortField> parseSort(JsonNode sort) {
    List<SortField> fields = new ArrayList<>();
    if (sort == null || !sort.isArray()) return fields;
    for (JsonNode s : sort) {
      if (!s.isObject()) continue;
      String f = textOrNull(s.get("field"));
      String dir = textOrNull(s.get("dir"));
      if (f == null) continue;
      fields.add(new SortField(f, SortField.Direction.parse(dir)));
    }
    return fields;
  }

  /** Parses one filter element; shared by the write-directive and read-spec codecs. */
  public static QueryElement parseFilter(JsonNode n, ObjectCodec codec) throws IOException {
    if (n == null || n.isNull()) return null;

    // Canonical group forms: { "and": [ ... ] } / { "or": [ ... ] }
    if (n.isObject() && n.has("and")) {
      return new LogicalGroup(Clause.AND, parseChildren(n.get("and"), codec));
    }
    if (n.isObject() && n.has("or")) {
      return new LogicalGroup(Clause.OR, parseChildren(n.get("or"), codec));
    }

    // Canonical NOT form: { "not": <element> }
    if (n.isObject() && n.has("not")) {
      QueryElement child = parseFilter(n.get("not"), codec);
      if (child == null) return null;
      return new NotElement(child);
    }

    if (n.isObject()) {
      Iterator<String> it = n.fieldNames();
      while (it.hasNext()) {
        String k = it.next();
        RelationFilter.Quantifier quantifier = QUANTIFIERS.get(k);
        if (quantifier != null) return parseRelation(quantifier, n.get(k), codec);
        Operator op = tryOp(k);
        if (op == null) continue;
        JsonNode body = n.get(k);
        if (body == null || !body.isObject()) throw new IllegalArgumentException(k + " must be an object");
        return parseCondition(op, body, codec);
      }
    }

    // Back-compat: {clause: AND, elements:[...] } or {operator: EQ, property: email, ...}
    if (n.isObject()) {
      @SuppressWarnings("unchecked")
      Map<String, Object> m = codec.treeToValue(n, Map.class);
      if (m.containsKey("clause") || m.containsKey("elements")) return LogicalGroup.fromMap(m);
      if (m.containsKey("operator") && m.containsKey("property")) return Condition.fromMap(m);
    }

    throw new IllegalArgumentException("Unsupported filter element: " + n);
  }

  private static RelationFilter parseRelation(RelationFilter.Quantifier quantifier, JsonNode body, ObjectCodec codec) throws IOException {
    if (body == null || !body.isObject()) throw new IllegalArgumentException(quantifier + " must be an object");
    String relation = textOrNull(body.get("relation"));
    if (relation == null) throw new IllegalArgumentException(quantifier + " requires relation");
    return new RelationFilter(relation, quantifier, parseFilter(body.get("where"), codec));
  }

  private static List<QueryElement> parseChildren(JsonNode arr, ObjectCodec codec) throws IOException {
    if (arr == null || !arr.isArray()) return List.of();
    List<QueryElement> out = new ArrayList<>();
    for (JsonNode x : arr) {
      QueryElement e = parseFilter(x, codec);
      if (e != null) out.add(e);
    }
    return out;
  }

  private static QueryElement parseCondition(Operator op, JsonNode body, ObjectCodec codec) throws IOException {
    String field = textOrNull(body.get("field"));
    if (field == null) throw new IllegalArgumentException(op + " requires field");
    boolean not = boolOrDefault(body.get("not"), false);

    if (op == Operator.RANGE) {
      Object lower = decodeValue(body.get("lower"), codec);
      Object upper = decodeValue(body.get("upper"), codec);
      return new Condition(field, op, null, lower, upper, not);
    }

    if (op == Operator.IN || op == Operator.NIN) {
      return new Condition(field, op, decodeValue(body.get("values"), codec), null, null, not);
    }

    return new Condition(field, op, decodeValue(body.get("value"), codec), null, null, not);
  }

  private static Object decodeValue(JsonNode v, ObjectCodec codec) throws IOException {
    if (v == null || v.isNull()) return null;
    // Param: {"param":"x"} or {"$param":"x"}
    if (v.isObject()) {
      JsonNode p = v.get("param");
      if (p == null) p = v.get("$param");
      if (p != null && p.isTextual()) return QueryValues.param(p.asText());
    }
    return codec.treeToValue(v, Object.class);
  }

  private static Operator tryOp(String key) {
    if (key == null) return null;
    try {
      return Operator.valueOf(key.toUpperCase());
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  static Integer intOrNull(JsonNode n) {
    if (n == null || n.isNull()) return null;
    return n.isNumber() ? n.intValue() : Integer.valueOf(n.asText());
  }

  private static boolean boolOrDefault(JsonNode n, boolean def) {
    if (n == null || n.isNull()) return def;
    return n.isBoolean() ? n.booleanValue() : Boolean.parseBoolean(n.asText());
  }
}

package io.intellixity.relata.persistence.read;

import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.relata.persistence.query.QueryJsonDeserializer;
import io.intellixity.relata.persistence.query.QueryValidationException;

import java.io.IOException;
import java.util.*;

/**
 * Reader of the include wire shape.
 * <pre>{@code
 * {"profile": true,
 *  "posts": {"where": {...}, "orderBy": [{"field": "title"}], "limit": 5, "include": {"categories": true}},
 *  "author": {"profile": true}}
 * }</pre>
 * An object carrying any of {@code include}, {@code where}, {@code orderBy}, {@code offset}, {@code limit} is the
 * extended form; any other object is a nested include map. {@code false} leaves the relation out.
 */
public final class ReadSpecJsonParser {
  private static final Set<String> RESERVED = Set.of("include", "where", "orderBy", "offset", "limit");

  private final ObjectCodec codec;

  public ReadSpecJsonParser() {
    this(new ObjectMapper());
  }

  public ReadSpecJsonParser(ObjectCodec codec) {
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  public ReadSpec parse(JsonNode node) {
    if (node == null || node.isNull()) return ReadSpec.empty();
    if (!node.isObject()) throw new QueryValidationException("Include spec must be an object: " + node);
    ReadSpec.Builder b = ReadSpec.builder();
    for (var it = node.fields(); it.hasNext(); ) {
      var e = it.next();
      JsonNode v = e.getValue();
      if (v.isBoolean()) {
        if (v.booleanValue()) b.include(e.getKey());
      } else if (v.isObject()) {
        b.include(e.getKey(), isExtended(v) ? extended(v) : Include.of(parse(v)));
      } else {
        throw new QueryValidationException("Include of '" + e.getKey() + "' must be true, false or an object");
      }
    }
    return b.build();
  }

  private Include extended(JsonNode v) {
    for (var it = v.fieldNames(); it.hasNext(); ) {
      String k = it.next();
      if (!RESERVED.contains(k)) throw new QueryValidationException("Unknown include option '" + k + "'; nest relations under \"include\"");
    }
    try {
      JsonNode limit = v.get("limit");
      JsonNode offset = v.get("offset");
      return new Include(
          parse(v.get("include")),
          QueryJsonDeserializer.parseFilter(v.get("where"), codec),
          QueryJsonDeserializer.parseSort(v.get("orderBy")),
          offset == null || offset.isNull() ? 0 : offset.asInt(),
          limit == null || limit.isNull() ? null : limit.asInt());
    } catch (IOException e) {
      throw new QueryValidationException("Malformed include filter", e);
    } catch (IllegalArgumentException e) {
      throw new QueryValidationException(e.getMessage(), e);
    }
  }

  private static boolean isExtended(JsonNode v) {
    for (var it = v.fieldNames(); it.hasNext(); ) {
      if (RESERVED.contains(it.next())) return true;
    }
    return false;
  }
}

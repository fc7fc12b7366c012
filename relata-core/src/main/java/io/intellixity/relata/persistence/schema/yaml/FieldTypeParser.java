package io.intellixity.relata.persistence.schema.yaml;

import java.util.Set;

/** Tiny scalar type DSL: {@code long}, {@code string?} (nullable), {@code long!} (storage generated). */
final class FieldTypeParser {
  static final Set<String> KNOWN = Set.of("string", "long", "int", "boolean", "double", "uuid", "timestamp", "json");

  private FieldTypeParser() {}

  record FieldType(String typeId, boolean optional, boolean generated) {}

  static FieldType parse(String s) {
    if (s == null || s.isBlank()) throw new IllegalArgumentException("type is blank");
    s = s.trim();
    boolean optional = false;
    boolean generated = false;
    while (s.endsWith("?") || s.endsWith("!")) {
      if (s.endsWith("?")) optional = true;
      else generated = true;
      s = s.substring(0, s.length() - 1).trim();
    }
    String id = s.toLowerCase();
    if (!KNOWN.contains(id)) throw new IllegalArgumentException("Unknown scalar type: " + s);
    return new FieldType(id, optional, generated);
  }
}

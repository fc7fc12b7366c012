package io.intellixity.relata.persistence.write;

import java.util.*;

/**
 * Payload of a create or update: scalar values plus, per relation field, the ordered directives to apply.
 */
public record WriteData(Map<String, Object> scalars, Map<String, List<WriteDirective>> relations) {
  public WriteData {
    scalars = Collections.unmodifiableMap(new LinkedHashMap<>(scalars == null ? Map.of() : scalars));
    Map<String, List<WriteDirective>> rel = new LinkedHashMap<>();
    if (relations != null) {
      for (var e : relations.entrySet()) rel.put(e.getKey(), List.copyOf(e.getValue()));
    }
    relations = Collections.unmodifiableMap(rel);
  }

  public static WriteData empty() {
    return new WriteData(Map.of(), Map.of());
  }

  public static WriteData of(Map<String, Object> scalars) {
    return new WriteData(scalars, Map.of());
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private final Map<String, Object> scalars = new LinkedHashMap<>();
    private final Map<String, List<WriteDirective>> relations = new LinkedHashMap<>();

    private Builder() {}

    /** Null values are kept: they clear an optional field. */
    public Builder set(String field, Object value) { scalars.put(field, value); return this; }

    public Builder with(String relation, WriteDirective... directives) {
      relations.computeIfAbsent(relation, k -> new ArrayList<>()).addAll(List.of(directives));
      return this;
    }

    public WriteData build() {
      return new WriteData(scalars, relations);
    }
  }
}

package io.intellixity.relata.persistence.read;

import java.util.*;

/** Relation field name -> {@link Include}; depth is exactly what the caller declares. */
public record ReadSpec(Map<String, Include> includes) {
  private static final ReadSpec EMPTY = new ReadSpec(Map.of());

  public ReadSpec {
    includes = Collections.unmodifiableMap(new LinkedHashMap<>(includes == null ? Map.of() : includes));
  }

  public static ReadSpec empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return includes.isEmpty();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private final Map<String, Include> includes = new LinkedHashMap<>();

    private Builder() {}

    public Builder include(String relation) {
      return include(relation, Include.all());
    }

    public Builder include(String relation, ReadSpec nested) {
      return include(relation, Include.of(nested));
    }

    public Builder include(String relation, Include include) {
      includes.put(Objects.requireNonNull(relation, "relation"), Objects.requireNonNull(include, "include"));
      return this;
    }

    public ReadSpec build() {
      return new ReadSpec(includes);
    }
  }
}

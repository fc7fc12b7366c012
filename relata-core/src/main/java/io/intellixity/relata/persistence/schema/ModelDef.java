package io.intellixity.relata.persistence.schema;

import java.util.*;

/**
 * Static description of one model: scalar fields (ordered), relation fields, primary key and unique constraints.
 * <p>
 * The primary key is always reported as the first unique constraint.
 */
public record ModelDef(
    String name,
    /** Storage source (table). Defaults to the model name. */
    String source,
    Map<String, ScalarField> fields,
    Map<String, RelationField> relations,
    List<String> primaryKey,
    List<List<String>> uniqueConstraints
) {
  public ModelDef {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("model name is required");
    source = (source == null || source.isBlank()) ? name : source;
    fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields == null ? Map.of() : fields));
    relations = Collections.unmodifiableMap(new LinkedHashMap<>(relations == null ? Map.of() : relations));
    primaryKey = primaryKey == null ? List.of() : List.copyOf(primaryKey);
    if (primaryKey.isEmpty()) throw new IllegalArgumentException("primaryKey is required for model: " + name);

    for (String pk : primaryKey) {
      if (!fields.containsKey(pk)) throw new IllegalArgumentException("primary key field '" + pk + "' is not a scalar of model: " + name);
    }
    for (String r : relations.keySet()) {
      if (fields.containsKey(r)) throw new IllegalArgumentException("relation '" + r + "' clashes with a scalar field of model: " + name);
    }

    List<List<String>> uniques = new ArrayList<>();
    uniques.add(primaryKey);
    if (uniqueConstraints != null) {
      for (List<String> u : uniqueConstraints) {
        if (u == null || u.isEmpty()) continue;
        for (String f : u) {
          if (!fields.containsKey(f)) throw new IllegalArgumentException("unique field '" + f + "' is not a scalar of model: " + name);
        }
        if (uniques.stream().noneMatch(x -> new HashSet<>(x).equals(new HashSet<>(u)))) uniques.add(List.copyOf(u));
      }
    }
    uniqueConstraints = List.copyOf(uniques);
  }

  public ScalarField scalar(String field) {
    ScalarField f = fields.get(field);
    if (f == null) throw new IllegalArgumentException("Unknown scalar field '" + field + "' on model: " + name);
    return f;
  }

  public boolean hasScalar(String field) {
    return fields.containsKey(field);
  }

  public boolean hasRelation(String field) {
    return relations.containsKey(field);
  }

  /** True if the given field set is exactly one of the declared unique constraints. */
  public boolean isUnique(Collection<String> fieldSet) {
    if (fieldSet == null || fieldSet.isEmpty()) return false;
    Set<String> s = new HashSet<>(fieldSet);
    for (List<String> u : uniqueConstraints) {
      if (u.size() == s.size() && s.containsAll(u)) return true;
    }
    return false;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public static final class Builder {
    private final String name;
    private String source;
    private final Map<String, ScalarField> fields = new LinkedHashMap<>();
    private final Map<String, RelationField> relations = new LinkedHashMap<>();
    private final List<String> primaryKey = new ArrayList<>();
    private final List<List<String>> uniques = new ArrayList<>();

    private Builder(String name) {
      this.name = name;
    }

    public Builder source(String source) { this.source = source; return this; }
    public Builder field(ScalarField f) { fields.put(f.name(), f); return this; }
    public Builder relation(RelationField r) { relations.put(r.name(), r); return this; }
    public Builder primaryKey(String... fields) { primaryKey.clear(); primaryKey.addAll(List.of(fields)); return this; }
    public Builder unique(String... fields) { uniques.add(List.of(fields)); return this; }

    public ModelDef build() {
      return new ModelDef(name, source, fields, relations, primaryKey, uniques);
    }
  }
}

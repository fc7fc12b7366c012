package io.intellixity.relata.persistence.schema;

import io.intellixity.relata.persistence.query.QueryElement;
import io.intellixity.relata.persistence.query.QueryFilters;
import io.intellixity.relata.persistence.query.Values;

import java.util.*;

/**
 * Field -> value mapping that addresses exactly one row through a primary key or declared unique constraint.
 * <p>
 * Whether the field set really is unique is checked against the schema by
 * {@link SchemaRegistry#isUniqueSelector(String, UniqueSelector)}.
 */
public record UniqueSelector(Map<String, Object> values) {
  public UniqueSelector {
    if (values == null || values.isEmpty()) throw new IllegalArgumentException("unique selector needs at least one field");
    for (var e : values.entrySet()) {
      if (e.getKey() == null || e.getKey().isBlank()) throw new IllegalArgumentException("blank selector field");
      if (e.getValue() == null) throw new IllegalArgumentException("null value for selector field: " + e.getKey());
    }
    values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public static UniqueSelector of(String field, Object value) {
    return new UniqueSelector(Map.of(field, value));
  }

  public static UniqueSelector of(String f1, Object v1, String f2, Object v2) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put(f1, v1);
    m.put(f2, v2);
    return new UniqueSelector(m);
  }

  public Set<String> fields() {
    return values.keySet();
  }

  /** Conjunction of equality conditions on every selector field. */
  public QueryElement toFilter() {
    List<QueryElement> eqs = new ArrayList<>();
    for (var e : values.entrySet()) eqs.add(QueryFilters.eq(e.getKey(), e.getValue()));
    return eqs.size() == 1 ? eqs.get(0) : QueryFilters.and(eqs.toArray(new QueryElement[0]));
  }

  /** True if every selector field has an equal value in the given row (or payload). */
  public boolean matches(Map<String, Object> row) {
    if (row == null) return false;
    for (var e : values.entrySet()) {
      if (!row.containsKey(e.getKey())) return false;
      if (!Values.same(e.getValue(), row.get(e.getKey()))) return false;
    }
    return true;
  }

  @Override
  public String toString() {
    return values.toString();
  }
}

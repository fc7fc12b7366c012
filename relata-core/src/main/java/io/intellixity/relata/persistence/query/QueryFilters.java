package io.intellixity.relata.persistence.query;

import java.util.*;

public final class QueryFilters {
  private QueryFilters() {}

  public static Condition eq(String property, Object value) { return Condition.of(property, Operator.EQ, value); }
  public static Condition ne(String property, Object value) { return Condition.of(property, Operator.NE, value); }
  public static Condition gt(String property, Object value) { return Condition.of(property, Operator.GT, value); }
  public static Condition ge(String property, Object value) { return Condition.of(property, Operator.GE, value); }
  public static Condition lt(String property, Object value) { return Condition.of(property, Operator.LT, value); }
  public static Condition le(String property, Object value) { return Condition.of(property, Operator.LE, value); }

  public static Condition in(String property, Collection<?> values) { return Condition.of(property, Operator.IN, List.copyOf(values)); }
  public static Condition nin(String property, Collection<?> values) { return Condition.of(property, Operator.NIN, List.copyOf(values)); }

  public static Condition range(String property, Object lower, Object upper) { return Condition.range(property, lower, upper); }

  /** SQL LIKE pattern ({@code %} and {@code _} wildcards). */
  public static Condition like(String property, Object value) { return Condition.of(property, Operator.LIKE, value); }

  public static Condition isNull(String property) { return Condition.isNull(property); }
  public static Condition isNotNull(String property) { return Condition.isNotNull(property); }

  // --- relation-scoped filters ---

  /** At least one row of the list relation matches {@code where} (any row when null). */
  public static RelationFilter some(String relation, QueryElement where) {
    return new RelationFilter(relation, RelationFilter.Quantifier.SOME, where);
  }

  /** No row of the list relation matches {@code where} (no rows at all when null). */
  public static RelationFilter none(String relation, QueryElement where) {
    return new RelationFilter(relation, RelationFilter.Quantifier.NONE, where);
  }

  /** Every row of the list relation matches {@code where}; vacuously true without rows. */
  public static RelationFilter every(String relation, QueryElement where) {
    return new RelationFilter(relation, RelationFilter.Quantifier.EVERY, where);
  }

  /** The single related row matches {@code where}; with a null {@code where} there is no related row. */
  public static RelationFilter is(String relation, QueryElement where) {
    return new RelationFilter(relation, RelationFilter.Quantifier.IS, where);
  }

  public static RelationFilter isNot(String relation, QueryElement where) {
    return new RelationFilter(relation, RelationFilter.Quantifier.IS_NOT, where);
  }

  public static LogicalGroup and(QueryElement... elements) {
    return new LogicalGroup(Clause.AND, List.of(elements));
  }

  public static LogicalGroup or(QueryElement... elements) {
    return new LogicalGroup(Clause.OR, List.of(elements));
  }

  public static NotElement not(QueryElement element) {
    return new NotElement(element);
  }

  /** AND of the non-null arguments; null when none remain. */
  public static QueryElement allOf(QueryElement... elements) {
    List<QueryElement> out = new ArrayList<>();
    for (QueryElement e : elements) if (e != null) out.add(e);
    if (out.isEmpty()) return null;
    if (out.size() == 1) return out.get(0);
    return new LogicalGroup(Clause.AND, out);
  }
}

package io.intellixity.relata.persistence.exec;

import io.intellixity.relata.persistence.query.*;
import io.intellixity.relata.persistence.schema.*;

import java.util.*;

/** Filters on a target model selecting the rows linked to one parent row, plus key helpers. */
final class LinkFilters {
  private final SchemaRegistry schema;

  LinkFilters(SchemaRegistry schema) {
    this.schema = schema;
  }

  /**
   * Rows of {@code r.target()} linked to {@code parentRow} through {@code r}; empty when the parent holds no link.
   */
  Optional<QueryElement> linked(String parentModel, RelationField r, Map<String, Object> parentRow) {
    switch (r.ownership()) {
      case SELF: {
        List<Object> fk = Values.key(r.fields(), parentRow);
        if (Values.hasNull(fk)) return Optional.empty();
        return Optional.of(equalTo(r.references(), fk));
      }
      case TARGET: {
        RelationField inv = schema.relation(r.target(), r.inverse());
        List<Object> ref = Values.key(inv.references(), parentRow);
        if (Values.hasNull(ref)) return Optional.empty();
        return Optional.of(equalTo(inv.fields(), ref));
      }
      case JOIN_TABLE: {
        JoinTableDef jt = r.joinTable();
        Object pk = parentRow.get(schema.singleKey(parentModel));
        if (pk == null) return Optional.empty();
        return Optional.of(new InSubquery(List.of(schema.singleKey(r.target())), InSubquery.Source.joinTable(jt.name()),
            List.of(jt.targetColumn()), QueryFilters.eq(jt.column(), pk), false));
      }
      default:
        throw new IllegalArgumentException("Unsupported ownership: " + r.ownership());
    }
  }

  /** Exact match on the primary key of {@code model}. */
  QueryElement byKey(String model, Map<String, Object> row) {
    List<String> pk = schema.model(model).primaryKey();
    List<Object> key = Values.key(pk, row);
    if (Values.hasNull(key)) throw new IllegalStateException("Row of " + model + " has no primary key value: " + row);
    return equalTo(pk, key);
  }

  /** Any of the given primary keys. */
  QueryElement byKeys(String model, Collection<List<Object>> keys) {
    List<String> pk = schema.model(model).primaryKey();
    return anyOf(pk, keys);
  }

  List<Object> key(String model, Map<String, Object> row) {
    return Values.key(schema.model(model).primaryKey(), row);
  }

  static QueryElement equalTo(List<String> fields, List<Object> values) {
    if (fields.size() == 1) return QueryFilters.eq(fields.get(0), values.get(0));
    List<QueryElement> eqs = new ArrayList<>(fields.size());
    for (int i = 0; i < fields.size(); i++) eqs.add(QueryFilters.eq(fields.get(i), values.get(i)));
    return new LogicalGroup(Clause.AND, eqs);
  }

  static QueryElement anyOf(List<String> fields, Collection<List<Object>> tuples) {
    if (fields.size() == 1) {
      List<Object> vals = new ArrayList<>(tuples.size());
      for (List<Object> t : tuples) vals.add(t.get(0));
      return QueryFilters.in(fields.get(0), vals);
    }
    List<QueryElement> alts = new ArrayList<>(tuples.size());
    for (List<Object> t : tuples) alts.add(equalTo(fields, t));
    return new LogicalGroup(Clause.OR, alts);
  }
}

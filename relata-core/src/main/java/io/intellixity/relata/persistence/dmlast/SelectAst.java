package io.intellixity.relata.persistence.dmlast;

import io.intellixity.relata.persistence.query.Page;
import io.intellixity.relata.persistence.query.QueryElement;
import io.intellixity.relata.persistence.query.SortField;

import java.util.List;

/**
 * Row fetch from a model or join table. Rows come back as field -> value maps of every scalar field
 * (or both join columns).
 */
public record SelectAst(
    String table,
    boolean joinTable,
    QueryElement where,
    List<SortField> sort,
    Page page
) {
  public SelectAst {
    sort = sort == null ? List.of() : List.copyOf(sort);
  }

  public static SelectAst of(String model, QueryElement where) {
    return new SelectAst(model, false, where, List.of(), null);
  }

  public static SelectAst joinRows(String joinTable, QueryElement where) {
    return new SelectAst(joinTable, true, where, List.of(), null);
  }
}

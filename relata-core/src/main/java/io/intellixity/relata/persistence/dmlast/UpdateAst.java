package io.intellixity.relata.persistence.dmlast;

import io.intellixity.relata.persistence.query.QueryElement;

import java.util.List;
import java.util.Objects;

/** Sets {@code sets} on every row of {@code table} matching {@code where} (all rows when null). */
public record UpdateAst(
    String table,
    List<ColumnBind> sets,
    QueryElement where
) implements DmlAst {
  public UpdateAst {
    Objects.requireNonNull(table, "table");
    sets = ColumnBind.distinct(sets, table);
  }
}

package io.intellixity.relata.persistence.dmlast;

import java.util.List;
import java.util.Objects;

/** One row insert; {@code returningColumns} are the fields the executor reports back (generated keys). */
public record InsertAst(
    String table,
    List<ColumnBind> columns,
    List<String> returningColumns
) implements DmlAst {
  public InsertAst {
    Objects.requireNonNull(table, "table");
    columns = ColumnBind.distinct(columns, table);
    returningColumns = returningColumns == null ? List.of() : List.copyOf(returningColumns);
  }

  /** Join-table row linking two keys; nothing is returned. */
  public static InsertAst joinRow(String joinTable, ColumnBind left, ColumnBind right) {
    return new InsertAst(joinTable, List.of(left, right), List.of());
  }
}

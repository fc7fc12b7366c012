package io.intellixity.relata.persistence.dmlast;

import io.intellixity.relata.persistence.compile.Bind;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public record ColumnBind(String column, Bind bind) {
  public ColumnBind {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(bind, "bind");
  }

  static List<ColumnBind> distinct(List<ColumnBind> binds, String table) {
    if (binds == null) return List.of();
    Set<String> seen = new HashSet<>();
    for (ColumnBind b : binds) {
      if (!seen.add(b.column())) throw new IllegalArgumentException("Column '" + b.column() + "' bound twice for " + table);
    }
    return List.copyOf(binds);
  }
}

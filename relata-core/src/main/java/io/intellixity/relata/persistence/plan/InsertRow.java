package io.intellixity.relata.persistence.plan;

import java.util.*;

public record InsertRow(RowRef row, Map<String, Object> values, List<FkBinding> foreignKeys, DirectivePath path) implements PlanStep {
  public InsertRow {
    values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    foreignKeys = List.copyOf(foreignKeys);
  }

  @Override
  public String describe() {
    return foreignKeys.isEmpty() ? "insert " + row : "insert " + row + " " + foreignKeys;
  }
}

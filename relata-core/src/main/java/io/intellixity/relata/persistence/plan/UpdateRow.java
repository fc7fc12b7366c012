package io.intellixity.relata.persistence.plan;

import java.util.*;

public record UpdateRow(RowRef row, Map<String, Object> values, DirectivePath path) implements PlanStep {
  public UpdateRow {
    values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  @Override
  public String describe() {
    return "update " + row + " " + values.keySet();
  }
}

package io.intellixity.relata.persistence.plan;

import io.intellixity.relata.persistence.schema.UniqueSelector;

/**
 * Resolves {@code row} by selector, optionally restricted to rows linked through {@code scope}.
 * A missing row is an error. Either the selector or the scope is set.
 */
public record LookupRow(RowRef row, UniqueSelector selector, LinkScope scope, DirectivePath path) implements PlanStep {
  public LookupRow {
    if (selector == null && scope == null) throw new IllegalArgumentException("lookup needs a selector or a scope");
  }

  @Override
  public String describe() {
    return "lookup " + row + (selector == null ? "" : " " + selector) + (scope == null ? "" : " in " + scope);
  }
}

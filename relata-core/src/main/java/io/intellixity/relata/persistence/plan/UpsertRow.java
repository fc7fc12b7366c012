package io.intellixity.relata.persistence.plan;

import io.intellixity.relata.persistence.schema.UniqueSelector;

/** Linked lookup of {@code row}; found runs {@code updateBranch}, otherwise {@code createBranch}. */
public record UpsertRow(RowRef row, UniqueSelector selector, LinkScope scope,
                        WritePlan createBranch, WritePlan updateBranch, DirectivePath path) implements PlanStep {
  @Override
  public String describe() {
    return "upsert " + row + (selector == null ? "" : " " + selector) + " in " + scope
        + " then " + updateBranch.describe() + " else " + createBranch.describe();
  }
}

package io.intellixity.relata.persistence.plan;

import io.intellixity.relata.persistence.schema.UniqueSelector;

/**
 * connectOrCreate: resolve {@code row} by selector inside the transaction, otherwise run {@code createBranch}
 * (which inserts {@code row} and its nested writes). A unique conflict on that insert is retried once as a lookup.
 */
public record ResolveOrCreate(RowRef row, UniqueSelector selector, WritePlan createBranch, DirectivePath path) implements PlanStep {
  @Override
  public String describe() {
    return "resolveOrCreate " + row + " " + selector + " else " + createBranch.describe();
  }
}

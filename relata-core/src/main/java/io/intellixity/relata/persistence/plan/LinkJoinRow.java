package io.intellixity.relata.persistence.plan;

import io.intellixity.relata.persistence.schema.JoinTableDef;

/** Ensures a join row between {@code left} (the {@code column} side) and {@code right}. Idempotent. */
public record LinkJoinRow(JoinTableDef joinTable, RowRef left, RowRef right, DirectivePath path) implements PlanStep {
  @Override
  public String describe() {
    return "link " + joinTable.name() + " " + left + " <-> " + right;
  }
}

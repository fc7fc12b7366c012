package io.intellixity.relata.persistence.plan;

import io.intellixity.relata.persistence.query.QueryElement;

public record DeleteLinkedMany(LinkScope scope, QueryElement filter, DirectivePath path) implements PlanStep {
  @Override
  public String describe() {
    return "deleteMany " + scope + (filter == null ? "" : " where " + filter);
  }
}

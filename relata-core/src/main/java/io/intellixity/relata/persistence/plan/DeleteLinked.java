package io.intellixity.relata.persistence.plan;

import io.intellixity.relata.persistence.schema.UniqueSelector;

public record DeleteLinked(LinkScope scope, UniqueSelector selector, DirectivePath path) implements PlanStep {
  @Override
  public String describe() {
    return "delete " + scope + (selector == null ? "" : " " + selector);
  }
}

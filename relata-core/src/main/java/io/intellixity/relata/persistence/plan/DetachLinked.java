package io.intellixity.relata.persistence.plan;

import io.intellixity.relata.persistence.schema.UniqueSelector;

/** disconnect: clears the foreign key (or removes the join row) of the linked row matching the selector. */
public record DetachLinked(LinkScope scope, UniqueSelector selector, DirectivePath path) implements PlanStep {
  @Override
  public String describe() {
    return "disconnect " + scope + (selector == null ? "" : " " + selector);
  }
}

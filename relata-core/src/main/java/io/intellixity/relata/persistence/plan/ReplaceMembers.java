package io.intellixity.relata.persistence.plan;

import io.intellixity.relata.persistence.schema.UniqueSelector;

import java.util.List;

/** Replaces the membership of a list relation: unlisted rows are detached, listed rows linked. */
public record ReplaceMembers(LinkScope scope, List<UniqueSelector> members, DirectivePath path) implements PlanStep {
  public ReplaceMembers {
    members = List.copyOf(members);
  }

  @Override
  public String describe() {
    return "set " + scope + " " + members;
  }
}

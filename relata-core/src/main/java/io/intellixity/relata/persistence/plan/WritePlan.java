package io.intellixity.relata.persistence.plan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered steps of one nested write. Steps run strictly in list order inside a single transaction;
 * a plan is consumed once.
 */
public record WritePlan(RowRef root, List<PlanStep> steps) {
  public WritePlan {
    Objects.requireNonNull(root, "root");
    steps = List.copyOf(steps);
  }

  public List<String> describeSteps() {
    List<String> out = new ArrayList<>(steps.size());
    for (PlanStep s : steps) out.add(s.describe());
    return out;
  }

  public String describe() {
    return describeSteps().toString();
  }
}

package io.intellixity.relata.persistence.plan;

/** One primitive (or runtime-branching) operation of a {@link WritePlan}. */
public interface PlanStep {
  /** Directive that produced this step. */
  DirectivePath path();

  /** Compact human readable form, used in logs and plan inspection. */
  String describe();
}

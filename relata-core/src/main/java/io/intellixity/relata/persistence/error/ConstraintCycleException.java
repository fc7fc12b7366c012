package io.intellixity.relata.persistence.error;

import io.intellixity.relata.persistence.plan.DirectivePath;

/** Mutually required foreign keys with no optional side to break the cycle. Raised at plan time. */
public final class ConstraintCycleException extends RelationException {
  public ConstraintCycleException(String message, DirectivePath path) {
    super(message, path);
  }
}

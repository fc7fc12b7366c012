package io.intellixity.relata.persistence.error;

import io.intellixity.relata.persistence.plan.DirectivePath;

/** Storage reported a unique-constraint conflict outside of connectOrCreate's retry path. */
public final class UniqueConstraintViolationException extends RelationException {
  public UniqueConstraintViolationException(String message, DirectivePath path) {
    super(message, path);
  }
}

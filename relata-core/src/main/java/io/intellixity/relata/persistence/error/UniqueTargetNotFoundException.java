package io.intellixity.relata.persistence.error;

import io.intellixity.relata.persistence.plan.DirectivePath;

/** A connect, update, delete, disconnect or set selector matched no row. */
public final class UniqueTargetNotFoundException extends RelationException {
  public UniqueTargetNotFoundException(String message, DirectivePath path) {
    super(message, path);
  }
}

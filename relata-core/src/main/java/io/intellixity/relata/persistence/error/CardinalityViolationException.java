package io.intellixity.relata.persistence.error;

import io.intellixity.relata.persistence.plan.DirectivePath;

/** Removing or replacing a required single-sided link, or linking a second row into a one-to-one relation. */
public final class CardinalityViolationException extends RelationException {
  public CardinalityViolationException(String message, DirectivePath path) {
    super(message, path);
  }
}

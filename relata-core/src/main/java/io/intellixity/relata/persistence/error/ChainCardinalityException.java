package io.intellixity.relata.persistence.error;

import io.intellixity.relata.persistence.plan.DirectivePath;

/** A fluent chain continues past a list step, or filters a single-valued step. Always raised before any query. */
public final class ChainCardinalityException extends RelationException {
  public ChainCardinalityException(String message, DirectivePath path) {
    super(message, path);
  }
}

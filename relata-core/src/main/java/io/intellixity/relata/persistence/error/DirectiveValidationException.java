package io.intellixity.relata.persistence.error;

import io.intellixity.relata.persistence.plan.DirectivePath;

/** Malformed write tree: unknown fields, directives illegal for the relation's shape, selectors that are not unique constraints. */
public final class DirectiveValidationException extends RelationException {
  public DirectiveValidationException(String message, DirectivePath path) {
    super(message, path);
  }
}

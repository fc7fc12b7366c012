package io.intellixity.relata.persistence.chain;

import io.intellixity.relata.persistence.query.QueryElement;

import java.util.Objects;

/** One relation traversal; {@code filter} applies to the rows of a final list step only. */
public record ChainStep(String relation, QueryElement filter) {
  public ChainStep {
    Objects.requireNonNull(relation, "relation");
  }

  public static ChainStep of(String relation) {
    return new ChainStep(relation, null);
  }
}

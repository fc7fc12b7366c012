package io.intellixity.relata.persistence.plan;

import java.util.Objects;

/** The rows currently reached from {@code parent} through its relation field {@code relation}. */
public record LinkScope(RowRef parent, String relation) {
  public LinkScope {
    Objects.requireNonNull(parent, "parent");
    Objects.requireNonNull(relation, "relation");
  }

  @Override
  public String toString() {
    return parent + "." + relation;
  }
}

package io.intellixity.relata.persistence.query;

import java.util.Objects;

/**
 * Filter expressed through a relation field: "related rows reached through {@code relation} satisfy {@code where}".
 * <p>
 * {@code SOME}/{@code NONE}/{@code EVERY} apply to list relations, {@code IS}/{@code IS_NOT} to single relations.
 * A null {@code where} means "any related row" (list) or "no related row" for {@code IS} ({@code IS_NOT}: "has one").
 */
public record RelationFilter(String relation, Quantifier quantifier, QueryElement where) implements QueryElement {
  public enum Quantifier {
    SOME(true), NONE(true), EVERY(true), IS(false), IS_NOT(false);

    private final boolean list;

    Quantifier(boolean list) { this.list = list; }

    public boolean forList() { return list; }
  }

  public RelationFilter {
    if (relation == null || relation.isBlank()) throw new IllegalArgumentException("relation is required");
    Objects.requireNonNull(quantifier, "quantifier");
  }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) {
    return visitor.visit(this);
  }
}

package io.intellixity.relata.persistence.query;

/** Double dispatch over the filter tree; the relation filter translator rewrites trees through it. */
public interface QueryVisitor<Q> {
  Q visit(Condition condition);
  Q visit(LogicalGroup group);
  Q visit(NotElement not);
  Q visit(RelationFilter relation);
  /** Semi-join produced by relation-filter translation. */
  Q visit(InSubquery subquery);
}

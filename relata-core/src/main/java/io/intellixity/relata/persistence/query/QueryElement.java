package io.intellixity.relata.persistence.query;

/** Node of a filter tree. */
public interface QueryElement {
  <Q> Q accept(QueryVisitor<Q> visitor);
}

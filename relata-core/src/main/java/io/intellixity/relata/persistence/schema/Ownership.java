package io.intellixity.relata.persistence.schema;

/** Which storage row carries the link of a relation. */
public enum Ownership {
  /** The declaring model stores the foreign key. */
  SELF,

  /** The target model stores the foreign key (back side of an owning relation). */
  TARGET,

  /** A join table mediates the link (many-to-many). */
  JOIN_TABLE
}

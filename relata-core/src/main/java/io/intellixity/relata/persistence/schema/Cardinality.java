package io.intellixity.relata.persistence.schema;

/** Shape of a relation as seen from the model that declares the field. */
public enum Cardinality {
  ONE_TO_ONE(false),
  ONE_TO_MANY(true),
  /** Single-valued back side of a {@link #ONE_TO_MANY}. */
  MANY_TO_ONE(false),
  MANY_TO_MANY(true);

  private final boolean list;

  Cardinality(boolean list) {
    this.list = list;
  }

  /** True if the field holds a list of related rows. */
  public boolean isList() {
    return list;
  }
}

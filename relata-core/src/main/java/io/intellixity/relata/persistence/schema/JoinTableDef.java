package io.intellixity.relata.persistence.schema;

/**
 * Join table of a many-to-many relation, seen from the declaring side.
 *
 * @param name join table name
 * @param column column holding the declaring model's primary key
 * @param targetColumn column holding the target model's primary key
 */
public record JoinTableDef(String name, String column, String targetColumn) {
  public JoinTableDef {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("join table name is required");
    if (column == null || column.isBlank()) throw new IllegalArgumentException("join table column is required: " + name);
    if (targetColumn == null || targetColumn.isBlank()) throw new IllegalArgumentException("join table targetColumn is required: " + name);
    if (column.equals(targetColumn)) throw new IllegalArgumentException("join table columns must differ: " + name);
  }

  /** Same table seen from the other side. */
  public JoinTableDef flipped() {
    return new JoinTableDef(name, targetColumn, column);
  }
}

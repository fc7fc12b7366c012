package io.intellixity.relata.persistence.schema;

import java.util.List;

/**
 * Relation field of a model.
 *
 * <p>{@code fields}/{@code references} are only set on the side that owns the foreign key
 * ({@link Ownership#SELF}); the other side resolves them through {@code inverse}.</p>
 */
public record RelationField(
    String name,
    String target,
    Cardinality cardinality,
    Ownership ownership,
    /** Whether this side may exist without the related row. */
    boolean optional,
    List<String> fields,
    List<String> references,
    String inverse,
    JoinTableDef joinTable
) {
  public RelationField {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
    if (target == null || target.isBlank()) throw new IllegalArgumentException("target is required for relation: " + name);
    if (cardinality == null) throw new IllegalArgumentException("cardinality is required for relation: " + name);
    if (ownership == null) throw new IllegalArgumentException("ownership is required for relation: " + name);
    fields = fields == null ? List.of() : List.copyOf(fields);
    references = references == null ? List.of() : List.copyOf(references);
    inverse = (inverse == null || inverse.isBlank()) ? null : inverse;

    switch (ownership) {
      case SELF -> {
        if (cardinality.isList()) throw new IllegalArgumentException("list relation cannot own a foreign key: " + name);
        if (fields.isEmpty() || fields.size() != references.size()) {
          throw new IllegalArgumentException("owning relation needs matching fields/references: " + name);
        }
        if (joinTable != null) throw new IllegalArgumentException("owning relation cannot declare a join table: " + name);
      }
      case TARGET -> {
        if (cardinality == Cardinality.MANY_TO_ONE || cardinality == Cardinality.MANY_TO_MANY) {
          throw new IllegalArgumentException(cardinality + " relation cannot be owned by its target: " + name);
        }
        if (!fields.isEmpty() || !references.isEmpty()) throw new IllegalArgumentException("non-owning relation declares fields: " + name);
        if (inverse == null) throw new IllegalArgumentException("non-owning relation requires an inverse: " + name);
        if (joinTable != null) throw new IllegalArgumentException("non-owning relation cannot declare a join table: " + name);
      }
      case JOIN_TABLE -> {
        if (cardinality != Cardinality.MANY_TO_MANY) throw new IllegalArgumentException("join table requires MANY_TO_MANY: " + name);
        if (joinTable == null) throw new IllegalArgumentException("joinTable is required for relation: " + name);
        if (inverse == null) throw new IllegalArgumentException("many-to-many relation requires an inverse: " + name);
      }
    }
    if (cardinality == Cardinality.MANY_TO_MANY && ownership != Ownership.JOIN_TABLE) {
      throw new IllegalArgumentException("MANY_TO_MANY relation must use a join table: " + name);
    }
  }

  public boolean isList() {
    return cardinality.isList();
  }

  /** Relation whose declaring model stores {@code fields} referencing the target's {@code references}. */
  public static RelationField owning(String name, String target, Cardinality cardinality,
                                     List<String> fields, List<String> references, String inverse, boolean optional) {
    return new RelationField(name, target, cardinality, Ownership.SELF, optional, fields, references, inverse, null);
  }

  /** Back side of an owning relation declared on {@code target} as {@code inverse}. */
  public static RelationField backReference(String name, String target, Cardinality cardinality, String inverse) {
    return new RelationField(name, target, cardinality, Ownership.TARGET, true, null, null, inverse, null);
  }

  public static RelationField manyToMany(String name, String target, JoinTableDef joinTable, String inverse) {
    return new RelationField(name, target, Cardinality.MANY_TO_MANY, Ownership.JOIN_TABLE, true, null, null, inverse, joinTable);
  }
}

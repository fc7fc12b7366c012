package io.intellixity.relata.persistence.schema;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/** Read-only lookup surface over the model catalog. Loaded once, never mutated. */
public interface SchemaRegistry {
  ModelDef model(String model);

  Collection<ModelDef> models();

  /** Relation field of a model; throws if either is unknown. */
  RelationField relation(String model, String field);

  /** Field sets of the primary key and every declared unique constraint. */
  List<List<String>> uniqueConstraints(String model);

  /** True if the selector's field set is exactly a declared unique constraint of the model. */
  boolean isUniqueSelector(String model, UniqueSelector selector);

  /** Physical foreign key of a non-join relation; throws for many-to-many relations. */
  ForeignKeyLink foreignKey(String model, String field);

  /** Join table by name, as declared on either side of a many-to-many relation. */
  Optional<JoinTableDef> joinTable(String name);

  /** The primary key field of a model that must have a single-field key (join tables, batched reads). */
  default String singleKey(String model) {
    List<String> pk = model(model).primaryKey();
    if (pk.size() != 1) throw new IllegalArgumentException("Model '" + model + "' has a composite primary key: " + pk);
    return pk.get(0);
  }
}

package io.intellixity.relata.persistence.schema;

import java.util.*;

/**
 * Map-backed {@link SchemaRegistry}.
 * <p>
 * The catalog is validated once at construction so that planners can rely on it:
 * targets and inverses exist and point back at each other, exactly one side of a foreign key relation owns it,
 * owned fields reference a unique constraint, and join tables agree on both sides.
 */
public final class InMemorySchemaRegistry implements SchemaRegistry {
  private final Map<String, ModelDef> models = new LinkedHashMap<>();
  private final Map<String, ForeignKeyLink> links = new HashMap<>();
  private final Map<String, JoinTableDef> joinTables = new HashMap<>();

  public InMemorySchemaRegistry(List<ModelDef> defs) {
    Objects.requireNonNull(defs, "defs");
    for (ModelDef m : defs) {
      if (models.put(m.name(), m) != null) throw new IllegalArgumentException("Duplicate model: " + m.name());
    }
    for (ModelDef m : models.values()) {
      for (RelationField r : m.relations().values()) validate(m, r);
    }
    for (ModelDef m : models.values()) {
      for (RelationField r : m.relations().values()) {
        if (r.ownership() == Ownership.JOIN_TABLE) {
          if (models.containsKey(r.joinTable().name())) {
            throw new IllegalArgumentException("Join table " + r.joinTable().name() + " clashes with a model name");
          }
          joinTables.putIfAbsent(r.joinTable().name(), r.joinTable());
          continue;
        }
        links.put(key(m.name(), r.name()), link(m, r));
      }
    }
  }

  public static InMemorySchemaRegistry of(ModelDef... defs) {
    return new InMemorySchemaRegistry(List.of(defs));
  }

  @Override
  public ModelDef model(String model) {
    ModelDef m = models.get(model);
    if (m == null) throw new IllegalArgumentException("Unknown model: " + model);
    return m;
  }

  @Override
  public Collection<ModelDef> models() {
    return Collections.unmodifiableCollection(models.values());
  }

  @Override
  public RelationField relation(String model, String field) {
    RelationField r = model(model).relations().get(field);
    if (r == null) throw new IllegalArgumentException("Unknown relation '" + field + "' on model: " + model);
    return r;
  }

  @Override
  public List<List<String>> uniqueConstraints(String model) {
    return model(model).uniqueConstraints();
  }

  @Override
  public boolean isUniqueSelector(String model, UniqueSelector selector) {
    if (selector == null) return false;
    return model(model).isUnique(selector.fields());
  }

  @Override
  public ForeignKeyLink foreignKey(String model, String field) {
    RelationField r = relation(model, field);
    if (r.ownership() == Ownership.JOIN_TABLE) {
      throw new IllegalArgumentException("Relation '" + model + "." + field + "' is mediated by join table " + r.joinTable().name());
    }
    return links.get(key(model, field));
  }

  @Override
  public Optional<JoinTableDef> joinTable(String name) {
    return Optional.ofNullable(joinTables.get(name));
  }

  private ForeignKeyLink link(ModelDef m, RelationField r) {
    if (r.ownership() == Ownership.SELF) {
      boolean nullable = r.fields().stream().allMatch(f -> m.scalar(f).optional());
      return new ForeignKeyLink(m.name(), r.fields(), r.target(), r.references(), nullable, r.cardinality() == Cardinality.ONE_TO_ONE);
    }
    ModelDef owner = model(r.target());
    RelationField inv = owner.relations().get(r.inverse());
    boolean nullable = inv.fields().stream().allMatch(f -> owner.scalar(f).optional());
    return new ForeignKeyLink(owner.name(), inv.fields(), m.name(), inv.references(), nullable, inv.cardinality() == Cardinality.ONE_TO_ONE);
  }

  private void validate(ModelDef m, RelationField r) {
    String where = m.name() + "." + r.name();
    ModelDef target = models.get(r.target());
    if (target == null) throw new IllegalArgumentException("Relation " + where + " targets unknown model: " + r.target());

    RelationField inv = null;
    if (r.inverse() != null) {
      inv = target.relations().get(r.inverse());
      if (inv == null) throw new IllegalArgumentException("Relation " + where + " names unknown inverse: " + r.target() + "." + r.inverse());
      if (!inv.target().equals(m.name()) || !r.name().equals(inv.inverse())) {
        throw new IllegalArgumentException("Relation " + where + " and " + r.target() + "." + r.inverse() + " are not inverses of each other");
      }
    }

    switch (r.ownership()) {
      case SELF -> {
        for (String f : r.fields()) m.scalar(f);
        for (String f : r.references()) target.scalar(f);
        if (!target.isUnique(r.references())) {
          throw new IllegalArgumentException("Relation " + where + " references non-unique fields " + r.references() + " of " + target.name());
        }
        if (r.cardinality() == Cardinality.ONE_TO_ONE && !m.isUnique(r.fields())) {
          throw new IllegalArgumentException("One-to-one relation " + where + " needs a unique constraint on " + r.fields());
        }
        if (inv != null) {
          if (inv.ownership() != Ownership.TARGET) throw new IllegalArgumentException("Both sides of " + where + " own the foreign key");
          Cardinality expected = (r.cardinality() == Cardinality.ONE_TO_ONE) ? Cardinality.ONE_TO_ONE : Cardinality.ONE_TO_MANY;
          if (inv.cardinality() != expected) {
            throw new IllegalArgumentException("Inverse of " + where + " must be " + expected + " but is " + inv.cardinality());
          }
        }
      }
      case TARGET -> {
        if (inv.ownership() != Ownership.SELF) throw new IllegalArgumentException("Neither side of " + where + " owns the foreign key");
      }
      case JOIN_TABLE -> {
        if (inv.ownership() != Ownership.JOIN_TABLE || !inv.joinTable().equals(r.joinTable().flipped())) {
          throw new IllegalArgumentException("Join table of " + where + " does not match its inverse");
        }
        if (m.primaryKey().size() != 1 || target.primaryKey().size() != 1) {
          throw new IllegalArgumentException("Many-to-many relation " + where + " requires single-field primary keys");
        }
      }
    }
  }

  private static String key(String model, String field) {
    return model + "." + field;
  }
}

package io.intellixity.relata.persistence.filter;

import io.intellixity.relata.persistence.query.*;
import io.intellixity.relata.persistence.schema.*;

import java.util.*;

/**
 * Rewrites relation-scoped filters into semi-join predicates on the source model.
 * <p>
 * The result contains only {@link Condition}, {@link LogicalGroup}, {@link NotElement} and {@link InSubquery}
 * nodes, each sub-query expressed against its own source. Scalar properties are validated against the model
 * they are evaluated on.
 * <ul>
 *   <li>source owns the key: {@code fk IN (SELECT ref FROM target WHERE inner)}</li>
 *   <li>target owns the key: {@code ref IN (SELECT fk FROM target WHERE inner)}</li>
 *   <li>join table: {@code pk IN (SELECT a FROM jt WHERE b IN (SELECT pk FROM target WHERE inner))}</li>
 * </ul>
 * {@code NOT IN} forms guard the sub-query with {@code fk IS NOT NULL}; {@code EVERY w} is {@code NONE (NOT w)}.
 */
public final class RelationFilterTranslator {
  private final SchemaRegistry schema;

  public RelationFilterTranslator(SchemaRegistry schema) {
    this.schema = Objects.requireNonNull(schema, "schema");
  }

  /** Translated filter for rows of {@code model}; null stays null. */
  public QueryElement translate(String model, QueryElement filter) {
    if (filter == null) return null;
    return filter.accept(new Visitor(schema.model(model)));
  }

  private final class Visitor implements QueryVisitor<QueryElement> {
    private final ModelDef model;

    Visitor(ModelDef model) {
      this.model = model;
    }

    @Override
    public QueryElement visit(Condition c) {
      if (!model.hasScalar(c.property())) {
        String hint = model.hasRelation(c.property()) ? " (relation fields need some/none/every/is/isNot)" : "";
        throw QueryValidationException.unknownField(c.property(), "model " + model.name() + hint);
      }
      return c;
    }

    @Override
    public QueryElement visit(LogicalGroup g) {
      List<QueryElement> out = new ArrayList<>(g.elements().size());
      for (QueryElement e : g.elements()) out.add(e.accept(this));
      return new LogicalGroup(g.clause(), out);
    }

    @Override
    public QueryElement visit(NotElement n) {
      return new NotElement(n.element().accept(this));
    }

    @Override
    public QueryElement visit(InSubquery s) {
      for (String p : s.properties()) {
        if (!model.hasScalar(p)) throw QueryValidationException.unknownField(p, "model " + model.name());
      }
      return s;
    }

    @Override
    public QueryElement visit(RelationFilter f) {
      RelationField r = model.relations().get(f.relation());
      if (r == null) {
        throw QueryValidationException.unknownRelation(f.relation(), model.name());
      }
      if (f.quantifier().forList() != r.isList()) {
        throw new QueryValidationException("Quantifier " + f.quantifier() + " does not apply to "
            + (r.isList() ? "list" : "single") + " relation " + model.name() + "." + r.name());
      }
      if (f.quantifier() == RelationFilter.Quantifier.EVERY && f.where() == null) {
        throw new QueryValidationException("every on " + model.name() + "." + r.name() + " requires a where filter");
      }
      QueryElement inner = translate(r.target(), f.where());

      return switch (f.quantifier()) {
        case SOME -> exists(r, inner);
        case NONE -> absent(r, inner);
        case EVERY -> absent(r, new NotElement(inner));
        case IS -> f.where() == null ? absent(r, null) : exists(r, inner);
        case IS_NOT -> f.where() == null ? exists(r, null) : absent(r, inner);
      };
    }

    /** At least one related row satisfies {@code inner} (any related row when null). */
    private QueryElement exists(RelationField r, QueryElement inner) {
      switch (r.ownership()) {
        case SELF:
          if (inner == null) return anyNull(r.fields(), false);
          return new InSubquery(r.fields(), InSubquery.Source.model(r.target()), r.references(), inner, false);
        case TARGET: {
          RelationField inv = schema.relation(r.target(), r.inverse());
          return new InSubquery(inv.references(), InSubquery.Source.model(r.target()), inv.fields(), inner, false);
        }
        case JOIN_TABLE:
          return joinSubquery(r, inner, false);
        default:
          throw new IllegalArgumentException("Unsupported ownership: " + r.ownership());
      }
    }

    /** No related row satisfies {@code inner} (no related row at all when null). */
    private QueryElement absent(RelationField r, QueryElement inner) {
      switch (r.ownership()) {
        case SELF:
          if (inner == null) return anyNull(r.fields(), true);
          return QueryFilters.or(anyNull(r.fields(), true),
              new InSubquery(r.fields(), InSubquery.Source.model(r.target()), r.references(), inner, true));
        case TARGET: {
          RelationField inv = schema.relation(r.target(), r.inverse());
          QueryElement guarded = QueryFilters.allOf(inner, notNull(inv.fields()));
          return new InSubquery(inv.references(), InSubquery.Source.model(r.target()), inv.fields(), guarded, true);
        }
        case JOIN_TABLE:
          return joinSubquery(r, inner, true);
        default:
          throw new IllegalArgumentException("Unsupported ownership: " + r.ownership());
      }
    }

    private QueryElement joinSubquery(RelationField r, QueryElement inner, boolean not) {
      JoinTableDef jt = r.joinTable();
      QueryElement joinWhere = null;
      if (inner != null) {
        String targetKey = schema.singleKey(r.target());
        joinWhere = new InSubquery(List.of(jt.targetColumn()), InSubquery.Source.model(r.target()), List.of(targetKey), inner, false);
      }
      return new InSubquery(List.of(schema.singleKey(model.name())), InSubquery.Source.joinTable(jt.name()),
          List.of(jt.column()), joinWhere, not);
    }
  }

  /** {@code nullSide}: some key field is null (no link); otherwise every key field is set. */
  private static QueryElement anyNull(List<String> fields, boolean nullSide) {
    if (nullSide) {
      if (fields.size() == 1) return Condition.isNull(fields.get(0));
      List<QueryElement> out = new ArrayList<>();
      for (String f : fields) out.add(Condition.isNull(f));
      return new LogicalGroup(Clause.OR, out);
    }
    return notNull(fields);
  }

  private static QueryElement notNull(List<String> fields) {
    if (fields.size() == 1) return Condition.isNotNull(fields.get(0));
    List<QueryElement> out = new ArrayList<>();
    for (String f : fields) out.add(Condition.isNotNull(f));
    return new LogicalGroup(Clause.AND, out);
  }
}

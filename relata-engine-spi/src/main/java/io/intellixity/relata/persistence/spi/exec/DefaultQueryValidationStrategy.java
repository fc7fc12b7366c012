package io.intellixity.relata.persistence.spi.exec;

import io.intellixity.relata.persistence.dmlast.*;
import io.intellixity.relata.persistence.query.*;
import io.intellixity.relata.persistence.schema.JoinTableDef;
import io.intellixity.relata.persistence.schema.ModelDef;
import io.intellixity.relata.persistence.schema.SchemaRegistry;

import java.util.Objects;
import java.util.Set;

/**
 * Default, backend-agnostic statement validation.
 * <p>
 * Validates:
 * <ul>
 *   <li>that the table names a model or join table</li>
 *   <li>filter properties, including those of sub-queries against their own source</li>
 *   <li>sort fields, insert/update columns and returning columns</li>
 * </ul>
 * Relation filters must have been translated before they reach storage. Unknown names throw
 * {@link QueryValidationException}.
 */
public final class DefaultQueryValidationStrategy implements QueryValidationStrategy {
  @Override
  public void validate(SchemaRegistry schema, SelectAst select) {
    Objects.requireNonNull(select, "select");
    Source src = source(schema, select.table(), select.joinTable());
    validateElement(schema, src, select.where());
    for (SortField s : select.sort()) src.require(s.field(), "sort");
  }

  @Override
  public void validate(SchemaRegistry schema, DmlAst dml) {
    Objects.requireNonNull(dml, "dml");
    Source src = source(schema, dml.table(), schema.joinTable(dml.table()).isPresent());
    if (dml instanceof InsertAst ins) {
      for (ColumnBind c : ins.columns()) src.require(c.column(), "insert");
      for (String r : ins.returningColumns()) src.require(r, "returning");
    } else if (dml instanceof UpdateAst upd) {
      if (upd.sets().isEmpty()) throw new QueryValidationException("Update of '" + dml.table() + "' sets no columns");
      for (ColumnBind c : upd.sets()) src.require(c.column(), "update");
      validateElement(schema, src, upd.where());
    } else if (dml instanceof DeleteAst del) {
      validateElement(schema, src, del.where());
    } else {
      throw new QueryValidationException("Unsupported DmlAst: " + dml.getClass().getName());
    }
  }

  private static void validateElement(SchemaRegistry schema, Source src, QueryElement el) {
    if (el == null) return;

    if (el instanceof NotElement n) {
      validateElement(schema, src, n.element());
      return;
    }
    if (el instanceof LogicalGroup g) {
      for (QueryElement c : g.elements()) validateElement(schema, src, c);
      return;
    }
    if (el instanceof Condition c) {
      src.require(c.property(), "filter");
      return;
    }
    if (el instanceof InSubquery s) {
      for (String p : s.properties()) src.require(p, "filter");
      Source inner = source(schema, s.source().name(), s.source().joinTable());
      for (String p : s.selected()) inner.require(p, "sub-query");
      validateElement(schema, inner, s.where());
      return;
    }
    if (el instanceof RelationFilter f) {
      throw new QueryValidationException("Relation filter on '" + f.relation() + "' must be translated before execution");
    }

    throw new QueryValidationException("Unsupported QueryElement: " + el.getClass().getName());
  }

  private static Source source(SchemaRegistry schema, String table, boolean joinTable) {
    if (joinTable) {
      JoinTableDef jt = schema.joinTable(table)
          .orElseThrow(() -> new QueryValidationException("Unknown join table '" + table + "'"));
      return new Source(table, null, Set.of(jt.column(), jt.targetColumn()));
    }
    ModelDef m;
    try {
      m = schema.model(table);
    } catch (IllegalArgumentException e) {
      throw new QueryValidationException("Unknown model '" + table + "'", e);
    }
    return new Source(table, m, null);
  }

  private record Source(String name, ModelDef model, Set<String> columns) {
    void require(String field, String usage) {
      if (field == null || field.isBlank()) {
        throw new QueryValidationException("Blank field in " + usage + " for '" + name + "'");
      }
      boolean known = model != null ? model.hasScalar(field) : columns.contains(field);
      if (!known) {
        throw QueryValidationException.unknownField(field, usage + " of " + name);
      }
    }
  }
}

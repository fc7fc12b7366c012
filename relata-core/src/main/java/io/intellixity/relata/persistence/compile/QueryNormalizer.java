package io.intellixity.relata.persistence.compile;

import io.intellixity.relata.persistence.query.*;

import java.util.*;

/**
 * Resolves {@link QueryValues.Param} placeholders against {@link Query#params()} everywhere in a filter tree,
 * relation filters and sub-queries included. Unchanged subtrees are returned as the same instances.
 * <p>
 * Groups that lose every child collapse to null; a group left with one child collapses to that child.
 * NULL semantics (EQ/NE null to IS NULL/IS NOT NULL) stay with the renderers.
 */
public final class QueryNormalizer {

  public QueryElement normalize(Query query) {
    if (query == null) return null;
    return new ParamResolver(query).resolve(query.filter());
  }

  private final class ParamResolver implements QueryVisitor<QueryElement> {
    private final Query scope;

    ParamResolver(Query scope) {
      this.scope = scope;
    }

    QueryElement resolve(QueryElement el) {
      if (el == null) return null;
      // a nested query brings its own params
      if (el instanceof Query q) return normalize(q);
      return el.accept(this);
    }

    @Override
    public QueryElement visit(Condition c) {
      Object v = value(c.value());
      Object lo = value(c.lower());
      Object hi = value(c.upper());
      boolean same = v == c.value() && lo == c.lower() && hi == c.upper();
      return same ? c : c.withValue(v, lo, hi);
    }

    @Override
    public QueryElement visit(LogicalGroup g) {
      List<QueryElement> kept = new ArrayList<>(g.elements().size());
      boolean changed = false;
      for (QueryElement child : g.elements()) {
        QueryElement r = resolve(child);
        changed |= r != child;
        if (r != null) kept.add(r);
      }
      if (!changed) return g;
      if (kept.isEmpty()) return null;
      return kept.size() == 1 ? kept.get(0) : new LogicalGroup(g.clause(), kept);
    }

    @Override
    public QueryElement visit(NotElement n) {
      QueryElement inner = resolve(n.element());
      if (inner == n.element()) return n;
      return inner == null ? null : new NotElement(inner);
    }

    @Override
    public QueryElement visit(RelationFilter f) {
      QueryElement inner = resolve(f.where());
      return inner == f.where() ? f : new RelationFilter(f.relation(), f.quantifier(), inner);
    }

    @Override
    public QueryElement visit(InSubquery s) {
      QueryElement inner = resolve(s.where());
      return inner == s.where() ? s : new InSubquery(s.properties(), s.source(), s.selected(), inner, s.not());
    }

    private Object value(Object v) {
      if (v instanceof QueryValues.Param p) return scope.param(p.name());
      if (!(v instanceof Collection<?> items)) return v;
      List<Object> out = new ArrayList<>(items.size());
      boolean changed = false;
      for (Object x : items) {
        Object r = value(x);
        changed |= r != x;
        out.add(r);
      }
      return changed ? out : v;
    }
  }
}

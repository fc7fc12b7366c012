package io.intellixity.relata.persistence.read;

import io.intellixity.relata.persistence.dmlast.SelectAst;
import io.intellixity.relata.persistence.exec.TransactionExecutor;
import io.intellixity.relata.persistence.exec.TxHandle;
import io.intellixity.relata.persistence.filter.RelationFilterTranslator;
import io.intellixity.relata.persistence.query.*;
import io.intellixity.relata.persistence.read.ReadPlan.IncludePlan;
import io.intellixity.relata.persistence.schema.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Eager loading of related rows, one batched fetch per included relation per level.
 * <p>
 * Rows fetched for a level are reattached to their parents by key equality, so the result shape depends only on
 * the {@link ReadSpec}, never on the order storage returns rows in. Sibling relations of a level may be fetched
 * concurrently through the supplied {@link Executor}; levels run one after another. Reads inside a transaction
 * always run on the calling thread, since a transaction handle may be bound to one connection.
 */
public final class NestedReadResolver {
  private static final Logger log = LoggerFactory.getLogger(NestedReadResolver.class);
  private static final Executor DIRECT = Runnable::run;

  private final SchemaRegistry schema;
  private final TransactionExecutor executor;
  private final RelationFilterTranslator filters;
  private final Executor fetchExecutor;

  public NestedReadResolver(SchemaRegistry schema, TransactionExecutor executor) {
    this(schema, executor, DIRECT);
  }

  public NestedReadResolver(SchemaRegistry schema, TransactionExecutor executor, Executor fetchExecutor) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.fetchExecutor = Objects.requireNonNull(fetchExecutor, "fetchExecutor");
    this.filters = new RelationFilterTranslator(schema);
  }

  /** Validates the read spec against the schema; no storage access. */
  public ReadPlan plan(String model, ReadSpec spec) {
    ModelDef m = schema.model(model);
    List<IncludePlan> out = new ArrayList<>();
    for (var e : (spec == null ? ReadSpec.empty() : spec).includes().entrySet()) {
      RelationField r = m.relations().get(e.getKey());
      if (r == null) {
        String hint = m.hasScalar(e.getKey()) ? " (scalar fields are always returned)" : "";
        throw new QueryValidationException("Unknown relation '" + e.getKey() + "' on model " + model + hint);
      }
      Include inc = e.getValue();
      if (!r.isList() && (inc.where() != null || !inc.orderBy().isEmpty() || inc.offset() != 0 || inc.limit() != null)) {
        throw new QueryValidationException("Filter, order and window only apply to list relations: " + model + "." + r.name());
      }
      ModelDef target = schema.model(r.target());
      for (SortField s : inc.orderBy()) {
        if (!target.hasScalar(s.field())) {
          throw new QueryValidationException("Unknown sort field '" + s.field() + "' on model " + target.name());
        }
      }
      out.add(new IncludePlan(r, filters.translate(r.target(), inc.where()), inc.orderBy(), inc.offset(), inc.limit(),
          plan(r.target(), inc.nested())));
    }
    return new ReadPlan(model, out);
  }

  /**
   * Attaches the planned includes to copies of {@code roots}, in place of relation field names.
   *
   * @param tx transaction to read in, or null
   */
  public List<Map<String, Object>> resolve(TxHandle tx, ReadPlan plan, List<Map<String, Object>> roots) {
    List<Map<String, Object>> out = new ArrayList<>(roots.size());
    for (Map<String, Object> r : roots) out.add(new LinkedHashMap<>(r));
    if (plan.includes().isEmpty() || out.isEmpty()) return out;

    Executor runner = tx == null ? fetchExecutor : DIRECT;
    List<Level> level = List.of(new Level(plan, out));
    int depth = 0;
    while (!level.isEmpty()) {
      depth++;
      List<Level> next = new ArrayList<>();
      List<CompletableFuture<Fetched>> pending = new ArrayList<>();
      for (Level l : level) {
        for (IncludePlan inc : l.plan.includes()) {
          pending.add(CompletableFuture.supplyAsync(() -> fetch(tx, l.plan.model(), inc, l.rows), runner));
        }
      }
      List<Fetched> fetched = new ArrayList<>(pending.size());
      for (CompletableFuture<Fetched> f : pending) fetched.add(join(f));
      // parents are only written once every sibling fetch has read them
      for (Fetched done : fetched) {
        done.attach();
        if (!done.include.nested().includes().isEmpty() && !done.children.isEmpty()) {
          next.add(new Level(done.include.nested(), done.children));
        }
      }
      if (log.isDebugEnabled()) log.debug("relata.read model={} level={} fetches={}", plan.model(), depth, pending.size());
      level = next;
    }
    return out;
  }

  /** Convenience: plan and resolve in one go. */
  public List<Map<String, Object>> resolve(TxHandle tx, String model, ReadSpec spec, List<Map<String, Object>> roots) {
    return resolve(tx, plan(model, spec), roots);
  }

  private record Level(ReadPlan plan, List<Map<String, Object>> rows) {}

  /** Rows of one include with their assignment to parents; attached on the calling thread. */
  private static final class Fetched {
    final IncludePlan include;
    final Map<Map<String, Object>, Object> values = new IdentityHashMap<>();
    final List<Map<String, Object>> children = new ArrayList<>();

    Fetched(IncludePlan include) {
      this.include = include;
    }

    void attach() {
      for (var e : values.entrySet()) e.getKey().put(include.name(), e.getValue());
    }
  }

  private Fetched fetch(TxHandle tx, String parentModel, IncludePlan inc, List<Map<String, Object>> parents) {
    RelationField r = inc.relation();
    return switch (r.ownership()) {
      case SELF -> fetchOwned(tx, inc, parents);
      case TARGET -> fetchBackReferenced(tx, inc, parents);
      case JOIN_TABLE -> fetchJoined(tx, parentModel, inc, parents);
    };
  }

  /** Parent stores the key: each parent gets the row its key points at, or null. */
  private Fetched fetchOwned(TxHandle tx, IncludePlan inc, List<Map<String, Object>> parents) {
    RelationField r = inc.relation();
    Fetched out = new Fetched(inc);
    Set<List<Object>> keys = new LinkedHashSet<>();
    for (Map<String, Object> p : parents) {
      List<Object> k = Values.key(r.fields(), p);
      if (!Values.hasNull(k)) keys.add(k);
    }
    Map<List<Object>, Map<String, Object>> byKey = new HashMap<>();
    if (!keys.isEmpty()) {
      for (Map<String, Object> row : select(tx, r.target(), anyOf(r.references(), keys), inc)) {
        Map<String, Object> copy = new LinkedHashMap<>(row);
        byKey.put(Values.key(r.references(), copy), copy);
        out.children.add(copy);
      }
    }
    for (Map<String, Object> p : parents) out.values.put(p, byKey.get(Values.key(r.fields(), p)));
    return out;
  }

  /** Target stores the key: rows are grouped by their key value, in fetch order. */
  private Fetched fetchBackReferenced(TxHandle tx, IncludePlan inc, List<Map<String, Object>> parents) {
    RelationField r = inc.relation();
    RelationField inv = schema.relation(r.target(), r.inverse());
    Fetched out = new Fetched(inc);
    Set<List<Object>> keys = new LinkedHashSet<>();
    for (Map<String, Object> p : parents) {
      List<Object> k = Values.key(inv.references(), p);
      if (!Values.hasNull(k)) keys.add(k);
    }
    Map<List<Object>, List<Map<String, Object>>> groups = new HashMap<>();
    if (!keys.isEmpty()) {
      QueryElement where = QueryFilters.allOf(anyOf(inv.fields(), keys), inc.where());
      for (Map<String, Object> row : select(tx, r.target(), where, inc)) {
        Map<String, Object> copy = new LinkedHashMap<>(row);
        groups.computeIfAbsent(Values.key(inv.fields(), copy), k -> new ArrayList<>()).add(copy);
      }
    }
    for (Map<String, Object> p : parents) {
      List<Map<String, Object>> g = groups.getOrDefault(Values.key(inv.references(), p), List.of());
      assign(out, p, g, inc);
    }
    return out;
  }

  /** Join table: one fetch of join rows, one fetch of targets, reassembled in target fetch order. */
  private Fetched fetchJoined(TxHandle tx, String parentModel, IncludePlan inc, List<Map<String, Object>> parents) {
    RelationField r = inc.relation();
    JoinTableDef jt = r.joinTable();
    String parentPk = schema.singleKey(parentModel);
    String targetPk = schema.singleKey(r.target());
    Fetched out = new Fetched(inc);

    Set<Object> parentKeys = new LinkedHashSet<>();
    for (Map<String, Object> p : parents) {
      Object k = Values.normalize(p.get(parentPk));
      if (k != null) parentKeys.add(k);
    }
    Map<Object, List<Object>> parentsByTarget = new LinkedHashMap<>();
    if (!parentKeys.isEmpty()) {
      for (Map<String, Object> j : executor.query(tx, SelectAst.joinRows(jt.name(), QueryFilters.in(jt.column(), parentKeys)))) {
        Object t = Values.normalize(j.get(jt.targetColumn()));
        parentsByTarget.computeIfAbsent(t, k -> new ArrayList<>()).add(Values.normalize(j.get(jt.column())));
      }
    }
    Map<Object, List<Map<String, Object>>> groups = new HashMap<>();
    if (!parentsByTarget.isEmpty()) {
      QueryElement where = QueryFilters.allOf(QueryFilters.in(targetPk, parentsByTarget.keySet()), inc.where());
      for (Map<String, Object> row : select(tx, r.target(), where, inc)) {
        Map<String, Object> copy = new LinkedHashMap<>(row);
        out.children.add(copy);
        for (Object parentKey : parentsByTarget.getOrDefault(Values.normalize(copy.get(targetPk)), List.of())) {
          groups.computeIfAbsent(parentKey, k -> new ArrayList<>()).add(copy);
        }
      }
    }
    for (Map<String, Object> p : parents) {
      assign(out, p, groups.getOrDefault(Values.normalize(p.get(parentPk)), List.of()), inc);
    }
    return out;
  }

  private void assign(Fetched out, Map<String, Object> parent, List<Map<String, Object>> group, IncludePlan inc) {
    if (!inc.relation().isList()) {
      Map<String, Object> one = group.isEmpty() ? null : group.get(0);
      if (one != null) out.children.add(one);
      out.values.put(parent, one);
      return;
    }
    int from = Math.min(inc.offset(), group.size());
    int to = inc.limit() == null ? group.size() : Math.min(group.size(), from + inc.limit());
    List<Map<String, Object>> window = new ArrayList<>(group.subList(from, to));
    if (inc.relation().ownership() != Ownership.JOIN_TABLE) out.children.addAll(window);
    out.values.put(parent, window);
  }

  private List<Map<String, Object>> select(TxHandle tx, String model, QueryElement where, IncludePlan inc) {
    return executor.query(tx, new SelectAst(model, false, where, inc.orderBy(), null));
  }

  private static QueryElement anyOf(List<String> fields, Collection<List<Object>> tuples) {
    if (fields.size() == 1) {
      List<Object> vals = new ArrayList<>(tuples.size());
      for (List<Object> t : tuples) vals.add(t.get(0));
      return QueryFilters.in(fields.get(0), vals);
    }
    List<QueryElement> alts = new ArrayList<>(tuples.size());
    for (List<Object> t : tuples) {
      List<QueryElement> eqs = new ArrayList<>(fields.size());
      for (int i = 0; i < fields.size(); i++) eqs.add(QueryFilters.eq(fields.get(i), t.get(i)));
      alts.add(new LogicalGroup(Clause.AND, eqs));
    }
    return new LogicalGroup(Clause.OR, alts);
  }

  private static Fetched join(CompletableFuture<Fetched> f) {
    try {
      return f.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException re) throw re;
      throw e;
    }
  }
}

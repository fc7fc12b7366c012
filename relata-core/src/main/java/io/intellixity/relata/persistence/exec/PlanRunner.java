package io.intellixity.relata.persistence.exec;

import io.intellixity.relata.persistence.compile.Bind;
import io.intellixity.relata.persistence.dmlast.*;
import io.intellixity.relata.persistence.error.*;
import io.intellixity.relata.persistence.plan.*;
import io.intellixity.relata.persistence.query.QueryElement;
import io.intellixity.relata.persistence.query.QueryFilters;
import io.intellixity.relata.persistence.query.Values;
import io.intellixity.relata.persistence.schema.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Executes a {@link WritePlan} inside one caller-owned transaction, strictly in plan order.
 * <p>
 * Symbolic rows are materialized as their steps run. The first failing step aborts the run with a
 * {@link TransactionAbortedException} carrying that step's directive path; rolling back is the caller's job.
 * The only local recovery is connectOrCreate's single retry of a conflicting insert as a lookup.
 */
public final class PlanRunner {
  private static final Logger log = LoggerFactory.getLogger(PlanRunner.class);

  private final SchemaRegistry schema;
  private final TransactionExecutor executor;
  private final LinkFilters links;

  public PlanRunner(SchemaRegistry schema, TransactionExecutor executor) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.links = new LinkFilters(schema);
  }

  /** Runs every step; returns the materialized rows by symbolic reference. */
  public Map<RowRef, Map<String, Object>> run(TxHandle tx, WritePlan plan) {
    Objects.requireNonNull(tx, "tx");
    Run run = new Run(tx);
    long start = System.nanoTime();
    run.steps(plan.steps());
    if (log.isDebugEnabled()) {
      log.debug("relata.plan_done tx={} steps={} rows={} durationMs={}",
          tx.id(), plan.steps().size(), run.rows.size(), (System.nanoTime() - start) / 1_000_000.0);
    }
    return Collections.unmodifiableMap(run.rows);
  }

  private final class Run {
    final TxHandle tx;
    final Map<RowRef, Map<String, Object>> rows = new LinkedHashMap<>();
    DirectivePath at;

    Run(TxHandle tx) {
      this.tx = tx;
    }

    void steps(List<PlanStep> steps) {
      for (PlanStep s : steps) step(s);
    }

    void step(PlanStep s) {
      if (log.isTraceEnabled()) log.trace("relata.plan step={} path={}", s.describe(), s.path());
      DirectivePath outer = at;
      at = s.path();
      try {
        exec(s);
      } catch (TransactionAbortedException e) {
        throw e;
      } catch (RuntimeException e) {
        throw new TransactionAbortedException(s.path(), e);
      } finally {
        at = outer;
      }
    }

    private void exec(PlanStep s) {
      if (s instanceof InsertRow ins) {
        ExecResult r = insert(ins);
        if (r.conflict()) throw conflict(ins.row().model(), r, ins.path());
      } else if (s instanceof LookupRow l) {
        lookup(l);
      } else if (s instanceof UpdateRow u) {
        update(u.row(), u.values());
      } else if (s instanceof PatchForeignKey p) {
        patch(p);
      } else if (s instanceof LinkJoinRow j) {
        linkJoin(j);
      } else if (s instanceof ResolveOrCreate roc) {
        resolveOrCreate(roc);
      } else if (s instanceof UpsertRow u) {
        upsert(u);
      } else if (s instanceof DetachLinked d) {
        detach(d);
      } else if (s instanceof DeleteLinked d) {
        deleteLinked(d);
      } else if (s instanceof ReplaceMembers m) {
        replaceMembers(m);
      } else if (s instanceof UpdateLinkedMany u) {
        updateMany(u);
      } else if (s instanceof DeleteLinkedMany d) {
        deleteMany(d);
      } else {
        throw new IllegalArgumentException("Unsupported plan step: " + s.getClass().getName());
      }
    }

    // --- primitive rows ---

    private ExecResult insert(InsertRow ins) {
      String model = ins.row().model();
      Map<String, Object> values = new LinkedHashMap<>(ins.values());
      for (FkBinding fb : ins.foreignKeys()) {
        List<Object> ref = Values.key(fb.referencedFields(), row(fb.referenced()));
        if (Values.hasNull(ref)) throw new IllegalStateException("Referenced row " + fb.referenced() + " has no value for " + fb.referencedFields());
        for (int i = 0; i < fb.fields().size(); i++) values.put(fb.fields().get(i), ref.get(i));
        if (fb.exclusive()) evictHolders(model, fb.fields(), ref, null, ins.path());
      }
      ModelDef m = schema.model(model);
      List<String> returning = new ArrayList<>();
      for (ScalarField f : m.fields().values()) if (f.autoGenerated() && !values.containsKey(f.name())) returning.add(f.name());

      ExecResult r = executor.execute(tx, new InsertAst(model, columns(m, values), returning));
      if (!r.conflict()) {
        values.putAll(r.firstKeys());
        rows.put(ins.row(), values);
      }
      return r;
    }

    private void lookup(LookupRow l) {
      String model = l.row().model();
      Map<String, Object> found = findLinked(model, l.selector(), l.scope());
      if (found == null) {
        String what = l.selector() == null ? "linked row" : String.valueOf(l.selector());
        throw new UniqueTargetNotFoundException("No " + model + " matches " + what + (l.scope() == null ? "" : " in " + l.scope()), l.path());
      }
      rows.put(l.row(), found);
    }

    private void update(RowRef ref, Map<String, Object> values) {
      if (values.isEmpty()) return;
      Map<String, Object> current = row(ref);
      ModelDef m = schema.model(ref.model());
      write(new UpdateAst(ref.model(), columns(m, values), links.byKey(ref.model(), current)));
      current.putAll(values);
    }

    private void patch(PatchForeignKey p) {
      Map<String, Object> owner = row(p.owner());
      List<Object> ref = Values.key(p.referencedFields(), row(p.referenced()));
      if (p.exclusive()) evictHolders(p.owner().model(), p.fields(), ref, owner, p.path());
      Map<String, Object> values = new LinkedHashMap<>();
      for (int i = 0; i < p.fields().size(); i++) values.put(p.fields().get(i), ref.get(i));
      update(p.owner(), values);
    }

    private void linkJoin(LinkJoinRow j) {
      JoinTableDef jt = j.joinTable();
      Object left = row(j.left()).get(schema.singleKey(j.left().model()));
      Object right = row(j.right()).get(schema.singleKey(j.right().model()));
      QueryElement both = QueryFilters.and(QueryFilters.eq(jt.column(), left), QueryFilters.eq(jt.targetColumn(), right));
      if (!executor.query(tx, SelectAst.joinRows(jt.name(), both)).isEmpty()) return;
      ExecResult r = executor.execute(tx, InsertAst.joinRow(jt.name(),
          new ColumnBind(jt.column(), Bind.of(left, keyType(j.left().model()))),
          new ColumnBind(jt.targetColumn(), Bind.of(right, keyType(j.right().model())))));
      if (r.conflict()) log.debug("relata.plan join row already present table={}", jt.name());
    }

    // --- runtime branches ---

    private void resolveOrCreate(ResolveOrCreate roc) {
      String model = roc.row().model();
      Map<String, Object> found = findOne(model, roc.selector().toFilter());
      if (found != null) {
        rows.put(roc.row(), found);
        return;
      }
      for (PlanStep s : roc.createBranch().steps()) {
        if (s instanceof InsertRow ins && ins.row().equals(roc.row())) {
          ExecResult r;
          try {
            r = insert(ins);
          } catch (RuntimeException e) {
            throw new TransactionAbortedException(ins.path(), e);
          }
          if (!r.conflict()) continue;
          found = findOne(model, roc.selector().toFilter());
          if (found == null) throw new TransactionAbortedException(ins.path(), conflict(model, r, ins.path()));
          log.debug("relata.plan connectOrCreate conflict retried as connect model={} path={}", model, roc.path());
          rows.put(roc.row(), found);
          return;
        }
        step(s);
      }
    }

    private void upsert(UpsertRow u) {
      Map<String, Object> found = findLinked(u.row().model(), u.selector(), u.scope());
      if (found != null) {
        rows.put(u.row(), found);
        steps(u.updateBranch().steps());
      } else {
        steps(u.createBranch().steps());
      }
    }

    // --- linked rows ---

    private void detach(DetachLinked d) {
      Linked l = linked(d.scope(), d.selector(), d.path());
      if (l == null) return;
      switch (l.relation.ownership()) {
        case SELF -> {
          Map<String, Object> nulls = new LinkedHashMap<>();
          for (String f : l.relation.fields()) nulls.put(f, null);
          update(d.scope().parent(), nulls);
        }
        case TARGET -> {
          RelationField inv = schema.relation(l.relation.target(), l.relation.inverse());
          clearForeignKey(l.relation.target(), inv.fields(), l.keys);
        }
        case JOIN_TABLE -> deleteJoinRows(l.relation.joinTable(), rowKey(d.scope().parent()), l.keys);
      }
    }

    private void deleteLinked(DeleteLinked d) {
      Linked l = linked(d.scope(), d.selector(), d.path());
      if (l == null) return;
      if (l.relation.ownership() == Ownership.SELF) {
        Map<String, Object> nulls = new LinkedHashMap<>();
        for (String f : l.relation.fields()) nulls.put(f, null);
        update(d.scope().parent(), nulls);
      }
      deleteRows(l.relation.target(), l.keys);
    }

    private void replaceMembers(ReplaceMembers m) {
      RelationField r = relation(m.scope());
      String target = r.target();
      Set<List<Object>> wanted = new LinkedHashSet<>();
      for (UniqueSelector sel : m.members()) {
        Map<String, Object> row = findOne(target, sel.toFilter());
        if (row == null) throw new UniqueTargetNotFoundException("No " + target + " matches " + sel + " for set", m.path());
        wanted.add(links.key(target, row));
      }
      Set<List<Object>> current = new LinkedHashSet<>();
      Optional<QueryElement> scope = links.linked(m.scope().parent().model(), r, row(m.scope().parent()));
      if (scope.isPresent()) {
        for (Map<String, Object> row : executor.query(tx, SelectAst.of(target, scope.get()))) current.add(links.key(target, row));
      }
      List<List<Object>> stale = new ArrayList<>();
      for (List<Object> k : current) if (!wanted.contains(k)) stale.add(k);
      List<List<Object>> fresh = new ArrayList<>();
      for (List<Object> k : wanted) if (!current.contains(k)) fresh.add(k);

      if (r.ownership() == Ownership.JOIN_TABLE) {
        Object parentKey = rowKey(m.scope().parent());
        deleteJoinRows(r.joinTable(), parentKey, stale);
        for (List<Object> k : fresh) {
          write(InsertAst.joinRow(r.joinTable().name(),
              new ColumnBind(r.joinTable().column(), Bind.of(parentKey, keyType(m.scope().parent().model()))),
              new ColumnBind(r.joinTable().targetColumn(), Bind.of(k.get(0), keyType(target)))));
        }
      } else {
        RelationField inv = schema.relation(target, r.inverse());
        if (!stale.isEmpty() && !schema.foreignKey(target, inv.name()).nullable()) {
          throw new CardinalityViolationException("set on " + m.scope() + " would detach " + stale.size()
              + " row(s) whose " + target + inv.fields() + " is required", m.path());
        }
        clearForeignKey(target, inv.fields(), stale);
        if (!fresh.isEmpty()) {
          List<Object> ref = Values.key(inv.references(), row(m.scope().parent()));
          Map<String, Object> values = new LinkedHashMap<>();
          for (int i = 0; i < inv.fields().size(); i++) values.put(inv.fields().get(i), ref.get(i));
          write(new UpdateAst(target, columns(schema.model(target), values), links.byKeys(target, fresh)));
        }
      }
      log.debug("relata.plan set scope={} detached={} linked={}", m.scope(), stale.size(), fresh.size());
    }

    private void updateMany(UpdateLinkedMany u) {
      RelationField r = relation(u.scope());
      Optional<QueryElement> scope = links.linked(u.scope().parent().model(), r, row(u.scope().parent()));
      if (scope.isEmpty() || u.values().isEmpty()) return;
      write(new UpdateAst(r.target(), columns(schema.model(r.target()), u.values()),
          QueryFilters.allOf(scope.get(), u.filter())));
    }

    private void deleteMany(DeleteLinkedMany d) {
      RelationField r = relation(d.scope());
      Optional<QueryElement> scope = links.linked(d.scope().parent().model(), r, row(d.scope().parent()));
      if (scope.isEmpty()) return;
      List<List<Object>> keys = new ArrayList<>();
      for (Map<String, Object> row : executor.query(tx, SelectAst.of(r.target(), QueryFilters.allOf(scope.get(), d.filter())))) {
        keys.add(links.key(r.target(), row));
      }
      deleteRows(r.target(), keys);
    }

    // --- helpers ---

    private record Linked(RelationField relation, List<List<Object>> keys) {}

    /** Linked rows matching the selector; null (no-op) for an absent single link without selector. */
    private Linked linked(LinkScope scope, UniqueSelector selector, DirectivePath path) {
      RelationField r = relation(scope);
      Optional<QueryElement> link = links.linked(scope.parent().model(), r, row(scope.parent()));
      List<Map<String, Object>> found = link.isEmpty() ? List.of()
          : executor.query(tx, SelectAst.of(r.target(), QueryFilters.allOf(link.get(), selector == null ? null : selector.toFilter())));
      if (found.isEmpty()) {
        if (selector != null) {
          throw new UniqueTargetNotFoundException("No " + r.target() + " linked through " + scope + " matches " + selector, path);
        }
        return null;
      }
      List<List<Object>> keys = new ArrayList<>();
      for (Map<String, Object> row : found) keys.add(links.key(r.target(), row));
      return new Linked(r, keys);
    }

    private Map<String, Object> findLinked(String model, UniqueSelector selector, LinkScope scope) {
      QueryElement where = selector == null ? null : selector.toFilter();
      if (scope != null) {
        Optional<QueryElement> link = links.linked(scope.parent().model(), relation(scope), row(scope.parent()));
        if (link.isEmpty()) return null;
        where = QueryFilters.allOf(link.get(), where);
      }
      return findOne(model, where);
    }

    private Map<String, Object> findOne(String model, QueryElement where) {
      List<Map<String, Object>> found = executor.query(tx, SelectAst.of(model, where));
      return found.isEmpty() ? null : new LinkedHashMap<>(found.get(0));
    }

    /** Detaches other rows holding a one-to-one link to {@code ref}; fails if their key is required. */
    private void evictHolders(String ownerModel, List<String> fields, List<Object> ref, Map<String, Object> keep, DirectivePath path) {
      QueryElement holders = LinkFilters.equalTo(fields, ref);
      List<List<Object>> evict = new ArrayList<>();
      List<Object> keepKey = keep == null ? null : links.key(ownerModel, keep);
      for (Map<String, Object> row : executor.query(tx, SelectAst.of(ownerModel, holders))) {
        List<Object> k = links.key(ownerModel, row);
        if (!k.equals(keepKey)) evict.add(k);
      }
      if (evict.isEmpty()) return;
      ModelDef m = schema.model(ownerModel);
      for (String f : fields) {
        if (!m.scalar(f).optional()) {
          throw new CardinalityViolationException("One-to-one link " + ownerModel + fields + " = " + ref
              + " is already held by a row whose key is required", path);
        }
      }
      clearForeignKey(ownerModel, fields, evict);
    }

    private void clearForeignKey(String model, List<String> fields, List<List<Object>> keys) {
      if (keys.isEmpty()) return;
      Map<String, Object> nulls = new LinkedHashMap<>();
      for (String f : fields) nulls.put(f, null);
      write(new UpdateAst(model, columns(schema.model(model), nulls), links.byKeys(model, keys)));
    }

    /** Deletes rows together with every join row pointing at them. */
    private void deleteRows(String model, List<List<Object>> keys) {
      if (keys.isEmpty()) return;
      ModelDef m = schema.model(model);
      for (RelationField r : m.relations().values()) {
        if (r.ownership() != Ownership.JOIN_TABLE) continue;
        List<Object> pks = new ArrayList<>();
        for (List<Object> k : keys) pks.add(k.get(0));
        write(new DeleteAst(r.joinTable().name(), QueryFilters.in(r.joinTable().column(), pks)));
      }
      write(new DeleteAst(model, links.byKeys(model, keys)));
    }

    private void deleteJoinRows(JoinTableDef jt, Object parentKey, List<List<Object>> targetKeys) {
      if (targetKeys.isEmpty()) return;
      List<Object> targets = new ArrayList<>();
      for (List<Object> k : targetKeys) targets.add(k.get(0));
      write(new DeleteAst(jt.name(),
          QueryFilters.and(QueryFilters.eq(jt.column(), parentKey), QueryFilters.in(jt.targetColumn(), targets))));
    }

    /** Runs an operation whose unique conflict fails the step. */
    private ExecResult write(DmlAst op) {
      ExecResult r = executor.execute(tx, op);
      if (r.conflict()) throw conflict(op.table(), r, at);
      return r;
    }

    private RelationField relation(LinkScope scope) {
      return schema.relation(scope.parent().model(), scope.relation());
    }

    private Map<String, Object> row(RowRef ref) {
      Map<String, Object> r = rows.get(ref);
      if (r == null) throw new IllegalStateException("Row " + ref + " is not materialized yet");
      return r;
    }

    private Object rowKey(RowRef ref) {
      return row(ref).get(schema.singleKey(ref.model()));
    }

    private String keyType(String model) {
      return schema.model(model).scalar(schema.singleKey(model)).userTypeId();
    }
  }

  private static List<ColumnBind> columns(ModelDef m, Map<String, Object> values) {
    List<ColumnBind> out = new ArrayList<>(values.size());
    for (var e : values.entrySet()) out.add(new ColumnBind(e.getKey(), Bind.of(e.getValue(), m.scalar(e.getKey()).userTypeId())));
    return out;
  }

  private static UniqueConstraintViolationException conflict(String model, ExecResult r, DirectivePath path) {
    return new UniqueConstraintViolationException("Unique constraint violated on " + model
        + (r.conflictDetail() == null ? "" : ": " + r.conflictDetail()), path);
  }
}

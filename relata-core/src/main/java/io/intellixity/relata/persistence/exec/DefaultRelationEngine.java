package io.intellixity.relata.persistence.exec;

import io.intellixity.relata.persistence.chain.ChainResolver;
import io.intellixity.relata.persistence.chain.FluentChain;
import io.intellixity.relata.persistence.compile.QueryNormalizer;
import io.intellixity.relata.persistence.dmlast.SelectAst;
import io.intellixity.relata.persistence.error.DirectiveValidationException;
import io.intellixity.relata.persistence.filter.RelationFilterTranslator;
import io.intellixity.relata.persistence.plan.DirectivePath;
import io.intellixity.relata.persistence.plan.RowRef;
import io.intellixity.relata.persistence.plan.WritePlan;
import io.intellixity.relata.persistence.query.*;
import io.intellixity.relata.persistence.read.NestedReadResolver;
import io.intellixity.relata.persistence.read.ReadPlan;
import io.intellixity.relata.persistence.read.ReadSpec;
import io.intellixity.relata.persistence.schema.SchemaRegistry;
import io.intellixity.relata.persistence.schema.UniqueSelector;
import io.intellixity.relata.persistence.write.NestedWritePlanner;
import io.intellixity.relata.persistence.write.WriteData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.Executor;

/**
 * Default {@link RelationEngine}: plans before touching storage, then runs each write in its own transaction.
 * <p>
 * A write is begin, run plan, re-read root (with includes), commit. Any failure after begin rolls the
 * transaction back and is rethrown unchanged. Reads run without a transaction.
 */
public final class DefaultRelationEngine implements RelationEngine {
  private static final Logger log = LoggerFactory.getLogger(DefaultRelationEngine.class);

  private final SchemaRegistry schema;
  private final TransactionExecutor executor;
  private final NestedWritePlanner planner;
  private final PlanRunner runner;
  private final NestedReadResolver reads;
  private final ChainResolver chains;
  private final RelationFilterTranslator filters;
  private final QueryNormalizer normalizer = new QueryNormalizer();

  public DefaultRelationEngine(SchemaRegistry schema, TransactionExecutor executor) {
    this(schema, executor, Runnable::run);
  }

  /** @param fetchExecutor runs sibling include fetches of one level */
  public DefaultRelationEngine(SchemaRegistry schema, TransactionExecutor executor, Executor fetchExecutor) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.planner = new NestedWritePlanner(schema);
    this.runner = new PlanRunner(schema, executor);
    this.reads = new NestedReadResolver(schema, executor, fetchExecutor);
    this.chains = new ChainResolver(schema, executor);
    this.filters = new RelationFilterTranslator(schema);
  }

  public SchemaRegistry schema() {
    return schema;
  }

  @Override
  public Map<String, Object> create(String model, WriteData data, ReadSpec include) {
    WritePlan plan = planner.planCreate(model, data);
    return write("create", plan, reads.plan(model, include));
  }

  @Override
  public Map<String, Object> update(String model, UniqueSelector selector, WriteData data, ReadSpec include) {
    WritePlan plan = planner.planUpdate(model, selector, data);
    return write("update", plan, reads.plan(model, include));
  }

  @Override
  public Map<String, Object> findUnique(String model, UniqueSelector selector, ReadSpec include) {
    if (!schema.isUniqueSelector(model, selector)) {
      throw new DirectiveValidationException("Selector " + (selector == null ? null : selector.fields())
          + " is not a unique constraint of " + model, DirectivePath.root(model));
    }
    ReadPlan readPlan = reads.plan(model, include);
    List<Map<String, Object>> rows = executor.query(null, SelectAst.of(model, selector.toFilter()));
    if (rows.isEmpty()) return null;
    return reads.resolve(null, readPlan, List.of(rows.get(0))).get(0);
  }

  @Override
  public List<Map<String, Object>> findMany(String model, Query query, ReadSpec include) {
    ReadPlan readPlan = reads.plan(model, include);
    Query q = query == null ? new Query() : query;
    for (SortField s : q.sort()) {
      if (!schema.model(model).hasScalar(s.field())) throw new QueryValidationException("Unknown sort field '" + s.field() + "' on model " + model);
    }
    QueryElement where = filters.translate(model, normalizer.normalize(q));
    List<Map<String, Object>> rows = executor.query(null, new SelectAst(model, false, where, q.sort(), q.page()));
    return reads.resolve(null, readPlan, rows);
  }

  @Override
  public long count(String model, QueryElement filter) {
    return executor.query(null, SelectAst.of(model, filters.translate(model, filter))).size();
  }

  @Override
  public FluentChain chain(String model, UniqueSelector root) {
    schema.model(model);
    return new FluentChain(chains, model, root);
  }

  @Override
  public WritePlan planCreate(String model, WriteData data) {
    return planner.planCreate(model, data);
  }

  @Override
  public WritePlan planUpdate(String model, UniqueSelector selector, WriteData data) {
    return planner.planUpdate(model, selector, data);
  }

  private Map<String, Object> write(String op, WritePlan plan, ReadPlan include) {
    long start = System.nanoTime();
    TxHandle tx = executor.begin();
    try {
      Map<RowRef, Map<String, Object>> rows = runner.run(tx, plan);
      Map<String, Object> root = rows.get(plan.root());
      List<Map<String, Object>> reread = executor.query(tx, SelectAst.of(plan.root().model(),
          keyFilter(plan.root().model(), root)));
      if (reread.isEmpty()) throw new IllegalStateException("Root row " + plan.root() + " vanished before commit");
      Map<String, Object> result = reads.resolve(tx, include, List.of(reread.get(0))).get(0);
      executor.commit(tx);
      if (log.isDebugEnabled()) {
        log.debug("relata.write op={} model={} tx={} steps={} durationMs={}",
            op, plan.root().model(), tx.id(), plan.steps().size(), (System.nanoTime() - start) / 1_000_000.0);
      }
      return result;
    } catch (RuntimeException e) {
      try {
        executor.rollback(tx);
      } catch (RuntimeException rollbackFailure) {
        e.addSuppressed(rollbackFailure);
      }
      log.debug("relata.write op={} model={} tx={} rolledBack cause={}", op, plan.root().model(), tx.id(), e.toString());
      throw e;
    }
  }

  private QueryElement keyFilter(String model, Map<String, Object> row) {
    QueryElement out = null;
    for (String f : schema.model(model).primaryKey()) out = QueryFilters.allOf(out, QueryFilters.eq(f, row.get(f)));
    return out;
  }
}

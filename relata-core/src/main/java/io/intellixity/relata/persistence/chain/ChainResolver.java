package io.intellixity.relata.persistence.chain;

import io.intellixity.relata.persistence.compile.QueryNormalizer;
import io.intellixity.relata.persistence.dmlast.SelectAst;
import io.intellixity.relata.persistence.error.ChainCardinalityException;
import io.intellixity.relata.persistence.error.DirectiveValidationException;
import io.intellixity.relata.persistence.exec.TransactionExecutor;
import io.intellixity.relata.persistence.exec.TxHandle;
import io.intellixity.relata.persistence.filter.RelationFilterTranslator;
import io.intellixity.relata.persistence.plan.DirectivePath;
import io.intellixity.relata.persistence.query.*;
import io.intellixity.relata.persistence.schema.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Validates relation-traversal chains and compiles them into one or two sequential queries.
 * <p>
 * The anchor starts single (the root locator addresses at most one row). A list step turns it into many, after
 * which no step may follow. The final query walks the chain backwards through inverse relations, ending in a
 * condition on the root key that is bound once the root row is known.
 */
public final class ChainResolver {
  private static final Logger log = LoggerFactory.getLogger(ChainResolver.class);
  static final String ROOT_KEY_PARAM = "chainRoot.";

  private final SchemaRegistry schema;
  private final TransactionExecutor executor;
  private final RelationFilterTranslator filters;
  private final QueryNormalizer normalizer = new QueryNormalizer();

  public ChainResolver(SchemaRegistry schema, TransactionExecutor executor) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.filters = new RelationFilterTranslator(schema);
  }

  public SchemaRegistry schema() {
    return schema;
  }

  /**
   * Checks that {@code next} may follow {@code previous} (all steps already accepted) and returns the model it
   * lands on. Cardinality is checked before the relation name is resolved.
   */
  public String checkStep(String rootModel, List<ChainStep> previous, ChainStep next) {
    String model = rootModel;
    List<String> segments = new ArrayList<>(List.of(rootModel));
    for (ChainStep s : previous) {
      segments.add(s.relation());
      RelationField r = schema.relation(model, s.relation());
      if (r.isList()) {
        segments.add(next.relation());
        throw new ChainCardinalityException("Cannot traverse '" + next.relation() + "' after list relation "
            + model + "." + r.name(), new DirectivePath(segments));
      }
      model = r.target();
    }
    segments.add(next.relation());
    DirectivePath path = new DirectivePath(segments);
    ModelDef m = schema.model(model);
    RelationField r = m.relations().get(next.relation());
    if (r == null) throw QueryValidationException.unknownRelation(next.relation(), model);
    if (next.filter() != null && !r.isList()) {
      throw new ChainCardinalityException("Filter on single relation " + model + "." + r.name(), path);
    }
    if (r.inverse() == null) {
      throw new QueryValidationException("Chain step " + model + "." + r.name() + " needs an inverse relation");
    }
    return r.target();
  }

  /** Validates the whole chain and compiles it; no storage access. */
  public ChainPlan plan(String rootModel, UniqueSelector root, List<ChainStep> steps) {
    Objects.requireNonNull(root, "root");
    if (!schema.isUniqueSelector(rootModel, root)) {
      throw new DirectiveValidationException("Selector " + root.fields() + " is not a unique constraint of " + rootModel,
          DirectivePath.root(rootModel));
    }
    List<ChainStep> accepted = new ArrayList<>();
    List<String> models = new ArrayList<>(List.of(rootModel));
    for (ChainStep s : steps) {
      models.add(checkStep(rootModel, accepted, s));
      accepted.add(s);
    }

    List<String> keyFields = schema.model(rootModel).primaryKey();
    List<String> keyParams = new ArrayList<>();
    for (String f : keyFields) keyParams.add(ROOT_KEY_PARAM + f);
    if (accepted.isEmpty()) {
      return new ChainPlan(rootModel, root.toFilter(), accepted, rootModel, false, null, keyFields, keyParams);
    }

    // Backwards: a predicate on models[i] selecting rows reachable from the root.
    QueryElement back = null;
    for (int i = 0; i < keyFields.size(); i++) {
      back = QueryFilters.allOf(back, QueryFilters.eq(keyFields.get(i), QueryValues.param(keyParams.get(i))));
    }
    for (int i = 0; i < accepted.size(); i++) {
      RelationField r = schema.relation(models.get(i), accepted.get(i).relation());
      RelationField inv = schema.relation(r.target(), r.inverse());
      back = new RelationFilter(inv.name(), inv.isList() ? RelationFilter.Quantifier.SOME : RelationFilter.Quantifier.IS, back);
    }
    String target = models.get(models.size() - 1);
    ChainStep last = accepted.get(accepted.size() - 1);
    QueryElement where = filters.translate(target, QueryFilters.allOf(back, last.filter()));
    boolean list = schema.relation(models.get(models.size() - 2), last.relation()).isList();
    return new ChainPlan(rootModel, root.toFilter(), accepted, target, list, Query.of(where), keyFields, keyParams);
  }

  /**
   * Runs the plan: the root row for an empty chain, otherwise the final relation's rows.
   * An unknown root yields no rows.
   */
  public List<Map<String, Object>> fetch(TxHandle tx, ChainPlan plan) {
    List<Map<String, Object>> roots = executor.query(tx, SelectAst.of(plan.rootModel(), plan.rootQuery()));
    if (plan.steps().isEmpty() || roots.isEmpty()) return roots.isEmpty() ? List.of() : List.of(roots.get(0));

    Query q = Query.of(plan.finalQuery().filter());
    Map<String, Object> root = roots.get(0);
    for (int i = 0; i < plan.rootKeyFields().size(); i++) q.withParam(plan.rootKeyParams().get(i), root.get(plan.rootKeyFields().get(i)));
    List<Map<String, Object>> rows = executor.query(tx, SelectAst.of(plan.targetModel(), normalizer.normalize(q)));
    if (log.isDebugEnabled()) {
      log.debug("relata.chain root={} steps={} target={} rows={}", plan.rootModel(), plan.steps().size(), plan.targetModel(), rows.size());
    }
    return rows;
  }
}

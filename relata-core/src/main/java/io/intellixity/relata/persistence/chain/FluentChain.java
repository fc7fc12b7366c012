package io.intellixity.relata.persistence.chain;

import io.intellixity.relata.persistence.error.ChainCardinalityException;
import io.intellixity.relata.persistence.plan.DirectivePath;
import io.intellixity.relata.persistence.query.QueryElement;
import io.intellixity.relata.persistence.schema.UniqueSelector;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable fluent traversal from a single-row locator, e.g.
 * {@code engine.chain("User", UniqueSelector.of("email", "a@x.io")).to("profile").one()}.
 * <p>
 * Every {@link #to} call is validated on the spot, so an illegal chain fails before any query runs.
 * Reads run outside a transaction.
 */
public final class FluentChain {
  private final ChainResolver resolver;
  private final String rootModel;
  private final UniqueSelector root;
  private final List<ChainStep> steps;

  public FluentChain(ChainResolver resolver, String rootModel, UniqueSelector root) {
    this(resolver, rootModel, root, List.of());
  }

  private FluentChain(ChainResolver resolver, String rootModel, UniqueSelector root, List<ChainStep> steps) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.rootModel = Objects.requireNonNull(rootModel, "rootModel");
    this.root = Objects.requireNonNull(root, "root");
    this.steps = steps;
  }

  public FluentChain to(String relation) {
    return to(relation, null);
  }

  /** Traverses {@code relation}; a filter is only legal on a final list relation. */
  public FluentChain to(String relation, QueryElement filter) {
    ChainStep next = new ChainStep(relation, filter);
    resolver.checkStep(rootModel, steps, next);
    List<ChainStep> more = new ArrayList<>(steps);
    more.add(next);
    return new FluentChain(resolver, rootModel, root, List.copyOf(more));
  }

  public List<ChainStep> steps() {
    return steps;
  }

  public ChainPlan plan() {
    return resolver.plan(rootModel, root, steps);
  }

  /** Row reached by a chain of single steps, or null. */
  public Map<String, Object> one() {
    ChainPlan plan = plan();
    if (plan.list()) {
      throw new ChainCardinalityException("one() on a chain ending in list relation " + plan.targetModel(), path());
    }
    List<Map<String, Object>> rows = resolver.fetch(null, plan);
    return rows.isEmpty() ? null : rows.get(0);
  }

  /** Rows of the final relation in storage order; empty when the root does not exist. */
  public List<Map<String, Object>> many() {
    return resolver.fetch(null, plan());
  }

  private DirectivePath path() {
    List<String> segments = new ArrayList<>(List.of(rootModel));
    for (ChainStep s : steps) segments.add(s.relation());
    return new DirectivePath(segments);
  }
}

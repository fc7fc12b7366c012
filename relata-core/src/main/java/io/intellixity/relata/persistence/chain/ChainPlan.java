package io.intellixity.relata.persistence.chain;

import io.intellixity.relata.persistence.query.Query;
import io.intellixity.relata.persistence.query.QueryElement;

import java.util.List;

/**
 * Compiled fluent chain.
 * <p>
 * {@code rootQuery} resolves the root locator. For a non-empty chain, {@code finalQuery} selects rows of
 * {@code targetModel}; its filter refers to the root row's key through the named params in {@code rootKeyParams}
 * (param name per root key field), bound after the first query ran. The two queries are not atomic.
 *
 * @param list the final step is a list relation
 */
public record ChainPlan(
    String rootModel,
    QueryElement rootQuery,
    List<ChainStep> steps,
    String targetModel,
    boolean list,
    Query finalQuery,
    List<String> rootKeyFields,
    List<String> rootKeyParams
) {
  public ChainPlan {
    steps = List.copyOf(steps);
    rootKeyFields = List.copyOf(rootKeyFields);
    rootKeyParams = List.copyOf(rootKeyParams);
  }

  /** Queries issued when the plan runs: one for a bare root locator, otherwise two. */
  public int queryCount() {
    return steps.isEmpty() ? 1 : 2;
  }
}

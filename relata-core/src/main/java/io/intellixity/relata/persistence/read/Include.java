package io.intellixity.relata.persistence.read;

import io.intellixity.relata.persistence.query.QueryElement;
import io.intellixity.relata.persistence.query.SortField;

import java.util.List;

/**
 * One included relation: nested includes, plus filter, order and per-parent window for list relations.
 *
 * @param limit rows kept per parent after grouping; null for all
 */
public record Include(ReadSpec nested, QueryElement where, List<SortField> orderBy, int offset, Integer limit) {
  public Include {
    nested = nested == null ? ReadSpec.empty() : nested;
    orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
    if (limit != null && limit <= 0) throw new IllegalArgumentException("limit must be > 0");
  }

  public static Include all() {
    return new Include(ReadSpec.empty(), null, List.of(), 0, null);
  }

  public static Include of(ReadSpec nested) {
    return new Include(nested, null, List.of(), 0, null);
  }

  public Include where(QueryElement where) {
    return new Include(nested, where, orderBy, offset, limit);
  }

  public Include orderBy(SortField... sort) {
    return new Include(nested, where, List.of(sort), offset, limit);
  }

  public Include window(int offset, Integer limit) {
    return new Include(nested, where, orderBy, offset, limit);
  }
}

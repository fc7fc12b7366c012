package io.intellixity.relata.persistence.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.*;

/**
 * Filter, sort and page for one model. Named params are resolved against {@link #params()} by the
 * normalizer before a query reaches an executor.
 */
@JsonDeserialize(using = QueryJsonDeserializer.class)
public final class Query implements QueryElement {
  private QueryElement filter;
  private Page page;
  private List<SortField> sort = new ArrayList<>();
  private final Map<String, Object> params = new LinkedHashMap<>();

  public Query() {}

  public static Query of(QueryElement filter) {
    return new Query().withFilter(filter);
  }

  public QueryElement filter() { return filter; }
  public Page page() { return page; }
  public List<SortField> sort() { return sort; }
  public Map<String, Object> params() { return params; }

  public Query withFilter(QueryElement filter) { this.filter = filter; return this; }
  public Query withPage(Page page) { this.page = page; return this; }
  public Query withPage(int offset, int limit) { return withPage(new OffsetPage(offset, limit)); }
  public Query withSort(List<SortField> sort) { this.sort = new ArrayList<>(sort == null ? List.of() : sort); return this; }
  public Query sortedBy(SortField... fields) { return withSort(Arrays.asList(fields)); }

  public Query withParams(Map<String, Object> params) {
    this.params.clear();
    if (params != null) this.params.putAll(params);
    return this;
  }

  public Query withParam(String name, Object value) {
    params.put(Objects.requireNonNull(name, "name"), value);
    return this;
  }

  /** Bound value of {@code name}; a param bound to null is present. */
  public Object param(String name) {
    if (!params.containsKey(name)) throw new IllegalArgumentException("Missing query param: " + name);
    return params.get(name);
  }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) {
    return filter == null ? null : filter.accept(visitor);
  }
}

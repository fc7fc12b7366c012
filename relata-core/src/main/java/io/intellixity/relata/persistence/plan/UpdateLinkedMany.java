package io.intellixity.relata.persistence.plan;

import io.intellixity.relata.persistence.query.QueryElement;

import java.util.*;

public record UpdateLinkedMany(LinkScope scope, QueryElement filter, Map<String, Object> values, DirectivePath path) implements PlanStep {
  public UpdateLinkedMany {
    values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  @Override
  public String describe() {
    return "updateMany " + scope + " " + values.keySet() + (filter == null ? "" : " where " + filter);
  }
}

package io.intellixity.relata.persistence.exec;

import io.intellixity.relata.persistence.chain.FluentChain;
import io.intellixity.relata.persistence.plan.WritePlan;
import io.intellixity.relata.persistence.query.Query;
import io.intellixity.relata.persistence.query.QueryElement;
import io.intellixity.relata.persistence.read.ReadSpec;
import io.intellixity.relata.persistence.schema.UniqueSelector;
import io.intellixity.relata.persistence.write.WriteData;

import java.util.List;
import java.util.Map;

/**
 * Entry point over one schema and one {@link TransactionExecutor}. Rows are field -> value maps; included
 * relations appear under their relation field names.
 */
public interface RelationEngine {
  /** Nested create in one transaction; returns the created root row re-read with {@code include}. */
  Map<String, Object> create(String model, WriteData data, ReadSpec include);

  default Map<String, Object> create(String model, WriteData data) {
    return create(model, data, ReadSpec.empty());
  }

  /** Nested update of the row addressed by {@code selector}, in one transaction. */
  Map<String, Object> update(String model, UniqueSelector selector, WriteData data, ReadSpec include);

  default Map<String, Object> update(String model, UniqueSelector selector, WriteData data) {
    return update(model, selector, data, ReadSpec.empty());
  }

  /** The row addressed by {@code selector}, or null. */
  Map<String, Object> findUnique(String model, UniqueSelector selector, ReadSpec include);

  List<Map<String, Object>> findMany(String model, Query query, ReadSpec include);

  long count(String model, QueryElement filter);

  FluentChain chain(String model, UniqueSelector root);

  /** Plan of a nested create, for inspection; nothing is executed. */
  WritePlan planCreate(String model, WriteData data);

  WritePlan planUpdate(String model, UniqueSelector selector, WriteData data);
}

package io.intellixity.relata.examples.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.relata.persistence.chain.FluentChain;
import io.intellixity.relata.persistence.exec.RelationEngine;
import io.intellixity.relata.persistence.plan.DirectivePath;
import io.intellixity.relata.persistence.query.Query;
import io.intellixity.relata.persistence.query.QueryElement;
import io.intellixity.relata.persistence.query.QueryJsonDeserializer;
import io.intellixity.relata.persistence.read.ReadSpecJsonParser;
import io.intellixity.relata.persistence.schema.UniqueSelector;
import io.intellixity.relata.persistence.write.WriteDataJsonParser;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/** Turns wire-shaped JSON into engine calls for any model of the loaded schema. */
@Service
public final class RelationService {
  private final RelationEngine engine;
  private final WriteDataJsonParser writes;
  private final ReadSpecJsonParser reads;
  private final ObjectMapper mapper;

  public RelationService(RelationEngine engine, WriteDataJsonParser writes, ReadSpecJsonParser reads, ObjectMapper mapper) {
    this.engine = engine;
    this.writes = writes;
    this.reads = reads;
    this.mapper = mapper;
  }

  public record ChainHop(String relation, JsonNode where) {}

  public Map<String, Object> create(String model, JsonNode data, JsonNode include) {
    return engine.create(model, writes.parse(model, data), reads.parse(include));
  }

  public Map<String, Object> update(String model, JsonNode where, JsonNode data, JsonNode include) {
    return engine.update(model, selector(model, where), writes.parse(model, data), reads.parse(include));
  }

  public Map<String, Object> findUnique(String model, JsonNode where, JsonNode include) {
    return engine.findUnique(model, selector(model, where), reads.parse(include));
  }

  public List<Map<String, Object>> findMany(String model, Query query, JsonNode include) {
    Query q = (query == null) ? new Query() : query;
    return engine.findMany(model, q, reads.parse(include));
  }

  public long count(String model, Query query) {
    return engine.count(model, query == null ? null : query.filter());
  }

  /** Follows {@code hops} from the row addressed by {@code root}; a single-valued chain yields at most one row. */
  public List<Map<String, Object>> chain(String model, JsonNode root, List<ChainHop> hops, boolean many) {
    FluentChain chain = engine.chain(model, selector(model, root));
    for (ChainHop hop : hops == null ? List.<ChainHop>of() : hops) {
      chain = chain.to(hop.relation(), filter(hop.where()));
    }
    if (many) return chain.many();
    Map<String, Object> one = chain.one();
    return one == null ? List.of() : List.of(one);
  }

  public List<String> planCreate(String model, JsonNode data) {
    return engine.planCreate(model, writes.parse(model, data)).describeSteps();
  }

  public List<String> planUpdate(String model, JsonNode where, JsonNode data) {
    return engine.planUpdate(model, selector(model, where), writes.parse(model, data)).describeSteps();
  }

  private UniqueSelector selector(String model, JsonNode where) {
    return writes.parseSelector(where, DirectivePath.root(model));
  }

  private QueryElement filter(JsonNode where) {
    try {
      return QueryJsonDeserializer.parseFilter(where, mapper);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}

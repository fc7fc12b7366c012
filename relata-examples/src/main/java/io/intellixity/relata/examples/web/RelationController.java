package io.intellixity.relata.examples.web;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.relata.examples.service.RelationService;
import io.intellixity.relata.persistence.query.Query;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/models/{model}")
public final class RelationController {
  private final RelationService relations;

  public RelationController(RelationService relations) {
    this.relations = relations;
  }

  public record CreateRequest(JsonNode data, JsonNode include) {}

  public record UpdateRequest(JsonNode where, JsonNode data, JsonNode include) {}

  public record FindUniqueRequest(JsonNode where, JsonNode include) {}

  public record FindManyRequest(Query query, JsonNode include) {}

  public record ChainRequest(JsonNode root, List<RelationService.ChainHop> steps, boolean many) {}

  @PostMapping
  public ResponseEntity<Map<String, Object>> create(@PathVariable("model") String model, @RequestBody CreateRequest req) {
    return ResponseEntity.status(HttpStatus.CREATED).body(relations.create(model, req.data(), req.include()));
  }

  @PatchMapping
  public Map<String, Object> update(@PathVariable("model") String model, @RequestBody UpdateRequest req) {
    return relations.update(model, req.where(), req.data(), req.include());
  }

  @PostMapping("/find-unique")
  public ResponseEntity<Map<String, Object>> findUnique(@PathVariable("model") String model, @RequestBody FindUniqueRequest req) {
    Map<String, Object> row = relations.findUnique(model, req.where(), req.include());
    return (row == null) ? ResponseEntity.notFound().build() : ResponseEntity.ok(row);
  }

  @PostMapping("/search")
  public List<Map<String, Object>> search(@PathVariable("model") String model, @RequestBody(required = false) FindManyRequest req) {
    return (req == null) ? relations.findMany(model, null, null) : relations.findMany(model, req.query(), req.include());
  }

  @PostMapping("/count")
  public long count(@PathVariable("model") String model, @RequestBody(required = false) Query query) {
    return relations.count(model, query);
  }

  @PostMapping("/chain")
  public List<Map<String, Object>> chain(@PathVariable("model") String model, @RequestBody ChainRequest req) {
    return relations.chain(model, req.root(), req.steps(), req.many());
  }

  @PostMapping("/plan")
  public List<String> planCreate(@PathVariable("model") String model, @RequestBody CreateRequest req) {
    return relations.planCreate(model, req.data());
  }

  @PatchMapping("/plan")
  public List<String> planUpdate(@PathVariable("model") String model, @RequestBody UpdateRequest req) {
    return relations.planUpdate(model, req.where(), req.data());
  }
}

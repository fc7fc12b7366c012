package io.intellixity.relata.persistence.exec;

import io.intellixity.relata.persistence.dmlast.DmlAst;
import io.intellixity.relata.persistence.dmlast.InsertAst;
import io.intellixity.relata.persistence.dmlast.SelectAst;
import io.intellixity.relata.persistence.error.DirectiveValidationException;
import io.intellixity.relata.persistence.error.TransactionAbortedException;
import io.intellixity.relata.persistence.error.UniqueTargetNotFoundException;
import io.intellixity.relata.persistence.query.InSubquery;
import io.intellixity.relata.persistence.query.Query;
import io.intellixity.relata.persistence.query.QueryValidationException;
import io.intellixity.relata.persistence.query.SortField;
import io.intellixity.relata.persistence.read.ReadSpec;
import io.intellixity.relata.persistence.schema.SchemaRegistry;
import io.intellixity.relata.persistence.schema.UniqueSelector;
import io.intellixity.relata.persistence.schema.yaml.YamlSchemaLoader;
import io.intellixity.relata.persistence.write.WriteData;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.function.Function;

import static io.intellixity.relata.persistence.query.QueryFilters.some;
import static org.junit.jupiter.api.Assertions.*;

final class DefaultRelationEngineTest {
  private static final SchemaRegistry SCHEMA = new YamlSchemaLoader().registryFromResource("schema/blog.yml");

  private final ScriptedExecutor executor = new ScriptedExecutor();
  private final DefaultRelationEngine engine = new DefaultRelationEngine(SCHEMA, executor);

  @Test
  void create_runsPlanRereadsRootAndCommits() {
    executor.onQuery = s -> List.of(Map.of("id", 7L, "email", "a@x.io"));

    Map<String, Object> user = engine.create("User", WriteData.of(Map.of("email", "a@x.io")));

    assertEquals(7L, user.get("id"));
    assertEquals(List.of("begin", "execute:User", "query:User", "commit"), executor.calls);
    InsertAst insert = (InsertAst) executor.executed.get(0);
    assertEquals(List.of("id"), insert.returningColumns());
  }

  @Test
  void invalidWrite_failsBeforeBegin() {
    assertThrows(DirectiveValidationException.class,
        () -> engine.create("User", WriteData.of(Map.of("email", "a@x.io", "nickname", "x"))));
    assertTrue(executor.calls.isEmpty());
  }

  @Test
  void failingStep_rollsBackAndCarriesPath() {
    executor.onExecute = op -> {
      throw new IllegalStateException("disk full");
    };

    TransactionAbortedException e = assertThrows(TransactionAbortedException.class,
        () -> engine.create("User", WriteData.of(Map.of("email", "a@x.io"))));

    assertEquals("User", e.path().toString());
    assertEquals("disk full", e.getCause().getMessage());
    assertEquals(List.of("begin", "execute:User", "rollback"), executor.calls);
  }

  @Test
  void failingRollback_isSuppressedIntoOriginalError() {
    executor.onExecute = op -> {
      throw new IllegalStateException("disk full");
    };
    executor.rollbackFailure = new IllegalStateException("connection lost");

    TransactionAbortedException e = assertThrows(TransactionAbortedException.class,
        () -> engine.create("User", WriteData.of(Map.of("email", "a@x.io"))));

    assertEquals(1, e.getSuppressed().length);
    assertEquals("connection lost", e.getSuppressed()[0].getMessage());
  }

  @Test
  void missingRootOnUpdate_isAbortedAsNotFound() {
    executor.onQuery = s -> List.of();

    TransactionAbortedException e = assertThrows(TransactionAbortedException.class,
        () -> engine.update("User", UniqueSelector.of("email", "a@x.io"), WriteData.of(Map.of("name", "A"))));

    assertTrue(e.getCause() instanceof UniqueTargetNotFoundException);
    assertEquals("rollback", executor.calls.get(executor.calls.size() - 1));
    assertFalse(executor.calls.contains("commit"));
  }

  @Test
  void findUnique_requiresUniqueSelectorAndReturnsNullWhenMissing() {
    assertThrows(DirectiveValidationException.class,
        () -> engine.findUnique("User", UniqueSelector.of("name", "A"), ReadSpec.empty()));
    assertTrue(executor.calls.isEmpty());

    assertNull(engine.findUnique("User", UniqueSelector.of("email", "a@x.io"), ReadSpec.empty()));
    assertEquals(List.of("query:User"), executor.calls);
  }

  @Test
  void findMany_validatesSortBeforeQuerying() {
    Query q = new Query().withSort(List.of(SortField.asc("nickname")));

    assertThrows(QueryValidationException.class, () -> engine.findMany("User", q, ReadSpec.empty()));
    assertTrue(executor.calls.isEmpty());
  }

  @Test
  void count_sendsTranslatedFilter() {
    executor.onQuery = s -> List.of(Map.of("id", 1L), Map.of("id", 2L));

    long n = engine.count("User", some("posts", null));

    assertEquals(2, n);
    assertTrue(executor.selects.get(0).where() instanceof InSubquery);
  }

  @Test
  void chainOnUnknownModel_isRejected() {
    assertThrows(IllegalArgumentException.class, () -> engine.chain("Nope", UniqueSelector.of("id", 1)));
  }

  /** Executor whose answers are set per test; records every call. */
  private static final class ScriptedExecutor implements TransactionExecutor {
    final List<String> calls = new ArrayList<>();
    final List<DmlAst> executed = new ArrayList<>();
    final List<SelectAst> selects = new ArrayList<>();
    Function<DmlAst, ExecResult> onExecute = op -> ExecResult.inserted(Map.of("id", 7L));
    Function<SelectAst, List<Map<String, Object>>> onQuery = s -> List.of();
    RuntimeException rollbackFailure;

    @Override
    public TxHandle begin() {
      calls.add("begin");
      return () -> "tx-1";
    }

    @Override
    public ExecResult execute(TxHandle tx, DmlAst op) {
      calls.add("execute:" + op.table());
      executed.add(op);
      return onExecute.apply(op);
    }

    @Override
    public List<Map<String, Object>> query(TxHandle tx, SelectAst select) {
      calls.add("query:" + select.table());
      selects.add(select);
      return onQuery.apply(select);
    }

    @Override
    public void commit(TxHandle tx) {
      calls.add("commit");
    }

    @Override
    public void rollback(TxHandle tx) {
      calls.add("rollback");
      if (rollbackFailure != null) throw rollbackFailure;
    }
  }
}

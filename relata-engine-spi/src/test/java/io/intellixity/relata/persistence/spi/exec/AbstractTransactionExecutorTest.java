package io.intellixity.relata.persistence.spi.exec;

import io.intellixity.relata.persistence.compile.Bind;
import io.intellixity.relata.persistence.dmlast.*;
import io.intellixity.relata.persistence.exec.ExecResult;
import io.intellixity.relata.persistence.exec.TxHandle;
import io.intellixity.relata.persistence.query.QueryFilters;
import io.intellixity.relata.persistence.query.QueryValidationException;
import io.intellixity.relata.persistence.schema.SchemaRegistry;
import io.intellixity.relata.persistence.spi.sql.Dialect;
import io.intellixity.relata.persistence.spi.sql.NativeStatement;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class AbstractTransactionExecutorTest {

  private record Stmt(String table) implements NativeStatement {}

  private static final class TableDialect implements Dialect<Stmt> {
    @Override public String id() { return "test"; }
    @Override public Stmt renderSelect(SchemaRegistry schema, SelectAst select) { return new Stmt(select.table()); }
    @Override public Stmt renderDml(SchemaRegistry schema, DmlAst dml) { return new Stmt(dml.table()); }
  }

  private record Handle(String id) implements TxHandle {}

  private static final class CountingExecutor extends AbstractTransactionExecutor<Stmt, Handle> {
    private final AtomicInteger seq = new AtomicInteger();
    final List<String> events = new ArrayList<>();

    CountingExecutor() {
      super(new TableDialect(), TestSchema.orders(), Handle.class);
    }

    @Override protected Handle doBegin() { return new Handle("t" + seq.incrementAndGet()); }
    @Override protected void doCommit(Handle tx) { events.add("commit " + tx.id()); }
    @Override protected void doRollback(Handle tx) { events.add("rollback " + tx.id()); }

    @Override
    protected ExecResult doExecute(Handle tx, DmlAst ast, Stmt stmt) {
      events.add("execute " + tx.id() + " " + stmt.table());
      return ExecResult.affected(1);
    }

    @Override
    protected List<Map<String, Object>> doQuery(Handle txOrNull, SelectAst select, Stmt stmt) {
      events.add("query " + (txOrNull == null ? "-" : txOrNull.id()) + " " + stmt.table());
      return List.of();
    }
  }

  private final CountingExecutor executor = new CountingExecutor();

  @Test
  void tracksOpenTransactionsUntilFinished() {
    TxHandle a = executor.begin();
    TxHandle b = executor.begin();
    assertEquals(2, executor.openTransactions());

    executor.execute(a, insert());
    executor.commit(a);
    executor.rollback(b);

    assertEquals(0, executor.openTransactions());
    assertEquals(List.of("execute t1 Order", "commit t1", "rollback t2"), executor.events);
  }

  @Test
  void finishedHandle_isRejected() {
    TxHandle tx = executor.begin();
    executor.commit(tx);

    assertThrows(IllegalStateException.class, () -> executor.execute(tx, insert()));
    assertThrows(IllegalStateException.class, () -> executor.commit(tx));
    assertThrows(IllegalStateException.class, () -> executor.query(tx, SelectAst.of("Order", null)));
  }

  @Test
  void foreignHandle_isRejected() {
    TxHandle foreign = () -> "elsewhere";

    assertThrows(IllegalArgumentException.class, () -> executor.rollback(foreign));
    assertTrue(executor.events.isEmpty());
  }

  @Test
  void queryWithoutTransaction_isAllowed() {
    executor.query(null, SelectAst.of("Order", QueryFilters.eq("paymentStatus", "PAID")));

    assertEquals(List.of("query - Order"), executor.events);
  }

  @Test
  void invalidStatement_neverReachesBackend() {
    TxHandle tx = executor.begin();

    assertThrows(QueryValidationException.class,
        () -> executor.execute(tx, new UpdateAst("Order", List.of(new ColumnBind("status", Bind.of("x", "string"))), null)));
    assertThrows(QueryValidationException.class, () -> executor.query(tx, SelectAst.of("Invoice", null)));
    assertTrue(executor.events.isEmpty());
    assertEquals(1, executor.openTransactions());
  }

  private static InsertAst insert() {
    return new InsertAst("Order", List.of(new ColumnBind("paymentStatus", Bind.of("NEW", "string"))), List.of("id"));
  }
}

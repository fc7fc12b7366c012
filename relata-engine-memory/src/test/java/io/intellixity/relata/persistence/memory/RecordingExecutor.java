package io.intellixity.relata.persistence.memory;

import io.intellixity.relata.persistence.dmlast.DmlAst;
import io.intellixity.relata.persistence.dmlast.InsertAst;
import io.intellixity.relata.persistence.dmlast.SelectAst;
import io.intellixity.relata.persistence.exec.ExecResult;
import io.intellixity.relata.persistence.exec.TransactionExecutor;
import io.intellixity.relata.persistence.exec.TxHandle;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Delegating executor that records calls and can fail the n-th primitive operation. */
final class RecordingExecutor implements TransactionExecutor {
  private final TransactionExecutor delegate;
  private int failOnExecute = -1;
  private String sneakTable;
  private DmlAst sneakOp;

  final List<String> calls = new ArrayList<>();
  int begins;
  int queries;
  int executes;
  int commits;
  int rollbacks;

  RecordingExecutor(TransactionExecutor delegate) {
    this.delegate = delegate;
  }

  /** The {@code n}-th execute (1-based) throws instead of reaching storage. */
  RecordingExecutor failOnExecute(int n) {
    this.failOnExecute = n;
    return this;
  }

  /** Runs {@code op} in the same transaction right before the next insert into {@code table}, once. */
  RecordingExecutor beforeInsertInto(String table, DmlAst op) {
    this.sneakTable = table;
    this.sneakOp = op;
    return this;
  }

  @Override
  public TxHandle begin() {
    begins++;
    calls.add("begin");
    return delegate.begin();
  }

  @Override
  public ExecResult execute(TxHandle tx, DmlAst op) {
    executes++;
    calls.add(op.getClass().getSimpleName() + ":" + op.table());
    if (executes == failOnExecute) throw new IllegalStateException("injected failure on " + op.table());
    if (sneakOp != null && op instanceof InsertAst && op.table().equals(sneakTable)) {
      DmlAst first = sneakOp;
      sneakOp = null;
      delegate.execute(tx, first);
    }
    return delegate.execute(tx, op);
  }

  @Override
  public List<Map<String, Object>> query(TxHandle tx, SelectAst select) {
    queries++;
    calls.add("select:" + select.table());
    return delegate.query(tx, select);
  }

  @Override
  public void commit(TxHandle tx) {
    commits++;
    calls.add("commit");
    delegate.commit(tx);
  }

  @Override
  public void rollback(TxHandle tx) {
    rollbacks++;
    calls.add("rollback");
    delegate.rollback(tx);
  }
}

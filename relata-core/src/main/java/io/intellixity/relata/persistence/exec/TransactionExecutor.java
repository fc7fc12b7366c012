package io.intellixity.relata.persistence.exec;

import io.intellixity.relata.persistence.dmlast.DmlAst;
import io.intellixity.relata.persistence.dmlast.SelectAst;

import java.util.List;
import java.util.Map;

/**
 * Storage capability consumed by the planners: primitive operations inside explicit transactions.
 * <p>
 * Unique-constraint violations are reported as {@link ExecResult#conflict()} rather than thrown, and leave the
 * transaction usable. Every other failure is thrown as an unchecked exception. Statement and transaction
 * timeouts are the implementation's concern.
 */
public interface TransactionExecutor {
  TxHandle begin();

  ExecResult execute(TxHandle tx, DmlAst op);

  /** Ordered rows as field -> value maps; {@code tx} may be null for reads outside a transaction. */
  List<Map<String, Object>> query(TxHandle tx, SelectAst select);

  void commit(TxHandle tx);

  void rollback(TxHandle tx);
}

package io.intellixity.relata.persistence.exec;

/**
 * Opaque transaction handle issued by {@link TransactionExecutor#begin()}.
 * <p>
 * Passed explicitly into every call that must run inside the transaction; nothing is bound to the
 * current thread.
 */
public interface TxHandle {
  /** Backend-specific identifier used in logs. */
  String id();
}

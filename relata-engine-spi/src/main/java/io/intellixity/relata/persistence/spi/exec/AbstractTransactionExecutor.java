package io.intellixity.relata.persistence.spi.exec;

import io.intellixity.relata.persistence.dmlast.DmlAst;
import io.intellixity.relata.persistence.dmlast.SelectAst;
import io.intellixity.relata.persistence.exec.ExecResult;
import io.intellixity.relata.persistence.exec.TransactionExecutor;
import io.intellixity.relata.persistence.exec.TxHandle;
import io.intellixity.relata.persistence.schema.SchemaRegistry;
import io.intellixity.relata.persistence.spi.sql.Dialect;
import io.intellixity.relata.persistence.spi.sql.NativeStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Template-method base for {@link TransactionExecutor} backends.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>validate every statement against the schema ({@link QueryValidationStrategy})</li>
 *   <li>render it through the backend {@link Dialect}</li>
 *   <li>track open transactions, rejecting foreign or finished handles</li>
 * </ul>
 * Backends implement the {@code do*} hooks and only ever see their own handle type.
 */
public abstract class AbstractTransactionExecutor<S extends NativeStatement, T extends TxHandle> implements TransactionExecutor {
  private static final Logger log = LoggerFactory.getLogger(AbstractTransactionExecutor.class);

  private final Dialect<S> dialect;
  private final SchemaRegistry schema;
  private final QueryValidationStrategy queryValidation;
  private final Class<T> handleType;
  private final Set<String> open = ConcurrentHashMap.newKeySet();

  protected AbstractTransactionExecutor(Dialect<S> dialect,
                                        SchemaRegistry schema,
                                        Class<T> handleType,
                                        QueryValidationStrategy queryValidation) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.schema = Objects.requireNonNull(schema, "schema");
    this.handleType = Objects.requireNonNull(handleType, "handleType");
    this.queryValidation = (queryValidation == null) ? new DefaultQueryValidationStrategy() : queryValidation;
  }

  protected AbstractTransactionExecutor(Dialect<S> dialect, SchemaRegistry schema, Class<T> handleType) {
    this(dialect, schema, handleType, new DefaultQueryValidationStrategy());
  }

  /** Backend-specific transaction begin. */
  protected abstract T doBegin();

  protected abstract void doCommit(T tx);

  protected abstract void doRollback(T tx);

  /** Runs a rendered primitive operation; unique-constraint violations come back as {@link ExecResult#conflict()}. */
  protected abstract ExecResult doExecute(T tx, DmlAst ast, S stmt);

  protected abstract List<Map<String, Object>> doQuery(T txOrNull, SelectAst select, S stmt);

  @Override
  public final TxHandle begin() {
    T tx = doBegin();
    open.add(tx.id());
    log.debug("relata.tx begin tx={} dialect={}", tx.id(), dialect.id());
    return tx;
  }

  @Override
  public final void commit(TxHandle tx) {
    T t = finish(tx);
    doCommit(t);
    log.debug("relata.tx commit tx={}", t.id());
  }

  @Override
  public final void rollback(TxHandle tx) {
    T t = finish(tx);
    doRollback(t);
    log.debug("relata.tx rollback tx={}", t.id());
  }

  @Override
  public final ExecResult execute(TxHandle tx, DmlAst op) {
    T t = active(tx);
    queryValidation.validate(schema, op);
    S stmt = dialect.renderDml(schema, op);
    if (log.isTraceEnabled()) log.trace("relata.exec tx={} table={} stmt={}", t.id(), op.table(), stmt.describe());
    return doExecute(t, op, stmt);
  }

  @Override
  public final List<Map<String, Object>> query(TxHandle tx, SelectAst select) {
    T t = (tx == null) ? null : active(tx);
    queryValidation.validate(schema, select);
    S stmt = dialect.renderSelect(schema, select);
    if (log.isTraceEnabled()) log.trace("relata.query tx={} table={} stmt={}", t == null ? "-" : t.id(), select.table(), stmt.describe());
    return doQuery(t, select, stmt);
  }

  protected final Dialect<S> dialect() { return dialect; }
  protected final SchemaRegistry schema() { return schema; }
  protected QueryValidationStrategy queryValidation() { return queryValidation; }

  /** Number of transactions begun and not yet finished. */
  public final int openTransactions() {
    return open.size();
  }

  private T active(TxHandle tx) {
    T t = own(tx);
    if (!open.contains(t.id())) throw new IllegalStateException("Transaction " + t.id() + " is not active");
    return t;
  }

  private T finish(TxHandle tx) {
    T t = own(tx);
    if (!open.remove(t.id())) throw new IllegalStateException("Transaction " + t.id() + " is not active");
    return t;
  }

  private T own(TxHandle tx) {
    Objects.requireNonNull(tx, "tx");
    if (!handleType.isInstance(tx)) {
      throw new IllegalArgumentException("Foreign transaction handle: " + tx.getClass().getName());
    }
    return handleType.cast(tx);
  }
}

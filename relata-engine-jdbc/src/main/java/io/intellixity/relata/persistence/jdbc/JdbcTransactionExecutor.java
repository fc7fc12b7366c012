package io.intellixity.relata.persistence.jdbc;

import io.intellixity.relata.persistence.compile.Bind;
import io.intellixity.relata.persistence.dmlast.DeleteAst;
import io.intellixity.relata.persistence.dmlast.DmlAst;
import io.intellixity.relata.persistence.dmlast.InsertAst;
import io.intellixity.relata.persistence.dmlast.SelectAst;
import io.intellixity.relata.persistence.dmlast.UpdateAst;
import io.intellixity.relata.persistence.exec.ExecResult;
import io.intellixity.relata.persistence.exec.TxHandle;
import io.intellixity.relata.persistence.jdbc.bind.JdbcBinderProvider;
import io.intellixity.relata.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.relata.persistence.schema.SchemaRegistry;
import io.intellixity.relata.persistence.spi.exec.AbstractTransactionExecutor;
import io.intellixity.relata.persistence.spi.exec.QueryValidationStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Transaction executor over a JDBC {@link DataSource}.
 * <p>
 * A transaction owns one connection with auto-commit off. Inserts and updates run behind a savepoint so a
 * unique-constraint violation can be rolled back on its own and reported as {@link ExecResult#conflict()},
 * leaving the transaction usable. Selects outside a transaction borrow a connection for the call.
 */
public final class JdbcTransactionExecutor extends AbstractTransactionExecutor<SqlStatement, JdbcTransactionExecutor.JdbcTxHandle> {
  private static final Logger log = LoggerFactory.getLogger(JdbcTransactionExecutor.class);

  private final JdbcHandle handle;
  private final JdbcDialect dialect;
  private final JdbcBinderProvider binders;
  private final AtomicLong txIds = new AtomicLong();

  public JdbcTransactionExecutor(JdbcHandle handle,
                                 SchemaRegistry schema,
                                 JdbcDialect dialect,
                                 QueryValidationStrategy queryValidation) {
    super(dialect, schema, JdbcTxHandle.class, queryValidation);
    this.handle = Objects.requireNonNull(handle, "handle");
    this.dialect = dialect;
    this.binders = dialect.binders();
  }

  public JdbcTransactionExecutor(JdbcHandle handle, SchemaRegistry schema, JdbcDialect dialect) {
    this(handle, schema, dialect, null);
  }

  /** Convenience: wraps a raw pool into a handle. */
  public JdbcTransactionExecutor(DataSource ds, SchemaRegistry schema, JdbcDialect dialect) {
    this(new JdbcHandle("jdbc", ds), schema, dialect, null);
  }

  public record JdbcTxHandle(String id, Connection conn) implements TxHandle {
    public JdbcTxHandle {
      Objects.requireNonNull(id, "id");
      Objects.requireNonNull(conn, "conn");
    }
  }

  public JdbcHandle handle() {
    return handle;
  }

  @Override
  protected JdbcTxHandle doBegin() {
    Connection c = open();
    try {
      c.setAutoCommit(false);
    } catch (SQLException e) {
      close(c);
      throw new JdbcExecutionException("begin failed", e);
    }
    return new JdbcTxHandle(handle.id() + "-" + txIds.incrementAndGet(), c);
  }

  @Override
  protected void doCommit(JdbcTxHandle tx) {
    try {
      tx.conn().commit();
    } catch (SQLException e) {
      throw new JdbcExecutionException("commit of " + tx.id() + " failed", e);
    } finally {
      close(tx.conn());
    }
  }

  @Override
  protected void doRollback(JdbcTxHandle tx) {
    try {
      tx.conn().rollback();
    } catch (SQLException e) {
      throw new JdbcExecutionException("rollback of " + tx.id() + " failed", e);
    } finally {
      close(tx.conn());
    }
  }

  @Override
  protected List<Map<String, Object>> doQuery(JdbcTxHandle txOrNull, SelectAst select, SqlStatement ss) {
    Connection c = (txOrNull == null) ? open() : txOrNull.conn();
    try {
      String jdbcSql = toJdbcSql(ss);
      long start = System.nanoTime();
      debugSql("SELECT", ss, jdbcSql);
      try (PreparedStatement ps = c.prepareStatement(jdbcSql)) {
        bindAll(ps, ss);
        try (ResultSet rs = ps.executeQuery()) {
          List<Map<String, Object>> out = new ArrayList<>();
          JdbcRowAdapter row = new JdbcRowAdapter(rs, binders);
          while (rs.next()) out.add(row.row());
          debugDone("SELECT", ss, out.size(), System.nanoTime() - start);
          return out;
        }
      }
    } catch (SQLException e) {
      throw new JdbcExecutionException("select from " + select.table() + " failed", e);
    } finally {
      if (txOrNull == null) close(c);
    }
  }

  @Override
  protected ExecResult doExecute(JdbcTxHandle tx, DmlAst ast, SqlStatement ss) {
    String op = opName(ast);
    Connection c = tx.conn();
    String jdbcSql = toJdbcSql(ss);
    boolean guarded = ast instanceof InsertAst || ast instanceof UpdateAst;
    Savepoint sp = null;
    try {
      if (guarded) sp = c.setSavepoint();
      long start = System.nanoTime();
      debugSql(op, ss, jdbcSql);
      ExecResult r = run(c, op, ss, jdbcSql);
      if (sp != null) c.releaseSavepoint(sp);
      debugDone(op, ss, r.affected(), System.nanoTime() - start);
      return r;
    } catch (SQLException e) {
      if (sp != null && dialect.isUniqueViolation(e)) {
        rollbackTo(c, sp, e);
        log.debug("relata.jdbc conflict op={} table={} tx={} sqlState={}", op, ast.table(), tx.id(), e.getSQLState());
        return ExecResult.conflict(e.getMessage());
      }
      throw new JdbcExecutionException(op + " on " + ast.table() + " failed", e);
    }
  }

  private ExecResult run(Connection c, String op, SqlStatement ss, String jdbcSql) throws SQLException {
    return switch (ss.execKind()) {
      case QUERY_RETURNING -> {
        try (PreparedStatement ps = c.prepareStatement(jdbcSql)) {
          bindAll(ps, ss);
          try (ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) yield ExecResult.affected(0);
            yield ExecResult.inserted(new JdbcRowAdapter(rs, binders).row(ss.returningFields()));
          }
        }
      }
      case UPDATE_GENERATED_KEYS -> {
        try (PreparedStatement ps = c.prepareStatement(jdbcSql, ss.returningColumns().toArray(new String[0]))) {
          bindAll(ps, ss);
          int n = ps.executeUpdate();
          try (ResultSet rs = ps.getGeneratedKeys()) {
            if (rs == null || !rs.next()) yield ExecResult.affected(n);
            yield ExecResult.inserted(new JdbcRowAdapter(rs, binders).row(ss.returningFields()));
          }
        }
      }
      case UPDATE -> {
        try (PreparedStatement ps = c.prepareStatement(jdbcSql)) {
          bindAll(ps, ss);
          yield ExecResult.affected(ps.executeUpdate());
        }
      }
      case QUERY -> throw new IllegalArgumentException("Invalid execKind=QUERY for " + op + "; use QUERY_RETURNING/UPDATE/UPDATE_GENERATED_KEYS");
    };
  }

  private void rollbackTo(Connection c, Savepoint sp, SQLException original) {
    try {
      c.rollback(sp);
    } catch (SQLException e) {
      JdbcExecutionException ex = new JdbcExecutionException("rollback to savepoint failed", e);
      ex.addSuppressed(original);
      throw ex;
    }
  }

  private Connection open() {
    try {
      Connection c = handle.client().getConnection();
      if (handle.schema() != null) c.setSchema(handle.schema());
      return c;
    } catch (SQLException e) {
      throw new JdbcExecutionException("cannot obtain connection from " + handle.id(), e);
    }
  }

  private void close(Connection c) {
    try {
      c.close();
    } catch (SQLException e) {
      log.warn("relata.jdbc close failed handleId={} sqlState={}", handle.id(), e.getSQLState(), e);
    }
  }

  private static String toJdbcSql(SqlStatement ss) {
    String jdbcSql = SqlParamCompiler.toJdbcSql(ss.sql());
    int placeholders = SqlParamCompiler.countParams(ss.sql());
    if (placeholders != ss.binds().size()) {
      throw new IllegalStateException("Statement has " + placeholders + " placeholders but " + ss.binds().size() + " binds: " + ss.sql());
    }
    return jdbcSql;
  }

  private void bindAll(PreparedStatement ps, SqlStatement stmt) throws SQLException {
    for (int i = 0; i < stmt.binds().size(); i++) {
      Bind b = stmt.binds().get(i);
      binders.binderFor(b, b.value()).bind(ps, i + 1, b, b.value());
    }
  }

  private static String opName(DmlAst ast) {
    if (ast instanceof InsertAst) return "INSERT";
    if (ast instanceof UpdateAst) return "UPDATE";
    if (ast instanceof DeleteAst) return "DELETE";
    return ast.getClass().getSimpleName();
  }

  private void debugSql(String op, SqlStatement ss, String jdbcSql) {
    if (!log.isDebugEnabled()) return;
    log.debug("relata.jdbc op={} execKind={} bindCount={} handleId={} schema={} sql={}",
        op, ss.execKind(), ss.binds().size(), handle.id(), handle.schema() == null ? "-" : handle.schema(), jdbcSql);

    // TRACE: bind summary only (no raw values)
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Bind b : ss.binds()) {
        Object v = b.value();
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("relata.jdbc bind index={} userTypeId={} valueType={} valueLen={}", idx++, b.userTypeId(), vType, vLen);
      }
    }
  }

  private void debugDone(String op, SqlStatement ss, long result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("relata.jdbc_done op={} execKind={} durationMs={} result={}",
        op, ss.execKind(), durationNanos / 1_000_000.0, result);
  }
}

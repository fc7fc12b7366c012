package io.intellixity.relata.persistence.jdbc;

import io.intellixity.relata.persistence.compile.Bind;
import io.intellixity.relata.persistence.spi.sql.NativeStatement;

import java.util.List;
import java.util.Objects;

/**
 * Rendered SQL with {@code :name} placeholders and binds in placeholder order.
 *
 * @param returning columns read back from an insert, in result-column order
 */
public record SqlStatement(String sql, List<Bind> binds, ExecKind execKind, List<Returned> returning) implements NativeStatement {
  public enum ExecKind {
    /** Execute via PreparedStatement.executeQuery() (selects). */
    QUERY,
    /** Execute via PreparedStatement.executeUpdate() (no generated keys). */
    UPDATE,
    /** Execute via PreparedStatement.executeUpdate() + getGeneratedKeys(). */
    UPDATE_GENERATED_KEYS,
    /** Execute via PreparedStatement.executeQuery() and read the returned row (RETURNING/OUTPUT). */
    QUERY_RETURNING
  }

  /** A physical column handed back by an insert and the logical field it fills. */
  public record Returned(String column, String field) {
    public Returned {
      Objects.requireNonNull(column, "column");
      Objects.requireNonNull(field, "field");
    }
  }

  public SqlStatement {
    binds = binds == null ? List.of() : List.copyOf(binds);
    execKind = (execKind == null) ? ExecKind.QUERY : execKind;
    returning = returning == null ? List.of() : List.copyOf(returning);
  }

  public SqlStatement(String sql, List<Bind> binds, ExecKind execKind) {
    this(sql, binds, execKind, List.of());
  }

  public SqlStatement(String sql, List<Bind> binds) {
    this(sql, binds, ExecKind.QUERY);
  }

  /** Same statement with more SQL appended; binds and execution kind are kept. */
  public SqlStatement append(String more) {
    return new SqlStatement(sql + more, binds, execKind, returning);
  }

  public List<String> returningColumns() {
    return returning.stream().map(Returned::column).toList();
  }

  public List<String> returningFields() {
    return returning.stream().map(Returned::field).toList();
  }

  @Override
  public String describe() {
    return execKind + " " + sql + " binds=" + binds.size();
  }
}

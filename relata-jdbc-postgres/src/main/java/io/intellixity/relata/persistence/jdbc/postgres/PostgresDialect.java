package io.intellixity.relata.persistence.jdbc.postgres;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.relata.persistence.jdbc.SqlStatement;
import io.intellixity.relata.persistence.jdbc.SqlStatement.ExecKind;
import io.intellixity.relata.persistence.jdbc.SqlStatement.Returned;
import io.intellixity.relata.persistence.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.relata.persistence.query.OffsetPage;

import java.util.ArrayList;
import java.util.List;

/**
 * Postgres dialect implementation for JDBC.
 *
 * Keeps only Postgres-specific overrides (quoting, LIMIT/OFFSET, RETURNING) and bind behavior.
 * Generic SQL rendering lives in {@link AbstractJdbcSqlDialect}.
 */
public final class PostgresDialect extends AbstractJdbcSqlDialect {
  public static final String ID = "postgres";

  public PostgresDialect() {
    this(new ObjectMapper());
  }

  public PostgresDialect(ObjectMapper mapper) {
    super(new PostgresBinderProvider(mapper));
  }

  @Override
  public String id() {
    return ID;
  }

  @Override
  protected ExecKind insertExecKind(List<Returned> returning) {
    if (returning == null || returning.isEmpty()) return ExecKind.UPDATE;
    return ExecKind.QUERY_RETURNING;
  }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected SqlStatement applyOffsetPage(SqlStatement base, OffsetPage page) {
    return base.append(" LIMIT " + page.limit() + " OFFSET " + page.offset());
  }

  @Override
  protected SqlStatement applyLimit(SqlStatement base, int limit) {
    return base.append(" LIMIT " + limit);
  }

  @Override
  protected String applyInsertReturning(String insertSql, List<Returned> returning) {
    if (returning == null || returning.isEmpty()) return insertSql;
    List<String> ret = new ArrayList<>();
    for (Returned r : returning) {
      String col = quoteIdent(r.column());
      ret.add(r.column().equals(r.field()) ? col : col + " AS " + quoteIdent(r.field()));
    }
    return insertSql + " RETURNING " + String.join(", ", ret);
  }
}

package io.intellixity.relata.persistence.jdbc.dialect;

import io.intellixity.relata.persistence.jdbc.bind.JdbcBinderProvider;

/**
 * Plain SQL:2008 dialect: double-quoted identifiers, {@code OFFSET/FETCH} paging and JDBC generated keys.
 * Fits databases without a dedicated dialect (H2, Derby, HSQLDB).
 */
public final class StandardSqlDialect extends AbstractJdbcSqlDialect {
  public static final String ID = "sql";

  public StandardSqlDialect() {
    super();
  }

  public StandardSqlDialect(JdbcBinderProvider binders) {
    super(binders);
  }

  @Override
  public String id() {
    return ID;
  }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }
}

package io.intellixity.relata.persistence.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class SqlParamCompilerTest {
  @Test
  void replacesNamedParamsInOrder() {
    assertEquals("SELECT \"id\" FROM \"users\" WHERE \"email\" = ? AND \"id\" IN (?, ?)",
        SqlParamCompiler.toJdbcSql("SELECT \"id\" FROM \"users\" WHERE \"email\" = :b1 AND \"id\" IN (:b2, :b3)"));
    assertEquals(3, SqlParamCompiler.countParams("WHERE a = :b1 AND b IN (:b2, :b3)"));
  }

  @Test
  void leavesCastsLiteralsAndQuotedIdentifiersAlone() {
    String sql = "SELECT '2024-01-01 10:00'::timestamp, \"odd:name\" FROM t WHERE x = 'it''s :not' AND y = :b1";

    assertEquals("SELECT '2024-01-01 10:00'::timestamp, \"odd:name\" FROM t WHERE x = 'it''s :not' AND y = ?",
        SqlParamCompiler.toJdbcSql(sql));
    assertEquals(1, SqlParamCompiler.countParams(sql));
  }

  @Test
  void nullSql_isEmpty() {
    assertEquals("", SqlParamCompiler.toJdbcSql(null));
  }
}

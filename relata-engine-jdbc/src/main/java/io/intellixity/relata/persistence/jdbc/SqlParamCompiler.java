package io.intellixity.relata.persistence.jdbc;

/**
 * Rewrites SQL containing named placeholders (e.g. {@code :b1}) into JDBC SQL with '?' binds.
 *
 * Rules:
 * - Params are recognized as ':' followed by [A-Za-z_][A-Za-z0-9_]*
 * - '::' is treated as a SQL cast and not a param.
 * - Params inside single-quoted literals and double-quoted identifiers are ignored.
 */
public final class SqlParamCompiler {
  private SqlParamCompiler() {}

  /** Purely lexical scanning; bind order is placeholder order. */
  public static String toJdbcSql(String sql) {
    if (sql == null) return "";
    StringBuilder out = new StringBuilder(sql.length() + 16);
    boolean inSingleQuote = false;
    boolean inDoubleQuote = false;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (ch == '\'' && !inDoubleQuote) {
        // '' escape
        if (inSingleQuote && i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
          out.append("''");
          i++;
          continue;
        }
        inSingleQuote = !inSingleQuote;
        out.append(ch);
        continue;
      }

      if (ch == '"' && !inSingleQuote) {
        inDoubleQuote = !inDoubleQuote;
        out.append(ch);
        continue;
      }

      if (!inSingleQuote && !inDoubleQuote && ch == ':') {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
          out.append("::");
          i++;
          continue;
        }

        int start = i + 1;
        if (start < sql.length() && isIdentStart(sql.charAt(start))) {
          int end = start + 1;
          while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
          out.append('?');
          i = end - 1;
          continue;
        }
      }

      out.append(ch);
    }

    return out.toString();
  }

  /** Number of placeholders {@link #toJdbcSql} would produce. */
  public static int countParams(String sql) {
    String jdbc = toJdbcSql(sql);
    int n = 0;
    boolean inSingleQuote = false;
    boolean inDoubleQuote = false;
    for (int i = 0; i < jdbc.length(); i++) {
      char ch = jdbc.charAt(i);
      if (ch == '\'' && !inDoubleQuote) inSingleQuote = !inSingleQuote;
      else if (ch == '"' && !inSingleQuote) inDoubleQuote = !inDoubleQuote;
      else if (ch == '?' && !inSingleQuote && !inDoubleQuote) n++;
    }
    return n;
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}

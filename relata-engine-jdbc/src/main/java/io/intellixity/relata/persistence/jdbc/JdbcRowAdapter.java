package io.intellixity.relata.persistence.jdbc;

import io.intellixity.relata.persistence.jdbc.bind.JdbcBinderProvider;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Reads result rows into field -> value maps keyed by column label. */
public final class JdbcRowAdapter {
  private final ResultSet rs;
  private final JdbcBinderProvider binders;
  private List<String> labels;

  public JdbcRowAdapter(ResultSet rs, JdbcBinderProvider binders) {
    this.rs = rs;
    this.binders = binders;
  }

  /** Current row; values pass through {@link JdbcBinderProvider#decode(Object)}. */
  public Map<String, Object> row() throws SQLException {
    List<String> ls = labels();
    Map<String, Object> out = new LinkedHashMap<>();
    for (int i = 0; i < ls.size(); i++) {
      out.put(ls.get(i), binders.decode(rs.getObject(i + 1)));
    }
    return out;
  }

  /** Current row with positional columns renamed to the given fields. */
  public Map<String, Object> row(List<String> fields) throws SQLException {
    Map<String, Object> out = new LinkedHashMap<>();
    int n = Math.min(fields.size(), rs.getMetaData().getColumnCount());
    for (int i = 0; i < n; i++) {
      out.put(fields.get(i), binders.decode(rs.getObject(i + 1)));
    }
    return out;
  }

  private List<String> labels() throws SQLException {
    if (labels == null) {
      ResultSetMetaData md = rs.getMetaData();
      List<String> ls = new ArrayList<>(md.getColumnCount());
      for (int i = 1; i <= md.getColumnCount(); i++) ls.add(md.getColumnLabel(i));
      labels = ls;
    }
    return labels;
  }
}

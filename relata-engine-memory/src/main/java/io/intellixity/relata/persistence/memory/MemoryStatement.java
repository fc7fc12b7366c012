package io.intellixity.relata.persistence.memory;

import io.intellixity.relata.persistence.spi.sql.NativeStatement;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/** Rendered form of a select or primitive operation, evaluated directly against table rows. */
public interface MemoryStatement extends NativeStatement {
  String table();

  record Select(String table, RowPredicate where, Comparator<Map<String, Object>> order, int offset, Integer limit)
      implements MemoryStatement {
    @Override
    public String describe() {
      return "select " + table + (limit == null ? "" : " limit " + limit);
    }
  }

  record Insert(String table, Map<String, Object> values, List<String> returning) implements MemoryStatement {
    @Override
    public String describe() {
      return "insert " + table + " " + values.keySet();
    }
  }

  record Update(String table, Map<String, Object> sets, RowPredicate where) implements MemoryStatement {
    @Override
    public String describe() {
      return "update " + table + " " + sets.keySet();
    }
  }

  record Delete(String table, RowPredicate where) implements MemoryStatement {
    @Override
    public String describe() {
      return "delete " + table;
    }
  }
}

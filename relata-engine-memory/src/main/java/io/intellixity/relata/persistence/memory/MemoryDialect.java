package io.intellixity.relata.persistence.memory;

import io.intellixity.relata.persistence.compile.Bind;
import io.intellixity.relata.persistence.dmlast.*;
import io.intellixity.relata.persistence.query.*;
import io.intellixity.relata.persistence.schema.SchemaRegistry;
import io.intellixity.relata.persistence.spi.sql.Dialect;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.*;
import java.util.function.Function;
import java.util.regex.Pattern;

/** Compiles selects and primitive operations into row predicates and value maps. */
public final class MemoryDialect implements Dialect<MemoryStatement> {
  public static final String ID = "memory";

  @Override
  public String id() {
    return ID;
  }

  @Override
  public MemoryStatement renderSelect(SchemaRegistry schema, SelectAst select) {
    int offset = 0;
    Integer limit = null;
    if (select.page() instanceof OffsetPage op) {
      offset = op.offset();
      limit = op.limit();
    } else if (select.page() != null) {
      limit = select.page().limit();
    }
    return new MemoryStatement.Select(select.table(), compile(select.where()), order(select.sort()), offset, limit);
  }

  @Override
  public MemoryStatement renderDml(SchemaRegistry schema, DmlAst dml) {
    if (dml instanceof InsertAst ins) {
      return new MemoryStatement.Insert(ins.table(), values(ins.columns()), ins.returningColumns());
    }
    if (dml instanceof UpdateAst upd) {
      return new MemoryStatement.Update(upd.table(), values(upd.sets()), compile(upd.where()));
    }
    if (dml instanceof DeleteAst del) {
      return new MemoryStatement.Delete(del.table(), compile(del.where()));
    }
    throw new IllegalArgumentException("Unsupported DmlAst: " + dml.getClass().getName());
  }

  private static Map<String, Object> values(List<ColumnBind> columns) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (ColumnBind c : columns) out.put(c.column(), encode(c.bind()));
    return out;
  }

  /** Coerces wire values (JSON numbers, ISO strings) into the Java type of the declared scalar type. */
  static Object encode(Bind bind) {
    Object v = bind.value();
    if (v == null || bind.userTypeId() == null) return v;
    switch (bind.userTypeId()) {
      case "long":
        return v instanceof Number n ? (Object) n.longValue() : Long.valueOf(String.valueOf(v));
      case "int":
        return v instanceof Number n ? (Object) n.intValue() : Integer.valueOf(String.valueOf(v));
      case "double":
        return v instanceof Number n ? (Object) n.doubleValue() : Double.valueOf(String.valueOf(v));
      case "boolean":
        return v instanceof Boolean ? v : Boolean.valueOf(String.valueOf(v));
      case "string":
        return String.valueOf(v);
      case "uuid":
        return v instanceof UUID ? v : UUID.fromString(String.valueOf(v));
      case "timestamp":
        if (v instanceof Instant) return v;
        if (v instanceof OffsetDateTime odt) return odt.toInstant();
        return Instant.parse(String.valueOf(v));
      default:
        return v;
    }
  }

  private static Comparator<Map<String, Object>> order(List<SortField> sort) {
    if (sort == null || sort.isEmpty()) return null;
    Comparator<Map<String, Object>> out = null;
    for (SortField s : sort) {
      Comparator<Map<String, Object>> c = (a, b) -> Values.compare(a.get(s.field()), b.get(s.field()));
      if (s.direction() == SortField.Direction.DESC) c = c.reversed();
      out = (out == null) ? c : out.thenComparing(c);
    }
    return out;
  }

  // --- predicates ---

  static RowPredicate compile(QueryElement el) {
    if (el == null) return RowPredicate.ALWAYS;

    if (el instanceof NotElement n) {
      RowPredicate inner = compile(n.element());
      return (row, tables) -> not(inner.test(row, tables));
    }

    if (el instanceof LogicalGroup g) {
      List<RowPredicate> parts = new ArrayList<>();
      for (QueryElement e : g.elements()) parts.add(compile(e));
      boolean or = g.clause() == Clause.OR;
      return (row, tables) -> {
        boolean unknown = false;
        for (RowPredicate p : parts) {
          Boolean r = p.test(row, tables);
          if (r == null) unknown = true;
          else if (r == or) return r;
        }
        return unknown ? null : !or;
      };
    }

    if (el instanceof Condition c) {
      RowPredicate p = condition(c);
      return c.not() ? (row, tables) -> not(p.test(row, tables)) : p;
    }

    if (el instanceof InSubquery s) {
      return subquery(s);
    }

    throw new IllegalArgumentException("Unsupported QueryElement in filter: " + el.getClass().getName());
  }

  private static RowPredicate condition(Condition c) {
    String f = c.property();
    Object value = resolved(c.value(), f);
    return switch (c.operator()) {
      case EQ -> value == null
          ? (row, tables) -> row.get(f) == null
          : (row, tables) -> row.get(f) == null ? null : Values.same(row.get(f), value);
      case NE -> value == null
          ? (row, tables) -> row.get(f) != null
          : (row, tables) -> row.get(f) == null ? null : !Values.same(row.get(f), value);
      case GT -> compare(f, value, r -> r > 0);
      case GE -> compare(f, value, r -> r >= 0);
      case LT -> compare(f, value, r -> r < 0);
      case LE -> compare(f, value, r -> r <= 0);
      case IN -> in(f, list(value, f), false);
      case NIN -> in(f, list(value, f), true);
      case LIKE -> {
        if (value == null) throw new IllegalArgumentException("LIKE requires a value for property '" + f + "'");
        Pattern p = likePattern(String.valueOf(value));
        yield (row, tables) -> row.get(f) == null ? null : p.matcher(String.valueOf(row.get(f))).matches();
      }
      case RANGE -> {
        Object lo = resolved(c.lower(), f);
        Object hi = resolved(c.upper(), f);
        if (lo == null || hi == null) throw new IllegalArgumentException("RANGE requires non-null lower+upper for property '" + f + "'");
        yield (row, tables) -> {
          Object v = row.get(f);
          if (v == null) return null;
          return Values.compare(v, lo) >= 0 && Values.compare(v, hi) <= 0;
        };
      }
    };
  }

  private interface Cmp {
    boolean test(int r);
  }

  private static RowPredicate compare(String f, Object value, Cmp cmp) {
    if (value == null) throw new IllegalArgumentException("Comparison requires a value for property '" + f + "'");
    return (row, tables) -> {
      Object v = row.get(f);
      return v == null ? null : cmp.test(Values.compare(v, value));
    };
  }

  private static RowPredicate in(String f, List<Object> values, boolean not) {
    Set<Object> set = new HashSet<>();
    boolean hasNull = false;
    for (Object v : values) {
      if (v == null) hasNull = true;
      else set.add(Values.normalize(v));
    }
    boolean listHasNull = hasNull;
    return (row, tables) -> {
      Object v = row.get(f);
      Boolean r;
      if (v == null) r = values.isEmpty() ? Boolean.FALSE : null;
      else if (set.contains(Values.normalize(v))) r = Boolean.TRUE;
      else r = listHasNull ? null : Boolean.FALSE;
      return not ? not(r) : r;
    };
  }

  private static RowPredicate subquery(InSubquery s) {
    RowPredicate inner = compile(s.where());
    String source = s.source().name();
    return (row, tables) -> {
      List<Object> probe = Values.key(s.properties(), row);
      boolean sawNull = false;
      boolean found = false;
      if (!Values.hasNull(probe)) {
        for (Map<String, Object> candidate : tables.apply(source)) {
          if (!inner.matches(candidate, tables)) continue;
          List<Object> k = Values.key(s.selected(), candidate);
          if (Values.hasNull(k)) sawNull = true;
          else if (k.equals(probe)) {
            found = true;
            break;
          }
        }
      }
      Boolean r;
      if (found) r = Boolean.TRUE;
      else if (Values.hasNull(probe)) r = anyMatch(inner, source, tables) ? null : Boolean.FALSE;
      else r = sawNull ? null : Boolean.FALSE;
      return s.not() ? not(r) : r;
    };
  }

  /** {@code NULL IN (empty)} is false, {@code NULL IN (anything)} unknown. */
  private static boolean anyMatch(RowPredicate inner, String source, Function<String, List<Map<String, Object>>> tables) {
    for (Map<String, Object> candidate : tables.apply(source)) {
      if (inner.matches(candidate, tables)) return true;
    }
    return false;
  }

  private static Boolean not(Boolean b) {
    return b == null ? null : !b;
  }

  private static Object resolved(Object v, String f) {
    QueryValues.requireResolved(v, f);
    if (v instanceof BigDecimal bd) return Values.normalize(bd);
    return v;
  }

  private static List<Object> list(Object v, String f) {
    if (v instanceof Collection<?> c) {
      List<Object> out = new ArrayList<>(c.size());
      for (Object o : c) out.add(resolved(o, f));
      return out;
    }
    if (v == null) return List.of();
    return List.of(resolved(v, f));
  }

  private static Pattern likePattern(String like) {
    StringBuilder sb = new StringBuilder();
    for (char ch : like.toCharArray()) {
      if (ch == '%') sb.append(".*");
      else if (ch == '_') sb.append('.');
      else sb.append(Pattern.quote(String.valueOf(ch)));
    }
    return Pattern.compile(sb.toString(), Pattern.DOTALL);
  }
}

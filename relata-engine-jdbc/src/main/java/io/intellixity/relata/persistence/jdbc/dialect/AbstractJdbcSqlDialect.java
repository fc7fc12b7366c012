package io.intellixity.relata.persistence.jdbc.dialect;

import io.intellixity.relata.persistence.compile.Bind;
import io.intellixity.relata.persistence.dmlast.*;
import io.intellixity.relata.persistence.jdbc.SqlStatement;
import io.intellixity.relata.persistence.jdbc.SqlStatement.ExecKind;
import io.intellixity.relata.persistence.jdbc.SqlStatement.Returned;
import io.intellixity.relata.persistence.jdbc.bind.JdbcBinderProvider;
import io.intellixity.relata.persistence.query.*;
import io.intellixity.relata.persistence.schema.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.*;

/**
 * JDBC-generic SQL dialect base.
 *
 * Provides common rendering for:
 * - selects: model columns aliased to field names (join tables by column) + filter + sort + paging
 * - sub-query semi-joins produced by relation filter translation
 * - DML: insert/update/delete from DmlAst
 *
 * Logical names are mapped through the schema: models to their source, fields to their column.
 * DB-specific dialects override hooks for quoting, paging and returning.
 */
public abstract class AbstractJdbcSqlDialect implements JdbcDialect {
  protected static final class RenderCtx {
    private int n = 1;
    private int aliases = 0;
    private final List<Bind> binds = new ArrayList<>();

    public String add(Bind b) {
      binds.add(b);
      return ":b" + (n++);
    }

    String nextAlias() {
      return "s" + (++aliases);
    }

    List<Bind> binds() {
      return binds;
    }
  }

  /** Physical view of a model or join table: field -> column and field -> scalar type id, in field order. */
  protected record Table(String name, String source, Map<String, String> columns, Map<String, String> types, String alias) {
    Table as(String alias) {
      return new Table(name, source, columns, types, alias);
    }
  }

  private final JdbcBinderProvider binders;

  protected AbstractJdbcSqlDialect(JdbcBinderProvider binders) {
    this.binders = Objects.requireNonNull(binders, "binders");
  }

  protected AbstractJdbcSqlDialect() {
    this(new JdbcBinderProvider());
  }

  @Override
  public JdbcBinderProvider binders() {
    return binders;
  }

  @Override
  public final SqlStatement renderSelect(SchemaRegistry schema, SelectAst select) {
    Table t = table(schema, select.table(), select.joinTable());
    RenderCtx ctx = new RenderCtx();

    List<String> items = new ArrayList<>();
    for (var e : t.columns().entrySet()) {
      String col = quoteIdent(e.getValue());
      items.add(e.getKey().equals(e.getValue()) ? col : col + " AS " + quoteIdent(e.getKey()));
    }
    StringBuilder sql = new StringBuilder("SELECT ")
        .append(String.join(", ", items))
        .append(" FROM ")
        .append(quoteIdent(t.source()));

    String where = renderPredicate(schema, t, select.where(), ctx);
    if (!where.isBlank()) sql.append(" WHERE ").append(where);

    SqlStatement base = new SqlStatement(sql.toString(), ctx.binds());
    return appendPage(appendSort(base, t, select.sort()), select.page());
  }

  @Override
  public final SqlStatement renderDml(SchemaRegistry schema, DmlAst dml) {
    Table t = table(schema, dml.table(), schema.joinTable(dml.table()).isPresent());
    if (dml instanceof InsertAst ins) return renderInsert(t, ins);
    if (dml instanceof UpdateAst upd) return renderUpdate(schema, t, upd);
    if (dml instanceof DeleteAst del) return renderDelete(schema, t, del);
    throw new IllegalArgumentException("Unknown DmlAst: " + dml);
  }

  protected SqlStatement appendSort(SqlStatement base, Table t, List<SortField> sort) {
    if (sort == null || sort.isEmpty()) return base;
    List<String> parts = new ArrayList<>();
    for (SortField sf : sort) {
      String expr = column(t, sf.field());
      parts.add(expr + (sf.direction() == SortField.Direction.DESC ? " DESC" : " ASC") + nullOrdering(sf.direction()));
    }
    return base.append(" ORDER BY " + String.join(", ", parts));
  }

  /** Nulls sort before values ascending and after them descending. */
  protected String nullOrdering(SortField.Direction direction) {
    return direction == SortField.Direction.DESC ? " NULLS LAST" : " NULLS FIRST";
  }

  protected SqlStatement appendPage(SqlStatement base, Page page) {
    if (page == null) return base;
    if (page instanceof OffsetPage op) return applyOffsetPage(base, op);
    return applyLimit(base, page.limit());
  }

  /** SQL:2008 form; dialects override (Postgres LIMIT/OFFSET). */
  protected SqlStatement applyOffsetPage(SqlStatement base, OffsetPage page) {
    return base.append(" OFFSET " + page.offset() + " ROWS FETCH NEXT " + page.limit() + " ROWS ONLY");
  }

  protected SqlStatement applyLimit(SqlStatement base, int limit) {
    return base.append(" FETCH FIRST " + limit + " ROWS ONLY");
  }

  protected String renderPredicate(SchemaRegistry schema, Table t, QueryElement el, RenderCtx ctx) {
    if (el == null) return "";
    return renderPredicateSql(schema, t, el, ctx, false);
  }

  private String renderPredicateSql(SchemaRegistry schema, Table t, QueryElement el, RenderCtx ctx, boolean negate) {
    if (el instanceof NotElement n) {
      return renderPredicateSql(schema, t, n.element(), ctx, !negate);
    }

    if (el instanceof LogicalGroup g) {
      Clause clause = g.clause();
      if (negate) clause = (clause == Clause.OR) ? Clause.AND : Clause.OR;
      List<String> childSql = new ArrayList<>();
      for (QueryElement c : g.elements()) childSql.add(renderPredicateSql(schema, t, c, ctx, negate));
      if (childSql.isEmpty()) return clause == Clause.OR ? falseLiteral() : trueLiteral();
      if (childSql.size() == 1) return childSql.get(0);
      String sep = (clause == Clause.OR) ? " OR " : " AND ";
      return "(" + String.join(sep, childSql) + ")";
    }

    if (el instanceof InSubquery s) {
      return renderSubquery(schema, t, s, ctx, negate);
    }

    if (el instanceof RelationFilter f) {
      throw new QueryValidationException("Relation filter on '" + f.relation() + "' must be translated before rendering");
    }

    if (!(el instanceof Condition c)) {
      throw new IllegalArgumentException("Unsupported QueryElement in filter: " + el.getClass().getName());
    }

    String propertyPath = c.property();
    String expr = column(t, propertyPath);
    String userTypeId = t.types().get(propertyPath);
    boolean not = c.not() ^ negate;
    Object value = resolved(c.value(), propertyPath);

    return switch (c.operator()) {
      case EQ -> (value == null)
          ? nullCheckSql(expr, true, not)
          : unarySql(expr, "=", value, userTypeId, not, ctx);
      case NE -> (value == null)
          ? nullCheckSql(expr, false, not)
          : unarySql(expr, "<>", value, userTypeId, not, ctx);
      case GT -> unaryNonNull(expr, ">", value, userTypeId, not, ctx);
      case GE -> unaryNonNull(expr, ">=", value, userTypeId, not, ctx);
      case LT -> unaryNonNull(expr, "<", value, userTypeId, not, ctx);
      case LE -> unaryNonNull(expr, "<=", value, userTypeId, not, ctx);
      case LIKE -> unaryNonNull(expr, "LIKE", value, "string", not, ctx);
      case IN -> listSql(expr, toList(value, propertyPath), userTypeId, not, ctx);
      case NIN -> listSql(expr, toList(value, propertyPath), userTypeId, !not, ctx);
      case RANGE -> {
        Object lo = resolved(c.lower(), propertyPath);
        Object hi = resolved(c.upper(), propertyPath);
        if (lo == null || hi == null) throw new IllegalArgumentException("RANGE requires non-null lower+upper for property '" + propertyPath + "'");
        yield betweenSql(expr, lo, hi, userTypeId, not, ctx);
      }
    };
  }

  /** {@code (cols) [NOT] IN (SELECT cols FROM source alias WHERE ...)}; the inner filter sees only its own source. */
  private String renderSubquery(SchemaRegistry schema, Table outer, InSubquery s, RenderCtx ctx, boolean negate) {
    Table inner = table(schema, s.source().name(), s.source().joinTable()).as(ctx.nextAlias());

    List<String> lhs = new ArrayList<>();
    for (String p : s.properties()) lhs.add(column(outer, p));
    List<String> selected = new ArrayList<>();
    for (String p : s.selected()) selected.add(column(inner, p));

    StringBuilder sub = new StringBuilder("SELECT ")
        .append(String.join(", ", selected))
        .append(" FROM ")
        .append(quoteIdent(inner.source()))
        .append(' ')
        .append(inner.alias());
    if (s.where() != null) {
      sub.append(" WHERE ").append(renderPredicateSql(schema, inner, s.where(), ctx, false));
    }

    String left = lhs.size() == 1 ? lhs.get(0) : "(" + String.join(", ", lhs) + ")";
    boolean not = s.not() ^ negate;
    return left + (not ? " NOT IN (" : " IN (") + sub + ")";
  }

  protected String trueLiteral() {
    return "TRUE";
  }

  protected String falseLiteral() {
    return "FALSE";
  }

  private String nullCheckSql(String expr, boolean isNull, boolean not) {
    String sql = expr + (isNull ? " IS NULL" : " IS NOT NULL");
    return not ? "NOT (" + sql + ")" : sql;
  }

  private String unarySql(String expr, String op, Object value, String userTypeId, boolean not, RenderCtx ctx) {
    String p = ctx.add(new Bind(coerceScalar(userTypeId, value), userTypeId));
    String sql = expr + " " + op + " " + p;
    return not ? "NOT (" + sql + ")" : sql;
  }

  private String betweenSql(String expr, Object lower, Object upper, String userTypeId, boolean not, RenderCtx ctx) {
    String p1 = ctx.add(new Bind(coerceScalar(userTypeId, lower), userTypeId));
    String p2 = ctx.add(new Bind(coerceScalar(userTypeId, upper), userTypeId));
    String sql = expr + " BETWEEN " + p1 + " AND " + p2;
    return not ? "NOT (" + sql + ")" : sql;
  }

  private String listSql(String expr, List<Object> vals, String userTypeId, boolean not, RenderCtx ctx) {
    if (vals.isEmpty()) return not ? trueLiteral() : falseLiteral();
    List<String> ph = new ArrayList<>();
    for (Object x : vals) ph.add(ctx.add(new Bind(coerceScalar(userTypeId, x), userTypeId)));
    String sql = expr + " IN (" + String.join(", ", ph) + ")";
    return not ? "NOT (" + sql + ")" : sql;
  }

  private String unaryNonNull(String expr, String op, Object value, String userTypeId, boolean not, RenderCtx ctx) {
    if (value == null) throw new IllegalArgumentException(op + " requires non-null value");
    return unarySql(expr, op, value, userTypeId, not, ctx);
  }

  protected SqlStatement renderInsert(Table t, InsertAst ins) {
    List<String> cols = new ArrayList<>();
    List<String> ph = new ArrayList<>();
    List<Bind> binds = new ArrayList<>();
    int n = 1;
    for (ColumnBind cb : ins.columns()) {
      cols.add(quoteIdent(physical(t, cb.column())));
      ph.add(":b" + (n++));
      binds.add(encoded(t, cb));
    }
    String sql = cols.isEmpty()
        ? "INSERT INTO " + quoteIdent(t.source()) + " DEFAULT VALUES"
        : "INSERT INTO " + quoteIdent(t.source()) + " (" + String.join(", ", cols) + ") VALUES (" + String.join(", ", ph) + ")";

    List<Returned> returning = new ArrayList<>();
    for (String f : ins.returningColumns()) returning.add(new Returned(physical(t, f), f));
    sql = applyInsertReturning(sql, returning);
    return new SqlStatement(sql, binds, insertExecKind(returning), returning);
  }

  /**
   * Decide execution strategy for insert.
   *
   * <p>Default uses JDBC generated keys when something must be read back. Dialects that implement SQL-level
   * returning (Postgres RETURNING) override to return {@link ExecKind#QUERY_RETURNING}.</p>
   */
  protected ExecKind insertExecKind(List<Returned> returning) {
    if (returning == null || returning.isEmpty()) return ExecKind.UPDATE;
    return ExecKind.UPDATE_GENERATED_KEYS;
  }

  protected String applyInsertReturning(String insertSql, List<Returned> returning) {
    return insertSql;
  }

  protected SqlStatement renderUpdate(SchemaRegistry schema, Table t, UpdateAst upd) {
    if (upd.sets().isEmpty()) throw new IllegalArgumentException("Update has no SET columns");
    RenderCtx ctx = new RenderCtx();
    List<String> sets = new ArrayList<>();
    for (ColumnBind cb : upd.sets()) {
      sets.add(quoteIdent(physical(t, cb.column())) + " = " + ctx.add(encoded(t, cb)));
    }
    String sql = "UPDATE " + quoteIdent(t.source()) + " SET " + String.join(", ", sets);
    String where = renderPredicate(schema, t, upd.where(), ctx);
    if (!where.isBlank()) sql += " WHERE " + where;
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  protected SqlStatement renderDelete(SchemaRegistry schema, Table t, DeleteAst del) {
    RenderCtx ctx = new RenderCtx();
    String sql = "DELETE FROM " + quoteIdent(t.source());
    String where = renderPredicate(schema, t, del.where(), ctx);
    if (!where.isBlank()) sql += " WHERE " + where;
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  protected abstract String quoteIdent(String ident);

  /** Resolves a model or join table into its physical columns. */
  protected Table table(SchemaRegistry schema, String name, boolean joinTable) {
    if (joinTable) {
      for (ModelDef m : schema.models()) {
        for (RelationField r : m.relations().values()) {
          if (r.ownership() != Ownership.JOIN_TABLE || !r.joinTable().name().equals(name)) continue;
          JoinTableDef jt = r.joinTable();
          Map<String, String> cols = new LinkedHashMap<>();
          cols.put(jt.column(), jt.column());
          cols.put(jt.targetColumn(), jt.targetColumn());
          Map<String, String> types = new LinkedHashMap<>();
          types.put(jt.column(), keyType(schema, m.name()));
          types.put(jt.targetColumn(), keyType(schema, r.target()));
          return new Table(name, name, cols, types, null);
        }
      }
      throw new QueryValidationException("Unknown join table '" + name + "'");
    }

    ModelDef m;
    try {
      m = schema.model(name);
    } catch (IllegalArgumentException e) {
      throw new QueryValidationException("Unknown model '" + name + "'", e);
    }
    Map<String, String> cols = new LinkedHashMap<>();
    Map<String, String> types = new LinkedHashMap<>();
    for (ScalarField f : m.fields().values()) {
      cols.put(f.name(), f.column());
      types.put(f.name(), f.userTypeId());
    }
    return new Table(m.name(), m.source(), cols, types, null);
  }

  private static String keyType(SchemaRegistry schema, String model) {
    return schema.model(model).scalar(schema.singleKey(model)).userTypeId();
  }

  /** Quoted column, qualified with the table alias inside sub-queries. */
  protected String column(Table t, String field) {
    String col = quoteIdent(physical(t, field));
    return t.alias() == null ? col : t.alias() + "." + col;
  }

  private static String physical(Table t, String field) {
    String col = t.columns().get(field);
    if (col == null) {
      throw QueryValidationException.unknownField(field, t.name());
    }
    return col;
  }

  private static Bind encoded(Table t, ColumnBind cb) {
    String type = t.types().getOrDefault(cb.column(), cb.bind().userTypeId());
    return new Bind(coerceScalar(type, cb.bind().value()), type);
  }

  /** Coerces wire values (JSON numbers, ISO strings) into the Java type the driver expects for the declared type. */
  protected static Object coerceScalar(String userTypeId, Object value) {
    if (value == null || userTypeId == null) return value;
    return switch (userTypeId) {
      case "long" -> value instanceof Number n ? (Object) n.longValue() : Long.valueOf(String.valueOf(value).trim());
      case "int" -> value instanceof Number n ? (Object) n.intValue() : Integer.valueOf(String.valueOf(value).trim());
      case "double" -> value instanceof Number n ? (Object) n.doubleValue() : Double.valueOf(String.valueOf(value).trim());
      case "boolean" -> value instanceof Boolean ? value : Boolean.valueOf(String.valueOf(value).trim());
      case "string" -> String.valueOf(value);
      case "uuid" -> value instanceof UUID ? value : UUID.fromString(String.valueOf(value).trim());
      case "timestamp" -> {
        if (value instanceof Instant) yield value;
        if (value instanceof OffsetDateTime odt) yield odt.toInstant();
        yield Instant.parse(String.valueOf(value).trim());
      }
      default -> value;
    };
  }

  private static Object resolved(Object v, String property) {
    QueryValues.requireResolved(v, property);
    if (v instanceof BigDecimal bd) return Values.normalize(bd);
    return v;
  }

  private static List<Object> toList(Object v, String property) {
    if (v == null) return List.of();
    if (v instanceof Collection<?> c) {
      List<Object> out = new ArrayList<>(c.size());
      for (Object o : c) out.add(resolved(o, property));
      return out;
    }
    return List.of(resolved(v, property));
  }
}

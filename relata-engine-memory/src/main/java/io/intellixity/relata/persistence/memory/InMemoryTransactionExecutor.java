package io.intellixity.relata.persistence.memory;

import io.intellixity.relata.persistence.dmlast.DmlAst;
import io.intellixity.relata.persistence.dmlast.SelectAst;
import io.intellixity.relata.persistence.exec.ExecResult;
import io.intellixity.relata.persistence.query.Values;
import io.intellixity.relata.persistence.schema.*;
import io.intellixity.relata.persistence.spi.exec.AbstractTransactionExecutor;
import io.intellixity.relata.persistence.spi.exec.QueryValidationStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Transactional executor over in-memory tables, enforcing what a relational store would:
 * required fields, unique constraints (reported as conflicts), and foreign keys in both directions
 * (dangling references and deletes of referenced rows are rejected).
 * <p>
 * Each transaction works on a private copy of all tables taken at begin; commit publishes it unless another
 * transaction committed in between, in which case the commit fails. Reads outside a transaction see the last
 * committed state. Generated values come from per-field sequences that are never rolled back.
 */
public final class InMemoryTransactionExecutor extends AbstractTransactionExecutor<MemoryStatement, MemoryTxHandle> {
  private static final Logger log = LoggerFactory.getLogger(InMemoryTransactionExecutor.class);

  /** A foreign key as stored: {@code owner(ownerFields) -> referenced(referencedFields)}. */
  private record Ref(String owner, List<String> ownerFields, String referenced, List<String> referencedFields) {}

  private final Object lock = new Object();
  private final List<Ref> refs = new ArrayList<>();
  private final Map<String, AtomicLong> sequences = new ConcurrentHashMap<>();
  private final AtomicLong txIds = new AtomicLong();
  private Map<String, List<Map<String, Object>>> committed;
  private long version;

  public InMemoryTransactionExecutor(SchemaRegistry schema) {
    this(schema, null);
  }

  public InMemoryTransactionExecutor(SchemaRegistry schema, QueryValidationStrategy queryValidation) {
    super(new MemoryDialect(), schema, MemoryTxHandle.class, queryValidation);
    Map<String, List<Map<String, Object>>> tables = new HashMap<>();
    Set<Ref> seen = new LinkedHashSet<>();
    for (ModelDef m : schema.models()) {
      tables.put(m.name(), new ArrayList<>());
      for (RelationField r : m.relations().values()) {
        if (r.ownership() == Ownership.SELF) {
          seen.add(new Ref(m.name(), r.fields(), r.target(), r.references()));
        } else if (r.ownership() == Ownership.JOIN_TABLE) {
          JoinTableDef jt = r.joinTable();
          tables.put(jt.name(), new ArrayList<>());
          seen.add(new Ref(jt.name(), List.of(jt.column()), m.name(), List.of(schema.singleKey(m.name()))));
          seen.add(new Ref(jt.name(), List.of(jt.targetColumn()), r.target(), List.of(schema.singleKey(r.target()))));
        }
      }
    }
    refs.addAll(seen);
    this.committed = tables;
  }

  /** Committed rows of a model or join table, as copies. */
  public List<Map<String, Object>> committedRows(String table) {
    List<Map<String, Object>> out = new ArrayList<>();
    for (Map<String, Object> r : committedTables().getOrDefault(table, List.of())) out.add(new LinkedHashMap<>(r));
    return out;
  }

  @Override
  protected MemoryTxHandle doBegin() {
    synchronized (lock) {
      Map<String, List<Map<String, Object>>> copy = new HashMap<>();
      for (var e : committed.entrySet()) {
        List<Map<String, Object>> rows = new ArrayList<>(e.getValue().size());
        for (Map<String, Object> r : e.getValue()) rows.add(new LinkedHashMap<>(r));
        copy.put(e.getKey(), rows);
      }
      return new MemoryTxHandle("mem-" + txIds.incrementAndGet(), version, copy);
    }
  }

  @Override
  protected void doCommit(MemoryTxHandle tx) {
    synchronized (lock) {
      if (version != tx.baseVersion()) {
        throw new IllegalStateException("Transaction " + tx.id() + " conflicts with a concurrent commit");
      }
      committed = tx.tables();
      version++;
    }
  }

  @Override
  protected void doRollback(MemoryTxHandle tx) {
    // the private copy is dropped with the handle
  }

  @Override
  protected List<Map<String, Object>> doQuery(MemoryTxHandle txOrNull, SelectAst select, MemoryStatement stmt) {
    MemoryStatement.Select s = (MemoryStatement.Select) stmt;
    Map<String, List<Map<String, Object>>> tables = (txOrNull == null) ? committedTables() : txOrNull.tables();
    Function<String, List<Map<String, Object>>> lookup = name -> tables.getOrDefault(name, List.of());

    List<Map<String, Object>> rows = new ArrayList<>();
    for (Map<String, Object> r : lookup.apply(s.table())) {
      if (s.where().matches(r, lookup)) rows.add(r);
    }
    if (s.order() != null) rows.sort(s.order());
    int from = Math.min(s.offset(), rows.size());
    int to = (s.limit() == null) ? rows.size() : Math.min(rows.size(), from + s.limit());
    List<Map<String, Object>> out = new ArrayList<>(to - from);
    for (Map<String, Object> r : rows.subList(from, to)) out.add(new LinkedHashMap<>(r));
    return out;
  }

  @Override
  protected ExecResult doExecute(MemoryTxHandle tx, DmlAst ast, MemoryStatement stmt) {
    Map<String, List<Map<String, Object>>> tables = tx.tables();
    Function<String, List<Map<String, Object>>> lookup = name -> tables.getOrDefault(name, List.of());
    if (stmt instanceof MemoryStatement.Insert ins) return insert(tables, lookup, ins);
    if (stmt instanceof MemoryStatement.Update upd) return update(tables, lookup, upd);
    if (stmt instanceof MemoryStatement.Delete del) return delete(tables, lookup, del);
    throw new IllegalArgumentException("Unsupported statement: " + stmt.getClass().getName());
  }

  private ExecResult insert(Map<String, List<Map<String, Object>>> tables,
                            Function<String, List<Map<String, Object>>> lookup,
                            MemoryStatement.Insert ins) {
    List<Map<String, Object>> rows = tables.get(ins.table());
    Map<String, Object> row = new LinkedHashMap<>();
    Optional<ModelDef> model = modelOf(ins.table());
    if (model.isPresent()) {
      for (ScalarField f : model.get().fields().values()) {
        Object v = ins.values().get(f.name());
        if (v == null && f.autoGenerated()) v = generate(ins.table(), f);
        if (v == null && !f.optional()) {
          throw new IllegalStateException("null value in required field " + ins.table() + "." + f.name());
        }
        row.put(f.name(), v);
      }
    } else {
      row.putAll(ins.values());
    }

    String dup = duplicate(ins.table(), rows, row, null);
    if (dup != null) {
      log.debug("relata.memory conflict table={} constraint={}", ins.table(), dup);
      return ExecResult.conflict("duplicate key value violates unique constraint " + ins.table() + dup);
    }
    checkOutgoing(ins.table(), lookup, List.of(row), null);
    rows.add(row);

    Map<String, Object> keys = new LinkedHashMap<>();
    for (String r : ins.returning()) keys.put(r, row.get(r));
    return ExecResult.inserted(keys);
  }

  private ExecResult update(Map<String, List<Map<String, Object>>> tables,
                            Function<String, List<Map<String, Object>>> lookup,
                            MemoryStatement.Update upd) {
    List<Map<String, Object>> rows = tables.get(upd.table());
    Optional<ModelDef> model = modelOf(upd.table());
    if (model.isPresent()) {
      for (var e : upd.sets().entrySet()) {
        if (e.getValue() == null && !model.get().scalar(e.getKey()).optional()) {
          throw new IllegalStateException("null value in required field " + upd.table() + "." + e.getKey());
        }
      }
    }
    List<Integer> hits = new ArrayList<>();
    List<Map<String, Object>> before = new ArrayList<>();
    List<Map<String, Object>> after = new ArrayList<>();
    for (int i = 0; i < rows.size(); i++) {
      if (!upd.where().matches(rows.get(i), lookup)) continue;
      Map<String, Object> next = new LinkedHashMap<>(rows.get(i));
      next.putAll(upd.sets());
      hits.add(i);
      before.add(rows.get(i));
      after.add(next);
    }
    if (hits.isEmpty()) return ExecResult.affected(0);

    List<Map<String, Object>> candidate = new ArrayList<>(rows);
    for (int k = 0; k < hits.size(); k++) candidate.set(hits.get(k), after.get(k));
    for (Map<String, Object> next : after) {
      String dup = duplicate(upd.table(), candidate, next, next);
      if (dup != null) {
        log.debug("relata.memory conflict table={} constraint={}", upd.table(), dup);
        return ExecResult.conflict("duplicate key value violates unique constraint " + upd.table() + dup);
      }
    }
    checkOutgoing(upd.table(), lookup, after, upd.sets().keySet());
    checkIncoming(upd.table(), lookup, before, after);
    for (int k = 0; k < hits.size(); k++) rows.set(hits.get(k), after.get(k));
    return ExecResult.affected(hits.size());
  }

  private ExecResult delete(Map<String, List<Map<String, Object>>> tables,
                            Function<String, List<Map<String, Object>>> lookup,
                            MemoryStatement.Delete del) {
    List<Map<String, Object>> rows = tables.get(del.table());
    List<Map<String, Object>> gone = new ArrayList<>();
    for (Map<String, Object> r : rows) {
      if (del.where().matches(r, lookup)) gone.add(r);
    }
    if (gone.isEmpty()) return ExecResult.affected(0);
    checkIncoming(del.table(), lookup, gone, null);
    Set<Map<String, Object>> drop = Collections.newSetFromMap(new IdentityHashMap<>());
    drop.addAll(gone);
    rows.removeIf(drop::contains);
    return ExecResult.affected(gone.size());
  }

  /** Name of the violated constraint, or null. {@code self} is skipped when comparing. */
  private String duplicate(String table, List<Map<String, Object>> rows, Map<String, Object> row, Map<String, Object> self) {
    for (List<String> u : uniqueFields(table)) {
      List<Object> k = Values.key(u, row);
      if (Values.hasNull(k)) continue;
      for (Map<String, Object> other : rows) {
        if (other == self || other == row) continue;
        if (Values.key(u, other).equals(k)) return u.toString();
      }
    }
    return null;
  }

  private List<List<String>> uniqueFields(String table) {
    Optional<ModelDef> m = modelOf(table);
    if (m.isPresent()) return m.get().uniqueConstraints();
    JoinTableDef jt = schema().joinTable(table).orElseThrow();
    return List.of(List.of(jt.column(), jt.targetColumn()));
  }

  /** Every foreign key held by {@code rows} must point at an existing row. */
  private void checkOutgoing(String table, Function<String, List<Map<String, Object>>> lookup,
                             List<Map<String, Object>> rows, Set<String> changed) {
    for (Ref ref : refs) {
      if (!ref.owner().equals(table)) continue;
      if (changed != null && Collections.disjoint(changed, ref.ownerFields())) continue;
      for (Map<String, Object> row : rows) {
        List<Object> k = Values.key(ref.ownerFields(), row);
        if (Values.hasNull(k)) continue;
        boolean exists = false;
        for (Map<String, Object> target : lookup.apply(ref.referenced())) {
          if (Values.key(ref.referencedFields(), target).equals(k)) {
            exists = true;
            break;
          }
        }
        if (!exists) {
          throw new IllegalStateException("foreign key violation: " + table + ref.ownerFields() + "=" + k
              + " has no matching " + ref.referenced() + ref.referencedFields());
        }
      }
    }
  }

  /** Rows of {@code table} losing their key (deleted, or key changed) must not be referenced anymore. */
  private void checkIncoming(String table, Function<String, List<Map<String, Object>>> lookup,
                             List<Map<String, Object>> before, List<Map<String, Object>> after) {
    for (Ref ref : refs) {
      if (!ref.referenced().equals(table)) continue;
      Set<List<Object>> lost = new HashSet<>();
      for (int i = 0; i < before.size(); i++) {
        List<Object> k = Values.key(ref.referencedFields(), before.get(i));
        if (after == null || !Values.key(ref.referencedFields(), after.get(i)).equals(k)) lost.add(k);
      }
      if (lost.isEmpty()) continue;
      Set<Map<String, Object>> leaving = Collections.newSetFromMap(new IdentityHashMap<>());
      if (after == null && ref.owner().equals(table)) leaving.addAll(before);
      for (Map<String, Object> holder : lookup.apply(ref.owner())) {
        if (leaving.contains(holder)) continue;
        List<Object> k = Values.key(ref.ownerFields(), holder);
        if (lost.contains(k)) {
          throw new IllegalStateException("foreign key violation: " + table + ref.referencedFields() + "=" + k
              + " is still referenced from " + ref.owner() + ref.ownerFields());
        }
      }
    }
  }

  private Object generate(String table, ScalarField f) {
    return switch (f.userTypeId()) {
      case "uuid" -> UUID.randomUUID();
      case "timestamp" -> Instant.now();
      case "int" -> (int) sequences.computeIfAbsent(table + "." + f.name(), k -> new AtomicLong()).incrementAndGet();
      case "string" -> String.valueOf(sequences.computeIfAbsent(table + "." + f.name(), k -> new AtomicLong()).incrementAndGet());
      default -> sequences.computeIfAbsent(table + "." + f.name(), k -> new AtomicLong()).incrementAndGet();
    };
  }

  private Optional<ModelDef> modelOf(String table) {
    if (schema().joinTable(table).isPresent()) return Optional.empty();
    return Optional.of(schema().model(table));
  }

  private Map<String, List<Map<String, Object>>> committedTables() {
    synchronized (lock) {
      return committed;
    }
  }
}

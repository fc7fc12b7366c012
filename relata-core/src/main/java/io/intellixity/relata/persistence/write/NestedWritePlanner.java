package io.intellixity.relata.persistence.write;

import io.intellixity.relata.persistence.error.CardinalityViolationException;
import io.intellixity.relata.persistence.error.ConstraintCycleException;
import io.intellixity.relata.persistence.error.DirectiveValidationException;
import io.intellixity.relata.persistence.filter.RelationFilterTranslator;
import io.intellixity.relata.persistence.plan.*;
import io.intellixity.relata.persistence.query.QueryElement;
import io.intellixity.relata.persistence.query.QueryValidationException;
import io.intellixity.relata.persistence.schema.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Compiles a nested write tree into an ordered {@link WritePlan}.
 *
 * <p>Every directive becomes one or more steps registered in tree order. A step depends on the steps that
 * produce the rows it needs: an insert binding a foreign key waits for the referenced row, a link waits for both
 * ends. Steps are then ordered topologically (Kahn), ties broken by registration order, so sibling directives run
 * in array order.</p>
 *
 * <p>A cycle is only broken through an insert whose foreign key is optional: the insert runs with the key unset
 * and a {@link PatchForeignKey} sets it once the referenced row exists. Otherwise planning fails with
 * {@link ConstraintCycleException}.</p>
 *
 * <p>All legality checks (selectors, cardinality, directive shape) happen here, before any storage call.</p>
 */
public final class NestedWritePlanner {
  private static final Logger log = LoggerFactory.getLogger(NestedWritePlanner.class);

  private final SchemaRegistry schema;
  private final RelationFilterTranslator filters;

  public NestedWritePlanner(SchemaRegistry schema) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.filters = new RelationFilterTranslator(schema);
  }

  public WritePlan planCreate(String model, WriteData data) {
    Objects.requireNonNull(data, "data");
    DirectivePath path = DirectivePath.root(model);
    schema.model(model);
    Build b = new Build(null, new int[1]);
    RowRef root = b.newRef(model);
    Node insert = b.insert(root, checkScalars(model, data, path), path);
    b.registerCreated(root, insert, data.scalars());
    applyRelations(b, root, insert, data, path);
    WritePlan plan = b.finish(root);
    log.debug("relata.plan op=create model={} steps={}", model, plan.steps().size());
    return plan;
  }

  public WritePlan planUpdate(String model, UniqueSelector selector, WriteData data) {
    Objects.requireNonNull(data, "data");
    DirectivePath path = DirectivePath.root(model);
    requireUnique(model, selector, path);
    Build b = new Build(null, new int[1]);
    RowRef root = b.newRef(model);
    b.add(new LookupRow(root, selector, null, path), root);
    Map<String, Object> scalars = checkScalars(model, data, path);
    if (!scalars.isEmpty()) b.add(new UpdateRow(root, scalars, path), root);
    applyRelations(b, root, null, data, path);
    WritePlan plan = b.finish(root);
    log.debug("relata.plan op=update model={} steps={}", model, plan.steps().size());
    return plan;
  }

  // --- directive dispatch ---

  /** {@code parentInsert} is the parent's insert node when the parent is created by this request. */
  private void applyRelations(Build b, RowRef parent, Node parentInsert, WriteData data, DirectivePath path) {
    ModelDef m = schema.model(parent.model());
    for (var e : data.relations().entrySet()) {
      RelationField r = m.relations().get(e.getKey());
      if (r == null) throw new DirectiveValidationException("Unknown relation '" + e.getKey() + "' on model " + m.name(), path);
      List<WriteDirective> directives = e.getValue();
      if (!r.isList() && directives.size() != 1) {
        throw new DirectiveValidationException("Single relation '" + r.name() + "' takes exactly one operation, got " + directives.size(), path);
      }
      for (int i = 0; i < directives.size(); i++) {
        WriteDirective d = directives.get(i);
        DirectivePath p = path.child(r.name(), i, d == null ? "null" : d.kind());
        if (parentInsert != null && !(d instanceof WriteDirective.Create
            || d instanceof WriteDirective.Connect || d instanceof WriteDirective.ConnectOrCreate)) {
          throw new DirectiveValidationException("Only create, connect and connectOrCreate apply to a row being created", p);
        }
        apply(b, parent, parentInsert, r, d, p);
      }
    }
  }

  private void apply(Build b, RowRef parent, Node parentInsert, RelationField r, WriteDirective d, DirectivePath p) {
    if (d instanceof WriteDirective.Create c) {
      planCreateChild(b, parent, parentInsert, r, c.data(), p);
    } else if (d instanceof WriteDirective.Connect c) {
      planConnect(b, parent, parentInsert, r, c.selector(), p);
    } else if (d instanceof WriteDirective.ConnectOrCreate c) {
      planConnectOrCreate(b, parent, parentInsert, r, c, p);
    } else if (d instanceof WriteDirective.Update u) {
      planNestedUpdate(b, parent, r, u, p);
    } else if (d instanceof WriteDirective.Upsert u) {
      planUpsert(b, parent, r, u, p);
    } else if (d instanceof WriteDirective.Delete del) {
      checkDeletable(parent, r, p);
      requireSelectorOnList(r, del.selector(), p);
      b.add(new DeleteLinked(new LinkScope(parent, r.name()), del.selector(), p), null, parent);
    } else if (d instanceof WriteDirective.Disconnect dis) {
      checkDetachable(parent, r, p);
      requireSelectorOnList(r, dis.selector(), p);
      b.add(new DetachLinked(new LinkScope(parent, r.name()), dis.selector(), p), null, parent);
    } else if (d instanceof WriteDirective.SetMembers s) {
      requireList(r, "set", p);
      for (UniqueSelector sel : s.members()) requireUnique(r.target(), sel, p);
      b.add(new ReplaceMembers(new LinkScope(parent, r.name()), s.members(), p), null, parent);
    } else if (d instanceof WriteDirective.UpdateMany u) {
      requireList(r, "updateMany", p);
      if (!u.data().relations().isEmpty()) throw new DirectiveValidationException("updateMany only sets scalar fields", p);
      Map<String, Object> values = checkScalars(r.target(), u.data(), p);
      b.add(new UpdateLinkedMany(new LinkScope(parent, r.name()), filter(r.target(), u.filter(), p), values, p), null, parent);
    } else if (d instanceof WriteDirective.DeleteMany dm) {
      requireList(r, "deleteMany", p);
      b.add(new DeleteLinkedMany(new LinkScope(parent, r.name()), filter(r.target(), dm.filter(), p), p), null, parent);
    } else {
      throw new DirectiveValidationException("Unsupported write directive: " + (d == null ? "null" : d.getClass().getName()), p);
    }
  }

  private void planCreateChild(Build b, RowRef parent, Node parentInsert, RelationField r, WriteData data, DirectivePath p) {
    RowRef child = b.newRef(r.target());
    Node insert = b.insert(child, checkScalars(r.target(), data, p), p);
    b.registerCreated(child, insert, data.scalars());
    link(b, parent, parentInsert, r, child, insert, p);
    applyRelations(b, child, insert, data, p);
  }

  private void planConnect(Build b, RowRef parent, Node parentInsert, RelationField r, UniqueSelector selector, DirectivePath p) {
    requireUnique(r.target(), selector, p);
    Created same = b.findCreated(r.target(), selector);
    if (same != null) {
      log.trace("relata.plan in-plan reference {} for {} at {}", same.ref, selector, p);
      link(b, parent, parentInsert, r, same.ref, same.insert, p);
      return;
    }
    RowRef child = b.newRef(r.target());
    b.add(new LookupRow(child, selector, null, p), child);
    link(b, parent, parentInsert, r, child, null, p);
  }

  private void planConnectOrCreate(Build b, RowRef parent, Node parentInsert, RelationField r,
                                   WriteDirective.ConnectOrCreate c, DirectivePath p) {
    requireUnique(r.target(), c.selector(), p);
    RowRef child = b.newRef(r.target());

    Build branch = new Build(b, b.counter);
    Node insert = branch.insert(child, checkScalars(r.target(), c.create(), p), p);
    branch.registerCreated(child, insert, c.create().scalars());
    if (r.ownership() == Ownership.TARGET) bindToParent(branch, parent, parentInsert, r, insert);
    applyRelations(branch, child, insert, c.create(), p);
    WritePlan createBranch = branch.finish(child);

    b.addBranch(new ResolveOrCreate(child, c.selector(), createBranch, p), child, branch);
    link(b, parent, parentInsert, r, child, null, p);
  }

  private void planNestedUpdate(Build b, RowRef parent, RelationField r, WriteDirective.Update u, DirectivePath p) {
    requireSelectorOnList(r, u.selector(), p);
    if (u.selector() != null) requireUnique(r.target(), u.selector(), p);
    RowRef child = b.newRef(r.target());
    b.add(new LookupRow(child, u.selector(), new LinkScope(parent, r.name()), p), child, parent);
    Map<String, Object> scalars = checkScalars(r.target(), u.data(), p);
    if (!scalars.isEmpty()) b.add(new UpdateRow(child, scalars, p), child);
    applyRelations(b, child, null, u.data(), p);
  }

  private void planUpsert(Build b, RowRef parent, RelationField r, WriteDirective.Upsert u, DirectivePath p) {
    requireSelectorOnList(r, u.selector(), p);
    if (u.selector() != null) requireUnique(r.target(), u.selector(), p);
    RowRef child = b.newRef(r.target());

    Build create = new Build(b, b.counter);
    Node insert = create.insert(child, checkScalars(r.target(), u.create(), p), p);
    create.registerCreated(child, insert, u.create().scalars());
    if (r.ownership() == Ownership.TARGET) bindToParent(create, parent, null, r, insert);
    applyRelations(create, child, insert, u.create(), p);

    Build update = new Build(b, b.counter);
    update.assume(child);
    Map<String, Object> scalars = checkScalars(r.target(), u.update(), p);
    if (!scalars.isEmpty()) update.add(new UpdateRow(child, scalars, p), child);
    applyRelations(update, child, null, u.update(), p);

    UpsertRow step = new UpsertRow(child, u.selector(), new LinkScope(parent, r.name()), create.finish(child), update.finish(child), p);
    b.addBranch(step, child, create, update);
    b.dependsOn(b.producer(child), parent);
    // A created row owned by its target is bound on insert; a found row is already linked.
    if (r.ownership() != Ownership.TARGET) link(b, parent, null, r, child, null, p);
  }

  // --- linking ---

  /**
   * Records the link between {@code parent} and {@code child} through {@code r}: a key binding on whichever row
   * is being inserted and owns the key, a key patch on an existing owner, or a join row.
   */
  private void link(Build b, RowRef parent, Node parentInsert, RelationField r, RowRef child, Node childInsert, DirectivePath p) {
    switch (r.ownership()) {
      case SELF -> {
        ForeignKeyLink fk = schema.foreignKey(parent.model(), r.name());
        boolean exclusive = fk.unique() && childInsert == null;
        if (parentInsert != null) {
          parentInsert.bindings.add(new FkBinding(r.fields(), child, r.references(), exclusive));
          b.dependsOn(parentInsert, child);
        } else {
          b.add(new PatchForeignKey(parent, r.fields(), child, r.references(), exclusive, p), null, parent, child);
        }
      }
      case TARGET -> {
        if (childInsert != null) {
          bindToParent(b, parent, parentInsert, r, childInsert);
        } else {
          RelationField inv = schema.relation(r.target(), r.inverse());
          boolean exclusive = inv.cardinality() == Cardinality.ONE_TO_ONE;
          b.add(new PatchForeignKey(child, inv.fields(), parent, inv.references(), exclusive, p), null, parent, child);
        }
      }
      case JOIN_TABLE -> b.add(new LinkJoinRow(r.joinTable(), parent, child, p), null, parent, child);
    }
  }

  /** The inserted child stores the key of {@code parent}. */
  private void bindToParent(Build b, RowRef parent, Node parentInsert, RelationField r, Node childInsert) {
    RelationField inv = schema.relation(r.target(), r.inverse());
    boolean exclusive = inv.cardinality() == Cardinality.ONE_TO_ONE && parentInsert == null;
    childInsert.bindings.add(new FkBinding(inv.fields(), parent, inv.references(), exclusive));
    b.dependsOn(childInsert, parent);
  }

  // --- legality ---

  private void checkDetachable(RowRef parent, RelationField r, DirectivePath p) {
    if (r.ownership() == Ownership.JOIN_TABLE) return;
    ForeignKeyLink fk = schema.foreignKey(parent.model(), r.name());
    if (!fk.nullable()) {
      throw new CardinalityViolationException("Cannot disconnect " + parent.model() + "." + r.name()
          + ": foreign key " + fk.ownerModel() + fk.ownerFields() + " is required", p);
    }
  }

  private void checkDeletable(RowRef parent, RelationField r, DirectivePath p) {
    if (r.isList()) return;
    boolean ok = r.optional();
    if (ok && r.ownership() == Ownership.SELF) ok = schema.foreignKey(parent.model(), r.name()).nullable();
    if (!ok) {
      throw new CardinalityViolationException("Cannot delete the required related row of " + parent.model() + "." + r.name(), p);
    }
  }

  private static void requireList(RelationField r, String kind, DirectivePath p) {
    if (!r.isList()) throw new DirectiveValidationException(kind + " only applies to list relations, not '" + r.name() + "'", p);
  }

  private static void requireSelectorOnList(RelationField r, UniqueSelector selector, DirectivePath p) {
    if (r.isList() && selector == null) {
      throw new DirectiveValidationException("A selector is required on list relation '" + r.name() + "'", p);
    }
  }

  private void requireUnique(String model, UniqueSelector selector, DirectivePath p) {
    if (selector == null) throw new DirectiveValidationException("A unique selector is required for " + model, p);
    ModelDef m = schema.model(model);
    for (String f : selector.fields()) {
      if (!m.hasScalar(f)) throw new DirectiveValidationException("Unknown selector field '" + f + "' on model " + model, p);
    }
    if (!schema.isUniqueSelector(model, selector)) {
      throw new DirectiveValidationException("Selector " + selector.fields() + " is not a unique constraint of " + model
          + "; declared: " + schema.uniqueConstraints(model), p);
    }
  }

  private Map<String, Object> checkScalars(String model, WriteData data, DirectivePath p) {
    ModelDef m = schema.model(model);
    for (String f : data.scalars().keySet()) {
      if (m.hasRelation(f)) throw new DirectiveValidationException("Relation '" + f + "' of " + model + " needs an operation object", p);
      if (!m.hasScalar(f)) throw new DirectiveValidationException("Unknown field '" + f + "' on model " + model, p);
      if (data.scalars().get(f) == null && !m.scalar(f).optional()) {
        throw new DirectiveValidationException("Field '" + f + "' of " + model + " is required", p);
      }
    }
    return data.scalars();
  }

  private QueryElement filter(String model, QueryElement f, DirectivePath p) {
    try {
      return filters.translate(model, f);
    } catch (QueryValidationException e) {
      throw new DirectiveValidationException(e.getMessage(), p);
    }
  }

  // --- graph ---

  private static final class Node {
    final int seq;
    PlanStep step;
    final List<FkBinding> bindings = new ArrayList<>();
    final Set<Node> deps = new LinkedHashSet<>();

    Node(int seq, PlanStep step) {
      this.seq = seq;
      this.step = step;
    }

    /** Step with the bindings collected so far. */
    PlanStep build() {
      if (step instanceof InsertRow ins) return new InsertRow(ins.row(), ins.values(), bindings, ins.path());
      return step;
    }
  }

  private record Created(RowRef ref, Node insert, Map<String, Object> values) {}

  /** Per-request (or per-branch) planning state. Branches see the rows created unconditionally above them. */
  private final class Build {
    final Build outer;
    final int[] counter;
    final List<Node> nodes = new ArrayList<>();
    final Map<RowRef, Node> producers = new HashMap<>();
    final Set<RowRef> assumed = new HashSet<>();
    final Set<RowRef> externals = new LinkedHashSet<>();
    final List<Created> created = new ArrayList<>();
    int seq;

    Build(Build outer, int[] counter) {
      this.outer = outer;
      this.counter = counter;
    }

    RowRef newRef(String model) {
      return new RowRef(counter[0]++, model);
    }

    /** Row materialized by the step owning this branch before the branch runs. */
    void assume(RowRef ref) {
      assumed.add(ref);
    }

    Node insert(RowRef ref, Map<String, Object> values, DirectivePath path) {
      return add(new InsertRow(ref, values, List.of(), path), ref);
    }

    /** Registers a step producing {@code produces} (may be null) that needs {@code requires}. */
    Node add(PlanStep step, RowRef produces, RowRef... requires) {
      Node n = new Node(seq++, step);
      for (RowRef r : requires) dependsOn(n, r);
      if (produces != null) {
        Node previous = producers.get(produces);
        if (previous != null) n.deps.add(previous);
        producers.put(produces, n);
      }
      nodes.add(n);
      return n;
    }

    Node addBranch(PlanStep step, RowRef produces, Build... branches) {
      Node n = add(step, produces);
      for (Build br : branches) {
        for (RowRef ext : br.externals) {
          if (!ext.equals(produces)) dependsOn(n, ext);
        }
      }
      return n;
    }

    void dependsOn(Node n, RowRef ref) {
      Node p = producer(ref);
      if (p != null && p != n) n.deps.add(p);
    }

    Node producer(RowRef ref) {
      Node p = producers.get(ref);
      if (p == null && !assumed.contains(ref) && outer != null) externals.add(ref);
      return p;
    }

    void registerCreated(RowRef ref, Node insert, Map<String, Object> values) {
      created.add(new Created(ref, insert, values));
    }

    Created findCreated(String model, UniqueSelector selector) {
      for (Build x = this; x != null; x = x.outer) {
        for (Created c : x.created) {
          if (c.ref.model().equals(model) && selector.matches(c.values)) {
            // rows created in an enclosing scope can be linked, not bound from a branch
            return x == this ? c : new Created(c.ref, null, c.values);
          }
        }
      }
      return null;
    }

    WritePlan finish(RowRef root) {
      for (Node n : nodes) n.step = n.build();
      checkRequired();
      while (true) {
        List<PlanStep> ordered = sort();
        if (ordered != null) return new WritePlan(root, ordered);
        breakCycle();
      }
    }

    private void checkRequired() {
      for (Node n : nodes) {
        if (!(n.step instanceof InsertRow ins)) continue;
        ModelDef m = schema.model(ins.row().model());
        Set<String> bound = new HashSet<>(ins.values().keySet());
        for (FkBinding fb : ins.foreignKeys()) bound.addAll(fb.fields());
        for (ScalarField f : m.fields().values()) {
          if (!f.optional() && !f.autoGenerated() && !bound.contains(f.name())) {
            throw new DirectiveValidationException("Missing required field '" + f.name() + "' for " + m.name(), ins.path());
          }
        }
      }
    }

    /** Kahn's algorithm with registration order as tie-break; null if a cycle remains. */
    private List<PlanStep> sort() {
      Map<Node, Integer> pending = new HashMap<>();
      Map<Node, List<Node>> dependents = new HashMap<>();
      for (Node n : nodes) {
        pending.put(n, n.deps.size());
        for (Node d : n.deps) dependents.computeIfAbsent(d, k -> new ArrayList<>()).add(n);
      }
      PriorityQueue<Node> ready = new PriorityQueue<>(Comparator.comparingInt(x -> x.seq));
      for (Node n : nodes) if (n.deps.isEmpty()) ready.add(n);

      List<PlanStep> out = new ArrayList<>(nodes.size());
      while (!ready.isEmpty()) {
        Node n = ready.poll();
        out.add(n.step);
        for (Node d : dependents.getOrDefault(n, List.of())) {
          if (pending.merge(d, -1, Integer::sum) == 0) ready.add(d);
        }
      }
      return out.size() == nodes.size() ? out : null;
    }

    /** Splits the earliest insert on the cycle whose key to another cycle row is optional. */
    private void breakCycle() {
      Set<Node> stuck = new LinkedHashSet<>(nodes);
      boolean changed = true;
      while (changed) {
        changed = false;
        for (Node n : sort0(stuck)) {
          stuck.remove(n);
          changed = true;
        }
        // drop rows nothing on the cycle waits for
        Set<Node> needed = new HashSet<>();
        for (Node n : stuck) for (Node d : n.deps) if (stuck.contains(d)) needed.add(d);
        if (stuck.retainAll(needed)) changed = true;
      }

      Node victim = null;
      FkBinding cut = null;
      for (Node n : stuck) {
        if (!(n.step instanceof InsertRow ins)) continue;
        ModelDef m = schema.model(ins.row().model());
        for (FkBinding fb : ins.foreignKeys()) {
          Node ref = producers.get(fb.referenced());
          boolean optional = fb.fields().stream().allMatch(f -> m.scalar(f).optional());
          if (optional && ref != null && stuck.contains(ref) && (victim == null || n.seq < victim.seq)) {
            victim = n;
            cut = fb;
            break;
          }
        }
      }
      if (victim == null) {
        Node first = stuck.stream().min(Comparator.comparingInt(x -> x.seq)).orElse(nodes.get(0));
        List<String> rows = new ArrayList<>();
        for (Node n : stuck) rows.add(n.step.describe());
        throw new ConstraintCycleException("Required foreign keys form a cycle: " + rows, first.step.path());
      }

      InsertRow ins = (InsertRow) victim.step;
      List<FkBinding> kept = new ArrayList<>(ins.foreignKeys());
      kept.remove(cut);
      victim.step = new InsertRow(ins.row(), ins.values(), kept, ins.path());
      RowRef cutRef = cut.referenced();
      Node refProducer = producers.get(cutRef);
      if (kept.stream().noneMatch(fb -> fb.referenced().equals(cutRef))) victim.deps.remove(refProducer);

      boolean exclusive = schema.model(ins.row().model()).isUnique(cut.fields());
      Node patch = new Node(seq++, new PatchForeignKey(ins.row(), cut.fields(), cut.referenced(), cut.referencedFields(), exclusive, ins.path()));
      patch.deps.add(victim);
      patch.deps.add(refProducer);
      nodes.add(patch);
      log.debug("relata.plan cycle split row={} fields={} ref={}", ins.row(), cut.fields(), cut.referenced());
    }

    /** Nodes of {@code set} with no dependency inside {@code set}. */
    private List<Node> sort0(Set<Node> set) {
      List<Node> free = new ArrayList<>();
      for (Node n : set) {
        boolean blocked = false;
        for (Node d : n.deps) if (set.contains(d)) { blocked = true; break; }
        if (!blocked) free.add(n);
      }
      return free;
    }
  }
}

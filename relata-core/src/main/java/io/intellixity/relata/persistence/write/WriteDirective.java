package io.intellixity.relata.persistence.write;

import io.intellixity.relata.persistence.query.QueryElement;
import io.intellixity.relata.persistence.schema.UniqueSelector;

import java.util.List;
import java.util.Objects;

/**
 * Operation applied to a relation field inside a create or update payload.
 * <p>
 * The planner dispatches on the concrete record type; anything else is rejected.
 */
public interface WriteDirective {
  /** Wire name of the operation, e.g. {@code connectOrCreate}. */
  String kind();

  record Create(WriteData data) implements WriteDirective {
    public Create { Objects.requireNonNull(data, "data"); }
    @Override public String kind() { return "create"; }
  }

  record Connect(UniqueSelector selector) implements WriteDirective {
    public Connect { Objects.requireNonNull(selector, "selector"); }
    @Override public String kind() { return "connect"; }
  }

  record ConnectOrCreate(UniqueSelector selector, WriteData create) implements WriteDirective {
    public ConnectOrCreate {
      Objects.requireNonNull(selector, "selector");
      Objects.requireNonNull(create, "create");
    }
    @Override public String kind() { return "connectOrCreate"; }
  }

  /** Selector may be null on single relations: the linked row is updated. */
  record Update(UniqueSelector selector, WriteData data) implements WriteDirective {
    public Update { Objects.requireNonNull(data, "data"); }
    @Override public String kind() { return "update"; }
  }

  record Upsert(UniqueSelector selector, WriteData create, WriteData update) implements WriteDirective {
    public Upsert {
      Objects.requireNonNull(create, "create");
      Objects.requireNonNull(update, "update");
    }
    @Override public String kind() { return "upsert"; }
  }

  record Delete(UniqueSelector selector) implements WriteDirective {
    @Override public String kind() { return "delete"; }
  }

  record Disconnect(UniqueSelector selector) implements WriteDirective {
    @Override public String kind() { return "disconnect"; }
  }

  record SetMembers(List<UniqueSelector> members) implements WriteDirective {
    public SetMembers { members = List.copyOf(members); }
    @Override public String kind() { return "set"; }
  }

  /** Scalar-only update of the linked rows matching {@code filter} (all linked rows when null). */
  record UpdateMany(QueryElement filter, WriteData data) implements WriteDirective {
    public UpdateMany { Objects.requireNonNull(data, "data"); }
    @Override public String kind() { return "updateMany"; }
  }

  record DeleteMany(QueryElement filter) implements WriteDirective {
    @Override public String kind() { return "deleteMany"; }
  }

  static WriteDirective create(WriteData data) { return new Create(data); }
  static WriteDirective connect(UniqueSelector selector) { return new Connect(selector); }
  static WriteDirective connectOrCreate(UniqueSelector selector, WriteData create) { return new ConnectOrCreate(selector, create); }
  static WriteDirective update(UniqueSelector selector, WriteData data) { return new Update(selector, data); }
  static WriteDirective update(WriteData data) { return new Update(null, data); }
  static WriteDirective upsert(UniqueSelector selector, WriteData create, WriteData update) { return new Upsert(selector, create, update); }
  static WriteDirective delete(UniqueSelector selector) { return new Delete(selector); }
  static WriteDirective disconnect(UniqueSelector selector) { return new Disconnect(selector); }
  static WriteDirective set(UniqueSelector... members) { return new SetMembers(List.of(members)); }
  static WriteDirective updateMany(QueryElement filter, WriteData data) { return new UpdateMany(filter, data); }
  static WriteDirective deleteMany(QueryElement filter) { return new DeleteMany(filter); }
}

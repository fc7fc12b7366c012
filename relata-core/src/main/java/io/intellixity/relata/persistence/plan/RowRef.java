package io.intellixity.relata.persistence.plan;

import java.util.Objects;

/** Symbolic row of a write plan; materialized by the runner when the producing step executes. */
public record RowRef(int id, String model) {
  public RowRef {
    Objects.requireNonNull(model, "model");
  }

  @Override
  public String toString() {
    return model + "#" + id;
  }
}

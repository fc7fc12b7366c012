package io.intellixity.relata.persistence.plan;

import java.util.List;

/** Points the foreign key fields of an existing row at {@code referenced}. */
public record PatchForeignKey(RowRef owner, List<String> fields, RowRef referenced, List<String> referencedFields,
                              boolean exclusive, DirectivePath path) implements PlanStep {
  public PatchForeignKey {
    fields = List.copyOf(fields);
    referencedFields = List.copyOf(referencedFields);
  }

  @Override
  public String describe() {
    return "patch " + owner + "." + String.join(",", fields) + " -> " + referenced + (exclusive ? "!" : "");
  }
}

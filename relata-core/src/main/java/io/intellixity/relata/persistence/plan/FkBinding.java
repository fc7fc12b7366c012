package io.intellixity.relata.persistence.plan;

import java.util.List;

/**
 * Foreign key fields of an inserted row, filled from the {@code referencedFields} of {@code referenced}.
 *
 * @param exclusive one-to-one link to a pre-existing row: a previous holder is detached first
 */
public record FkBinding(List<String> fields, RowRef referenced, List<String> referencedFields, boolean exclusive) {
  public FkBinding {
    fields = List.copyOf(fields);
    referencedFields = List.copyOf(referencedFields);
  }

  @Override
  public String toString() {
    return fields + "->" + referenced + (exclusive ? "!" : "");
  }
}

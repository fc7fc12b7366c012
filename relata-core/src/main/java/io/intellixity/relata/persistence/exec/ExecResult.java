package io.intellixity.relata.persistence.exec;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one primitive operation.
 *
 * @param affected rows inserted, updated or deleted
 * @param generatedKeys one map of returned fields per inserted row
 * @param conflict storage rejected the operation because of a unique constraint; nothing was applied
 * @param conflictDetail backend message for a conflict, for diagnostics
 */
public record ExecResult(long affected, List<Map<String, Object>> generatedKeys, boolean conflict, String conflictDetail) {
  public ExecResult {
    generatedKeys = generatedKeys == null ? List.of() : List.copyOf(generatedKeys);
  }

  public static ExecResult affected(long count) {
    return new ExecResult(count, List.of(), false, null);
  }

  public static ExecResult inserted(Map<String, Object> keys) {
    return new ExecResult(1, List.of(keys), false, null);
  }

  public static ExecResult conflict(String detail) {
    return new ExecResult(0, List.of(), true, detail);
  }

  /** Returned fields of the single inserted row, or an empty map. */
  public Map<String, Object> firstKeys() {
    return generatedKeys.isEmpty() ? Map.of() : generatedKeys.get(0);
  }
}

package io.intellixity.relata.persistence.memory;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Compiled filter with SQL three-valued logic: {@code TRUE}, {@code FALSE} or {@code null} (unknown).
 * Only rows evaluating to {@code TRUE} match. Sub-queries read other tables through {@code tables}.
 */
@FunctionalInterface
public interface RowPredicate {
  RowPredicate ALWAYS = (row, tables) -> Boolean.TRUE;

  Boolean test(Map<String, Object> row, Function<String, List<Map<String, Object>>> tables);

  default boolean matches(Map<String, Object> row, Function<String, List<Map<String, Object>>> tables) {
    return Boolean.TRUE.equals(test(row, tables));
  }
}

package io.intellixity.relata.persistence.query;

import java.util.Locale;
import java.util.Objects;

/** One ordering key; nulls sort first ascending and last descending, in every backend. */
public record SortField(String field, Direction direction) {
  public SortField {
    Objects.requireNonNull(field, "field");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public static SortField asc(String field) { return new SortField(field, Direction.ASC); }
  public static SortField desc(String field) { return new SortField(field, Direction.DESC); }

  public enum Direction {
    ASC, DESC;

    /** Case-insensitive {@code asc}/{@code desc}; null means ascending. */
    public static Direction parse(String s) {
      if (s == null) return ASC;
      switch (s.trim().toLowerCase(Locale.ROOT)) {
        case "asc": return ASC;
        case "desc": return DESC;
        default: throw new QueryValidationException("Sort direction must be asc or desc, got '" + s + "'");
      }
    }
  }
}

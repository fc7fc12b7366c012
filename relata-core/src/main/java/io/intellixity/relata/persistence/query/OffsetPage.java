package io.intellixity.relata.persistence.query;

/** Offset/limit window over an ordered result. */
public record OffsetPage(int offset, int limit) implements Page {
  public static final int DEFAULT_LIMIT = 50;

  public OffsetPage {
    if (limit <= 0) throw new QueryValidationException("page limit must be > 0, got " + limit);
    if (offset < 0) throw new QueryValidationException("page offset must be >= 0, got " + offset);
  }

  public static OffsetPage first(int limit) {
    return new OffsetPage(0, limit);
  }

  /** Missing parts fall back to offset 0 and {@link #DEFAULT_LIMIT}. */
  public static OffsetPage of(Integer offset, Integer limit) {
    return new OffsetPage(offset == null ? 0 : offset, limit == null ? DEFAULT_LIMIT : limit);
  }

  public OffsetPage next() {
    return new OffsetPage(offset + limit, limit);
  }
}

package io.intellixity.strata.query;

/**
 * Row limit of a query. An absent limit ({@link #unspecified()}) gets the compiler's default bound,
 * while an explicit null ({@link #unbounded()}) disables the bound entirely.
 */
public record RowLimit(Kind kind, int value) {
  private static final RowLimit UNSPECIFIED = new RowLimit(Kind.UNSPECIFIED, 0);
  private static final RowLimit UNBOUNDED = new RowLimit(Kind.UNBOUNDED, 0);

  public enum Kind { UNSPECIFIED, UNBOUNDED, BOUNDED }

  public RowLimit {
    if (kind == null) throw new IllegalArgumentException("kind is required");
    if (value < 0) throw new IllegalArgumentException("limit must be >= 0: " + value);
  }

  public static RowLimit unspecified() { return UNSPECIFIED; }
  public static RowLimit unbounded() { return UNBOUNDED; }
  public static RowLimit of(int n) { return new RowLimit(Kind.BOUNDED, n); }

  public boolean isUnspecified() { return kind == Kind.UNSPECIFIED; }
  public boolean isUnbounded() { return kind == Kind.UNBOUNDED; }
  public boolean isBounded() { return kind == Kind.BOUNDED; }

  /** Effective bound, or {@code null} when no bound applies. */
  public Integer resolve(int defaultLimit) {
    if (kind == Kind.UNBOUNDED) return null;
    if (kind == Kind.UNSPECIFIED) return defaultLimit;
    return value;
  }

  /**
   * Lenient conversion of a raw JSON value that was present in the request.\n
   * null means unbounded; a non-negative number (or numeric string) is a bound; anything else is treated as absent.
   */
  public static RowLimit lenient(Object raw) {
    if (raw == null) return UNBOUNDED;
    Integer n = lenientInt(raw);
    return n == null ? UNSPECIFIED : of(n);
  }

  /** Non-negative int from a number or numeric string, else {@code null}. */
  public static Integer lenientInt(Object raw) {
    if (raw instanceof Number num) {
      long v = num.longValue();
      if (v < 0 || v > Integer.MAX_VALUE || num.doubleValue() != v) return null;
      return (int) v;
    }
    if (raw instanceof String s) {
      try {
        int v = Integer.parseInt(s.trim());
        return v < 0 ? null : v;
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }
}

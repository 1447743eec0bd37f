package io.intellixity.strata.interval;

import java.util.*;

/**
 * Parsed interval: a magnitude per explicitly mentioned unit. Units never mentioned read as zero.
 */
public final class Interval {
  private static final Interval EMPTY = new Interval(new EnumMap<>(IntervalUnit.class));

  private final EnumMap<IntervalUnit, Integer> magnitudes;

  private Interval(EnumMap<IntervalUnit, Integer> magnitudes) {
    this.magnitudes = magnitudes;
  }

  public static Interval empty() { return EMPTY; }

  public static Interval of(Map<IntervalUnit, Integer> magnitudes) {
    EnumMap<IntervalUnit, Integer> m = new EnumMap<>(IntervalUnit.class);
    if (magnitudes != null) {
      for (Map.Entry<IntervalUnit, Integer> e : magnitudes.entrySet()) {
        m.put(Objects.requireNonNull(e.getKey(), "unit"), Objects.requireNonNull(e.getValue(), "magnitude"));
      }
    }
    return new Interval(m);
  }

  public static Interval of(int magnitude, IntervalUnit unit) {
    return of(Map.of(unit, magnitude));
  }

  public int get(IntervalUnit unit) { return magnitudes.getOrDefault(unit, 0); }

  /** {@code year*12 + quarter*3 + month}. */
  public int calendarMonths() {
    int total = 0;
    for (Map.Entry<IntervalUnit, Integer> e : magnitudes.entrySet()) {
      if (e.getKey().isCalendar()) total = Math.addExact(total, Math.multiplyExact(e.getKey().months(), e.getValue()));
    }
    return total;
  }

  /** Duration units with a non-zero magnitude, ordered day, hour, minute, second. */
  public Map<IntervalUnit, Integer> durationTerms() {
    EnumMap<IntervalUnit, Integer> out = new EnumMap<>(IntervalUnit.class);
    for (Map.Entry<IntervalUnit, Integer> e : magnitudes.entrySet()) {
      if (!e.getKey().isCalendar() && e.getValue() != 0) out.put(e.getKey(), e.getValue());
    }
    return out;
  }

  public boolean isZero() {
    return calendarMonths() == 0 && durationTerms().isEmpty();
  }

  public Interval negate() {
    EnumMap<IntervalUnit, Integer> m = new EnumMap<>(IntervalUnit.class);
    for (Map.Entry<IntervalUnit, Integer> e : magnitudes.entrySet()) m.put(e.getKey(), Math.negateExact(e.getValue()));
    return new Interval(m);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Interval other && magnitudes.equals(other.magnitudes);
  }

  @Override
  public int hashCode() { return magnitudes.hashCode(); }

  /** Canonical text, e.g. {@code 1 year 2 day}; parses back to an equal interval. */
  @Override
  public String toString() {
    StringJoiner sj = new StringJoiner(" ");
    for (Map.Entry<IntervalUnit, Integer> e : magnitudes.entrySet()) sj.add(e.getValue() + " " + e.getKey().id());
    return sj.toString();
  }
}

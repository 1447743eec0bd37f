package io.intellixity.strata.interval;

import java.util.Locale;

/**
 * Units accepted in interval text. Calendar units fold into a month count; duration units are emitted
 * one term each, in declaration order (day, hour, minute, second).
 */
public enum IntervalUnit {
  YEAR(12),
  QUARTER(3),
  MONTH(1),
  DAY(0),
  HOUR(0),
  MINUTE(0),
  SECOND(0);

  private final int months;

  IntervalUnit(int months) {
    this.months = months;
  }

  public boolean isCalendar() { return months > 0; }

  /** Months per unit for calendar units, 0 for duration units. */
  public int months() { return months; }

  /** Upper-case SQL keyword: {@code DAY}, {@code HOUR}, ... */
  public String sqlName() { return name(); }

  public String id() { return name().toLowerCase(Locale.ROOT); }

  /** Case-insensitive, singular or plural ({@code Days}, {@code hour}). Returns null when unrecognized. */
  public static IntervalUnit fromToken(String token) {
    if (token == null) return null;
    String t = token.trim().toUpperCase(Locale.ROOT);
    if (t.endsWith("S") && t.length() > 1) t = t.substring(0, t.length() - 1);
    for (IntervalUnit u : values()) {
      if (u.name().equals(t)) return u;
    }
    return null;
  }
}

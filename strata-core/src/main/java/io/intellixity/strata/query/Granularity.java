package io.intellixity.strata.query;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

public enum Granularity {
  SECOND,
  MINUTE,
  HOUR,
  DAY,
  WEEK,
  MONTH,
  QUARTER,
  YEAR;

  /** Lower-case id used in JSON and in member aliases ({@code visitors__created_at_day}). */
  public String id() { return name().toLowerCase(Locale.ROOT); }

  public static Granularity fromId(String id) {
    if (id == null || id.isBlank()) return null;
    try {
      return Granularity.valueOf(id.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new QueryValidationException("Unknown granularity: " + id, e);
    }
  }

  /** Start of the bucket that contains {@code t}. Weeks start on Monday (ISO). */
  public LocalDateTime truncate(LocalDateTime t) {
    switch (this) {
      case SECOND: return t.truncatedTo(ChronoUnit.SECONDS);
      case MINUTE: return t.truncatedTo(ChronoUnit.MINUTES);
      case HOUR: return t.truncatedTo(ChronoUnit.HOURS);
      case DAY: return t.truncatedTo(ChronoUnit.DAYS);
      case WEEK: return t.truncatedTo(ChronoUnit.DAYS).with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
      case MONTH: return t.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1);
      case QUARTER: {
        int firstMonth = ((t.getMonthValue() - 1) / 3) * 3 + 1;
        return t.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1).withMonth(firstMonth);
      }
      case YEAR: return t.truncatedTo(ChronoUnit.DAYS).withDayOfYear(1);
      default: throw new IllegalStateException("Unhandled granularity: " + this);
    }
  }

  /** Start of the bucket following the one that starts at {@code bucketStart}. */
  public LocalDateTime next(LocalDateTime bucketStart) {
    switch (this) {
      case SECOND: return bucketStart.plusSeconds(1);
      case MINUTE: return bucketStart.plusMinutes(1);
      case HOUR: return bucketStart.plusHours(1);
      case DAY: return bucketStart.plusDays(1);
      case WEEK: return bucketStart.plusWeeks(1);
      case MONTH: return bucketStart.plusMonths(1);
      case QUARTER: return bucketStart.plusMonths(3);
      case YEAR: return bucketStart.plusYears(1);
      default: throw new IllegalStateException("Unhandled granularity: " + this);
    }
  }
}

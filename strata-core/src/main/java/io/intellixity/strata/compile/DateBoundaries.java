package io.intellixity.strata.compile;

import io.intellixity.strata.query.QueryValidationException;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Normalizes date-range bounds into the UTC literal form bound as parameters:
 * {@code 2024-02-01T00:00:00.000Z}.
 */
public final class DateBoundaries {
  public static final DateTimeFormatter UTC_MILLIS = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'");
  public static final DateTimeFormatter LOCAL_MILLIS = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS");

  private DateBoundaries() {}

  /** Lower bound: a date-only value starts at {@code 00:00:00.000} in {@code zone}. */
  public static String startOf(String bound, ZoneId zone) {
    return UTC_MILLIS.format(toUtc(parseStart(bound), bound, zone));
  }

  /** Upper bound: a date-only value ends at {@code 23:59:59.999} in {@code zone}. */
  public static String endOf(String bound, ZoneId zone) {
    return UTC_MILLIS.format(toUtc(parseEnd(bound), bound, zone));
  }

  public static LocalDateTime parseStart(String bound) {
    String b = requireBound(bound);
    if (isDateOnly(b)) return parseDate(b).atStartOfDay();
    return localOf(b).truncatedTo(ChronoUnit.MILLIS);
  }

  public static LocalDateTime parseEnd(String bound) {
    String b = requireBound(bound);
    if (isDateOnly(b)) return parseDate(b).atTime(LocalTime.of(23, 59, 59, 999_000_000));
    LocalDateTime t = localOf(b);
    // Second-precision upper bounds cover the whole second
    if (t.getNano() == 0 && !hasFraction(b)) t = t.plusNanos(999_000_000);
    return t.truncatedTo(ChronoUnit.MILLIS);
  }

  public static ZoneId zone(String timezone) {
    try {
      return ZoneId.of(timezone == null || timezone.isBlank() ? "UTC" : timezone);
    } catch (DateTimeException e) {
      throw new QueryValidationException("Unknown timezone: " + timezone, e);
    }
  }

  private static LocalDateTime toUtc(LocalDateTime local, String bound, ZoneId zone) {
    // Bounds that carry their own offset are already absolute
    if (hasOffset(bound)) return local;
    return local.atZone(zone).withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
  }

  private static LocalDateTime localOf(String b) {
    try {
      if (hasOffset(b)) return OffsetDateTime.parse(b).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
      return LocalDateTime.parse(b);
    } catch (DateTimeParseException e) {
      throw new QueryValidationException("Invalid date: " + b, e);
    }
  }

  private static LocalDate parseDate(String b) {
    try {
      return LocalDate.parse(b);
    } catch (DateTimeParseException e) {
      throw new QueryValidationException("Invalid date: " + b, e);
    }
  }

  private static String requireBound(String bound) {
    if (bound == null || bound.isBlank()) throw new QueryValidationException("Date bound is required");
    return bound.trim();
  }

  private static boolean isDateOnly(String b) { return b.indexOf('T') < 0 && b.length() <= 10; }

  private static boolean hasFraction(String b) { return b.indexOf('.') > 0; }

  private static boolean hasOffset(String b) {
    int t = b.indexOf('T');
    if (t < 0) return false;
    String time = b.trim().substring(t);
    return time.endsWith("Z") || time.indexOf('+') > 0 || time.indexOf('-') > 0;
  }
}

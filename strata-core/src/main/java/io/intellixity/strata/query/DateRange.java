package io.intellixity.strata.query;

/**
 * Inclusive date range as sent by the caller: {@code 2024-02-01} or {@code 2024-02-01T10:00:00}.
 * Normalization to UTC instants happens at build time, against the query timezone.
 */
public record DateRange(String from, String to) {
  public DateRange {
    if (from == null || from.isBlank()) throw new IllegalArgumentException("dateRange from is required");
    if (to == null || to.isBlank()) throw new IllegalArgumentException("dateRange to is required");
  }

  public static DateRange of(String from, String to) { return new DateRange(from, to); }
}

package io.intellixity.strata.interval;

import java.util.EnumMap;

/**
 * Parses interval text such as {@code "1 year"}, {@code "2 days 3 hours"} or {@code "-7 day"}.\n
 * Tokens are whitespace-separated {@code <integer> <unit>} pairs; a repeated unit adds up.
 */
public final class IntervalParser {
  public static final String UNBOUNDED = "unbounded";

  private IntervalParser() {}

  public static Interval parse(String text) {
    if (text == null) throw new IntervalFormatException("Interval text is required");
    String trimmed = text.trim();
    if (trimmed.isEmpty()) return Interval.empty();
    if (isUnbounded(trimmed)) throw new IntervalFormatException("'unbounded' is not a finite interval");

    String[] parts = trimmed.split("\\s+");
    if (parts.length % 2 != 0) {
      throw new IntervalFormatException("Invalid interval '" + text + "': expected <number> <unit> pairs");
    }

    EnumMap<IntervalUnit, Integer> out = new EnumMap<>(IntervalUnit.class);
    for (int i = 0; i < parts.length; i += 2) {
      int magnitude;
      try {
        magnitude = Integer.parseInt(parts[i]);
      } catch (NumberFormatException e) {
        throw new IntervalFormatException("Invalid interval '" + text + "': '" + parts[i] + "' is not an integer", e);
      }
      IntervalUnit unit = IntervalUnit.fromToken(parts[i + 1]);
      if (unit == null) {
        throw new IntervalFormatException("Invalid interval '" + text + "': unknown unit '" + parts[i + 1] + "'");
      }
      out.merge(unit, magnitude, Math::addExact);
    }
    return Interval.of(out);
  }

  public static boolean isUnbounded(String text) {
    return text != null && UNBOUNDED.equalsIgnoreCase(text.trim());
  }
}

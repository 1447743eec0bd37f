package io.intellixity.strata.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.intellixity.strata.interval.Interval;
import io.intellixity.strata.interval.IntervalParser;

import java.util.Locale;

/**
 * Window of a rolling measure relative to each time bucket.\n
 * {@code trailing}/{@code leading} are interval text or {@code unbounded}.\n
 * A null side is a zero-length bound at the anchor; only {@code unbounded} removes the bound.
 */
public record RollingWindow(
    /** How far back the window reaches, e.g. {@code 1 year} or {@code unbounded}. */
    String trailing,
    /** How far forward the window reaches. */
    String leading,
    /** Which bucket edge the window is anchored to; defaults to END. */
    Offset offset
) {
  public RollingWindow {
    offset = offset == null ? Offset.END : offset;
  }

  public static RollingWindow trailing(String trailing) { return new RollingWindow(trailing, null, Offset.END); }

  public boolean hasTrailingBound() { return !IntervalParser.isUnbounded(trailing); }
  public boolean hasLeadingBound() { return !IntervalParser.isUnbounded(leading); }

  /** Trailing interval; empty when the side is null. Only valid when {@link #hasTrailingBound()}. */
  public Interval trailingInterval() { return trailing == null ? Interval.empty() : IntervalParser.parse(trailing); }

  /** Leading interval; empty when the side is null. Only valid when {@link #hasLeadingBound()}. */
  public Interval leadingInterval() { return leading == null ? Interval.empty() : IntervalParser.parse(leading); }

  public enum Offset {
    START,
    END;

    @JsonValue
    public String id() { return name().toLowerCase(Locale.ROOT); }

    @JsonCreator
    public static Offset fromId(String id) {
      if (id == null) return END;
      try {
        return Offset.valueOf(id.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new SchemaResolutionException("Unknown rollingWindow offset: " + id, e);
      }
    }
  }
}

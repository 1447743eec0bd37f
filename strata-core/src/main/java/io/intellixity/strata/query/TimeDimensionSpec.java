package io.intellixity.strata.query;

import java.util.Objects;

/**
 * A time dimension reference. Without a granularity it only filters (through {@code dateRange})
 * and never takes part in grouping.
 */
public record TimeDimensionSpec(String dimension, Granularity granularity, DateRange dateRange) {
  public TimeDimensionSpec {
    Objects.requireNonNull(dimension, "dimension");
  }

  public static TimeDimensionSpec of(String dimension, Granularity granularity, DateRange dateRange) {
    return new TimeDimensionSpec(dimension, granularity, dateRange);
  }

  public static TimeDimensionSpec filterOnly(String dimension, DateRange dateRange) {
    return new TimeDimensionSpec(dimension, null, dateRange);
  }

  public boolean isGranular() { return granularity != null; }
}

package io.intellixity.strata.compile;

import io.intellixity.strata.query.DateRange;
import io.intellixity.strata.query.Granularity;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/** Generates the buckets a rolling window is evaluated over. */
public final class TimeSeries {
  private TimeSeries() {}

  /**
   * Buckets of {@code granularity} covering {@code range}, in the query's local time.
   * The first bucket is aligned to the granularity, so it may start before the range does.
   */
  public static List<TimeBucket> of(Granularity granularity, DateRange range, int maxBuckets) {
    if (granularity == null) throw new IllegalArgumentException("granularity is required");
    if (range == null) throw new QueryCompileException("Time series for granularity '" + granularity.id() + "' requires a dateRange");

    LocalDateTime end = DateBoundaries.parseEnd(range.to());
    LocalDateTime cursor = granularity.truncate(DateBoundaries.parseStart(range.from()));

    List<TimeBucket> out = new ArrayList<>();
    while (!cursor.isAfter(end)) {
      if (out.size() >= maxBuckets) {
        throw new QueryCompileException("Time series for " + range.from() + " .. " + range.to() + " by "
            + granularity.id() + " exceeds " + maxBuckets + " buckets; use a larger granularity or a shorter dateRange");
      }
      LocalDateTime next = granularity.next(cursor);
      out.add(new TimeBucket(DateBoundaries.LOCAL_MILLIS.format(cursor), DateBoundaries.LOCAL_MILLIS.format(next.minusNanos(1_000_000))));
      cursor = next;
    }
    return out;
  }
}

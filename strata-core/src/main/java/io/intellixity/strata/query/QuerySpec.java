package io.intellixity.strata.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.*;

/**
 * Immutable analytical query: measures, dimensions, time dimensions, a filter tree, order, limit and offset.\n
 * Every {@code with*} method returns a new instance; builders never see a request change under them.
 */
@JsonSerialize(using = QuerySpecJsonSerializer.class)
@JsonDeserialize(using = QuerySpecJsonDeserializer.class)
public final class QuerySpec {
  public static final String DEFAULT_TIMEZONE = "UTC";

  private final List<String> measures;
  private final List<String> dimensions;
  private final List<TimeDimensionSpec> timeDimensions;
  private final FilterElement filter;
  private final List<OrderSpec> order;
  private final RowLimit limit;
  private final Integer offset;
  private final String timezone;

  private QuerySpec(List<String> measures, List<String> dimensions, List<TimeDimensionSpec> timeDimensions,
                    FilterElement filter, List<OrderSpec> order, RowLimit limit, Integer offset, String timezone) {
    this.measures = distinct(measures);
    this.dimensions = distinct(dimensions);
    this.timeDimensions = List.copyOf(timeDimensions == null ? List.of() : timeDimensions);
    this.filter = filter;
    this.order = List.copyOf(order == null ? List.of() : order);
    this.limit = limit == null ? RowLimit.unspecified() : limit;
    if (offset != null && offset < 0) throw new IllegalArgumentException("offset must be >= 0: " + offset);
    this.offset = offset;
    this.timezone = (timezone == null || timezone.isBlank()) ? DEFAULT_TIMEZONE : timezone;
  }

  public static QuerySpec empty() {
    return new QuerySpec(null, null, null, null, null, null, null, null);
  }

  public List<String> measures() { return measures; }
  public List<String> dimensions() { return dimensions; }
  public List<TimeDimensionSpec> timeDimensions() { return timeDimensions; }
  /** Root of the filter tree, or {@code null}. A top-level JSON filter array is an AND group. */
  public FilterElement filter() { return filter; }
  public List<OrderSpec> order() { return order; }
  public RowLimit limit() { return limit; }
  public Integer offset() { return offset; }
  public String timezone() { return timezone; }

  public QuerySpec withMeasures(List<String> v) { return new QuerySpec(v, dimensions, timeDimensions, filter, order, limit, offset, timezone); }
  public QuerySpec withMeasures(String... v) { return withMeasures(Arrays.asList(v)); }
  public QuerySpec withDimensions(List<String> v) { return new QuerySpec(measures, v, timeDimensions, filter, order, limit, offset, timezone); }
  public QuerySpec withDimensions(String... v) { return withDimensions(Arrays.asList(v)); }
  public QuerySpec withTimeDimensions(List<TimeDimensionSpec> v) { return new QuerySpec(measures, dimensions, v, filter, order, limit, offset, timezone); }
  public QuerySpec withTimeDimensions(TimeDimensionSpec... v) { return withTimeDimensions(Arrays.asList(v)); }
  public QuerySpec withFilter(FilterElement v) { return new QuerySpec(measures, dimensions, timeDimensions, v, order, limit, offset, timezone); }
  public QuerySpec withOrder(List<OrderSpec> v) { return new QuerySpec(measures, dimensions, timeDimensions, filter, v, limit, offset, timezone); }
  public QuerySpec withOrder(OrderSpec... v) { return withOrder(Arrays.asList(v)); }
  public QuerySpec withLimit(RowLimit v) { return new QuerySpec(measures, dimensions, timeDimensions, filter, order, v, offset, timezone); }
  public QuerySpec withLimit(int n) { return withLimit(RowLimit.of(n)); }
  public QuerySpec withOffset(Integer v) { return new QuerySpec(measures, dimensions, timeDimensions, filter, order, limit, v, timezone); }
  public QuerySpec withTimezone(String v) { return new QuerySpec(measures, dimensions, timeDimensions, filter, order, limit, offset, v); }

  /** Granular time dimensions, in declaration order. */
  public List<TimeDimensionSpec> granularTimeDimensions() {
    List<TimeDimensionSpec> out = new ArrayList<>();
    for (TimeDimensionSpec td : timeDimensions) if (td.isGranular()) out.add(td);
    return out;
  }

  private static List<String> distinct(List<String> in) {
    if (in == null || in.isEmpty()) return List.of();
    return List.copyOf(new LinkedHashSet<>(in));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof QuerySpec q)) return false;
    return measures.equals(q.measures) && dimensions.equals(q.dimensions) && timeDimensions.equals(q.timeDimensions)
        && Objects.equals(filter, q.filter) && order.equals(q.order) && limit.equals(q.limit)
        && Objects.equals(offset, q.offset) && timezone.equals(q.timezone);
  }

  @Override
  public int hashCode() {
    return Objects.hash(measures, dimensions, timeDimensions, filter, order, limit, offset, timezone);
  }

  @Override
  public String toString() {
    return "QuerySpec{measures=" + measures + ", dimensions=" + dimensions + ", timeDimensions=" + timeDimensions
        + ", filter=" + filter + ", order=" + order + ", limit=" + limit + ", offset=" + offset
        + ", timezone=" + timezone + "}";
  }
}

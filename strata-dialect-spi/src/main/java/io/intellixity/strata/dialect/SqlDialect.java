package io.intellixity.strata.dialect;

import io.intellixity.strata.compile.TimeBucket;
import io.intellixity.strata.interval.Interval;
import io.intellixity.strata.query.FilterElement;
import io.intellixity.strata.query.Granularity;
import io.intellixity.strata.schema.AggregationType;

import java.util.List;

/**
 * Everything the query builder asks of a SQL engine.\n
 *
 * Implementations are immutable once constructed; engine-version differences are folded into
 * {@link #capabilities()} at construction time.\n
 */
public interface SqlDialect {
  String id();

  DialectCapabilities capabilities();

  default String tableAliasKeyword() { return capabilities().tableAliasKeyword(); }
  default String joinAliasKeyword() { return capabilities().joinAliasKeyword(); }
  default PaginationStrategy paginationStrategy() { return capabilities().paginationStrategy(); }
  default GroupByStrategy groupByStrategy() { return capabilities().groupByStrategy(); }
  default int maxIdentifierLength() { return capabilities().maxIdentifierLength(); }

  /** {@code source alias} or {@code source AS alias}, per {@link #tableAliasKeyword()}. */
  default String aliasTable(String source, String alias) {
    String kw = tableAliasKeyword();
    return kw.isEmpty() ? source + " " + alias : source + " " + kw + " " + alias;
  }

  /** Same as {@link #aliasTable} for tables on the right side of a JOIN. */
  default String aliasJoin(String source, String alias) {
    String kw = joinAliasKeyword();
    return kw.isEmpty() ? source + " " + alias : source + " " + kw + " " + alias;
  }

  String quoteIdentifier(String identifier);

  /** Engine placeholder for the {@code position}-th parameter (1-based, in textual order). */
  String placeholder(int position);

  /** Wraps a raw parameter marker for use as a plain value. */
  String castParameter(String paramRef);

  /**
   * Date-typed comparison value from a raw parameter marker holding a UTC millisecond literal.\n
   * Date-range filters compare against {@link #timestampCast} instead, so this is for engines or callers
   * that need a value without a time of day.
   */
  String dateCast(String paramRef);

  /** Timestamp-typed comparison value from a raw parameter marker holding a UTC millisecond literal. */
  String timestampCast(String paramRef);

  /** Truncates {@code expr} to the start of its bucket; the identity when {@code granularity} is null. */
  String truncate(Granularity granularity, String expr);

  /** Converts a UTC timestamp expression to local time in {@code timezone}. */
  String convertTz(String expr, String timezone);

  String addInterval(String expr, Interval interval);

  String subtractInterval(String expr, Interval interval);

  String likeIgnoreCase(String column, boolean negated, String paramRef, LikeMatchType matchType);

  /** {@code count(*)} when {@code expr} is null for a count. */
  String aggregate(AggregationType type, String expr);

  /** Derived-table body producing {@code date_from}/{@code date_to} timestamp columns, one row per bucket. */
  String timeSeriesSql(List<TimeBucket> buckets);

  /**
   * GROUP BY clause (with a leading space) over the selected grouping columns, which occupy the first select
   * positions. Empty string when there is nothing to group by.
   */
  String groupByClause(List<String> groupingExpressions);

  /** Clause appended after ORDER BY (with a leading space), or empty. {@code limit == null} means no bound. */
  String nativePaginationClause(Integer limit, Integer offset);

  /** Wraps a complete statement in row-counter selects. {@code limit == null} means no bound. */
  String wrapWithPagination(String sql, Integer limit, Integer offset);

  /** Renders a filter tree; unsupported operators raise {@link io.intellixity.strata.compile.QueryCompileException}. */
  String renderPredicate(FilterElement filter, PredicateContext ctx);
}

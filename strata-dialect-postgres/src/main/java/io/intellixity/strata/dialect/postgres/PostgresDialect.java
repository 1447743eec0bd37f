package io.intellixity.strata.dialect.postgres;

import io.intellixity.strata.compile.TimeBucket;
import io.intellixity.strata.dialect.DialectCapabilities;
import io.intellixity.strata.dialect.GroupByStrategy;
import io.intellixity.strata.dialect.PaginationStrategy;
import io.intellixity.strata.interval.Interval;
import io.intellixity.strata.interval.IntervalUnit;
import io.intellixity.strata.query.Granularity;
import io.intellixity.strata.sql.dialect.AbstractSqlDialect;

import java.util.*;

/**
 * PostgreSQL dialect.
 *
 * Keeps only Postgres-specific overrides.\n
 * Generic SQL rendering lives in {@link AbstractSqlDialect}.
 */
public final class PostgresDialect extends AbstractSqlDialect {
  public static final String ID = "postgres";
  public static final int MAX_IDENTIFIER_LENGTH = 63;

  public PostgresDialect() {
    super(defaultCapabilities());
  }

  static DialectCapabilities defaultCapabilities() {
    Map<Granularity, String> tokens = new EnumMap<>(Granularity.class);
    for (Granularity g : Granularity.values()) tokens.put(g, g.id());
    return new DialectCapabilities("AS", "AS", PaginationStrategy.NATIVE_CLAUSE, GroupByStrategy.BY_ORDINAL, tokens,
        DialectCapabilities.PARAM + "::timestamp", DialectCapabilities.PARAM + "::timestamptz", MAX_IDENTIFIER_LENGTH);
  }

  @Override public String id() { return ID; }

  @Override
  public String placeholder(int position) { return "$" + position; }

  @Override
  protected String truncateExpression(String token, String expr) {
    return "date_trunc('" + token + "', " + expr + ")";
  }

  @Override
  public String convertTz(String expr, String timezone) {
    return "(" + expr + "::timestamptz AT TIME ZONE '" + timezone.replace("'", "''") + "')";
  }

  /** Single native literal: {@code x + interval '18 month 2 day'}. */
  @Override
  protected String applyInterval(String expr, Interval interval, boolean subtract) {
    if (interval == null || interval.isZero()) return expr;
    List<String> parts = new ArrayList<>();
    int months = interval.calendarMonths();
    if (months != 0) parts.add(months + " month");
    for (Map.Entry<IntervalUnit, Integer> term : interval.durationTerms().entrySet()) {
      parts.add(term.getValue() + " " + term.getKey().id());
    }
    if (parts.isEmpty()) return expr;
    return expr + (subtract ? " - " : " + ") + "interval '" + String.join(" ", parts) + "'";
  }

  @Override
  protected String likeKeyword() { return "ILIKE"; }

  @Override
  public String timeSeriesSql(List<TimeBucket> buckets) {
    StringJoiner values = new StringJoiner(", ");
    for (TimeBucket b : buckets) values.add("('" + b.from() + "', '" + b.to() + "')");
    return "SELECT date_from::timestamp AS \"date_from\", date_to::timestamp AS \"date_to\" FROM (VALUES "
        + values + ") AS dates (date_from, date_to)";
  }

  @Override
  public String nativePaginationClause(Integer limit, Integer offset) {
    StringBuilder sb = new StringBuilder();
    if (limit != null) sb.append(" LIMIT ").append(limit);
    if (offset != null && offset > 0) sb.append(" OFFSET ").append(offset);
    return sb.toString();
  }

  // Array columns: the full value list is bound as one parameter
  @Override
  protected String renderArrayContains(String expr, String paramRef) {
    return expr + " @> " + castParameter(paramRef);
  }

  @Override
  protected String renderArrayOverlaps(String expr, String paramRef) {
    return expr + " && " + castParameter(paramRef);
  }
}

package io.intellixity.strata.sql;

import io.intellixity.strata.compile.QueryCompileException;
import io.intellixity.strata.compile.TimeBucket;
import io.intellixity.strata.compile.TimeSeries;
import io.intellixity.strata.dialect.SqlDialect;
import io.intellixity.strata.schema.AggregationType;
import io.intellixity.strata.schema.ResolvedMember;
import io.intellixity.strata.schema.RollingWindow;
import io.intellixity.strata.sql.QueryBuilder.SelectColumn;
import io.intellixity.strata.sql.QueryBuilder.TimeDimension;

import java.util.*;

/**
 * Splits a query with rolling-window measures into derived tables and joins them back on the grouping columns.\n
 *
 * - every rolling measure gets its own derived table {@code q_i}\n
 * - all regular measures share one derived table, aliased when the first of them is reached\n
 * - derived tables are INNER JOINed null-safely on the grouping columns, or cross joined when there are none\n
 *
 * The window is anchored on the first granular time dimension: a generated time series is LEFT JOINed with the
 * measure's base rows on the window condition. With only a date range the range itself is the window; with no
 * time dimension at all the measure is a plain aggregate.\n
 */
final class RollingWindowPlanner {
  static final String TIME_SERIES = "time_series";
  static final String BASE = "base";
  static final String DATE_FROM = "date_from";
  static final String DATE_TO = "date_to";

  private final QueryBuilder qb;
  private final SqlDialect dialect;

  RollingWindowPlanner(QueryBuilder qb) {
    this.qb = qb;
    this.dialect = qb.dialect();
  }

  String render() {
    TimeDimension window = windowTimeDimension();

    List<ResolvedMember> regular = new ArrayList<>();
    for (ResolvedMember m : qb.measures()) if (!m.isRolling()) regular.add(m);

    // alias allocation follows measure declaration order
    Map<ResolvedMember, String> measureAlias = new LinkedHashMap<>();
    List<String> subqueryAliases = new ArrayList<>();
    Map<String, String> subquerySql = new LinkedHashMap<>();
    String regularAlias = null;
    for (ResolvedMember m : qb.measures()) {
      if (m.isRolling()) {
        String alias = derivedAlias();
        subqueryAliases.add(alias);
        subquerySql.put(alias, rollingSubquery(m, window));
        measureAlias.put(m, alias);
      } else {
        if (regularAlias == null) {
          regularAlias = derivedAlias();
          subqueryAliases.add(regularAlias);
          subquerySql.put(regularAlias, qb.renderAggregate(regular, qb.rangeConditionsExcept(null), qb.measureFilters()));
        }
        measureAlias.put(m, regularAlias);
      }
    }
    // measure filters still need a derived table to restrict the joined groups
    if (regularAlias == null && !qb.measureFilters().isEmpty()) {
      regularAlias = derivedAlias();
      subqueryAliases.add(regularAlias);
      subquerySql.put(regularAlias, qb.renderAggregate(List.of(), qb.rangeConditionsExcept(null), qb.measureFilters()));
    }

    String first = subqueryAliases.get(0);
    List<String> items = new ArrayList<>();
    for (SelectColumn c : qb.groupingColumns()) {
      items.add(new SelectColumn(column(first, c.alias()), c.alias()).render(dialect));
    }
    for (ResolvedMember m : qb.measures()) {
      items.add(new SelectColumn(column(measureAlias.get(m), m.alias()), m.alias()).render(dialect));
    }

    StringBuilder sb = new StringBuilder("SELECT ").append(String.join(", ", items))
        .append(" FROM ").append(dialect.aliasTable("(" + subquerySql.get(first) + ")", first));
    boolean grouped = !qb.groupingColumns().isEmpty();
    for (int i = 1; i < subqueryAliases.size(); i++) {
      String alias = subqueryAliases.get(i);
      String derived = dialect.aliasJoin("(" + subquerySql.get(alias) + ")", alias);
      if (grouped) sb.append(" INNER JOIN ").append(derived).append(" ON ").append(joinCondition(first, alias));
      else sb.append(" , ").append(derived);
    }
    return sb.toString();
  }

  private String derivedAlias() {
    String alias = qb.state().nextSubqueryAlias();
    qb.identifier(alias, null);
    return alias;
  }

  /** First granular time dimension, else the first one with a date range, else none. */
  private TimeDimension windowTimeDimension() {
    for (TimeDimension td : qb.timeDimensions()) if (td.isGranular()) return td;
    for (TimeDimension td : qb.timeDimensions()) if (td.hasRange()) return td;
    return null;
  }

  private String rollingSubquery(ResolvedMember m, TimeDimension window) {
    if (m.aggregationType() == AggregationType.NUMBER) {
      throw new QueryCompileException("Rolling window measure '" + m.path() + "' of type 'number' is not supported; "
          + "use an aggregating type such as sum or count");
    }
    if (window == null) {
      return qb.renderAggregate(List.of(m), List.of(), List.of());
    }
    if (!window.isGranular()) {
      List<String> conditions = new ArrayList<>();
      String windowCondition = windowCondition(m.rollingWindow(), window.member().sqlExpression(),
          dialect.timestampCast(window.fromRef()), dialect.timestampCast(window.toRef()));
      if (windowCondition != null) conditions.add(windowCondition);
      conditions.addAll(qb.rangeConditionsExcept(window));
      return qb.renderAggregate(List.of(m), conditions, List.of());
    }
    return seriesSubquery(m, window);
  }

  /**
   * {@code SELECT bucket, dims, agg(base.m) FROM (series) time_series LEFT JOIN (rows) base ON window GROUP BY ...}
   */
  private String seriesSubquery(ResolvedMember m, TimeDimension window) {
    if (!window.hasRange()) {
      throw new QueryCompileException("Rolling window measure '" + m.path() + "' needs a dateRange on time dimension '"
          + window.member().path() + "'");
    }
    List<TimeBucket> buckets = TimeSeries.of(window.granularity(), window.spec().dateRange(), qb.options().maxTimeSeriesBuckets());
    String windowField = window.member().alias();
    qb.identifier(TIME_SERIES, null);
    qb.identifier(BASE, null);

    List<String> baseItems = new ArrayList<>();
    baseItems.add(new SelectColumn(dialect.convertTz(window.member().sqlExpression(), qb.timezone()), windowField).render(dialect));
    List<String> items = new ArrayList<>();
    List<String> grouping = new ArrayList<>();
    for (SelectColumn c : qb.groupingColumns()) {
      String expr;
      if (c.timeDimension() == window) {
        expr = column(TIME_SERIES, DATE_FROM);
      } else {
        baseItems.add(c.render(dialect));
        expr = column(BASE, c.alias());
      }
      items.add(new SelectColumn(expr, c.alias()).render(dialect));
      grouping.add(expr);
    }
    String input = m.sqlExpression() == null ? "1" : m.sqlExpression();
    baseItems.add(new SelectColumn(input, m.alias()).render(dialect));
    items.add(new SelectColumn(dialect.aggregate(m.aggregationType(), column(BASE, m.alias())), m.alias()).render(dialect));

    List<String> baseWhere = new ArrayList<>(qb.rangeConditionsExcept(window));
    baseWhere.addAll(qb.dimensionFilters());
    String base = "SELECT " + String.join(", ", baseItems) + " " + qb.from() + QueryBuilder.whereClause(baseWhere);

    String on = windowCondition(m.rollingWindow(), column(BASE, windowField),
        column(TIME_SERIES, DATE_FROM), column(TIME_SERIES, DATE_TO));

    return "SELECT " + String.join(", ", items)
        + " FROM " + dialect.aliasTable("(" + dialect.timeSeriesSql(buckets) + ")", TIME_SERIES)
        + " LEFT JOIN " + dialect.aliasJoin("(" + base + ")", BASE)
        + " ON " + (on == null ? "1 = 1" : on)
        + dialect.groupByClause(grouping);
  }

  /**
   * Window bounds relative to a bucket (or the whole range).\n
   * trailing: {@code field > to - trailing} (offset end) or {@code field >= from - trailing} (offset start);\n
   * leading: {@code field <= to + leading} (offset end) or {@code field < from + leading} (offset start).\n
   * An {@code unbounded} side adds no condition; null when neither side is bounded.
   */
  String windowCondition(RollingWindow rw, String field, String dateFrom, String dateTo) {
    boolean end = rw.offset() == RollingWindow.Offset.END;
    List<String> conditions = new ArrayList<>();
    if (rw.hasTrailingBound()) {
      String start = dialect.subtractInterval(end ? dateTo : dateFrom, rw.trailingInterval());
      conditions.add(field + (end ? " > " : " >= ") + start);
    }
    if (rw.hasLeadingBound()) {
      String stop = dialect.addInterval(end ? dateTo : dateFrom, rw.leadingInterval());
      conditions.add(field + (end ? " <= " : " < ") + stop);
    }
    return conditions.isEmpty() ? null : String.join(" AND ", conditions);
  }

  private String joinCondition(String left, String right) {
    StringJoiner sj = new StringJoiner(" AND ");
    for (SelectColumn c : qb.groupingColumns()) {
      String l = column(left, c.alias());
      String r = column(right, c.alias());
      sj.add("(" + l + " = " + r + " OR (" + l + " IS NULL AND " + r + " IS NULL))");
    }
    return sj.toString();
  }

  private String column(String table, String column) {
    return table + "." + dialect.quoteIdentifier(column);
  }
}

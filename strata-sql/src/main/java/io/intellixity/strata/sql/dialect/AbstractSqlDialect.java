package io.intellixity.strata.sql.dialect;

import io.intellixity.strata.compile.DateBoundaries;
import io.intellixity.strata.compile.QueryCompileException;
import io.intellixity.strata.dialect.*;
import io.intellixity.strata.interval.Interval;
import io.intellixity.strata.interval.IntervalUnit;
import io.intellixity.strata.query.*;
import io.intellixity.strata.schema.AggregationType;

import java.time.ZoneId;
import java.util.*;

/**
 * SQL dialect base shared by all engines.\n
 *
 * Provides common rendering for:\n
 * - the filter tree (all cube operators, with LIKE, casts and array operators as hooks)\n
 * - interval arithmetic (calendar part folded into one month step, then day/hour/minute/second terms)\n
 * - aggregates, GROUP BY and ANSI OFFSET/FETCH pagination\n
 *
 * Engine dialects override hooks for quoting, placeholders, truncation, time series and paging.\n
 */
public abstract class AbstractSqlDialect implements SqlDialect {
  private final DialectCapabilities capabilities;

  protected AbstractSqlDialect(DialectCapabilities capabilities) {
    this.capabilities = Objects.requireNonNull(capabilities, "capabilities");
  }

  @Override
  public final DialectCapabilities capabilities() { return capabilities; }

  @Override
  public String quoteIdentifier(String identifier) {
    if (identifier == null) return null;
    return "\"" + identifier.replace("\"", "\"\"") + "\"";
  }

  @Override
  public String placeholder(int position) { return "?"; }

  @Override
  public String castParameter(String paramRef) { return paramRef; }

  @Override
  public String dateCast(String paramRef) { return capabilities.dateCast(paramRef); }

  @Override
  public String timestampCast(String paramRef) { return capabilities.timestampCast(paramRef); }

  @Override
  public final String truncate(Granularity granularity, String expr) {
    if (granularity == null) return expr;
    return truncateExpression(capabilities.truncationToken(granularity), expr);
  }

  /** Engine truncation call for an already-mapped token. */
  protected abstract String truncateExpression(String token, String expr);

  /** Default is the identity: timestamps are compared as stored. */
  @Override
  public String convertTz(String expr, String timezone) { return expr; }

  @Override
  public String addInterval(String expr, Interval interval) { return applyInterval(expr, interval, false); }

  @Override
  public String subtractInterval(String expr, Interval interval) { return applyInterval(expr, interval, true); }

  protected String applyInterval(String expr, Interval interval, boolean subtract) {
    if (interval == null || interval.isZero()) return expr;
    String out = expr;
    int months = interval.calendarMonths();
    if (months != 0) out = addMonths(out, subtract ? -months : months);
    for (Map.Entry<IntervalUnit, Integer> term : interval.durationTerms().entrySet()) {
      out = out + (subtract ? " - " : " + ") + durationTerm(term.getValue(), term.getKey());
    }
    return out;
  }

  /** ANSI month step; engines with a month function override. */
  protected String addMonths(String expr, int months) {
    return expr + " + INTERVAL '" + months + "' MONTH";
  }

  /** ANSI duration literal for one unit. */
  protected String durationTerm(int magnitude, IntervalUnit unit) {
    return "INTERVAL '" + magnitude + "' " + unit.sqlName();
  }

  @Override
  public String likeIgnoreCase(String column, boolean negated, String paramRef, LikeMatchType matchType) {
    LikeMatchType type = matchType == null ? LikeMatchType.CONTAINS : matchType;
    String p = type.leadingWildcard() ? "'%' || " : "";
    String s = type.trailingWildcard() ? " || '%'" : "";
    return column + (negated ? " NOT " : " ") + likeKeyword() + " " + p + castParameter(paramRef) + s;
  }

  /** Case-insensitive LIKE operator; plain LIKE where the engine has none. */
  protected String likeKeyword() { return "LIKE"; }

  @Override
  public String aggregate(AggregationType type, String expr) {
    Objects.requireNonNull(type, "type");
    if (expr == null && type != AggregationType.COUNT) {
      throw new QueryCompileException("Aggregation '" + type.id() + "' requires an expression");
    }
    return switch (type) {
      case COUNT -> expr == null ? "count(*)" : "count(" + expr + ")";
      case COUNT_DISTINCT -> "count(distinct " + expr + ")";
      case SUM -> "sum(" + expr + ")";
      case AVG -> "avg(" + expr + ")";
      case MIN -> "min(" + expr + ")";
      case MAX -> "max(" + expr + ")";
      case NUMBER -> expr;
    };
  }

  @Override
  public String groupByClause(List<String> groupingExpressions) {
    if (groupingExpressions == null || groupingExpressions.isEmpty()) return "";
    if (groupByStrategy() == GroupByStrategy.BY_EXPRESSION) {
      return " GROUP BY " + String.join(", ", groupingExpressions);
    }
    StringJoiner sj = new StringJoiner(", ", " GROUP BY ", "");
    for (int i = 1; i <= groupingExpressions.size(); i++) sj.add(String.valueOf(i));
    return sj.toString();
  }

  /** ANSI {@code OFFSET n ROWS FETCH NEXT m ROWS ONLY}; each part only when it applies. */
  @Override
  public String nativePaginationClause(Integer limit, Integer offset) {
    StringBuilder sb = new StringBuilder();
    if (offset != null && offset > 0) sb.append(" OFFSET ").append(offset).append(" ROWS");
    if (limit != null) sb.append(" FETCH NEXT ").append(limit).append(" ROWS ONLY");
    return sb.toString();
  }

  /** Default: no row-counter pagination; dialects with {@link PaginationStrategy#WRAPPING} override. */
  @Override
  public String wrapWithPagination(String sql, Integer limit, Integer offset) {
    throw new QueryCompileException("Row-counter pagination is not supported by dialect '" + id() + "'");
  }

  // ---------- filters ----------

  @Override
  public String renderPredicate(FilterElement filter, PredicateContext ctx) {
    if (filter == null) return "";
    Objects.requireNonNull(ctx, "ctx");
    return renderElement(filter, ctx);
  }

  private String renderElement(FilterElement el, PredicateContext ctx) {
    if (el instanceof NotElement n) {
      String inner = renderElement(n.element(), ctx);
      return inner.isBlank() ? "" : "NOT (" + inner + ")";
    }

    if (el instanceof LogicalGroup g) {
      List<String> childSql = new ArrayList<>();
      for (FilterElement c : g.elements()) {
        String s = renderElement(c, ctx);
        if (!s.isBlank()) childSql.add(s);
      }
      if (childSql.isEmpty()) return "";
      if (childSql.size() == 1) return childSql.get(0);
      String sep = (g.clause() == Clause.OR) ? " OR " : " AND ";
      return "(" + String.join(sep, childSql) + ")";
    }

    if (!(el instanceof MemberFilter f)) {
      throw new IllegalArgumentException("Unsupported filter element: " + el.getClass().getName());
    }

    String expr = ctx.expression(f.member());
    List<Object> values = f.values();
    ZoneId zone = DateBoundaries.zone(ctx.timezone());

    return switch (f.operator()) {
      case EQUALS -> equalsSql(expr, values, ctx);
      case NOT_EQUALS -> notEqualsSql(expr, values, ctx);
      case CONTAINS -> likeSql(expr, values, false, LikeMatchType.CONTAINS, ctx);
      case NOT_CONTAINS -> likeSql(expr, values, true, LikeMatchType.CONTAINS, ctx);
      case STARTS_WITH -> likeSql(expr, values, false, LikeMatchType.STARTS_WITH, ctx);
      case NOT_STARTS_WITH -> likeSql(expr, values, true, LikeMatchType.STARTS_WITH, ctx);
      case ENDS_WITH -> likeSql(expr, values, false, LikeMatchType.ENDS_WITH, ctx);
      case NOT_ENDS_WITH -> likeSql(expr, values, true, LikeMatchType.ENDS_WITH, ctx);
      case GT -> comparisonSql(expr, ">", f, ctx);
      case GTE -> comparisonSql(expr, ">=", f, ctx);
      case LT -> comparisonSql(expr, "<", f, ctx);
      case LTE -> comparisonSql(expr, "<=", f, ctx);
      case SET -> expr + " IS NOT NULL";
      case NOT_SET -> expr + " IS NULL";
      case IN_DATE_RANGE -> "(" + expr + " >= " + dateStart(f, 0, zone, ctx) + " AND " + expr + " <= " + dateEnd(f, 1, zone, ctx) + ")";
      case NOT_IN_DATE_RANGE -> "(" + expr + " < " + dateStart(f, 0, zone, ctx) + " OR " + expr + " > " + dateEnd(f, 1, zone, ctx) + ")";
      case BEFORE_DATE -> expr + " < " + dateStart(f, 0, zone, ctx);
      case BEFORE_OR_ON_DATE -> expr + " <= " + dateEnd(f, 0, zone, ctx);
      case AFTER_DATE -> expr + " > " + dateEnd(f, 0, zone, ctx);
      case AFTER_OR_ON_DATE -> expr + " >= " + dateStart(f, 0, zone, ctx);
      case ARRAY_CONTAINS -> renderArrayContains(expr, ctx.allocate(nonNullValues(values)));
      case ARRAY_OVERLAPS -> renderArrayOverlaps(expr, ctx.allocate(nonNullValues(values)));
    };
  }

  /**
   * Render array contains ("column contains all values") for dialects that support it.
   * Default throws; Postgres overrides with the containment operator.
   */
  protected String renderArrayContains(String expr, String paramRef) {
    throw unsupported(Operator.ARRAY_CONTAINS);
  }

  /** Render array overlaps ("column has any of values"). Default throws. */
  protected String renderArrayOverlaps(String expr, String paramRef) {
    throw unsupported(Operator.ARRAY_OVERLAPS);
  }

  protected final QueryCompileException unsupported(Operator op) {
    return new QueryCompileException("Operator '" + op.jsonName() + "' is not supported by dialect '" + id() + "'");
  }

  private String equalsSql(String expr, List<Object> values, PredicateContext ctx) {
    List<Object> vals = nonNullValues(values);
    boolean withNull = vals.size() < values.size() || values.isEmpty();
    if (vals.isEmpty()) return expr + " IS NULL";
    String sql = vals.size() == 1
        ? expr + " = " + castParameter(ctx.allocate(vals.get(0)))
        : expr + " IN (" + paramList(vals, ctx) + ")";
    return withNull ? "(" + sql + " OR " + expr + " IS NULL)" : sql;
  }

  private String notEqualsSql(String expr, List<Object> values, PredicateContext ctx) {
    List<Object> vals = nonNullValues(values);
    if (vals.isEmpty()) return expr + " IS NOT NULL";
    String sql = vals.size() == 1
        ? expr + " <> " + castParameter(ctx.allocate(vals.get(0)))
        : expr + " NOT IN (" + paramList(vals, ctx) + ")";
    // A null in the values list means "and not null" as well
    if (vals.size() < values.size()) return "(" + sql + " AND " + expr + " IS NOT NULL)";
    return "(" + sql + " OR " + expr + " IS NULL)";
  }

  private String likeSql(String expr, List<Object> values, boolean negated, LikeMatchType type, PredicateContext ctx) {
    List<String> likes = new ArrayList<>();
    for (Object v : nonNullValues(values)) likes.add(likeIgnoreCase(expr, negated, ctx.allocate(v), type));
    if (likes.isEmpty()) throw new QueryValidationException("LIKE operators require at least one value");
    if (!negated) return likes.size() == 1 ? likes.get(0) : "(" + String.join(" OR ", likes) + ")";
    String all = likes.size() == 1 ? likes.get(0) : "(" + String.join(" AND ", likes) + ")";
    return "(" + all + " OR " + expr + " IS NULL)";
  }

  private String comparisonSql(String expr, String op, MemberFilter f, PredicateContext ctx) {
    Object v = f.firstValue();
    if (v == null) throw new QueryValidationException("Operator '" + f.operator().jsonName() + "' requires a non-null value");
    return expr + " " + op + " " + castParameter(ctx.allocate(v));
  }

  private String dateStart(MemberFilter f, int index, ZoneId zone, PredicateContext ctx) {
    return timestampCast(ctx.allocate(DateBoundaries.startOf(dateValue(f, index), zone)));
  }

  private String dateEnd(MemberFilter f, int index, ZoneId zone, PredicateContext ctx) {
    return timestampCast(ctx.allocate(DateBoundaries.endOf(dateValue(f, index), zone)));
  }

  private static String dateValue(MemberFilter f, int index) {
    if (f.values().size() <= index || f.values().get(index) == null) {
      throw new QueryValidationException("Operator '" + f.operator().jsonName() + "' on '" + f.member() + "' is missing a date value");
    }
    return String.valueOf(f.values().get(index));
  }

  private String paramList(List<Object> vals, PredicateContext ctx) {
    StringJoiner sj = new StringJoiner(", ");
    for (Object v : vals) sj.add(castParameter(ctx.allocate(v)));
    return sj.toString();
  }

  private static List<Object> nonNullValues(List<Object> values) {
    List<Object> out = new ArrayList<>();
    for (Object v : values) if (v != null) out.add(v);
    return out;
  }
}

package io.intellixity.strata.sql.dialect;

import io.intellixity.strata.compile.QueryCompileException;
import io.intellixity.strata.dialect.*;
import io.intellixity.strata.interval.IntervalParser;
import io.intellixity.strata.query.*;
import io.intellixity.strata.schema.AggregationType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static io.intellixity.strata.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class AbstractSqlDialectTest {
  private final AnsiDialect d = new AnsiDialect();

  /** Renders with member paths used verbatim as column expressions. */
  private SqlStatement render(FilterElement filter) {
    ParamAllocator params = new ParamAllocator();
    String sql = d.renderPredicate(filter, new PredicateContext() {
      @Override public String expression(String memberPath) { return memberPath; }
      @Override public String allocate(Object value) { return params.allocate(value); }
      @Override public String timezone() { return "UTC"; }
    });
    return params.finish(sql, d::placeholder);
  }

  @Test
  void equalsUsesInForSeveralValuesAndIsNullForNone() {
    assertEquals("c = ?", render(QueryFilters.equals("c", "a")).sql());
    SqlStatement in = render(QueryFilters.equals("c", "a", "b"));
    assertEquals("c IN (?, ?)", in.sql());
    assertEquals(List.of("a", "b"), in.params());
    assertEquals("(c = ? OR c IS NULL)", render(QueryFilters.equals("c", "a", null)).sql());
    assertEquals("c IS NULL", render(new MemberFilter("c", Operator.EQUALS, List.of())).sql());
  }

  @Test
  void notEqualsKeepsNullRows() {
    assertEquals("(c <> ? OR c IS NULL)", render(notEquals("c", "a")).sql());
    assertEquals("(c NOT IN (?, ?) OR c IS NULL)", render(notEquals("c", "a", "b")).sql());
    assertEquals("c IS NOT NULL", render(new MemberFilter("c", Operator.NOT_EQUALS, Arrays.asList((Object) null))).sql());
  }

  @Test
  void likeFamilyPlacesWildcardsByMatchType() {
    assertEquals("c LIKE '%' || ? || '%'", render(contains("c", "x")).sql());
    assertEquals("c LIKE ? || '%'", render(startsWith("c", "x")).sql());
    assertEquals("c LIKE '%' || ?", render(endsWith("c", "x")).sql());
    assertEquals("(c LIKE '%' || ? || '%' OR c LIKE '%' || ? || '%')", render(contains("c", "x", "y")).sql());
    assertEquals("(c NOT LIKE '%' || ? || '%' OR c IS NULL)", render(notContains("c", "x")).sql());
    assertEquals("((c NOT LIKE '%' || ? || '%' AND c NOT LIKE '%' || ? || '%') OR c IS NULL)",
        render(notContains("c", "x", "y")).sql());
  }

  @Test
  void comparisonsAndNullChecks() {
    SqlStatement gt = render(gt("c", 5));
    assertEquals("c > ?", gt.sql());
    assertEquals(List.of(5), gt.params());
    assertEquals("c <= ?", render(lte("c", 5)).sql());
    assertEquals("c IS NOT NULL", render(set("c")).sql());
    assertEquals("c IS NULL", render(notSet("c")).sql());
  }

  @Test
  void dateOperatorsNormalizeBoundsAndUseTheTimestampCast() {
    SqlStatement range = render(inDateRange("t", "2024-01-01", "2024-01-31"));
    assertEquals("(t >= CAST(? AS TIMESTAMP) AND t <= CAST(? AS TIMESTAMP))", range.sql());
    assertEquals(List.of("2024-01-01T00:00:00.000Z", "2024-01-31T23:59:59.999Z"), range.params());

    SqlStatement notRange = render(new MemberFilter("t", Operator.NOT_IN_DATE_RANGE, List.of("2024-01-01", "2024-01-31")));
    assertEquals("(t < CAST(? AS TIMESTAMP) OR t > CAST(? AS TIMESTAMP))", notRange.sql());

    SqlStatement before = render(beforeDate("t", "2024-01-01"));
    assertEquals("t < CAST(? AS TIMESTAMP)", before.sql());
    assertEquals(List.of("2024-01-01T00:00:00.000Z"), before.params());

    SqlStatement after = render(afterDate("t", "2024-01-01"));
    assertEquals("t > CAST(? AS TIMESTAMP)", after.sql());
    assertEquals(List.of("2024-01-01T23:59:59.999Z"), after.params());

    assertEquals(List.of("2024-01-01T23:59:59.999Z"),
        render(new MemberFilter("t", Operator.BEFORE_OR_ON_DATE, List.of("2024-01-01"))).params());
    assertEquals(List.of("2024-01-01T00:00:00.000Z"),
        render(new MemberFilter("t", Operator.AFTER_OR_ON_DATE, List.of("2024-01-01"))).params());
  }

  @Test
  void groupsAndNegation() {
    assertEquals("(a = ? AND b IS NULL)", render(and(QueryFilters.equals("a", 1), notSet("b"))).sql());
    assertEquals("NOT ((a = ? OR b IS NOT NULL))", render(not(or(QueryFilters.equals("a", 1), set("b")))).sql());
    // a single child is not parenthesized
    assertEquals("a = ?", render(or(QueryFilters.equals("a", 1))).sql());
    assertEquals("", render(and()).sql());
  }

  @Test
  void arrayOperatorsAreUnsupportedByDefault() {
    QueryCompileException ex = assertThrows(QueryCompileException.class, () -> render(arrayContains("tags", "a")));
    assertEquals("Operator 'arrayContains' is not supported by dialect 'ansi'", ex.getMessage());
    assertThrows(QueryCompileException.class, () -> render(arrayOverlaps("tags", "a")));
  }

  @Test
  void intervalArithmeticFoldsMonthsThenDurations() {
    assertEquals("d + INTERVAL '14' MONTH + INTERVAL '2' DAY + INTERVAL '3' HOUR",
        d.addInterval("d", IntervalParser.parse("1 year 2 months 2 days 3 hours")));
    assertEquals("d + INTERVAL '-3' MONTH - INTERVAL '30' MINUTE",
        d.subtractInterval("d", IntervalParser.parse("1 quarter 30 minutes")));
    assertEquals("d", d.addInterval("d", IntervalParser.parse("0 days")));
  }

  @Test
  void aggregates() {
    assertEquals("count(*)", d.aggregate(AggregationType.COUNT, null));
    assertEquals("count(x)", d.aggregate(AggregationType.COUNT, "x"));
    assertEquals("count(distinct x)", d.aggregate(AggregationType.COUNT_DISTINCT, "x"));
    assertEquals("sum(x)", d.aggregate(AggregationType.SUM, "x"));
    assertEquals("x / 2", d.aggregate(AggregationType.NUMBER, "x / 2"));
    assertThrows(QueryCompileException.class, () -> d.aggregate(AggregationType.SUM, null));
  }

  @Test
  void groupByByOrdinalOrExpression() {
    assertEquals(" GROUP BY 1, 2", d.groupByClause(List.of("a", "b")));
    assertEquals("", d.groupByClause(List.of()));

    DialectCapabilities caps = AnsiDialect.defaultCapabilities();
    AnsiDialect byExpr = new AnsiDialect(new DialectCapabilities(caps.tableAliasKeyword(), caps.joinAliasKeyword(),
        caps.paginationStrategy(), GroupByStrategy.BY_EXPRESSION, caps.truncationTokens(),
        caps.dateCastTemplate(), caps.timestampCastTemplate(), caps.maxIdentifierLength()));
    assertEquals(" GROUP BY a, b", byExpr.groupByClause(List.of("a", "b")));
  }

  @Test
  void ansiPaginationClause() {
    assertEquals(" OFFSET 10 ROWS FETCH NEXT 5 ROWS ONLY", d.nativePaginationClause(5, 10));
    assertEquals(" FETCH NEXT 5 ROWS ONLY", d.nativePaginationClause(5, 0));
    assertEquals("", d.nativePaginationClause(null, null));
    assertThrows(QueryCompileException.class, () -> d.wrapWithPagination("SELECT 1", 5, null));
  }

  @Test
  void castsTruncationAndQuoting() {
    assertEquals("CAST($0$ AS DATE)", d.dateCast("$0$"));
    assertEquals("DATE_TRUNC('week', t)", d.truncate(Granularity.WEEK, "t"));
    assertEquals("t", d.truncate(null, "t"));
    assertEquals("\"a\"\"b\"", d.quoteIdentifier("a\"b"));
    assertEquals("x AS y", d.aliasTable("x", "y"));
  }
}

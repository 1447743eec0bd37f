package io.intellixity.strata.dialect;

import io.intellixity.strata.compile.TimeBucket;
import io.intellixity.strata.interval.Interval;
import io.intellixity.strata.query.FilterElement;
import io.intellixity.strata.query.Granularity;
import io.intellixity.strata.schema.AggregationType;
import io.intellixity.strata.util.Environment;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class DialectRegistryTest {
  private static DialectProvider provider(String id) {
    return new DialectProvider() {
      @Override public String id() { return id; }
      @Override public SqlDialect create(Environment environment) {
        return new StubDialect(id, environment.get("STUB_FLAVOR").orElse("plain"));
      }
    };
  }

  @Test
  void createsByCaseInsensitiveId() {
    DialectRegistry r = new DialectRegistry(List.of(provider("Alpha"), provider("beta")));
    assertEquals(Set.of("alpha", "beta"), r.ids());
    assertTrue(r.supports("ALPHA"));
    assertFalse(r.supports("gamma"));
    assertEquals("alpha", r.create("alpha", Environment.empty()).id());
  }

  @Test
  void environmentIsPassedToTheProvider() {
    DialectRegistry r = new DialectRegistry(List.of(provider("alpha")));
    StubDialect d = (StubDialect) r.create("alpha", Environment.of(Map.of("STUB_FLAVOR", "spicy")));
    assertEquals("spicy", d.flavor);
    StubDialect fallback = (StubDialect) r.create("alpha", null);
    assertEquals("plain", fallback.flavor);
  }

  @Test
  void unknownIdListsAvailableDialects() {
    DialectRegistry r = new DialectRegistry(List.of(provider("alpha")));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> r.create("gamma", Environment.empty()));
    assertEquals("Unknown dialect id: gamma (available: [alpha])", ex.getMessage());
  }

  @Test
  void duplicateIdsAreRejected() {
    IllegalStateException ex = assertThrows(IllegalStateException.class,
        () -> new DialectRegistry(List.of(provider("alpha"), provider("ALPHA"))));
    assertTrue(ex.getMessage().contains("Duplicate dialect id 'alpha'"));
  }

  @Test
  void aliasKeywordDefaultsFollowCapabilities() {
    StubDialect d = new StubDialect("alpha", "plain");
    assertEquals("(select 1) q_0", d.aliasTable("(select 1)", "q_0"));
    assertEquals("(select 1) q_1", d.aliasJoin("(select 1)", "q_1"));
  }

  private static final class StubDialect implements SqlDialect {
    private final String id;
    private final String flavor;
    private final DialectCapabilities caps;

    StubDialect(String id, String flavor) {
      this.id = id;
      this.flavor = flavor;
      Map<Granularity, String> tokens = new EnumMap<>(Granularity.class);
      for (Granularity g : Granularity.values()) tokens.put(g, g.id());
      this.caps = new DialectCapabilities("", null, PaginationStrategy.NATIVE_CLAUSE, GroupByStrategy.BY_ORDINAL, tokens,
          "{param}", "{param}", 30);
    }

    @Override public String id() { return id; }
    @Override public DialectCapabilities capabilities() { return caps; }
    @Override public String quoteIdentifier(String identifier) { return identifier; }
    @Override public String placeholder(int position) { return "?"; }
    @Override public String castParameter(String paramRef) { return paramRef; }
    @Override public String dateCast(String paramRef) { return paramRef; }
    @Override public String timestampCast(String paramRef) { return paramRef; }
    @Override public String truncate(Granularity granularity, String expr) { return expr; }
    @Override public String convertTz(String expr, String timezone) { return expr; }
    @Override public String addInterval(String expr, Interval interval) { return expr; }
    @Override public String subtractInterval(String expr, Interval interval) { return expr; }
    @Override public String likeIgnoreCase(String column, boolean negated, String paramRef, LikeMatchType matchType) { return column; }
    @Override public String aggregate(AggregationType type, String expr) { return expr; }
    @Override public String timeSeriesSql(List<TimeBucket> buckets) { return ""; }
    @Override public String groupByClause(List<String> groupingExpressions) { return ""; }
    @Override public String nativePaginationClause(Integer limit, Integer offset) { return ""; }
    @Override public String wrapWithPagination(String sql, Integer limit, Integer offset) { return sql; }
    @Override public String renderPredicate(FilterElement filter, PredicateContext ctx) { return ""; }
  }
}

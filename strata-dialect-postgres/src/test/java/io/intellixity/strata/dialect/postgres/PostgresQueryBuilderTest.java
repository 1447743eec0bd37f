package io.intellixity.strata.dialect.postgres;

import io.intellixity.strata.dialect.DialectRegistry;
import io.intellixity.strata.dialect.SqlStatement;
import io.intellixity.strata.query.*;
import io.intellixity.strata.schema.CubeSchemaJson;
import io.intellixity.strata.schema.InMemoryCubeEvaluator;
import io.intellixity.strata.schema.InMemoryJoinGraph;
import io.intellixity.strata.sql.SqlQueryCompiler;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.strata.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class PostgresQueryBuilderTest {
  private static final InMemoryCubeEvaluator SHOP = new InMemoryCubeEvaluator(CubeSchemaJson.readResource("schema/shop.json"));
  private static final SqlQueryCompiler COMPILER = new SqlQueryCompiler(new PostgresDialect(), SHOP, new InMemoryJoinGraph(SHOP));

  @Test
  void numberedPlaceholdersAndLimit() {
    SqlStatement st = COMPILER.buildSqlAndParams(QuerySpec.empty()
        .withMeasures("orders.count")
        .withDimensions("orders.status")
        .withFilter(QueryFilters.equals("orders.status", "shipped"))
        .withLimit(10));

    assertEquals("SELECT \"orders\".status AS \"orders__status\", count(*) AS \"orders__count\" "
        + "FROM public.orders AS \"orders\" WHERE \"orders\".status = $1 GROUP BY 1 ORDER BY 2 DESC LIMIT 10", st.sql());
    assertEquals(List.of("shipped"), st.params());
  }

  @Test
  void granularTimeDimensionInQueryTimezone() {
    SqlStatement st = COMPILER.buildSqlAndParams(QuerySpec.empty()
        .withMeasures("orders.count")
        .withTimeDimensions(TimeDimensionSpec.of("orders.createdAt", Granularity.DAY, DateRange.of("2024-01-01", "2024-01-02")))
        .withTimezone("America/New_York"));

    assertEquals("SELECT date_trunc('day', (\"orders\".created_at::timestamptz AT TIME ZONE 'America/New_York')) "
        + "AS \"orders__created_at_day\", count(*) AS \"orders__count\" FROM public.orders AS \"orders\" "
        + "WHERE \"orders\".created_at >= $1::timestamptz AND \"orders\".created_at <= $2::timestamptz "
        + "GROUP BY 1 ORDER BY 1 ASC LIMIT 10000", st.sql());
    assertEquals(List.of("2024-01-01T05:00:00.000Z", "2024-01-03T04:59:59.999Z"), st.params());
  }

  @Test
  void caseInsensitiveLikeAndArrayOperators() {
    SqlStatement st = COMPILER.buildSqlAndParams(QuerySpec.empty()
        .withMeasures("orders.count")
        .withFilter(and(contains("orders.status", "ship"), arrayOverlaps("orders.tags", "gift", "express")))
        .withLimit(RowLimit.unbounded()));

    assertEquals("SELECT count(*) AS \"orders__count\" FROM public.orders AS \"orders\" "
        + "WHERE \"orders\".status ILIKE '%' || $1 || '%' AND \"orders\".tags && $2 ORDER BY 1 DESC", st.sql());
    assertEquals(List.of("ship", List.of("gift", "express")), st.params());
  }

  @Test
  void rollingWindowAnchoredAtBucketStart() {
    SqlStatement st = COMPILER.buildSqlAndParams(QuerySpec.empty()
        .withMeasures("orders.monthlyAmount")
        .withTimeDimensions(TimeDimensionSpec.of("orders.createdAt", Granularity.DAY, DateRange.of("2024-01-01", "2024-01-02"))));
    String sql = st.sql();

    assertTrue(sql.contains("LEFT JOIN (SELECT (\"orders\".created_at::timestamptz AT TIME ZONE 'UTC') AS \"orders__created_at\", "
        + "\"orders\".amount AS \"orders__monthly_amount\" FROM public.orders AS \"orders\") AS base "
        + "ON base.\"orders__created_at\" >= time_series.\"date_from\" - interval '1 month' "
        + "AND base.\"orders__created_at\" < time_series.\"date_from\" GROUP BY 1) AS q_0"), sql);
    assertTrue(sql.endsWith(" ORDER BY 1 ASC LIMIT 10000"), sql);
    // the range only feeds the generated series
    assertTrue(st.params().isEmpty());
  }

  @Test
  void offsetFollowsLimit() {
    SqlStatement st = COMPILER.buildSqlAndParams(QuerySpec.empty().withDimensions("orders.status").withLimit(5).withOffset(10));
    assertTrue(st.sql().endsWith("ORDER BY 1 ASC LIMIT 5 OFFSET 10"), st.sql());
  }

  @Test
  void discoveredThroughTheRegistry() {
    DialectRegistry registry = new DialectRegistry();
    assertTrue(registry.supports("Postgres"));
    assertInstanceOf(PostgresDialect.class, registry.create("postgres"));
  }
}

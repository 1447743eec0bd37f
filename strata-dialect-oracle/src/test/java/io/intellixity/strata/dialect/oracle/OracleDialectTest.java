package io.intellixity.strata.dialect.oracle;

import io.intellixity.strata.compile.TimeBucket;
import io.intellixity.strata.dialect.GroupByStrategy;
import io.intellixity.strata.dialect.PaginationStrategy;
import io.intellixity.strata.interval.IntervalParser;
import io.intellixity.strata.query.Granularity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class OracleDialectTest {
  private final OracleDialect d = new OracleDialect();

  private String add(String expr, String interval) { return d.addInterval(expr, IntervalParser.parse(interval)); }
  private String subtract(String expr, String interval) { return d.subtractInterval(expr, IntervalParser.parse(interval)); }

  @Test
  void calendarUnitsFoldIntoAddMonths() {
    assertEquals("ADD_MONTHS(my_date, 12)", add("my_date", "1 year"));
    assertEquals("ADD_MONTHS(my_date, 36)", add("my_date", "3 year"));
    assertEquals("ADD_MONTHS(my_date, 1)", add("my_date", "1 month"));
    assertEquals("ADD_MONTHS(my_date, 6)", add("my_date", "6 month"));
    assertEquals("ADD_MONTHS(my_date, 3)", add("my_date", "1 quarter"));
    assertEquals("ADD_MONTHS(my_date, 12)", add("my_date", "4 quarter"));
    assertEquals("ADD_MONTHS(my_date, 18)", add("my_date", "1 year 6 month"));
    assertEquals("ADD_MONTHS(my_date, 9)", add("my_date", "2 quarter 3 month"));
    assertEquals("ADD_MONTHS(my_date, 29)", add("my_date", "2 year 1 quarter 2 month"));
    assertEquals("ADD_MONTHS(TRUNC(my_date), 1)", add("TRUNC(my_date)", "1 month"));
  }

  @Test
  void durationUnitsUseNumToDsInterval() {
    assertEquals("my_date + NUMTODSINTERVAL(1, 'DAY')", add("my_date", "1 day"));
    assertEquals("my_date + NUMTODSINTERVAL(7, 'DAY')", add("my_date", "7 day"));
    assertEquals("my_date + NUMTODSINTERVAL(24, 'HOUR')", add("my_date", "24 hour"));
    assertEquals("my_date + NUMTODSINTERVAL(30, 'MINUTE')", add("my_date", "30 minute"));
    assertEquals("my_date + NUMTODSINTERVAL(45, 'SECOND')", add("my_date", "45 second"));
    assertEquals("my_date + NUMTODSINTERVAL(1, 'DAY') + NUMTODSINTERVAL(2, 'HOUR')", add("my_date", "1 day 2 hour"));
    assertEquals("my_date + NUMTODSINTERVAL(1, 'HOUR') + NUMTODSINTERVAL(30, 'MINUTE') + NUMTODSINTERVAL(45, 'SECOND')",
        add("my_date", "1 hour 30 minute 45 second"));
  }

  @Test
  void mixedIntervalsPutMonthsFirst() {
    assertEquals("ADD_MONTHS(my_date, 12) + NUMTODSINTERVAL(2, 'DAY') + NUMTODSINTERVAL(3, 'HOUR')",
        add("my_date", "1 year 2 day 3 hour"));
    assertEquals("ADD_MONTHS(my_date, 21) + NUMTODSINTERVAL(4, 'DAY') + NUMTODSINTERVAL(5, 'HOUR') "
        + "+ NUMTODSINTERVAL(6, 'MINUTE') + NUMTODSINTERVAL(7, 'SECOND')",
        add("my_date", "1 year 2 quarter 3 month 4 day 5 hour 6 minute 7 second"));
  }

  @Test
  void subtractionNegatesMonthsAndSubtractsDurations() {
    assertEquals("ADD_MONTHS(my_date, -12)", subtract("my_date", "1 year"));
    assertEquals("ADD_MONTHS(my_date, -3)", subtract("my_date", "1 quarter"));
    assertEquals("ADD_MONTHS(my_date, -29)", subtract("my_date", "2 year 1 quarter 2 month"));
    assertEquals("my_date - NUMTODSINTERVAL(1, 'DAY')", subtract("my_date", "1 day"));
    assertEquals("my_date - NUMTODSINTERVAL(1, 'DAY') - NUMTODSINTERVAL(2, 'HOUR')", subtract("my_date", "1 day 2 hour"));
    assertEquals("ADD_MONTHS(my_date, -21) - NUMTODSINTERVAL(4, 'DAY') - NUMTODSINTERVAL(5, 'HOUR') "
        + "- NUMTODSINTERVAL(6, 'MINUTE') - NUMTODSINTERVAL(7, 'SECOND')",
        subtract("my_date", "1 year 2 quarter 3 month 4 day 5 hour 6 minute 7 second"));
    assertEquals("ADD_MONTHS(TRUNC(my_date), -1)", subtract("TRUNC(my_date)", "1 month"));
  }

  @Test
  void castsBindsAndTruncation() {
    assertEquals(":\"$0$\"", d.castParameter("$0$"));
    assertEquals("TO_TIMESTAMP_TZ(:\"$0$\", 'YYYY-MM-DD\"T\"HH24:MI:SS.FF\"Z\"')", d.timestampCast("$0$"));
    assertEquals("CAST(TO_TIMESTAMP_TZ(:\"$0$\", 'YYYY-MM-DD\"T\"HH24:MI:SS.FF\"Z\"') AS DATE)", d.dateCast("$0$"));
    assertEquals("TRUNC(created_at, 'DD')", d.truncate(Granularity.DAY, "created_at"));
    assertEquals("TRUNC(created_at, 'IW')", d.truncate(Granularity.WEEK, "created_at"));
    assertEquals("TRUNC(created_at, 'MM')", d.truncate(Granularity.MONTH, "created_at"));
    assertEquals("TRUNC(created_at, 'Q')", d.truncate(Granularity.QUARTER, "created_at"));
    assertEquals("TRUNC(created_at, 'YYYY')", d.truncate(Granularity.YEAR, "created_at"));
    assertEquals("created_at", d.convertTz("created_at", "Europe/Berlin"));
  }

  @Test
  void aliasesWithoutAsAndGroupByExpression() {
    assertEquals("(select 1 from dual) q_0", d.aliasTable("(select 1 from dual)", "q_0"));
    assertEquals("(select 1 from dual) q_1", d.aliasJoin("(select 1 from dual)", "q_1"));
    assertEquals(GroupByStrategy.BY_EXPRESSION, d.groupByStrategy());
    assertEquals(" GROUP BY \"visitors\".source, TRUNC(x, 'DD')", d.groupByClause(List.of("\"visitors\".source", "TRUNC(x, 'DD')")));
  }

  @Test
  void capabilitiesFollowVersion() {
    assertEquals(PaginationStrategy.NATIVE_CLAUSE, d.paginationStrategy());
    assertEquals(128, d.maxIdentifierLength());

    OracleDialect legacy = new OracleDialect(OracleVersion.parse("11.2"));
    assertEquals(PaginationStrategy.WRAPPING, legacy.paginationStrategy());
    assertEquals(30, legacy.maxIdentifierLength());

    OracleDialect twelveOne = new OracleDialect(OracleVersion.parse("12.1"));
    assertEquals(PaginationStrategy.NATIVE_CLAUSE, twelveOne.paginationStrategy());
    assertEquals(30, twelveOne.maxIdentifierLength());
  }

  @Test
  void rownumWrapping() {
    OracleDialect legacy = new OracleDialect(new OracleVersion(11, 2));
    assertEquals("SELECT * FROM (SELECT 1 FROM DUAL) WHERE ROWNUM <= 50", legacy.wrapWithPagination("SELECT 1 FROM DUAL", 50, null));
    assertEquals("SELECT * FROM (SELECT a.*, ROWNUM rnum FROM (SELECT 1 FROM DUAL) a WHERE ROWNUM <= 30) WHERE rnum > 10",
        legacy.wrapWithPagination("SELECT 1 FROM DUAL", 20, 10));
    assertEquals("SELECT * FROM (SELECT a.*, ROWNUM rnum FROM (SELECT 1 FROM DUAL) a) WHERE rnum > 10",
        legacy.wrapWithPagination("SELECT 1 FROM DUAL", null, 10));
  }

  @Test
  void timeSeriesUnionsDualRows() {
    String sql = d.timeSeriesSql(List.of(
        new TimeBucket("2024-01-01T00:00:00.000", "2024-01-31T23:59:59.999"),
        new TimeBucket("2024-02-01T00:00:00.000", "2024-02-29T23:59:59.999")));
    assertEquals("SELECT TO_TIMESTAMP('2024-01-01T00:00:00.000', 'YYYY-MM-DD\"T\"HH24:MI:SS.FF') \"date_from\", "
        + "TO_TIMESTAMP('2024-01-31T23:59:59.999', 'YYYY-MM-DD\"T\"HH24:MI:SS.FF') \"date_to\" FROM DUAL UNION ALL "
        + "SELECT TO_TIMESTAMP('2024-02-01T00:00:00.000', 'YYYY-MM-DD\"T\"HH24:MI:SS.FF') \"date_from\", "
        + "TO_TIMESTAMP('2024-02-29T23:59:59.999', 'YYYY-MM-DD\"T\"HH24:MI:SS.FF') \"date_to\" FROM DUAL", sql);
  }
}

package io.intellixity.strata.dialect.oracle;

import io.intellixity.strata.compile.TimeBucket;
import io.intellixity.strata.dialect.DialectCapabilities;
import io.intellixity.strata.dialect.GroupByStrategy;
import io.intellixity.strata.dialect.PaginationStrategy;
import io.intellixity.strata.interval.IntervalUnit;
import io.intellixity.strata.query.Granularity;
import io.intellixity.strata.sql.dialect.AbstractSqlDialect;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Oracle dialect.\n
 *
 * Differences from the shared rendering:\n
 * - no {@code AS} before table aliases, GROUP BY repeats expressions\n
 * - binds are written {@code :"?"}, date bounds go through {@code TO_TIMESTAMP_TZ}\n
 * - months via {@code ADD_MONTHS}, durations via {@code NUMTODSINTERVAL}\n
 * - before 12c pagination wraps the statement in {@code ROWNUM} selects\n
 */
public final class OracleDialect extends AbstractSqlDialect {
  public static final String ID = "oracle";

  static final String UTC_TIMESTAMP_FORMAT = "'YYYY-MM-DD\"T\"HH24:MI:SS.FF\"Z\"'";
  static final String LOCAL_TIMESTAMP_FORMAT = "'YYYY-MM-DD\"T\"HH24:MI:SS.FF'";

  private final OracleVersion version;

  public OracleDialect() {
    this(OracleVersion.DEFAULT);
  }

  public OracleDialect(OracleVersion version) {
    super(capabilitiesFor(Objects.requireNonNull(version, "version")));
    this.version = version;
  }

  static DialectCapabilities capabilitiesFor(OracleVersion version) {
    Map<Granularity, String> tokens = new EnumMap<>(Granularity.class);
    tokens.put(Granularity.SECOND, "ss");
    tokens.put(Granularity.MINUTE, "mm");
    tokens.put(Granularity.HOUR, "HH24");
    tokens.put(Granularity.DAY, "DD");
    tokens.put(Granularity.WEEK, "IW");
    tokens.put(Granularity.MONTH, "MM");
    tokens.put(Granularity.QUARTER, "Q");
    tokens.put(Granularity.YEAR, "YYYY");

    String timestamp = "TO_TIMESTAMP_TZ(:\"" + DialectCapabilities.PARAM + "\", " + UTC_TIMESTAMP_FORMAT + ")";
    PaginationStrategy paging = version.supportsFetchClause() ? PaginationStrategy.NATIVE_CLAUSE : PaginationStrategy.WRAPPING;
    return new DialectCapabilities("", "", paging, GroupByStrategy.BY_EXPRESSION, tokens,
        "CAST(" + timestamp + " AS DATE)", timestamp, version.maxIdentifierLength());
  }

  @Override public String id() { return ID; }

  public OracleVersion version() { return version; }

  @Override
  public String castParameter(String paramRef) { return ":\"" + paramRef + "\""; }

  @Override
  protected String truncateExpression(String token, String expr) {
    return "TRUNC(" + expr + ", '" + token + "')";
  }

  @Override
  protected String addMonths(String expr, int months) {
    return "ADD_MONTHS(" + expr + ", " + months + ")";
  }

  @Override
  protected String durationTerm(int magnitude, IntervalUnit unit) {
    return "NUMTODSINTERVAL(" + magnitude + ", '" + unit.sqlName() + "')";
  }

  @Override
  public String timeSeriesSql(List<TimeBucket> buckets) {
    StringJoiner rows = new StringJoiner(" UNION ALL ");
    for (TimeBucket b : buckets) {
      rows.add("SELECT TO_TIMESTAMP('" + b.from() + "', " + LOCAL_TIMESTAMP_FORMAT + ") \"date_from\", "
          + "TO_TIMESTAMP('" + b.to() + "', " + LOCAL_TIMESTAMP_FORMAT + ") \"date_to\" FROM DUAL");
    }
    return rows.toString();
  }

  /**
   * Pre-12c row-counter pagination:\n
   * - limit only: {@code SELECT * FROM (sql) WHERE ROWNUM <= m}\n
   * - with offset: {@code SELECT * FROM (SELECT a.*, ROWNUM rnum FROM (sql) a WHERE ROWNUM <= n+m) WHERE rnum > n}\n
   */
  @Override
  public String wrapWithPagination(String sql, Integer limit, Integer offset) {
    boolean hasOffset = offset != null && offset > 0;
    if (!hasOffset) {
      return limit == null ? sql : "SELECT * FROM (" + sql + ") WHERE ROWNUM <= " + limit;
    }
    String inner = "SELECT a.*, ROWNUM rnum FROM (" + sql + ") a";
    if (limit != null) inner = inner + " WHERE ROWNUM <= " + ((long) offset + limit);
    return "SELECT * FROM (" + inner + ") WHERE rnum > " + offset;
  }
}

package io.intellixity.strata.sql.dialect;

import io.intellixity.strata.compile.TimeBucket;
import io.intellixity.strata.dialect.DialectCapabilities;
import io.intellixity.strata.dialect.GroupByStrategy;
import io.intellixity.strata.dialect.PaginationStrategy;
import io.intellixity.strata.query.Granularity;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/** Plain ANSI dialect that keeps every default of {@link AbstractSqlDialect}; used to test the shared rendering. */
public class AnsiDialect extends AbstractSqlDialect {
  public AnsiDialect() {
    this(defaultCapabilities());
  }

  public AnsiDialect(DialectCapabilities capabilities) {
    super(capabilities);
  }

  public static DialectCapabilities defaultCapabilities() {
    Map<Granularity, String> tokens = new EnumMap<>(Granularity.class);
    for (Granularity g : Granularity.values()) tokens.put(g, g.id());
    return new DialectCapabilities("AS", "AS", PaginationStrategy.NATIVE_CLAUSE, GroupByStrategy.BY_ORDINAL, tokens,
        "CAST({param} AS DATE)", "CAST({param} AS TIMESTAMP)", 64);
  }

  @Override public String id() { return "ansi"; }

  @Override
  protected String truncateExpression(String token, String expr) {
    return "DATE_TRUNC('" + token + "', " + expr + ")";
  }

  @Override
  public String timeSeriesSql(List<TimeBucket> buckets) {
    StringJoiner rows = new StringJoiner(", ");
    for (TimeBucket b : buckets) rows.add("(TIMESTAMP '" + b.from() + "', TIMESTAMP '" + b.to() + "')");
    return "SELECT * FROM (VALUES " + rows + ") AS dates (date_from, date_to)";
  }
}

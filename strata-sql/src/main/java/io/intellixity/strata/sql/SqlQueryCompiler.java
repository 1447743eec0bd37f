package io.intellixity.strata.sql;

import io.intellixity.strata.compile.CompilerOptions;
import io.intellixity.strata.dialect.SqlDialect;
import io.intellixity.strata.dialect.SqlStatement;
import io.intellixity.strata.interval.IntervalParser;
import io.intellixity.strata.query.QuerySpec;
import io.intellixity.strata.schema.CubeEvaluator;
import io.intellixity.strata.schema.JoinGraph;
import io.intellixity.strata.validation.DefaultQueryValidationStrategy;
import io.intellixity.strata.validation.QueryValidationStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point: validates a query and builds it for one dialect.\n
 * Thread-safe; every call runs a fresh {@link QueryBuilder} with its own {@link BuildState}.
 */
public final class SqlQueryCompiler {
  private static final Logger log = LoggerFactory.getLogger(SqlQueryCompiler.class);

  private final SqlDialect dialect;
  private final CubeEvaluator evaluator;
  private final JoinGraph joinGraph;
  private final CompilerOptions options;
  private final QueryValidationStrategy validation;

  public SqlQueryCompiler(SqlDialect dialect, CubeEvaluator evaluator, JoinGraph joinGraph) {
    this(dialect, evaluator, joinGraph, CompilerOptions.defaults(), new DefaultQueryValidationStrategy());
  }

  public SqlQueryCompiler(SqlDialect dialect, CubeEvaluator evaluator, JoinGraph joinGraph, CompilerOptions options) {
    this(dialect, evaluator, joinGraph, options, new DefaultQueryValidationStrategy());
  }

  public SqlQueryCompiler(SqlDialect dialect, CubeEvaluator evaluator, JoinGraph joinGraph,
                          CompilerOptions options, QueryValidationStrategy validation) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    this.joinGraph = Objects.requireNonNull(joinGraph, "joinGraph");
    this.options = Objects.requireNonNull(options, "options");
    this.validation = Objects.requireNonNull(validation, "validation");
  }

  public SqlDialect dialect() { return dialect; }
  public CompilerOptions options() { return options; }

  public SqlStatement buildSqlAndParams(QuerySpec query) {
    Objects.requireNonNull(query, "query");
    validation.validate(query, evaluator);
    SqlStatement st = new QueryBuilder(dialect, evaluator, joinGraph, options, query, new BuildState()).build();
    debugSql("build", query, st);
    return st;
  }

  /** {@code dateExpr} shifted forward by interval text such as {@code "1 year 2 days"}. */
  public String addInterval(String dateExpr, String intervalText) {
    return dialect.addInterval(dateExpr, IntervalParser.parse(intervalText));
  }

  public String subtractInterval(String dateExpr, String intervalText) {
    return dialect.subtractInterval(dateExpr, IntervalParser.parse(intervalText));
  }

  private void debugSql(String op, QuerySpec query, SqlStatement st) {
    if (!log.isDebugEnabled()) return;
    log.debug("strata.sql op={} dialect={} measures={} dimensions={} timeDimensions={} paramCount={} sql={}",
        op, dialect.id(), query.measures().size(), query.dimensions().size(), query.timeDimensions().size(),
        st.params().size(), st.sql());

    // TRACE: parameter summary only, never raw values
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Object v : st.params()) {
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("strata.sql param index={} valueType={} valueLen={}", idx++, vType, vLen);
      }
    }
  }
}

package io.intellixity.strata.sql;

import io.intellixity.strata.compile.CompilerOptions;
import io.intellixity.strata.compile.DateBoundaries;
import io.intellixity.strata.compile.QueryCompileException;
import io.intellixity.strata.dialect.PredicateContext;
import io.intellixity.strata.dialect.SqlDialect;
import io.intellixity.strata.dialect.SqlStatement;
import io.intellixity.strata.query.*;
import io.intellixity.strata.schema.*;

import java.time.ZoneId;
import java.util.*;

/**
 * Builds one analytical query into SQL plus its ordered parameters.\n
 *
 * Steps:\n
 * - resolve measures, dimensions, time dimensions and filter members\n
 * - register date-range parameters (two per ranged time dimension)\n
 * - render FROM/LEFT JOIN from the join path, WHERE for dimension filters and HAVING for measure filters\n
 * - group by dimensions and truncated time dimensions\n
 * - hand rolling-window measures to {@link RollingWindowPlanner}\n
 * - order (explicit or default) and paginate\n
 *
 * A builder runs exactly once; use {@link SqlQueryCompiler} for repeated builds.\n
 */
public final class QueryBuilder {
  private final SqlDialect dialect;
  private final CubeEvaluator evaluator;
  private final JoinGraph joinGraph;
  private final CompilerOptions options;
  private final QuerySpec query;
  private final BuildState state;
  private final ZoneId zone;

  private final Map<String, ResolvedMember> resolved = new HashMap<>();
  private List<ResolvedMember> measures;
  private List<ResolvedMember> dimensions;
  private List<TimeDimension> timeDimensions;
  private List<SelectColumn> groupingColumns;
  private String from;
  private List<String> dimensionFilters;
  private List<String> measureFilters;
  private boolean built;

  public QueryBuilder(SqlDialect dialect, CubeEvaluator evaluator, JoinGraph joinGraph, CompilerOptions options,
                      QuerySpec query, BuildState state) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    this.joinGraph = Objects.requireNonNull(joinGraph, "joinGraph");
    this.options = Objects.requireNonNull(options, "options");
    this.query = Objects.requireNonNull(query, "query");
    this.state = Objects.requireNonNull(state, "state");
    this.zone = DateBoundaries.zone(query.timezone());
  }

  public SqlStatement build() {
    if (built) throw new IllegalStateException("QueryBuilder instances build exactly once");
    built = true;

    resolveMembers();
    from = renderFrom();
    renderFilters();

    String sql;
    if (measures.stream().anyMatch(ResolvedMember::isRolling)) {
      sql = new RollingWindowPlanner(this).render();
    } else {
      sql = renderAggregate(measures, allRangeConditions(), measureFilters);
    }
    sql = sql + orderByClause();
    sql = Pagination.apply(dialect, sql, query.limit(), query.offset(), options.defaultRowLimit());
    return state.params().finish(sql, dialect::placeholder);
  }

  // ---------- accessors used by the planner ----------

  SqlDialect dialect() { return dialect; }
  CompilerOptions options() { return options; }
  BuildState state() { return state; }
  String timezone() { return query.timezone(); }
  List<ResolvedMember> measures() { return measures; }
  List<TimeDimension> timeDimensions() { return timeDimensions; }
  List<SelectColumn> groupingColumns() { return groupingColumns; }
  String from() { return from; }
  List<String> dimensionFilters() { return dimensionFilters; }
  List<String> measureFilters() { return measureFilters; }

  /** Range conditions of every ranged time dimension except {@code excluded}, in query order. */
  List<String> rangeConditionsExcept(TimeDimension excluded) {
    List<String> out = new ArrayList<>();
    for (TimeDimension td : timeDimensions) {
      if (td != excluded && td.hasRange()) out.add(td.rangeCondition(dialect));
    }
    return out;
  }

  /** {@code SELECT grouping, aggregates FROM ... WHERE ... GROUP BY ... HAVING ...}. */
  String renderAggregate(List<ResolvedMember> selectedMeasures, List<String> rangeConditions, List<String> having) {
    List<String> items = new ArrayList<>();
    for (SelectColumn c : groupingColumns) items.add(c.render(dialect));
    for (ResolvedMember m : selectedMeasures) {
      items.add(new SelectColumn(measureExpression(m), m.alias()).render(dialect));
    }
    if (items.isEmpty()) {
      throw new QueryCompileException("Nothing to select: measure filters need a grouping column or a regular measure");
    }

    List<String> where = new ArrayList<>(rangeConditions);
    where.addAll(dimensionFilters);

    StringBuilder sb = new StringBuilder("SELECT ").append(String.join(", ", items))
        .append(' ').append(from)
        .append(whereClause(where))
        .append(dialect.groupByClause(groupingExpressions()));
    if (!having.isEmpty()) sb.append(" HAVING ").append(String.join(" AND ", having));
    return sb.toString();
  }

  List<String> groupingExpressions() {
    List<String> out = new ArrayList<>();
    for (SelectColumn c : groupingColumns) out.add(c.expression());
    return out;
  }

  String measureExpression(ResolvedMember m) {
    return dialect.aggregate(m.aggregationType(), m.sqlExpression());
  }

  static String whereClause(List<String> conditions) {
    return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
  }

  /** Quoted identifier after the engine length check; over-long names suggest {@code sqlAlias}. */
  String identifier(String name, String cube) {
    int max = dialect.maxIdentifierLength();
    if (max > 0 && name.length() > max) {
      String owner = cube == null ? "" : " in cube '" + cube + "'";
      throw new QueryCompileException("Identifier '" + name + "' is " + name.length() + " characters long but dialect '"
          + dialect.id() + "' allows at most " + max + ". Consider using the 'sqlAlias' attribute" + owner + " to shorten it");
    }
    return dialect.quoteIdentifier(name);
  }

  // ---------- resolution ----------

  private void resolveMembers() {
    measures = new ArrayList<>();
    for (String path : query.measures()) measures.add(resolve(path));

    dimensions = new ArrayList<>();
    for (String path : query.dimensions()) dimensions.add(resolve(path));

    timeDimensions = new ArrayList<>();
    for (TimeDimensionSpec spec : query.timeDimensions()) {
      ResolvedMember member = resolve(spec.dimension());
      String fromRef = null;
      String toRef = null;
      if (spec.dateRange() != null) {
        fromRef = state.params().allocate(DateBoundaries.startOf(spec.dateRange().from(), zone));
        toRef = state.params().allocate(DateBoundaries.endOf(spec.dateRange().to(), zone));
      }
      timeDimensions.add(new TimeDimension(spec, member, fromRef, toRef));
    }

    groupingColumns = new ArrayList<>();
    for (ResolvedMember d : dimensions) {
      groupingColumns.add(new SelectColumn(d.sqlExpression(), checkedAlias(d.alias(), d.cube()), d.path(), null));
    }
    for (TimeDimension td : timeDimensions) {
      if (!td.isGranular()) continue;
      String expr = dialect.truncate(td.granularity(), dialect.convertTz(td.member().sqlExpression(), query.timezone()));
      groupingColumns.add(new SelectColumn(expr, checkedAlias(td.alias(), td.member().cube()), td.member().path(), td));
    }
    for (ResolvedMember m : measures) checkedAlias(m.alias(), m.cube());
  }

  private String checkedAlias(String alias, String cube) {
    identifier(alias, cube);
    return alias;
  }

  private ResolvedMember resolve(String path) {
    return resolved.computeIfAbsent(path, evaluator::resolve);
  }

  // ---------- FROM ----------

  private String renderFrom() {
    JoinPath path = joinGraph.pathFor(referencedCubes());
    StringBuilder sb = new StringBuilder("FROM ").append(dialect.aliasTable(sourceSql(path.root()), sourceAlias(path.root())));
    for (JoinStep step : path.steps()) {
      sb.append(" LEFT JOIN ")
          .append(dialect.aliasJoin(sourceSql(step.source()), sourceAlias(step.source())))
          .append(" ON ").append(step.onSql());
    }
    return sb.toString();
  }

  private List<String> referencedCubes() {
    LinkedHashSet<String> cubes = new LinkedHashSet<>();
    for (ResolvedMember m : measures) cubes.add(m.cube());
    for (ResolvedMember d : dimensions) cubes.add(d.cube());
    for (TimeDimension td : timeDimensions) cubes.add(td.member().cube());
    for (String path : filterMembers(query.filter(), new ArrayList<>())) cubes.add(CubeEvaluator.cubeOf(path));
    return new ArrayList<>(cubes);
  }

  private static String sourceSql(CubeSource source) {
    return source.derived() ? "(" + source.sql().trim() + ")" : source.sql().trim();
  }

  private String sourceAlias(CubeSource source) {
    return identifier(source.alias(), source.cube());
  }

  // ---------- filters ----------

  private void renderFilters() {
    dimensionFilters = new ArrayList<>();
    measureFilters = new ArrayList<>();
    FilterElement root = query.filter();
    if (root == null) return;

    List<FilterElement> parts = (root instanceof LogicalGroup g && g.clause() == Clause.AND) ? g.elements() : List.of(root);
    PredicateContext ctx = new BuildPredicateContext();
    for (FilterElement part : parts) {
      boolean anyMeasure = false;
      boolean anyDimension = false;
      for (String path : filterMembers(part, new ArrayList<>())) {
        if (resolve(path).isMeasure()) anyMeasure = true;
        else anyDimension = true;
      }
      if (anyMeasure && anyDimension) {
        throw new QueryValidationException("A filter group can not mix measures and dimensions; split it into separate filters");
      }
      String sql = dialect.renderPredicate(part, ctx);
      if (sql.isBlank()) continue;
      (anyMeasure ? measureFilters : dimensionFilters).add(sql);
    }
  }

  private static List<String> filterMembers(FilterElement el, List<String> acc) {
    if (el instanceof MemberFilter f) acc.add(f.member());
    else if (el instanceof NotElement n) filterMembers(n.element(), acc);
    else if (el instanceof LogicalGroup g) for (FilterElement c : g.elements()) filterMembers(c, acc);
    return acc;
  }

  private List<String> allRangeConditions() { return rangeConditionsExcept(null); }

  private final class BuildPredicateContext implements PredicateContext {
    @Override
    public String expression(String memberPath) {
      ResolvedMember m = resolve(memberPath);
      return m.isMeasure() ? measureExpression(m) : m.sqlExpression();
    }

    @Override
    public String allocate(Object value) { return state.params().allocate(value); }

    @Override
    public String timezone() { return query.timezone(); }
  }

  // ---------- ordering ----------

  /**
   * ORDER BY by select position. Without an explicit order: first granular time dimension ascending,
   * else first measure descending, else first dimension ascending.
   */
  private String orderByClause() {
    List<String> positions = new ArrayList<>();
    if (!query.order().isEmpty()) {
      for (OrderSpec o : query.order()) {
        int pos = positionOf(o.member());
        if (pos < 0) throw new QueryValidationException("Order member '" + o.member() + "' is not selected");
        positions.add(pos + " " + o.direction().name());
      }
    } else {
      OptionalInt granular = firstGranularPosition();
      if (granular.isPresent()) positions.add(granular.getAsInt() + " ASC");
      else if (!measures.isEmpty()) positions.add((groupingColumns.size() + 1) + " DESC");
      else if (!groupingColumns.isEmpty()) positions.add("1 ASC");
    }
    return positions.isEmpty() ? "" : " ORDER BY " + String.join(", ", positions);
  }

  private OptionalInt firstGranularPosition() {
    for (int i = 0; i < groupingColumns.size(); i++) {
      if (groupingColumns.get(i).timeDimension() != null) return OptionalInt.of(i + 1);
    }
    return OptionalInt.empty();
  }

  private int positionOf(String memberPath) {
    for (int i = 0; i < groupingColumns.size(); i++) {
      if (memberPath.equals(groupingColumns.get(i).memberPath())) return i + 1;
    }
    for (int i = 0; i < measures.size(); i++) {
      if (memberPath.equals(measures.get(i).path())) return groupingColumns.size() + i + 1;
    }
    return -1;
  }

  // ---------- internal model ----------

  /** One selected column; {@code timeDimension} is set for truncated time dimensions. */
  record SelectColumn(String expression, String alias, String memberPath, TimeDimension timeDimension) {
    SelectColumn(String expression, String alias) { this(expression, alias, null, null); }

    String render(SqlDialect dialect) { return expression + " AS " + dialect.quoteIdentifier(alias); }
  }

  /** A requested time dimension with the raw markers of its normalized range, if any. */
  record TimeDimension(TimeDimensionSpec spec, ResolvedMember member, String fromRef, String toRef) {
    boolean isGranular() { return spec.isGranular(); }
    boolean hasRange() { return fromRef != null; }
    Granularity granularity() { return spec.granularity(); }
    String alias() { return member.alias(spec.granularity()); }

    String rangeCondition(SqlDialect dialect) {
      String col = member.sqlExpression();
      return col + " >= " + dialect.timestampCast(fromRef) + " AND " + col + " <= " + dialect.timestampCast(toRef);
    }
  }
}

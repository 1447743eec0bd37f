package io.intellixity.strata.validation;

import io.intellixity.strata.compile.DateBoundaries;
import io.intellixity.strata.query.*;
import io.intellixity.strata.schema.CubeEvaluator;
import io.intellixity.strata.schema.ResolvedMember;
import io.intellixity.strata.schema.SchemaResolutionException;

import java.util.*;

/**
 * Default, dialect-agnostic query validation.\n
 *
 * Validates:\n
 * - measures/dimensions resolve to members of the right kind\n
 * - time dimensions are time-typed and their date ranges are ordered\n
 * - filter members resolve and filter values fit the operator\n
 * - order members are part of the selection\n
 *
 * Shape problems throw {@link QueryValidationException}; unknown cubes and members propagate as
 * {@link SchemaResolutionException}.\n
 */
public final class DefaultQueryValidationStrategy implements QueryValidationStrategy {
  @Override
  public void validate(QuerySpec query, CubeEvaluator evaluator) {
    Objects.requireNonNull(query, "query");
    Objects.requireNonNull(evaluator, "evaluator");

    if (query.measures().isEmpty() && query.dimensions().isEmpty() && query.granularTimeDimensions().isEmpty()) {
      throw new QueryValidationException("Query should contain either measures, dimensions or timeDimensions with granularities");
    }
    DateBoundaries.zone(query.timezone());

    Set<String> selected = new HashSet<>();
    for (String m : query.measures()) {
      if (!evaluator.resolve(m).isMeasure()) throw new QueryValidationException("'" + m + "' is not a measure");
      selected.add(m);
    }
    for (String d : query.dimensions()) {
      if (evaluator.resolve(d).isMeasure()) throw new QueryValidationException("'" + d + "' is not a dimension");
      selected.add(d);
    }
    for (TimeDimensionSpec td : query.timeDimensions()) {
      validateTimeDimension(td, evaluator);
      if (td.isGranular()) selected.add(td.dimension());
    }

    validateElement(query.filter(), evaluator);
    validateOrder(query.order(), selected);
  }

  private static void validateTimeDimension(TimeDimensionSpec td, CubeEvaluator evaluator) {
    ResolvedMember r = evaluator.resolve(td.dimension());
    if (r.isMeasure() || !r.isTime()) {
      throw new QueryValidationException("'" + td.dimension() + "' is not a time dimension"
          + (td.isGranular() ? "; granularity '" + td.granularity().id() + "' can only be applied to time dimensions" : ""));
    }
    DateRange range = td.dateRange();
    if (range == null) return;
    if (DateBoundaries.parseStart(range.from()).isAfter(DateBoundaries.parseEnd(range.to()))) {
      throw new QueryValidationException("dateRange of '" + td.dimension() + "' is reversed: " + range.from() + " > " + range.to());
    }
  }

  private static void validateOrder(List<OrderSpec> order, Set<String> selected) {
    for (OrderSpec o : order) {
      if (!selected.contains(o.member())) {
        throw new QueryValidationException("Order member '" + o.member() + "' is not part of the selected measures, dimensions or granular time dimensions");
      }
    }
  }

  private static void validateElement(FilterElement el, CubeEvaluator evaluator) {
    if (el == null) return;

    if (el instanceof NotElement n) {
      validateElement(n.element(), evaluator);
      return;
    }
    if (el instanceof LogicalGroup g) {
      for (FilterElement c : g.elements()) validateElement(c, evaluator);
      return;
    }
    if (el instanceof MemberFilter f) {
      validateFilter(f, evaluator.resolve(f.member()));
      return;
    }

    throw new QueryValidationException("Unsupported filter element: " + el.getClass().getName());
  }

  private static void validateFilter(MemberFilter f, ResolvedMember member) {
    Operator op = f.operator();
    if (member.isRolling()) {
      throw new QueryValidationException("Filtering on rolling window measure '" + f.member() + "' is not supported");
    }
    if (op.isDateOperator() && (member.isMeasure() || !member.isTime())) {
      throw new QueryValidationException("Operator '" + op.jsonName() + "' requires a time dimension, got '" + f.member() + "'");
    }

    switch (op) {
      case IN_DATE_RANGE, NOT_IN_DATE_RANGE -> {
        requireValues(f, 2, 2);
        if (DateBoundaries.parseStart(str(f.values().get(0))).isAfter(DateBoundaries.parseEnd(str(f.values().get(1))))) {
          throw new QueryValidationException("Date range of filter on '" + f.member() + "' is reversed");
        }
      }
      case BEFORE_DATE, BEFORE_OR_ON_DATE, AFTER_DATE, AFTER_OR_ON_DATE, GT, GTE, LT, LTE -> requireValues(f, 1, 1);
      case SET, NOT_SET -> requireValues(f, 0, 0);
      case CONTAINS, NOT_CONTAINS, STARTS_WITH, NOT_STARTS_WITH, ENDS_WITH, NOT_ENDS_WITH,
          ARRAY_CONTAINS, ARRAY_OVERLAPS -> requireValues(f, 1, Integer.MAX_VALUE);
      default -> { }
    }
  }

  private static void requireValues(MemberFilter f, int min, int max) {
    List<Object> values = f.values();
    long nonNull = values.stream().filter(Objects::nonNull).count();
    if (values.size() < min || values.size() > max || (min > 0 && nonNull != values.size())) {
      String expected = min == max ? String.valueOf(min) : (max == Integer.MAX_VALUE ? "at least " + min : min + ".." + max);
      throw new QueryValidationException("Operator '" + f.operator().jsonName() + "' on '" + f.member()
          + "' expects " + expected + " non-null value(s), got " + values);
    }
  }

  private static String str(Object v) { return v == null ? null : String.valueOf(v); }
}

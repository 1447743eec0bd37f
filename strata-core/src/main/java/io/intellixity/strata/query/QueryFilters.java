package io.intellixity.strata.query;

import java.util.*;

public final class QueryFilters {
  private QueryFilters() {}

  public static MemberFilter equals(String member, Object... values) { return of(member, Operator.EQUALS, values); }
  public static MemberFilter notEquals(String member, Object... values) { return of(member, Operator.NOT_EQUALS, values); }

  public static MemberFilter contains(String member, Object... values) { return of(member, Operator.CONTAINS, values); }
  public static MemberFilter notContains(String member, Object... values) { return of(member, Operator.NOT_CONTAINS, values); }
  public static MemberFilter startsWith(String member, Object... values) { return of(member, Operator.STARTS_WITH, values); }
  public static MemberFilter endsWith(String member, Object... values) { return of(member, Operator.ENDS_WITH, values); }

  public static MemberFilter gt(String member, Object value) { return of(member, Operator.GT, value); }
  public static MemberFilter gte(String member, Object value) { return of(member, Operator.GTE, value); }
  public static MemberFilter lt(String member, Object value) { return of(member, Operator.LT, value); }
  public static MemberFilter lte(String member, Object value) { return of(member, Operator.LTE, value); }

  public static MemberFilter set(String member) { return of(member, Operator.SET); }
  public static MemberFilter notSet(String member) { return of(member, Operator.NOT_SET); }

  public static MemberFilter inDateRange(String member, String from, String to) { return of(member, Operator.IN_DATE_RANGE, from, to); }
  public static MemberFilter beforeDate(String member, String date) { return of(member, Operator.BEFORE_DATE, date); }
  public static MemberFilter afterDate(String member, String date) { return of(member, Operator.AFTER_DATE, date); }

  /** Array column contains all of the given values. Dialects without array support reject it. */
  public static MemberFilter arrayContains(String member, Object... values) { return of(member, Operator.ARRAY_CONTAINS, values); }

  /** Array column shares at least one value with the given values. */
  public static MemberFilter arrayOverlaps(String member, Object... values) { return of(member, Operator.ARRAY_OVERLAPS, values); }

  public static LogicalGroup and(FilterElement... elements) {
    return new LogicalGroup(Clause.AND, List.of(elements));
  }

  public static LogicalGroup or(FilterElement... elements) {
    return new LogicalGroup(Clause.OR, List.of(elements));
  }

  public static NotElement not(FilterElement element) {
    return new NotElement(element);
  }

  private static MemberFilter of(String member, Operator op, Object... values) {
    return new MemberFilter(member, op, values == null ? List.of() : Arrays.asList(values));
  }
}

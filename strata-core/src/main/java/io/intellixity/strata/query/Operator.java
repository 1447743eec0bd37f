package io.intellixity.strata.query;

import java.util.Locale;

public enum Operator {
  EQUALS("equals"),
  NOT_EQUALS("notEquals"),

  CONTAINS("contains"),
  NOT_CONTAINS("notContains"),
  STARTS_WITH("startsWith"),
  NOT_STARTS_WITH("notStartsWith"),
  ENDS_WITH("endsWith"),
  NOT_ENDS_WITH("notEndsWith"),

  GT("gt"),
  GTE("gte"),
  LT("lt"),
  LTE("lte"),

  SET("set"),
  NOT_SET("notSet"),

  IN_DATE_RANGE("inDateRange"),
  NOT_IN_DATE_RANGE("notInDateRange"),
  BEFORE_DATE("beforeDate"),
  BEFORE_OR_ON_DATE("beforeOrOnDate"),
  AFTER_DATE("afterDate"),
  AFTER_OR_ON_DATE("afterOrOnDate"),

  // Dialect-sensitive operators: a dialect that has no rendering for them rejects the query
  ARRAY_CONTAINS("arrayContains"),
  ARRAY_OVERLAPS("arrayOverlaps");

  private final String jsonName;

  Operator(String jsonName) {
    this.jsonName = jsonName;
  }

  public String jsonName() { return jsonName; }

  public boolean isDateOperator() {
    return this == IN_DATE_RANGE || this == NOT_IN_DATE_RANGE || this == BEFORE_DATE
        || this == BEFORE_OR_ON_DATE || this == AFTER_DATE || this == AFTER_OR_ON_DATE;
  }

  /** Accepts the JSON name ({@code notEquals}) as well as the enum constant ({@code NOT_EQUALS}). */
  public static Operator fromJsonName(String name) {
    if (name == null || name.isBlank()) throw new QueryValidationException("Filter operator is required");
    for (Operator op : values()) {
      if (op.jsonName.equals(name)) return op;
    }
    try {
      return Operator.valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new QueryValidationException("Unknown filter operator: " + name, e);
    }
  }
}

package io.intellixity.strata.dialect;

public enum GroupByStrategy {
  /** {@code GROUP BY 1, 2} */
  BY_ORDINAL,
  /** {@code GROUP BY <full expression>, ...} for engines that reject positional grouping. */
  BY_EXPRESSION
}

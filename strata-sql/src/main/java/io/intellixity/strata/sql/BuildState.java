package io.intellixity.strata.sql;

import io.intellixity.strata.dialect.ParamAllocator;

/**
 * Mutable state of one build: the parameter list and the derived-table alias counter.\n
 * Owned by a single {@link QueryBuilder}; never shared across builds.
 */
public final class BuildState {
  private final ParamAllocator params = new ParamAllocator();
  private int nextAlias;

  public ParamAllocator params() { return params; }

  /** {@code q_0}, {@code q_1}, ... in allocation order. */
  public String nextSubqueryAlias() { return "q_" + (nextAlias++); }
}

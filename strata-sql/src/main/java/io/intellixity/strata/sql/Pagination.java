package io.intellixity.strata.sql;

import io.intellixity.strata.dialect.PaginationStrategy;
import io.intellixity.strata.dialect.SqlDialect;
import io.intellixity.strata.query.RowLimit;

/**
 * Applies the row limit and offset to a finished, ordered statement.\n
 *
 * An unspecified limit gets {@code defaultLimit}; an unbounded one gets no upper bound at all.
 * A zero offset is the same as no offset.
 */
public final class Pagination {
  private Pagination() {}

  public static String apply(SqlDialect dialect, String sql, RowLimit limit, Integer offset, int defaultLimit) {
    Integer effectiveLimit = (limit == null ? RowLimit.unspecified() : limit).resolve(defaultLimit);
    Integer effectiveOffset = (offset != null && offset > 0) ? offset : null;

    if (dialect.paginationStrategy() == PaginationStrategy.NATIVE_CLAUSE) {
      return sql + dialect.nativePaginationClause(effectiveLimit, effectiveOffset);
    }
    if (effectiveLimit == null && effectiveOffset == null) return sql;
    return dialect.wrapWithPagination(sql, effectiveLimit, effectiveOffset);
  }
}

package io.intellixity.strata.dialect;

public enum PaginationStrategy {
  /** Limit/offset appended as a clause of the statement itself ({@code LIMIT}, {@code OFFSET ... FETCH NEXT}). */
  NATIVE_CLAUSE,
  /** Statement wrapped in outer selects that filter on a row counter ({@code ROWNUM}). */
  WRAPPING
}

package io.intellixity.strata.query;

public enum Clause {
  AND,
  OR
}

package io.intellixity.strata.schema;

public enum MemberKind {
  MEASURE,
  DIMENSION
}

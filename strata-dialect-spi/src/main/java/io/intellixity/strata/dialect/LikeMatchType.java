package io.intellixity.strata.dialect;

public enum LikeMatchType {
  CONTAINS(true, true),
  STARTS_WITH(false, true),
  ENDS_WITH(true, false);

  private final boolean leadingWildcard;
  private final boolean trailingWildcard;

  LikeMatchType(boolean leadingWildcard, boolean trailingWildcard) {
    this.leadingWildcard = leadingWildcard;
    this.trailingWildcard = trailingWildcard;
  }

  public boolean leadingWildcard() { return leadingWildcard; }
  public boolean trailingWildcard() { return trailingWildcard; }
}

package io.intellixity.strata.schema;

import io.intellixity.strata.query.Granularity;

import java.util.Objects;

/**
 * A member path resolved against the cube model.\n
 * {@code sqlExpression} is fully qualified against the owning cube's alias. For measures it is the
 * aggregate's input, or null for a bare {@code count}.
 */
public record ResolvedMember(
    String path,
    String cube,
    MemberKind kind,
    String sqlExpression,
    /** Column alias: {@code cube__member_snake}. */
    String alias,
    DimensionType dimensionType,
    AggregationType aggregationType,
    RollingWindow rollingWindow,
    boolean primaryKey
) {
  public ResolvedMember {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(alias, "alias");
  }

  public static ResolvedMember dimension(String path, String cube, String sql, String alias, DimensionType type, boolean primaryKey) {
    return new ResolvedMember(path, cube, MemberKind.DIMENSION, sql, alias, type, null, null, primaryKey);
  }

  public static ResolvedMember measure(String path, String cube, String sql, String alias, AggregationType type, RollingWindow rollingWindow) {
    return new ResolvedMember(path, cube, MemberKind.MEASURE, sql, alias, null, type, rollingWindow, false);
  }

  public boolean isMeasure() { return kind == MemberKind.MEASURE; }
  public boolean isTime() { return dimensionType == DimensionType.TIME; }
  public boolean isRolling() { return rollingWindow != null; }

  /** Type id as written in a schema: {@code count}, {@code time}, ... */
  public String type() { return isMeasure() ? aggregationType.id() : dimensionType.id(); }

  public String alias(Granularity granularity) {
    return granularity == null ? alias : alias + "_" + granularity.id();
  }
}

package io.intellixity.strata.schema;

import java.util.Objects;

public record MeasureDefinition(
    String name,
    AggregationType type,
    /** Input expression of the aggregate; may be null for {@code count}. */
    String sql,
    RollingWindow rollingWindow
) {
  public MeasureDefinition {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
  }

  public static MeasureDefinition of(String name, AggregationType type, String sql) {
    return new MeasureDefinition(name, type, sql, null);
  }
}

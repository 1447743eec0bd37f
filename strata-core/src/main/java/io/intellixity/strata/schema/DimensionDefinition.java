package io.intellixity.strata.schema;

import java.util.Objects;

public record DimensionDefinition(String name, DimensionType type, String sql, boolean primaryKey) {
  public DimensionDefinition {
    Objects.requireNonNull(name, "name");
    type = type == null ? DimensionType.STRING : type;
  }

  public static DimensionDefinition of(String name, DimensionType type, String sql) {
    return new DimensionDefinition(name, type, sql, false);
  }
}

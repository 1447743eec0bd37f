package io.intellixity.strata.schema;

import java.util.List;
import java.util.Objects;

/** A logical cube: its source (table or SQL), members and outgoing joins. */
public record CubeDefinition(
    String name,
    /** Source query; rendered as a parenthesized derived table. */
    String sql,
    /** Source table; rendered as-is. Takes precedence over {@code sql}. */
    String sqlTable,
    /** Table alias override for engines with short identifier limits. */
    String sqlAlias,
    List<MeasureDefinition> measures,
    List<DimensionDefinition> dimensions,
    List<JoinDefinition> joins
) {
  public CubeDefinition {
    Objects.requireNonNull(name, "name");
    if ((sql == null || sql.isBlank()) && (sqlTable == null || sqlTable.isBlank())) {
      throw new SchemaResolutionException("Cube '" + name + "' needs sql or sqlTable");
    }
    measures = measures == null ? List.of() : List.copyOf(measures);
    dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
    joins = joins == null ? List.of() : List.copyOf(joins);
  }
}

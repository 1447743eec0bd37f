package io.intellixity.strata.schema;

import java.util.Objects;

/** Join from the declaring cube to {@code cube}. {@code sql} may use {@code {CUBE}} and {@code {OtherCube}}. */
public record JoinDefinition(String cube, JoinRelationship relationship, String sql) {
  public JoinDefinition {
    Objects.requireNonNull(cube, "cube");
    Objects.requireNonNull(sql, "sql");
    relationship = relationship == null ? JoinRelationship.BELONGS_TO : relationship;
  }
}

package io.intellixity.strata.schema;

/** One join in a {@link JoinPath}: the cube to join and its rendered ON condition. */
public record JoinStep(CubeSource source, String onSql) {
}

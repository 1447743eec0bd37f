package io.intellixity.strata.schema;

/** What a cube contributes to FROM: a table name or a derived-table query, and its (unquoted) alias. */
public record CubeSource(String cube, String alias, String sql, boolean derived) {
}

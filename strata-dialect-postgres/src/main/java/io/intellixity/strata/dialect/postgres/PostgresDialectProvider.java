package io.intellixity.strata.dialect.postgres;

import io.intellixity.strata.dialect.DialectProvider;
import io.intellixity.strata.dialect.SqlDialect;
import io.intellixity.strata.util.Environment;

/** Registers {@link PostgresDialect} under id {@code postgres}; no environment settings. */
public final class PostgresDialectProvider implements DialectProvider {
  @Override public String id() { return PostgresDialect.ID; }

  @Override
  public SqlDialect create(Environment environment) { return new PostgresDialect(); }
}

package io.intellixity.strata.dialect.oracle;

import io.intellixity.strata.dialect.DialectProvider;
import io.intellixity.strata.dialect.SqlDialect;
import io.intellixity.strata.util.Environment;

/**
 * Registers {@link OracleDialect} under id {@code oracle}.\n
 * {@value #VERSION_ENV} selects the server version; without it the modern capability set is used.
 */
public final class OracleDialectProvider implements DialectProvider {
  public static final String VERSION_ENV = "STRATA_DB_ORACLE_VERSION";

  @Override public String id() { return OracleDialect.ID; }

  @Override
  public SqlDialect create(Environment environment) {
    OracleVersion version = environment == null
        ? OracleVersion.DEFAULT
        : environment.get(VERSION_ENV).map(OracleVersion::parse).orElse(OracleVersion.DEFAULT);
    return new OracleDialect(version);
  }
}

package io.intellixity.strata.dialect;

import io.intellixity.strata.util.Environment;

/**
 * Creates a {@link SqlDialect} for one engine. Registered in {@code META-INF/strata.factories}
 * under this interface's name.
 */
public interface DialectProvider {
  String id();

  /** Reads any version override from {@code environment} once; the returned dialect never looks again. */
  SqlDialect create(Environment environment);
}

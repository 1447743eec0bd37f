package io.intellixity.strata.compile;

import io.intellixity.strata.util.Environment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Build-wide knobs.\n
 * {@code defaultRowLimit} bounds queries that do not specify a limit; {@code maxTimeSeriesBuckets}
 * caps the series generated for rolling windows.
 */
public record CompilerOptions(int defaultRowLimit, int maxTimeSeriesBuckets) {
  private static final Logger log = LoggerFactory.getLogger(CompilerOptions.class);

  public static final String DEFAULT_LIMIT_ENV = "STRATA_DB_QUERY_DEFAULT_LIMIT";
  public static final int DEFAULT_ROW_LIMIT = 10_000;
  public static final int DEFAULT_MAX_TIME_SERIES_BUCKETS = 50_000;

  public CompilerOptions {
    if (defaultRowLimit < 0) throw new IllegalArgumentException("defaultRowLimit must be >= 0");
    if (maxTimeSeriesBuckets < 1) throw new IllegalArgumentException("maxTimeSeriesBuckets must be >= 1");
  }

  public static CompilerOptions defaults() {
    return new CompilerOptions(DEFAULT_ROW_LIMIT, DEFAULT_MAX_TIME_SERIES_BUCKETS);
  }

  public static CompilerOptions fromEnvironment(Environment env) {
    if (env == null) return defaults();
    int limit = env.get(DEFAULT_LIMIT_ENV).map(CompilerOptions::parseLimit).orElse(DEFAULT_ROW_LIMIT);
    return new CompilerOptions(limit, DEFAULT_MAX_TIME_SERIES_BUCKETS);
  }

  private static int parseLimit(String raw) {
    Integer v = null;
    try {
      v = Integer.valueOf(raw.trim());
    } catch (NumberFormatException e) {
      log.debug("strata.config key={} parse failed: {}", DEFAULT_LIMIT_ENV, e.getMessage());
    }
    if (v != null && v >= 0) return v;
    log.warn("strata.config key={} value={} invalid, using default={}", DEFAULT_LIMIT_ENV, raw, DEFAULT_ROW_LIMIT);
    return DEFAULT_ROW_LIMIT;
  }

  public CompilerOptions withDefaultRowLimit(int v) { return new CompilerOptions(v, maxTimeSeriesBuckets); }
  public CompilerOptions withMaxTimeSeriesBuckets(int v) { return new CompilerOptions(defaultRowLimit, v); }
}

package io.intellixity.strata.dialect;

import io.intellixity.strata.util.Environment;
import io.intellixity.strata.util.StrataFactoriesLoader;

import java.util.*;

/**
 * Dialect lookup by id, built via discovery (META-INF/strata.factories).\n
 *
 * Ids are matched case-insensitively. Two providers claiming the same id is a packaging error.\n
 */
public final class DialectRegistry {
  private final Map<String, DialectProvider> providers;

  public DialectRegistry() {
    this(StrataFactoriesLoader.load(DialectProvider.class));
  }

  DialectRegistry(List<DialectProvider> providers) {
    Map<String, DialectProvider> byId = new LinkedHashMap<>();
    for (DialectProvider p : providers) {
      if (p == null) continue;
      String id = normalize(p.id());
      DialectProvider prev = byId.putIfAbsent(id, p);
      if (prev != null) {
        throw new IllegalStateException("Duplicate dialect id '" + id + "': " + prev.getClass().getName()
            + " and " + p.getClass().getName());
      }
    }
    this.providers = Collections.unmodifiableMap(byId);
  }

  public Set<String> ids() { return providers.keySet(); }

  public boolean supports(String dialectId) {
    return dialectId != null && providers.containsKey(normalize(dialectId));
  }

  public SqlDialect create(String dialectId) {
    return create(dialectId, Environment.system());
  }

  public SqlDialect create(String dialectId, Environment environment) {
    if (dialectId == null || dialectId.isBlank()) throw new IllegalArgumentException("dialectId is required");
    DialectProvider p = providers.get(normalize(dialectId));
    if (p == null) throw new IllegalArgumentException("Unknown dialect id: " + dialectId + " (available: " + providers.keySet() + ")");
    return p.create(environment == null ? Environment.empty() : environment);
  }

  private static String normalize(String id) {
    if (id == null || id.isBlank()) throw new IllegalArgumentException("Dialect provider id is required");
    return id.trim().toLowerCase(Locale.ROOT);
  }
}

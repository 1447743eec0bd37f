package io.intellixity.strata.util;

import java.util.Map;
import java.util.Optional;

/** Read-only view of configuration variables. Resolved once, when a dialect or compiler is created. */
@FunctionalInterface
public interface Environment {
  Optional<String> get(String key);

  static Environment system() {
    return key -> Optional.ofNullable(System.getenv(key)).filter(v -> !v.isBlank());
  }

  static Environment of(Map<String, String> values) {
    Map<String, String> copy = Map.copyOf(values == null ? Map.of() : values);
    return key -> Optional.ofNullable(copy.get(key)).filter(v -> !v.isBlank());
  }

  static Environment empty() {
    return key -> Optional.empty();
  }
}

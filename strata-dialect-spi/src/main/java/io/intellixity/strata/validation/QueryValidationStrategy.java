package io.intellixity.strata.validation;

import io.intellixity.strata.query.QuerySpec;
import io.intellixity.strata.schema.CubeEvaluator;

/**
 * Hook to validate queries before SQL is built.
 * <p>
 * The compiler calls this once per build, before any dialect rendering. Applications may plug in
 * stricter rules.
 */
public interface QueryValidationStrategy {
  void validate(QuerySpec query, CubeEvaluator evaluator);
}

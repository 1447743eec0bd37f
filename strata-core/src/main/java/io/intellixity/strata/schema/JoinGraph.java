package io.intellixity.strata.schema;

import java.util.List;

public interface JoinGraph {
  /** Join path rooted at the first cube that reaches every other cube; fails with {@link SchemaResolutionException}. */
  JoinPath pathFor(List<String> cubes);
}

package io.intellixity.strata.schema;

import java.util.List;

public record JoinPath(CubeSource root, List<JoinStep> steps) {
  public JoinPath {
    steps = steps == null ? List.of() : List.copyOf(steps);
  }
}

package io.intellixity.strata.query;

import java.util.*;

public final class LogicalGroup implements FilterElement {
  private final Clause clause;
  private final List<FilterElement> elements;

  public LogicalGroup(Clause clause, List<FilterElement> elements) {
    this.clause = Objects.requireNonNull(clause, "clause");
    this.elements = List.copyOf(elements == null ? List.of() : elements);
  }

  public Clause clause() { return clause; }
  public List<FilterElement> elements() { return elements; }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof LogicalGroup other)) return false;
    return clause == other.clause && elements.equals(other.elements);
  }

  @Override
  public int hashCode() { return Objects.hash(clause, elements); }
}

package io.intellixity.strata.query;

import java.util.Objects;

/** Unary NOT for a filter subtree (can wrap a {@link MemberFilter} or a {@link LogicalGroup}). */
public final class NotElement implements FilterElement {
  private final FilterElement element;

  public NotElement(FilterElement element) {
    this.element = Objects.requireNonNull(element, "element");
  }

  public FilterElement element() { return element; }

  @Override
  public boolean equals(Object o) {
    return o instanceof NotElement other && element.equals(other.element);
  }

  @Override
  public int hashCode() { return element.hashCode() * 31 + 7; }
}

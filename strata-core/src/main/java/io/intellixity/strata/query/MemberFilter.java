package io.intellixity.strata.query;

import java.util.*;

/** A predicate on one cube member. {@code values} may be empty (set/notSet) and may hold nulls. */
public final class MemberFilter implements FilterElement {
  private final String member;
  private final Operator operator;
  private final List<Object> values;

  public MemberFilter(String member, Operator operator, List<?> values) {
    this.member = Objects.requireNonNull(member, "member");
    this.operator = Objects.requireNonNull(operator, "operator");
    this.values = Collections.unmodifiableList(new ArrayList<>(values == null ? List.of() : values));
  }

  public String member() { return member; }
  public Operator operator() { return operator; }
  public List<Object> values() { return values; }

  public Object firstValue() {
    return values.isEmpty() ? null : values.get(0);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof MemberFilter other)) return false;
    return member.equals(other.member) && operator == other.operator && values.equals(other.values);
  }

  @Override
  public int hashCode() { return Objects.hash(member, operator, values); }

  @Override
  public String toString() { return member + " " + operator.jsonName() + " " + values; }
}

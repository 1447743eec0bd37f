package io.intellixity.strata.query;

/** A node of a query filter tree: {@link MemberFilter}, {@link LogicalGroup} or {@link NotElement}. */
public interface FilterElement {
}

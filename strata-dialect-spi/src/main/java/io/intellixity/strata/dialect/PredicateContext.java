package io.intellixity.strata.dialect;

/** What a dialect needs from the build while it renders a filter tree. */
public interface PredicateContext {
  /** Expression a filter on {@code memberPath} compares against: the column SQL, or the aggregate for a measure. */
  String expression(String memberPath);

  /** Allocates a parameter and returns its raw marker; pass it through {@link SqlDialect#castParameter} or a cast. */
  String allocate(Object value);

  /** IANA id date-only filter values are interpreted in. */
  String timezone();
}

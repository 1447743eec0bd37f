package io.intellixity.strata.query;

/**
 * Raised when a {@link QuerySpec} references invalid members or otherwise has an invalid shape.
 * <p>
 * Thrown by the validation pass that runs before SQL is built.
 */
public final class QueryValidationException extends RuntimeException {
  public QueryValidationException(String message) {
    super(message);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}

package io.intellixity.strata.compile;

/**
 * Raised when a valid query cannot be turned into SQL for the target dialect:
 * identifier too long, operator not supported, unsupported rolling measure and similar.
 */
public class QueryCompileException extends RuntimeException {
  public QueryCompileException(String message) {
    super(message);
  }

  public QueryCompileException(String message, Throwable cause) {
    super(message, cause);
  }
}

package io.intellixity.strata.interval;

import io.intellixity.strata.compile.QueryCompileException;

public final class IntervalFormatException extends QueryCompileException {
  public IntervalFormatException(String message) {
    super(message);
  }

  public IntervalFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}

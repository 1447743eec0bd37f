package io.intellixity.strata.schema;

/** Unknown cube or member, unresolvable SQL reference, or no join path between the requested cubes. */
public final class SchemaResolutionException extends RuntimeException {
  public SchemaResolutionException(String message) {
    super(message);
  }

  public SchemaResolutionException(String message, Throwable cause) {
    super(message, cause);
  }
}

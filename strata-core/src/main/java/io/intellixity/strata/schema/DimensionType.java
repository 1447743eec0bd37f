package io.intellixity.strata.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DimensionType {
  STRING,
  NUMBER,
  BOOLEAN,
  TIME;

  @JsonValue
  public String id() { return name().toLowerCase(Locale.ROOT); }

  @JsonCreator
  public static DimensionType fromId(String id) {
    try {
      return DimensionType.valueOf(id.trim().toUpperCase(Locale.ROOT));
    } catch (RuntimeException e) {
      throw new SchemaResolutionException("Unknown dimension type: " + id, e);
    }
  }
}

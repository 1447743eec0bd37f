package io.intellixity.strata.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AggregationType {
  COUNT("count"),
  COUNT_DISTINCT("countDistinct"),
  SUM("sum"),
  AVG("avg"),
  MIN("min"),
  MAX("max"),
  /** Already-aggregated expression; rendered as-is. */
  NUMBER("number");

  private final String id;

  AggregationType(String id) {
    this.id = id;
  }

  @JsonValue
  public String id() { return id; }

  @JsonCreator
  public static AggregationType fromId(String id) {
    for (AggregationType t : values()) {
      if (t.id.equalsIgnoreCase(id) || t.name().equalsIgnoreCase(id)) return t;
    }
    throw new SchemaResolutionException("Unknown measure type: " + id);
  }
}

package io.intellixity.strata.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum JoinRelationship {
  BELONGS_TO("belongsTo"),
  HAS_ONE("hasOne"),
  HAS_MANY("hasMany");

  private final String id;

  JoinRelationship(String id) {
    this.id = id;
  }

  @JsonValue
  public String id() { return id; }

  @JsonCreator
  public static JoinRelationship fromId(String id) {
    for (JoinRelationship r : values()) {
      if (r.id.equalsIgnoreCase(id) || r.name().equalsIgnoreCase(id)) return r;
    }
    throw new SchemaResolutionException("Unknown join relationship: " + id);
  }
}

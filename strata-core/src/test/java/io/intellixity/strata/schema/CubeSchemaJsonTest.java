package io.intellixity.strata.schema;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class CubeSchemaJsonTest {
  @Test
  void readsBareArrayAndSchemaIds() {
    List<CubeDefinition> cubes = CubeSchemaJson.read("""
        [
          {
            "name": "visitors",
            "sql": "select * from visitors",
            "extra": "ignored",
            "measures": [
              { "name": "priorPeriod", "type": "sum", "sql": "amount",
                "rollingWindow": { "trailing": "1 year", "offset": "start" } }
            ],
            "dimensions": [ { "name": "createdAt", "type": "time", "sql": "created_at" } ],
            "joins": [ { "cube": "sources", "relationship": "hasMany", "sql": "{CUBE}.id = {sources}.visitor_id" } ]
          }
        ]
        """);
    assertEquals(1, cubes.size());
    CubeDefinition c = cubes.get(0);
    MeasureDefinition m = c.measures().get(0);
    assertEquals(AggregationType.SUM, m.type());
    assertEquals(new RollingWindow("1 year", null, RollingWindow.Offset.START), m.rollingWindow());
    assertEquals(DimensionType.TIME, c.dimensions().get(0).type());
    assertEquals(JoinRelationship.HAS_MANY, c.joins().get(0).relationship());
  }

  @Test
  void rejectsCubeWithoutSource() {
    assertThrows(SchemaResolutionException.class, () -> CubeSchemaJson.read("{\"cubes\":[{\"name\":\"x\"}]}"));
  }

  @Test
  void missingResourceFails() {
    SchemaResolutionException ex = assertThrows(SchemaResolutionException.class, () -> CubeSchemaJson.readResource("schema/none.json"));
    assertTrue(ex.getMessage().contains("schema/none.json"));
  }
}

package io.intellixity.strata.schema;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Reads cube definitions from JSON: either {@code {"cubes": [ ... ]}} or a bare array.\n
 * Each cube follows {@link CubeDefinition}; enum values use their schema ids ({@code countDistinct}, {@code belongsTo}).
 */
public final class CubeSchemaJson {
  private static final ObjectMapper JSON = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  private static final TypeReference<List<CubeDefinition>> CUBES = new TypeReference<>() {};

  private CubeSchemaJson() {}

  public static List<CubeDefinition> read(InputStream in) {
    try {
      return fromTree(JSON.readTree(in));
    } catch (IOException e) {
      throw new SchemaResolutionException("Failed to read cube schema: " + e.getMessage(), e);
    }
  }

  public static List<CubeDefinition> read(String json) {
    try {
      return fromTree(JSON.readTree(json));
    } catch (IOException e) {
      throw new SchemaResolutionException("Failed to read cube schema: " + e.getMessage(), e);
    }
  }

  public static List<CubeDefinition> readResource(String resource) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = CubeSchemaJson.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) throw new SchemaResolutionException("Cube schema resource not found: " + resource);
      return read(in);
    } catch (IOException e) {
      throw new SchemaResolutionException("Failed to close cube schema resource " + resource, e);
    }
  }

  private static List<CubeDefinition> fromTree(JsonNode root) throws IOException {
    if (root == null || root.isNull() || root.isMissingNode()) return List.of();
    JsonNode cubes = root.isObject() ? root.get("cubes") : root;
    if (cubes == null || !cubes.isArray()) throw new SchemaResolutionException("Cube schema must be an array or {\"cubes\": [...]}");
    return JSON.readerFor(CUBES).readValue(cubes);
  }
}

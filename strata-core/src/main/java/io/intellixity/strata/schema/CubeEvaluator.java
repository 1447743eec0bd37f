package io.intellixity.strata.schema;

/** Resolves member paths ({@code cube.member}) and cube sources against a cube model. */
public interface CubeEvaluator {
  ResolvedMember resolve(String memberPath);

  CubeSource source(String cube);

  static String cubeOf(String memberPath) {
    int dot = memberPath == null ? -1 : memberPath.indexOf('.');
    if (dot <= 0 || dot == memberPath.length() - 1) {
      throw new SchemaResolutionException("Member path must be <cube>.<member>: " + memberPath);
    }
    return memberPath.substring(0, dot);
  }
}

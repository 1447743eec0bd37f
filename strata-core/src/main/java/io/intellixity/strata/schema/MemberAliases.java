package io.intellixity.strata.schema;

import java.util.Locale;

/** Alias naming shared by cubes and members: {@code createdAt} becomes {@code created_at}. */
public final class MemberAliases {
  private MemberAliases() {}

  public static String snakeCase(String name) {
    if (name == null) return null;
    StringBuilder sb = new StringBuilder(name.length() + 4);
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (Character.isUpperCase(c)) {
        if (i > 0 && name.charAt(i - 1) != '_' && !Character.isUpperCase(name.charAt(i - 1))) sb.append('_');
        sb.append(Character.toLowerCase(c));
      } else if (c == '.' || c == '-' || c == ' ') {
        sb.append('_');
      } else {
        sb.append(c);
      }
    }
    return sb.toString().toLowerCase(Locale.ROOT);
  }

  public static String cubeAlias(CubeDefinition cube) {
    String alias = cube.sqlAlias();
    return (alias != null && !alias.isBlank()) ? alias : snakeCase(cube.name());
  }

  public static String memberAlias(String cubeAlias, String memberName) {
    return cubeAlias + "__" + snakeCase(memberName);
  }
}

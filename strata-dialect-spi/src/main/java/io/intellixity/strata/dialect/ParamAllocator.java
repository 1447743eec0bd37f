package io.intellixity.strata.dialect;

import java.util.*;
import java.util.function.IntFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Build-scoped parameter list.\n
 *
 * {@link #allocate(Object)} appends a value and returns a marker ({@code $0$}, {@code $1$}, ...) that stands in for
 * the parameter while SQL fragments are assembled in whatever order the builder needs. {@link #finish} then walks
 * the finished text, replaces each marker with the engine placeholder and emits the values in textual order,
 * so fragments moved around (HAVING before WHERE, subqueries inlined twice) still bind correctly.\n
 *
 * Not thread-safe; owned by exactly one build.\n
 */
public final class ParamAllocator {
  private static final Pattern MARKER = Pattern.compile("\\$(\\d+)\\$");

  private final List<Object> values = new ArrayList<>();

  public String allocate(Object value) {
    values.add(value);
    return "$" + (values.size() - 1) + "$";
  }

  public int size() { return values.size(); }

  public List<Object> values() { return Collections.unmodifiableList(values); }

  /**
   * Replaces markers with {@code placeholder.apply(position)} (1-based, in textual order).
   * A marker that occurs twice yields two placeholders and two copies of its value.
   */
  public SqlStatement finish(String sql, IntFunction<String> placeholder) {
    Objects.requireNonNull(sql, "sql");
    Objects.requireNonNull(placeholder, "placeholder");
    Matcher m = MARKER.matcher(sql);
    StringBuilder out = new StringBuilder(sql.length());
    List<Object> ordered = new ArrayList<>();
    while (m.find()) {
      int idx = Integer.parseInt(m.group(1));
      if (idx >= values.size()) throw new IllegalStateException("Unknown parameter marker " + m.group() + " in SQL");
      ordered.add(values.get(idx));
      m.appendReplacement(out, Matcher.quoteReplacement(placeholder.apply(ordered.size())));
    }
    m.appendTail(out);
    return new SqlStatement(out.toString(), ordered);
  }
}

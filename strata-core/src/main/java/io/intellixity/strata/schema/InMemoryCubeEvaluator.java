package io.intellixity.strata.schema;

import java.util.*;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Simple in-memory {@link CubeEvaluator} over {@link CubeDefinition}s.\n
 *
 * Member SQL may reference {@code {CUBE}}, another cube ({@code {orders}}), a member of the same cube
 * ({@code {amount}}) or of another cube ({@code {orders.amount}}). A bare column name is qualified
 * with the owning cube's alias.\n
 *
 * Useful for tests, demos and tooling; it is not a schema language.\n
 */
public final class InMemoryCubeEvaluator implements CubeEvaluator {
  private static final Pattern REFERENCE = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*)(?:\\.([A-Za-z_][A-Za-z0-9_]*))?\\}");
  private static final Pattern BARE_COLUMN = Pattern.compile("[A-Za-z_][A-Za-z0-9_$#]*");
  private static final String SELF = "CUBE";

  private final Map<String, CubeDefinition> cubes = new LinkedHashMap<>();
  private final UnaryOperator<String> quote;

  public InMemoryCubeEvaluator(List<CubeDefinition> defs) {
    this(defs, id -> "\"" + id + "\"");
  }

  public InMemoryCubeEvaluator(List<CubeDefinition> defs, UnaryOperator<String> quote) {
    this.quote = Objects.requireNonNull(quote, "quote");
    for (CubeDefinition c : defs) {
      if (cubes.put(c.name(), c) != null) throw new SchemaResolutionException("Duplicate cube: " + c.name());
    }
  }

  public Collection<CubeDefinition> cubes() { return Collections.unmodifiableCollection(cubes.values()); }

  public CubeDefinition cube(String name) {
    CubeDefinition c = cubes.get(name);
    if (c == null) throw new SchemaResolutionException("Cube '" + name + "' not found");
    return c;
  }

  @Override
  public ResolvedMember resolve(String memberPath) {
    return resolve(memberPath, new ArrayDeque<>());
  }

  @Override
  public CubeSource source(String cubeName) {
    CubeDefinition c = cube(cubeName);
    String alias = MemberAliases.cubeAlias(c);
    if (c.sqlTable() != null && !c.sqlTable().isBlank()) return new CubeSource(c.name(), alias, c.sqlTable(), false);
    return new CubeSource(c.name(), alias, c.sql(), true);
  }

  /** Renders join or member SQL in the context of {@code cubeName}. */
  public String renderSql(String cubeName, String sql) {
    return renderSql(cube(cubeName), sql, new ArrayDeque<>());
  }

  private ResolvedMember resolve(String memberPath, Deque<String> stack) {
    String cubeName = CubeEvaluator.cubeOf(memberPath);
    String memberName = memberPath.substring(cubeName.length() + 1);
    CubeDefinition c = cube(cubeName);
    String alias = MemberAliases.memberAlias(MemberAliases.cubeAlias(c), memberName);

    if (stack.contains(memberPath)) {
      throw new SchemaResolutionException("Circular reference: " + String.join(" -> ", stack) + " -> " + memberPath);
    }
    stack.push(memberPath);
    try {
      for (DimensionDefinition d : c.dimensions()) {
        if (!d.name().equals(memberName)) continue;
        if (d.sql() == null || d.sql().isBlank()) throw new SchemaResolutionException("Dimension '" + memberPath + "' has no sql");
        return ResolvedMember.dimension(memberPath, c.name(), renderSql(c, d.sql(), stack), alias, d.type(), d.primaryKey());
      }
      for (MeasureDefinition m : c.measures()) {
        if (!m.name().equals(memberName)) continue;
        String sql = m.sql();
        if (sql == null || sql.isBlank()) {
          if (m.type() != AggregationType.COUNT) throw new SchemaResolutionException("Measure '" + memberPath + "' has no sql");
          return ResolvedMember.measure(memberPath, c.name(), null, alias, m.type(), m.rollingWindow());
        }
        return ResolvedMember.measure(memberPath, c.name(), renderSql(c, sql, stack), alias, m.type(), m.rollingWindow());
      }
    } finally {
      stack.pop();
    }
    throw new SchemaResolutionException("'" + memberName + "' not found for path '" + memberPath + "'");
  }

  private String renderSql(CubeDefinition owner, String sql, Deque<String> stack) {
    String trimmed = sql.trim();
    if (BARE_COLUMN.matcher(trimmed).matches()) return quotedAlias(owner) + "." + trimmed;

    Matcher m = REFERENCE.matcher(sql);
    StringBuilder sb = new StringBuilder();
    while (m.find()) {
      String head = m.group(1);
      String tail = m.group(2);
      String replacement;
      if (tail == null) {
        if (SELF.equals(head)) replacement = quotedAlias(owner);
        else if (cubes.containsKey(head)) replacement = quotedAlias(cubes.get(head));
        else replacement = memberSql(owner.name() + "." + head, stack);
      } else {
        String cubeName = SELF.equals(head) ? owner.name() : head;
        if (!cubes.containsKey(cubeName)) throw new SchemaResolutionException("Cube '" + head + "' referenced in '" + sql + "' not found");
        CubeDefinition target = cubes.get(cubeName);
        if (isColumnOnly(target, tail)) replacement = quotedAlias(target) + "." + tail;
        else replacement = memberSql(cubeName + "." + tail, stack);
      }
      m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
    }
    m.appendTail(sb);
    return sb.toString();
  }

  private String memberSql(String path, Deque<String> stack) {
    ResolvedMember r = resolve(path, stack);
    if (r.sqlExpression() == null) throw new SchemaResolutionException("Member '" + path + "' has no sql to reference");
    return r.sqlExpression();
  }

  // {CUBE.col} where col is not a declared member refers to the raw column
  private static boolean isColumnOnly(CubeDefinition c, String name) {
    for (DimensionDefinition d : c.dimensions()) if (d.name().equals(name)) return false;
    for (MeasureDefinition md : c.measures()) if (md.name().equals(name)) return false;
    return true;
  }

  private String quotedAlias(CubeDefinition c) {
    return quote.apply(MemberAliases.cubeAlias(c));
  }
}

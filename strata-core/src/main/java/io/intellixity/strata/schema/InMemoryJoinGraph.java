package io.intellixity.strata.schema;

import java.util.*;

/**
 * {@link JoinGraph} over the joins declared in an {@link InMemoryCubeEvaluator}'s cubes.\n
 * Joins are walked in both directions; the first requested cube is the root and every other cube is
 * reached by the shortest path (breadth-first, declaration order breaks ties).\n
 */
public final class InMemoryJoinGraph implements JoinGraph {
  private final InMemoryCubeEvaluator evaluator;
  private final Map<String, List<Edge>> edges = new LinkedHashMap<>();

  private record Edge(String to, String onSql) {}

  public InMemoryJoinGraph(InMemoryCubeEvaluator evaluator) {
    this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    for (CubeDefinition c : evaluator.cubes()) {
      for (JoinDefinition j : c.joins()) {
        evaluator.cube(j.cube());
        String on = evaluator.renderSql(c.name(), j.sql());
        edges.computeIfAbsent(c.name(), k -> new ArrayList<>()).add(new Edge(j.cube(), on));
        edges.computeIfAbsent(j.cube(), k -> new ArrayList<>()).add(new Edge(c.name(), on));
      }
    }
  }

  @Override
  public JoinPath pathFor(List<String> cubes) {
    if (cubes == null || cubes.isEmpty()) throw new IllegalArgumentException("cubes must not be empty");
    List<String> wanted = List.copyOf(new LinkedHashSet<>(cubes));
    String root = wanted.get(0);
    CubeSource rootSource = evaluator.source(root);

    // BFS parents: cube -> edge used to reach it
    Map<String, String> parent = new HashMap<>();
    Map<String, String> via = new HashMap<>();
    Set<String> seen = new HashSet<>(List.of(root));
    Deque<String> queue = new ArrayDeque<>(List.of(root));
    while (!queue.isEmpty()) {
      String cur = queue.poll();
      for (Edge e : edges.getOrDefault(cur, List.of())) {
        if (!seen.add(e.to())) continue;
        parent.put(e.to(), cur);
        via.put(e.to(), e.onSql());
        queue.add(e.to());
      }
    }

    List<JoinStep> steps = new ArrayList<>();
    Set<String> joined = new HashSet<>(List.of(root));
    for (String target : wanted.subList(1, wanted.size())) {
      if (!seen.contains(target)) {
        throw new SchemaResolutionException("Can't find join path to join " + quoteAll(wanted));
      }
      Deque<String> chain = new ArrayDeque<>();
      for (String c = target; !joined.contains(c); c = parent.get(c)) chain.push(c);
      for (String c : chain) {
        steps.add(new JoinStep(evaluator.source(c), via.get(c)));
        joined.add(c);
      }
    }
    return new JoinPath(rootSource, steps);
  }

  private static String quoteAll(List<String> cubes) {
    StringJoiner sj = new StringJoiner(", ");
    for (String c : cubes) sj.add("'" + c + "'");
    return sj.toString();
  }
}

package io.intellixity.strata.dialect;

import io.intellixity.strata.query.Granularity;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Static facts about one engine (and version), resolved once when the dialect is built.\n
 * Cast templates use {@code {param}} where the parameter reference goes.
 */
public record DialectCapabilities(
    /** Keyword between a derived table and its alias; empty when the engine rejects {@code AS} there. */
    String tableAliasKeyword,
    String joinAliasKeyword,
    PaginationStrategy paginationStrategy,
    GroupByStrategy groupByStrategy,
    Map<Granularity, String> truncationTokens,
    String dateCastTemplate,
    String timestampCastTemplate,
    int maxIdentifierLength
) {
  public static final String PARAM = "{param}";

  public DialectCapabilities {
    tableAliasKeyword = tableAliasKeyword == null ? "" : tableAliasKeyword.trim();
    joinAliasKeyword = joinAliasKeyword == null ? tableAliasKeyword : joinAliasKeyword.trim();
    Objects.requireNonNull(paginationStrategy, "paginationStrategy");
    Objects.requireNonNull(groupByStrategy, "groupByStrategy");
    Objects.requireNonNull(truncationTokens, "truncationTokens");
    for (Granularity g : Granularity.values()) {
      if (!truncationTokens.containsKey(g)) throw new IllegalArgumentException("Missing truncation token for " + g.id());
    }
    truncationTokens = Map.copyOf(new EnumMap<>(truncationTokens));
    requireTemplate(dateCastTemplate, "dateCastTemplate");
    requireTemplate(timestampCastTemplate, "timestampCastTemplate");
    if (maxIdentifierLength < 1) throw new IllegalArgumentException("maxIdentifierLength must be >= 1");
  }

  public String truncationToken(Granularity g) { return truncationTokens.get(g); }

  public String dateCast(String paramRef) { return dateCastTemplate.replace(PARAM, paramRef); }
  public String timestampCast(String paramRef) { return timestampCastTemplate.replace(PARAM, paramRef); }

  public DialectCapabilities withPaginationStrategy(PaginationStrategy v) {
    return new DialectCapabilities(tableAliasKeyword, joinAliasKeyword, v, groupByStrategy, truncationTokens,
        dateCastTemplate, timestampCastTemplate, maxIdentifierLength);
  }

  public DialectCapabilities withMaxIdentifierLength(int v) {
    return new DialectCapabilities(tableAliasKeyword, joinAliasKeyword, paginationStrategy, groupByStrategy, truncationTokens,
        dateCastTemplate, timestampCastTemplate, v);
  }

  private static void requireTemplate(String template, String name) {
    if (template == null || !template.contains(PARAM)) {
      throw new IllegalArgumentException(name + " must contain " + PARAM);
    }
  }
}

package io.intellixity.strata.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.*;

import java.io.IOException;
import java.util.*;

/**
 * Canonical JSON deserializer for {@link QuerySpec}.\n
 *\n
 * <pre>\n
 * {\n
 *   "measures": ["visitors.count"],\n
 *   "dimensions": ["visitors.source"],\n
 *   "timeDimensions": [{ "dimension": "visitors.createdAt", "granularity": "day", "dateRange": ["2024-02-01", "2024-02-02"] }],\n
 *   "filters": [{ "member": "visitors.source", "operator": "equals", "values": ["google"] }],\n
 *   "order": [{ "member": "visitors.count", "direction": "desc" }],\n
 *   "limit": 100, "offset": 10, "timezone": "UTC"\n
 * }\n
 * </pre>\n
 */
public final class QuerySpecJsonDeserializer extends JsonDeserializer<QuerySpec> {
  @Override
  public QuerySpec deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("Query JSON must be an object");

    QuerySpec q = QuerySpec.empty()
        .withMeasures(textList(root.get("measures")))
        .withDimensions(textList(root.get("dimensions")));

    JsonNode tds = root.get("timeDimensions");
    if (tds != null && tds.isArray()) {
      List<TimeDimensionSpec> out = new ArrayList<>();
      for (JsonNode td : tds) {
        if (!td.isObject()) continue;
        String dim = textOrNull(td.get("dimension"));
        if (dim == null) throw new QueryValidationException("timeDimensions entry requires dimension");
        out.add(new TimeDimensionSpec(dim, Granularity.fromId(textOrNull(td.get("granularity"))), parseDateRange(td.get("dateRange"))));
      }
      q = q.withTimeDimensions(out);
    }

    JsonNode filters = root.get("filters");
    if (filters == null || filters.isNull()) filters = root.get("filter");
    if (filters != null && !filters.isNull()) {
      if (filters.isArray()) {
        List<FilterElement> els = parseChildren(filters, codec);
        if (els.size() == 1) q = q.withFilter(els.get(0));
        else if (!els.isEmpty()) q = q.withFilter(new LogicalGroup(Clause.AND, els));
      } else {
        q = q.withFilter(parseElement(filters, codec));
      }
    }

    q = q.withOrder(parseOrder(root.get("order")));

    // "limit": null and "rowLimit": null are explicit requests for no bound; a missing key is not.
    if (root.has("limit")) q = q.withLimit(RowLimit.lenient(rawValue(root.get("limit"), codec)));
    else if (root.has("rowLimit")) q = q.withLimit(RowLimit.lenient(rawValue(root.get("rowLimit"), codec)));

    JsonNode offset = root.get("offset");
    if (offset != null && !offset.isNull()) q = q.withOffset(RowLimit.lenientInt(rawValue(offset, codec)));

    String tz = textOrNull(root.get("timezone"));
    if (tz != null) q = q.withTimezone(tz);

    return q;
  }

  private static DateRange parseDateRange(JsonNode n) {
    if (n == null || n.isNull()) return null;
    if (n.isTextual()) return new DateRange(n.asText(), n.asText());
    if (n.isArray() && n.size() == 1) return new DateRange(n.get(0).asText(), n.get(0).asText());
    if (n.isArray() && n.size() == 2) return new DateRange(n.get(0).asText(), n.get(1).asText());
    throw new QueryValidationException("dateRange must be a date or a [from, to] pair: " + n);
  }

  private static List<OrderSpec> parseOrder(JsonNode n) {
    List<OrderSpec> out = new ArrayList<>();
    if (n == null || n.isNull()) return out;
    // Object form: { "visitors.count": "desc" }
    if (n.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> it = n.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        out.add(new OrderSpec(e.getKey(), direction(textOrNull(e.getValue()))));
      }
      return out;
    }
    if (!n.isArray()) throw new QueryValidationException("order must be an object or an array");
    for (JsonNode x : n) {
      // Pair form: [ "visitors.count", "desc" ]
      if (x.isArray() && x.size() >= 1) {
        out.add(new OrderSpec(x.get(0).asText(), direction(x.size() > 1 ? textOrNull(x.get(1)) : null)));
      } else if (x.isObject()) {
        String member = textOrNull(x.get("member"));
        if (member == null) member = textOrNull(x.get("id"));
        if (member == null) continue;
        String dir = textOrNull(x.get("direction"));
        if (dir == null && x.has("desc")) dir = x.get("desc").asBoolean() ? "desc" : "asc";
        out.add(new OrderSpec(member, direction(dir)));
      }
    }
    return out;
  }

  private static OrderSpec.Direction direction(String dir) {
    if (dir == null) return OrderSpec.Direction.ASC;
    try {
      return OrderSpec.Direction.valueOf(dir.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new QueryValidationException("Unknown order direction: " + dir, e);
    }
  }

  private static FilterElement parseElement(JsonNode n, ObjectCodec codec) throws IOException {
    if (n == null || n.isNull()) return null;
    if (!n.isObject()) throw new IllegalArgumentException("Unsupported filter element: " + n);

    // Group forms: { "and": [ ... ] } / { "or": [ ... ] }
    if (n.has("and")) return new LogicalGroup(Clause.AND, parseChildren(n.get("and"), codec));
    if (n.has("or")) return new LogicalGroup(Clause.OR, parseChildren(n.get("or"), codec));

    // NOT form: { "not": <element> }
    if (n.has("not")) {
      FilterElement child = parseElement(n.get("not"), codec);
      return child == null ? null : new NotElement(child);
    }

    // Member form: { "member": "...", "operator": "...", "values": [ ... ] }; "dimension" is an older alias of "member"
    String member = textOrNull(n.get("member"));
    if (member == null) member = textOrNull(n.get("dimension"));
    String op = textOrNull(n.get("operator"));
    if (member != null && op != null) {
      return new MemberFilter(member, Operator.fromJsonName(op), parseValues(n.get("values"), codec));
    }

    throw new IllegalArgumentException("Unsupported filter element: " + n);
  }

  private static List<FilterElement> parseChildren(JsonNode arr, ObjectCodec codec) throws IOException {
    if (arr == null || !arr.isArray()) return List.of();
    List<FilterElement> out = new ArrayList<>();
    for (JsonNode x : arr) {
      FilterElement e = parseElement(x, codec);
      if (e != null) out.add(e);
    }
    return out;
  }

  private static List<Object> parseValues(JsonNode v, ObjectCodec codec) throws IOException {
    List<Object> out = new ArrayList<>();
    if (v == null || v.isNull()) return out;
    if (!v.isArray()) {
      out.add(rawValue(v, codec));
      return out;
    }
    for (JsonNode x : v) out.add(rawValue(x, codec));
    return out;
  }

  private static Object rawValue(JsonNode v, ObjectCodec codec) throws IOException {
    if (v == null || v.isNull()) return null;
    return codec.treeToValue(v, Object.class);
  }

  private static List<String> textList(JsonNode n) {
    List<String> out = new ArrayList<>();
    if (n == null || !n.isArray()) return out;
    for (JsonNode x : n) if (x.isTextual()) out.add(x.asText());
    return out;
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }
}

package io.intellixity.strata.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.util.List;

/** Canonical JSON serializer for {@link QuerySpec}. */
public final class QuerySpecJsonSerializer extends JsonSerializer<QuerySpec> {
  @Override
  public void serialize(QuerySpec q, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (q == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();

    if (!q.measures().isEmpty()) g.writeObjectField("measures", q.measures());
    if (!q.dimensions().isEmpty()) g.writeObjectField("dimensions", q.dimensions());

    if (!q.timeDimensions().isEmpty()) {
      g.writeArrayFieldStart("timeDimensions");
      for (TimeDimensionSpec td : q.timeDimensions()) {
        g.writeStartObject();
        g.writeStringField("dimension", td.dimension());
        if (td.granularity() != null) g.writeStringField("granularity", td.granularity().id());
        if (td.dateRange() != null) g.writeObjectField("dateRange", List.of(td.dateRange().from(), td.dateRange().to()));
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (q.filter() != null) {
      g.writeArrayFieldStart("filters");
      // A top-level AND group is written back as the implicit filter array
      if (q.filter() instanceof LogicalGroup lg && lg.clause() == Clause.AND) {
        for (FilterElement child : lg.elements()) writeElement(child, g, serializers);
      } else {
        writeElement(q.filter(), g, serializers);
      }
      g.writeEndArray();
    }

    if (!q.order().isEmpty()) {
      g.writeArrayFieldStart("order");
      for (OrderSpec o : q.order()) {
        g.writeStartObject();
        g.writeStringField("member", o.member());
        g.writeStringField("direction", o.direction().name().toLowerCase());
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    RowLimit limit = q.limit();
    if (limit.isUnbounded()) g.writeNullField("limit");
    else if (limit.isBounded()) g.writeNumberField("limit", limit.value());

    if (q.offset() != null) g.writeNumberField("offset", q.offset());
    g.writeStringField("timezone", q.timezone());

    g.writeEndObject();
  }

  private static void writeElement(FilterElement el, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (el instanceof LogicalGroup lg) {
      String key = lg.clause() == Clause.OR ? "or" : "and";
      g.writeStartObject();
      g.writeArrayFieldStart(key);
      for (FilterElement child : lg.elements()) writeElement(child, g, serializers);
      g.writeEndArray();
      g.writeEndObject();
      return;
    }

    if (el instanceof NotElement n) {
      g.writeStartObject();
      g.writeFieldName("not");
      writeElement(n.element(), g, serializers);
      g.writeEndObject();
      return;
    }

    if (el instanceof MemberFilter f) {
      g.writeStartObject();
      g.writeStringField("member", f.member());
      g.writeStringField("operator", f.operator().jsonName());
      if (!f.values().isEmpty()) {
        g.writeFieldName("values");
        serializers.defaultSerializeValue(f.values(), g);
      }
      g.writeEndObject();
      return;
    }

    serializers.defaultSerializeValue(el, g);
  }
}

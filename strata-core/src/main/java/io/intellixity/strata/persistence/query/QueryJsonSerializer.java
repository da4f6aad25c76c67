package io.intellixity.strata.persistence.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/** Canonical JSON serializer for {@link QueryElement}. */
public final class QueryJsonSerializer extends JsonSerializer<QueryElement> {
  @Override
  public void serialize(QueryElement q, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (q == null) {
      g.writeNull();
      return;
    }
    writeElement(q, g, serializers);
  }

  private static void writeElement(QueryElement el, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (el instanceof LogicalGroup lg) {
      g.writeStartObject();
      if (lg.clause() == Clause.NOT) {
        g.writeFieldName("not");
        writeElement(lg.operand(), g, serializers);
      } else {
        g.writeArrayFieldStart(lg.clause() == Clause.OR ? "or" : "and");
        for (QueryElement child : lg.nodes()) {
          writeElement(child, g, serializers);
        }
        g.writeEndArray();
      }
      g.writeEndObject();
      return;
    }

    Condition c = (Condition) el;
    g.writeStartObject();
    g.writeObjectFieldStart(c.operator().wireName());
    g.writeStringField("field", c.attribute());
    if (c.operator().group() == OperatorGroup.SET) {
      g.writeFieldName("values");
    } else {
      g.writeFieldName("value");
    }
    serializers.defaultSerializeValue(c.argument(), g);
    g.writeEndObject();
    g.writeEndObject();
  }
}

package io.intellixity.strata.persistence.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.*;

/**
 * Canonical JSON deserializer for {@link QueryElement}.
 * <p>
 * Accepted forms: {@code {"and":[...]}}, {@code {"or":[...]}}, {@code {"not":{...}}} and
 * {@code {"<op>":{"field":...,"value":...}}} ({@code "values"} for in/nin).
 */
public final class QueryJsonDeserializer extends JsonDeserializer<QueryElement> {
  @Override
  public QueryElement deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    return parseElement(root, codec);
  }

  private static QueryElement parseElement(JsonNode n, ObjectCodec codec) throws IOException {
    if (n == null || !n.isObject()) throw new MalformedQueryException("Query element must be an object: " + n);
    if (n.size() != 1) throw new MalformedQueryException("Query element must have exactly one key: " + n);

    String key = n.fieldNames().next();
    JsonNode body = n.get(key);

    switch (key) {
      case "and":
        return new LogicalGroup(Clause.AND, parseChildren(key, body, codec));
      case "or":
        return new LogicalGroup(Clause.OR, parseChildren(key, body, codec));
      case "not":
        return new LogicalGroup(Clause.NOT, List.of(parseElement(body, codec)));
      default:
        return parseCondition(Operator.fromName(key), body, codec);
    }
  }

  private static List<QueryElement> parseChildren(String key, JsonNode arr, ObjectCodec codec) throws IOException {
    if (arr == null || !arr.isArray()) throw new MalformedQueryException(key + " requires an array of elements");
    List<QueryElement> out = new ArrayList<>();
    for (JsonNode x : arr) out.add(parseElement(x, codec));
    return out;
  }

  private static Condition parseCondition(Operator op, JsonNode body, ObjectCodec codec) throws IOException {
    if (body == null || !body.isObject()) throw new MalformedQueryException(op.wireName() + " must be an object");
    JsonNode field = body.get("field");
    if (field == null || !field.isTextual()) throw new MalformedQueryException(op.wireName() + " requires field");

    JsonNode value = body.get(op.group() == OperatorGroup.SET ? "values" : "value");
    Object argument = (value == null || value.isNull()) ? null : codec.treeToValue(value, Object.class);
    return new Condition(field.asText(), op, argument);
  }
}

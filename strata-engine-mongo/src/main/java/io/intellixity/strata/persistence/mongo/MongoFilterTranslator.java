package io.intellixity.strata.persistence.mongo;

import io.intellixity.strata.persistence.query.*;
import io.intellixity.strata.persistence.spi.translate.AbstractFilterTranslator;
import org.bson.Document;

import java.util.*;

/**
 * Renders query trees to MongoDB filter documents.
 * <p>
 * Leaves map to {@code {attr: {$op: v}}}; STRING operators become escaped {@code $regex} patterns.
 * Mongo already applies these element by element to array fields, as the matcher does. A null
 * argument means "no non-null value" and renders as
 * {@code {attr: {$in: [null, []], $not: {$elemMatch: {$ne: null}}}}}, so an empty array or one
 * holding only nulls counts as null while {@code [null, "x"]} does not.
 * <p>
 * AND merges children into one document, nesting operators of the same attribute under one key,
 * and falls back to an explicit {@code $and} on any key collision. NOT is {@code {$nor: [child]}}.
 */
public final class MongoFilterTranslator extends AbstractFilterTranslator<Document> {
  public static final String DIALECT = "mongo";

  static final String REGEX_RESERVED = "\\^$.|?*+()[]{}";

  @Override
  public String dialect() { return DIALECT; }

  @Override
  protected Document matchAll() {
    return new Document();
  }

  @Override
  public Document visit(Condition c) {
    Operator op = c.operator();
    switch (op) {
      case EQ:
        return (c.argument() == null) ? absent(c.attribute()) : leaf(c, c.argument());
      case NE:
        return (c.argument() == null) ? nor(absent(c.attribute())) : leaf(c, c.argument());
      case IN:
        return in(c);
      case NIN:
        return c.arguments().contains(null) ? nor(in(c)) : leaf(c, c.arguments());
      default:
        break;
    }
    if (op.group() != OperatorGroup.STRING) return leaf(c, c.argument());

    String literal = escape(stringArgument(c), REGEX_RESERVED);
    Document regex = switch (op) {
      case CONTAINS -> new Document("$regex", literal);
      case ICONTAINS -> new Document("$regex", literal).append("$options", "i");
      case STARTSWITH -> new Document("$regex", "^" + literal);
      case ENDSWITH -> new Document("$regex", literal + "$");
      default -> throw new UnsupportedOperatorException(DIALECT, op, "not a string operator");
    };
    return new Document(c.attribute(), regex);
  }

  @Override
  public Document visit(LogicalGroup g) {
    switch (g.clause()) {
      case AND:
        return and(children(g));
      case OR:
        return new Document("$or", children(g));
      case NOT:
        return nor(g.operand().accept(this));
      default:
        throw invalidGroup(g);
    }
  }

  private static Document leaf(Condition c, Object argument) {
    return new Document(c.attribute(), new Document("$" + c.operator().wireName(), argument));
  }

  private static Document in(Condition c) {
    List<Object> present = new ArrayList<>(c.arguments());
    if (!present.removeIf(Objects::isNull)) return new Document(c.attribute(), new Document("$in", present));
    if (present.isEmpty()) return absent(c.attribute());
    return new Document("$or", List.of(new Document(c.attribute(), new Document("$in", present)), absent(c.attribute())));
  }

  private static Document absent(String attribute) {
    Document ops = new Document("$in", Arrays.asList(null, List.of()))
        .append("$not", new Document("$elemMatch", new Document("$ne", null)));
    return new Document(attribute, ops);
  }

  private static Document nor(Document child) {
    return new Document("$nor", List.of(child));
  }

  private List<Document> children(LogicalGroup g) {
    List<Document> out = new ArrayList<>(g.nodes().size());
    for (QueryElement n : g.nodes()) out.add(n.accept(this));
    return out;
  }

  private static Document and(List<Document> parts) {
    if (parts.size() == 1) return parts.get(0);
    Document merged = new Document();
    for (Document part : parts) {
      for (Map.Entry<String, Object> e : part.entrySet()) {
        if (!mergeInto(merged, e.getKey(), e.getValue())) return new Document("$and", parts);
      }
    }
    return merged;
  }

  // false on a collision that cannot be expressed in a single document
  private static boolean mergeInto(Document merged, String key, Object value) {
    Object existing = merged.get(key);
    if (existing == null && !merged.containsKey(key)) {
      merged.put(key, (value instanceof Document d) ? new Document(d) : value);
      return true;
    }
    if (key.startsWith("$") || !(existing instanceof Document ops) || !(value instanceof Document more)) return false;
    for (String op : more.keySet()) {
      if (ops.containsKey(op) || !op.startsWith("$")) return false;
    }
    ops.putAll(more);
    return true;
  }
}

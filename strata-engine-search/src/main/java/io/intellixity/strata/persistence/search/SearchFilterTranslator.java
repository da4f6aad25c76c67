package io.intellixity.strata.persistence.search;

import io.intellixity.strata.persistence.query.*;
import io.intellixity.strata.persistence.spi.translate.AbstractFilterTranslator;

import java.util.*;

/**
 * Renders query trees to the search engine's JSON filter DSL, as nested maps.
 * <pre>
 * eq / ne        {"term": {a: v}}  or  {"missing": {"field": a}} for a null argument
 * gt gte lt lte  {"range": {a: {"gt": v}}}
 * in / nin       {"terms": {a: [...]}}
 * startswith     {"prefix": {a: p}}
 * contains       {"regexp": {a: ".*p.*"}}
 * icontains      {"regexp": {a: ".*[pP].*"}}
 * endswith       {"regexp": {a: ".*p"}}
 * and / or / not {"and": [...]}, {"or": [...]}, {"not": f}
 * </pre>
 * Negation operators wrap their own positive clause in {@code not}, and nothing else.
 * <p>
 * The engine applies every leaf to each value of an array field, and {@code missing} accepts a
 * field with no non-null value, which is how the matcher treats collections. Arguments are
 * rendered with {@link SearchValues#toWire}. A collection or map compared as a whole value has no
 * term form and is rejected.
 */
public final class SearchFilterTranslator extends AbstractFilterTranslator<Map<String, Object>> {
  public static final String DIALECT = "search";

  /** Characters with a meaning in the engine's regexp syntax. */
  static final String REGEXP_RESERVED = ".?+*|{}[]()\"\\#@&<>~";

  @Override
  public String dialect() { return DIALECT; }

  @Override
  protected Map<String, Object> matchAll() {
    return Map.of("match_all", Map.of());
  }

  /** Search request body for {@code query}. */
  public Map<String, Object> requestBody(QueryElement query) {
    return Map.of("filter", translate(query));
  }

  @Override
  public Map<String, Object> visit(Condition c) {
    Map<String, Object> positive = positive(c);
    return c.operator().isNegation() ? Map.of("not", positive) : positive;
  }

  @Override
  public Map<String, Object> visit(LogicalGroup g) {
    switch (g.clause()) {
      case AND:
        return Map.of("and", children(g));
      case OR:
        return Map.of("or", children(g));
      case NOT:
        return Map.of("not", g.operand().accept(this));
      default:
        throw invalidGroup(g);
    }
  }

  private List<Map<String, Object>> children(LogicalGroup g) {
    List<Map<String, Object>> out = new ArrayList<>(g.nodes().size());
    for (QueryElement n : g.nodes()) out.add(n.accept(this));
    return out;
  }

  private Map<String, Object> positive(Condition c) {
    String a = c.attribute();
    Operator op = c.operator().positive();
    switch (op.group()) {
      case EQUALITY:
        return (c.argument() == null) ? missing(a) : Map.of("term", Map.of(a, term(c, c.argument())));
      case RANGE:
        return Map.of("range", Map.of(a, Map.of(op.wireName(), term(c, c.argument()))));
      case SET:
        return terms(c);
      case STRING:
        return string(c, op);
      default:
        throw new UnsupportedOperatorException(DIALECT, op, "unknown operator group " + op.group());
    }
  }

  // A null member stands for "attribute missing", which terms cannot express.
  private static Map<String, Object> terms(Condition c) {
    String a = c.attribute();
    List<Object> values = c.arguments();
    List<Object> present = new ArrayList<>(values.size());
    for (Object v : values) {
      if (v != null) present.add(term(c, v));
    }
    if (present.size() == values.size()) return Map.of("terms", Map.of(a, present));
    if (present.isEmpty()) return missing(a);
    return Map.of("or", List.of(Map.of("terms", Map.of(a, present)), missing(a)));
  }

  private static Object term(Condition c, Object value) {
    if (value instanceof Collection<?> || value instanceof Map<?, ?>) {
      throw new UnsupportedOperatorException(DIALECT, c.operator(),
          "'" + c.attribute() + "' cannot be compared with a whole " + value.getClass().getSimpleName());
    }
    return SearchValues.toWire(value);
  }

  private Map<String, Object> string(Condition c, Operator op) {
    String s = stringArgument(c);
    String a = c.attribute();
    switch (op) {
      case STARTSWITH:
        return Map.of("prefix", Map.of(a, s));
      case CONTAINS:
        return regexp(a, ".*" + escape(s, REGEXP_RESERVED) + ".*");
      case ICONTAINS:
        return regexp(a, ".*" + anyCase(s) + ".*");
      case ENDSWITH:
        return regexp(a, ".*" + escape(s, REGEXP_RESERVED));
      default:
        throw new UnsupportedOperatorException(DIALECT, op, "not a string operator");
    }
  }

  /** Each cased letter becomes a two-letter class, e.g. {@code Ab} to {@code [aA][bB]}. */
  static String anyCase(String s) {
    StringBuilder out = new StringBuilder(s.length() * 4);
    for (int i = 0; i < s.length(); i++) {
      char ch = s.charAt(i);
      char lo = Character.toLowerCase(ch);
      char up = Character.toUpperCase(ch);
      if (lo != up) {
        out.append('[').append(lo).append(up).append(']');
      } else {
        out.append(escape(String.valueOf(ch), REGEXP_RESERVED));
      }
    }
    return out.toString();
  }

  private static Map<String, Object> regexp(String a, String pattern) {
    return Map.of("regexp", Map.of(a, pattern));
  }

  private static Map<String, Object> missing(String a) {
    return Map.of("missing", Map.of("field", a));
  }
}

package io.intellixity.strata.persistence.query;

import java.util.*;

public final class QueryFilters {
  private QueryFilters() {}

  public static Condition eq(String attribute, Object value) { return new Condition(attribute, Operator.EQ, value); }
  public static Condition ne(String attribute, Object value) { return new Condition(attribute, Operator.NE, value); }
  public static Condition gt(String attribute, Object value) { return new Condition(attribute, Operator.GT, value); }
  public static Condition gte(String attribute, Object value) { return new Condition(attribute, Operator.GTE, value); }
  public static Condition lt(String attribute, Object value) { return new Condition(attribute, Operator.LT, value); }
  public static Condition lte(String attribute, Object value) { return new Condition(attribute, Operator.LTE, value); }

  public static Condition in(String attribute, Collection<?> values) { return new Condition(attribute, Operator.IN, values); }
  public static Condition nin(String attribute, Collection<?> values) { return new Condition(attribute, Operator.NIN, values); }

  public static Condition contains(String attribute, String value) { return new Condition(attribute, Operator.CONTAINS, value); }
  public static Condition icontains(String attribute, String value) { return new Condition(attribute, Operator.ICONTAINS, value); }
  public static Condition startsWith(String attribute, String value) { return new Condition(attribute, Operator.STARTSWITH, value); }
  public static Condition endsWith(String attribute, String value) { return new Condition(attribute, Operator.ENDSWITH, value); }

  /** Parses the wire form {@code where("age", "gte", 18)}. */
  public static Condition where(String attribute, String operator, Object argument) {
    return new Condition(attribute, operator, argument);
  }

  public static LogicalGroup and(QueryElement... elements) {
    return new LogicalGroup(Clause.AND, Arrays.asList(elements));
  }

  public static LogicalGroup or(QueryElement... elements) {
    return new LogicalGroup(Clause.OR, Arrays.asList(elements));
  }

  public static LogicalGroup not(QueryElement element) {
    return new LogicalGroup(Clause.NOT, Collections.singletonList(element));
  }
}

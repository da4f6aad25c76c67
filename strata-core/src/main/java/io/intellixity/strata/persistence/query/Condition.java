package io.intellixity.strata.persistence.query;

import java.util.*;

/** Leaf predicate: {@code attribute <operator> argument}. */
public final class Condition implements QueryElement {
  private final String attribute;
  private final Operator operator;
  private final Object argument;

  public Condition(String attribute, Operator operator, Object argument) {
    if (attribute == null || attribute.isBlank()) throw new MalformedQueryException("Condition attribute must not be blank");
    if (operator == null) throw new MalformedQueryException("Condition on '" + attribute + "' has no operator");
    this.attribute = attribute;
    this.operator = operator;
    this.argument = checkArgument(attribute, operator, argument);
  }

  public Condition(String attribute, String operatorName, Object argument) {
    this(attribute, Operator.fromName(operatorName), argument);
  }

  public String attribute() { return attribute; }
  public Operator operator() { return operator; }
  public Object argument() { return argument; }

  /** SET operators only: the argument as an immutable list. */
  @SuppressWarnings("unchecked")
  public List<Object> arguments() {
    if (operator.group() != OperatorGroup.SET) throw new IllegalStateException(operator.wireName() + " has a scalar argument");
    return (List<Object>) argument;
  }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) { return visitor.visit(this); }

  private static Object checkArgument(String attribute, Operator op, Object argument) {
    switch (op.group()) {
      case SET -> {
        if (argument instanceof Collection<?> c) return frozenList(c);
        if (argument instanceof Object[] arr) return frozenList(Arrays.asList(arr));
        throw new MalformedQueryException(op.wireName() + " on '" + attribute + "' requires a collection argument");
      }
      case RANGE, STRING -> {
        if (argument == null) throw new MalformedQueryException(op.wireName() + " on '" + attribute + "' requires a non-null argument");
        return freeze(argument);
      }
      default -> {
        return freeze(argument);
      }
    }
  }

  private static List<Object> frozenList(Collection<?> c) {
    List<Object> out = new ArrayList<>(c.size());
    for (Object x : c) out.add(freeze(x));
    return Collections.unmodifiableList(out);
  }

  // Collection and map arguments are copied so later changes by the caller cannot alter the query.
  private static Object freeze(Object v) {
    if (v instanceof List<?> l) return frozenList(l);
    if (v instanceof Set<?> set) {
      Set<Object> out = new LinkedHashSet<>();
      for (Object x : set) out.add(freeze(x));
      return Collections.unmodifiableSet(out);
    }
    if (v instanceof Collection<?> c) return frozenList(c);
    if (v instanceof Map<?, ?> m) {
      Map<Object, Object> out = new LinkedHashMap<>();
      for (Map.Entry<?, ?> e : m.entrySet()) out.put(e.getKey(), freeze(e.getValue()));
      return Collections.unmodifiableMap(out);
    }
    return v;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Condition c)) return false;
    return attribute.equals(c.attribute) && operator == c.operator && Objects.equals(argument, c.argument);
  }

  @Override
  public int hashCode() {
    return Objects.hash(attribute, operator, argument);
  }

  @Override
  public String toString() {
    return "Condition(" + attribute + " " + operator.wireName() + " " + argument + ")";
  }
}

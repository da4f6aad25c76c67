package io.intellixity.strata.persistence.match;

import io.intellixity.strata.persistence.query.Operator;
import io.intellixity.strata.persistence.query.QueryTypeException;

import java.util.*;

/**
 * The closed table of operator semantics.
 * <p>
 * This is the canonical behavior every backend translator must reproduce. A null field value
 * (missing attribute) is equal only to a null argument and never satisfies a RANGE or STRING
 * operator.
 * <p>
 * A collection-valued field is tested element by element, the way document stores treat arrays:
 * {@code eq} and {@code in} hold when the whole collection or any one element is equal to the
 * argument, and RANGE and STRING operators hold when any non-null element satisfies them. A
 * collection with no non-null element counts as null. {@code ne} and {@code nin} are the exact
 * negations of {@code eq} and {@code in}.
 */
public final class OperatorRegistry {
  private static final Map<Operator, OperatorPredicate> PREDICATES = new EnumMap<>(Operator.class);
  private static final OperatorPredicate SUBSTRING = anyElement((v, a) ->
      string(Operator.CONTAINS, v).contains(string(Operator.CONTAINS, a)));

  static {
    PREDICATES.put(Operator.EQ, OperatorRegistry::eq);
    PREDICATES.put(Operator.NE, (v, a) -> !eq(v, a));
    PREDICATES.put(Operator.GT, anyElement((v, a) -> Values.compare(v, a) > 0));
    PREDICATES.put(Operator.GTE, anyElement((v, a) -> Values.compare(v, a) >= 0));
    PREDICATES.put(Operator.LT, anyElement((v, a) -> Values.compare(v, a) < 0));
    PREDICATES.put(Operator.LTE, anyElement((v, a) -> Values.compare(v, a) <= 0));
    PREDICATES.put(Operator.IN, OperatorRegistry::in);
    PREDICATES.put(Operator.NIN, (v, a) -> !in(v, a));
    PREDICATES.put(Operator.CONTAINS, OperatorRegistry::contains);
    PREDICATES.put(Operator.ICONTAINS, anyElement((v, a) ->
        fold(string(Operator.ICONTAINS, v)).contains(fold(string(Operator.ICONTAINS, a)))));
    PREDICATES.put(Operator.STARTSWITH, anyElement((v, a) ->
        string(Operator.STARTSWITH, v).startsWith(string(Operator.STARTSWITH, a))));
    PREDICATES.put(Operator.ENDSWITH, anyElement((v, a) ->
        string(Operator.ENDSWITH, v).endsWith(string(Operator.ENDSWITH, a))));

    if (PREDICATES.size() != Operator.values().length) {
      throw new IllegalStateException("Operator registry is missing entries");
    }
  }

  private OperatorRegistry() {}

  public static OperatorPredicate predicate(Operator op) {
    return PREDICATES.get(Objects.requireNonNull(op, "op"));
  }

  public static boolean test(Operator op, Object fieldValue, Object argument) {
    return predicate(op).test(fieldValue, argument);
  }

  private static boolean eq(Object v, Object a) {
    if (a == null) return Values.isAbsent(v);
    if (Values.equal(v, a)) return true;
    return v instanceof Collection<?> c && Values.containsValue(c, a);
  }

  private static boolean in(Object v, Object a) {
    for (Object candidate : (Collection<?>) a) {
      if (eq(v, candidate)) return true;
    }
    return false;
  }

  // Wraps a predicate over one non-null value so it also applies to the elements of a collection.
  private static OperatorPredicate anyElement(OperatorPredicate scalar) {
    return (v, a) -> {
      if (v instanceof Collection<?> c) {
        for (Object element : c) {
          if (element != null && scalar.test(element, a)) return true;
        }
        return false;
      }
      return v != null && scalar.test(v, a);
    };
  }

  // A non-string argument tests collection membership, which only the matcher can evaluate.
  private static boolean contains(Object v, Object a) {
    if (a instanceof CharSequence || v == null) return SUBSTRING.test(v, a);
    if (v instanceof Collection<?> c) return Values.containsValue(c, a);
    throw new QueryTypeException("contains on a " + v.getClass().getSimpleName() + " value requires a string argument");
  }

  private static String string(Operator op, Object v) {
    if (v instanceof CharSequence cs) return cs.toString();
    throw new QueryTypeException(op.wireName() + " requires string operands; got " + v.getClass().getSimpleName());
  }

  private static String fold(String s) {
    return s.toLowerCase(Locale.ROOT);
  }
}

package io.intellixity.strata.persistence.match;

import io.intellixity.strata.persistence.query.QueryTypeException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.*;

/**
 * Value equality and ordering shared by the matcher and the in-process sorter.
 * <p>
 * Numbers compare by value regardless of boxed type, so a record read back from JSON as
 * {@code Integer} still equals a {@code Long} argument.
 */
public final class Values {
  private Values() {}

  public static boolean equal(Object a, Object b) {
    if (a == b) return true;
    if (a == null || b == null) return false;
    if (a instanceof Number x && b instanceof Number y) return toBigDecimal(x).compareTo(toBigDecimal(y)) == 0;
    if (a instanceof List<?> la && b instanceof List<?> lb) {
      if (la.size() != lb.size()) return false;
      for (int i = 0; i < la.size(); i++) {
        if (!equal(la.get(i), lb.get(i))) return false;
      }
      return true;
    }
    if (a instanceof Map<?, ?> ma && b instanceof Map<?, ?> mb) {
      if (ma.size() != mb.size()) return false;
      for (Map.Entry<?, ?> e : ma.entrySet()) {
        if (!mb.containsKey(e.getKey()) || !equal(e.getValue(), mb.get(e.getKey()))) return false;
      }
      return true;
    }
    return a.equals(b);
  }

  /** Null, or a collection without any non-null element. */
  public static boolean isAbsent(Object v) {
    if (v == null) return true;
    if (!(v instanceof Collection<?> c)) return false;
    for (Object x : c) {
      if (x != null) return false;
    }
    return true;
  }

  public static boolean containsValue(Collection<?> haystack, Object needle) {
    for (Object x : haystack) {
      if (equal(x, needle)) return true;
    }
    return false;
  }

  /**
   * Total order over mutually comparable non-null values.
   *
   * @throws QueryTypeException when the operands cannot be ordered against each other
   */
  @SuppressWarnings({"unchecked", "rawtypes"})
  public static int compare(Object a, Object b) {
    Objects.requireNonNull(a, "a");
    Objects.requireNonNull(b, "b");
    if (a instanceof Number x && b instanceof Number y) return toBigDecimal(x).compareTo(toBigDecimal(y));
    if (a instanceof Comparable ca && b instanceof Comparable && isCompatible(a, b)) {
      try {
        return ca.compareTo(b);
      } catch (ClassCastException e) {
        throw notComparable(a, b);
      }
    }
    throw notComparable(a, b);
  }

  /** Ordering used for sorting: nulls first, then {@link #compare}. */
  public static int compareNullsFirst(Object a, Object b) {
    if (a == null) return (b == null) ? 0 : -1;
    if (b == null) return 1;
    return compare(a, b);
  }

  private static boolean isCompatible(Object a, Object b) {
    return a.getClass().isInstance(b) || b.getClass().isInstance(a);
  }

  private static QueryTypeException notComparable(Object a, Object b) {
    return new QueryTypeException("'" + a.getClass().getSimpleName() + "' and '" + b.getClass().getSimpleName()
        + "' values are not order-comparable: " + a + " vs " + b);
  }

  private static BigDecimal toBigDecimal(Number n) {
    if (n instanceof BigDecimal bd) return bd;
    if (n instanceof BigInteger bi) return new BigDecimal(bi);
    if (n instanceof Double || n instanceof Float) {
      double d = n.doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        throw new QueryTypeException("Non-finite number is not order-comparable: " + n);
      }
      return BigDecimal.valueOf(d);
    }
    return BigDecimal.valueOf(n.longValue());
  }
}

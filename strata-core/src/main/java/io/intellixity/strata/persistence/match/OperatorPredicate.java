package io.intellixity.strata.persistence.match;

/** Reference semantics of one operator: does {@code fieldValue} satisfy {@code argument}? */
@FunctionalInterface
public interface OperatorPredicate {
  boolean test(Object fieldValue, Object argument);
}

package io.intellixity.strata.persistence.query;

/** Disjoint operator families; every translator switches on these. */
public enum OperatorGroup {
  EQUALITY,
  RANGE,
  SET,
  STRING
}

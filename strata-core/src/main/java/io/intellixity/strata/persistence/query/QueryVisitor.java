package io.intellixity.strata.persistence.query;

/** One method per {@link QueryElement} variant; adding a variant breaks every consumer at compile time. */
public interface QueryVisitor<Q> {
  Q visit(Condition condition);
  Q visit(LogicalGroup group);
}

package io.intellixity.strata.persistence.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.List;

/**
 * A node of the predicate tree: either a {@link Condition} leaf or a {@link LogicalGroup}.
 * <p>
 * Trees are immutable; {@link #and}, {@link #or} and {@link #not} build new trees and never touch
 * their operands.
 */
@JsonSerialize(using = QueryJsonSerializer.class)
@JsonDeserialize(using = QueryJsonDeserializer.class)
public sealed interface QueryElement permits Condition, LogicalGroup {

  <Q> Q accept(QueryVisitor<Q> visitor);

  default QueryElement and(QueryElement other) {
    return new LogicalGroup(Clause.AND, List.of(this, other));
  }

  default QueryElement or(QueryElement other) {
    return new LogicalGroup(Clause.OR, List.of(this, other));
  }

  default QueryElement not() {
    return new LogicalGroup(Clause.NOT, List.of(this));
  }
}

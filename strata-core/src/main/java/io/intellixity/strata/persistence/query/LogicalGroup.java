package io.intellixity.strata.persistence.query;

import java.util.*;

/**
 * Boolean combination of child elements. AND/OR hold at least one node; NOT holds exactly one.
 */
public final class LogicalGroup implements QueryElement {
  private final Clause clause;
  private final List<QueryElement> nodes;

  public LogicalGroup(Clause clause, List<? extends QueryElement> nodes) {
    if (clause == null) throw new InvalidQueryGroupException("Group clause must be <and>, <or>, or <not>; got null");
    if (nodes == null || nodes.isEmpty()) {
      throw new MalformedQueryException(clause + " group requires at least one node");
    }
    if (clause == Clause.NOT && nodes.size() != 1) {
      throw new MalformedQueryException("NOT group requires exactly one node; got " + nodes.size());
    }
    for (QueryElement n : nodes) {
      if (n == null) throw new MalformedQueryException(clause + " group contains a null node");
    }
    this.clause = clause;
    this.nodes = List.copyOf(nodes);
  }

  public Clause clause() { return clause; }
  public List<QueryElement> nodes() { return nodes; }

  /** The wrapped element of a NOT group. */
  public QueryElement operand() {
    if (clause != Clause.NOT) throw new IllegalStateException(clause + " group has no single operand");
    return nodes.get(0);
  }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof LogicalGroup g)) return false;
    return clause == g.clause && nodes.equals(g.nodes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(clause, nodes);
  }

  @Override
  public String toString() {
    return clause + nodes.toString();
  }
}

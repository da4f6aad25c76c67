package io.intellixity.strata.persistence.match;

import io.intellixity.strata.persistence.query.*;

import java.util.*;

/**
 * Evaluates a query tree directly against one record (attribute name to value).
 * <p>
 * Used by backends without server-side filtering (in-memory map) and by backends whose filter
 * capability cannot express the full operator set (key-value store).
 */
public final class RecordMatcher {
  private RecordMatcher() {}

  /** A null query matches every record. */
  public static boolean matches(Map<String, ?> record, QueryElement query) {
    Objects.requireNonNull(record, "record");
    if (query == null) return true;
    return query.accept(new Evaluator(record));
  }

  public static <M extends Map<String, ?>> List<M> filter(Iterable<M> records, QueryElement query) {
    List<M> out = new ArrayList<>();
    for (M r : records) {
      if (matches(r, query)) out.add(r);
    }
    return out;
  }

  private static final class Evaluator implements QueryVisitor<Boolean> {
    private final Map<String, ?> record;

    Evaluator(Map<String, ?> record) {
      this.record = record;
    }

    @Override
    public Boolean visit(Condition c) {
      return OperatorRegistry.test(c.operator(), record.get(c.attribute()), c.argument());
    }

    @Override
    public Boolean visit(LogicalGroup g) {
      switch (g.clause()) {
        case AND:
          for (QueryElement n : g.nodes()) {
            if (!n.accept(this)) return false;
          }
          return true;
        case OR:
          for (QueryElement n : g.nodes()) {
            if (n.accept(this)) return true;
          }
          return false;
        case NOT:
          return !g.operand().accept(this);
        default:
          throw new InvalidQueryGroupException("Group clause must be <and>, <or>, or <not>; got " + g.clause());
      }
    }
  }
}

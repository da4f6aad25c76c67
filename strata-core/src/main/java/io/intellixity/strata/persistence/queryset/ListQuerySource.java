package io.intellixity.strata.persistence.queryset;

import java.util.*;

/** Source over raw matches that were already collected from the backend. */
public final class ListQuerySource implements QuerySource {
  private final List<Map<String, Object>> matches;

  public ListQuerySource(List<Map<String, Object>> matches) {
    this.matches = List.copyOf(Objects.requireNonNull(matches, "matches"));
  }

  @Override
  public List<Map<String, Object>> fetch(QueryDirectives directives) {
    return RecordSorter.apply(matches, directives);
  }

  public int size() { return matches.size(); }
}

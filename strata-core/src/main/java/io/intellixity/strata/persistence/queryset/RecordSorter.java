package io.intellixity.strata.persistence.queryset;

import io.intellixity.strata.persistence.match.Values;
import io.intellixity.strata.persistence.query.SortField;

import java.util.*;

/**
 * In-process implementation of the fixed evaluation order: sort, then offset, then limit.
 * <p>
 * Multi-key sorts apply one stable sort per key, iterating the keys in reverse declaration order,
 * so the first declared key ends up most significant.
 */
public final class RecordSorter {
  private RecordSorter() {}

  public static List<Map<String, Object>> apply(List<Map<String, Object>> records, QueryDirectives d) {
    List<Map<String, Object>> out = new ArrayList<>(records);
    List<SortField> sort = d.sort();
    for (int i = sort.size() - 1; i >= 0; i--) {
      SortField sf = sort.get(i);
      Comparator<Map<String, Object>> cmp = (a, b) -> Values.compareNullsFirst(a.get(sf.field()), b.get(sf.field()));
      out.sort(sf.descending() ? cmp.reversed() : cmp);
    }
    int from = (d.offset() == null) ? 0 : Math.min(d.offset(), out.size());
    int to = (d.limit() == null) ? out.size() : Math.min(out.size(), from + d.limit());
    return new ArrayList<>(out.subList(from, to));
  }
}

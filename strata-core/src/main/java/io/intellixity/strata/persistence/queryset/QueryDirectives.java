package io.intellixity.strata.persistence.queryset;

import io.intellixity.strata.persistence.query.SortField;

import java.util.ArrayList;
import java.util.List;

/** Pending sort/offset/limit of a {@link QuerySet}; applied once, in that order, at evaluation. */
public record QueryDirectives(List<SortField> sort, Integer offset, Integer limit) {
  public static final QueryDirectives NONE = new QueryDirectives(List.of(), null, null);

  public QueryDirectives {
    sort = List.copyOf(sort == null ? List.of() : sort);
    if (offset != null && offset < 0) throw new IllegalArgumentException("offset must be >= 0");
    if (limit != null && limit < 0) throw new IllegalArgumentException("limit must be >= 0");
  }

  /** Keys from a later sort call take precedence over keys already pending. */
  public QueryDirectives withSort(List<SortField> fields) {
    List<SortField> merged = new ArrayList<>(fields);
    merged.addAll(sort);
    return new QueryDirectives(merged, offset, limit);
  }

  public QueryDirectives withOffset(int n) { return new QueryDirectives(sort, n, limit); }
  public QueryDirectives withLimit(int n) { return new QueryDirectives(sort, offset, n); }

  public boolean paginated() { return offset != null || limit != null; }
}

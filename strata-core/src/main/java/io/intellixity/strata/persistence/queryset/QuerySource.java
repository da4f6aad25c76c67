package io.intellixity.strata.persistence.queryset;

import java.util.List;
import java.util.Map;

/**
 * Where a {@link QuerySet} gets its raw matches from: an already materialized list, or a backend
 * cursor that can apply the directives natively.
 */
public interface QuerySource {
  /** Raw matching records with sort, then offset, then limit applied. */
  List<Map<String, Object>> fetch(QueryDirectives directives);

  /**
   * Cheaper native count honoring offset/limit, or -1 when the source has none and the caller
   * should count the evaluated records instead.
   */
  default long nativeCount(QueryDirectives directives) {
    return -1;
  }
}

package io.intellixity.strata.persistence.spi.translate;

import io.intellixity.strata.persistence.query.QueryElement;

/**
 * Compiles a query tree into a backend's native filter. Pure: no I/O.
 * <p>
 * For every dataset D and well-formed query Q, the backend's matches for {@code translate(Q)}
 * must equal the records of D accepted by
 * {@link io.intellixity.strata.persistence.match.RecordMatcher}.
 */
public interface FilterTranslator<F> {
  /** Short dialect name used in error messages. */
  String dialect();

  /** Native filter for {@code query}; a null query yields the dialect's match-all filter. */
  F translate(QueryElement query);
}

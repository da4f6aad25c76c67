package io.intellixity.strata.persistence.query;

import io.intellixity.strata.persistence.StrataException;

/** Operands of a comparison are not mutually comparable (e.g. a string field against a numeric bound). */
public final class QueryTypeException extends StrataException {
  public QueryTypeException(String message) {
    super(message);
  }
}

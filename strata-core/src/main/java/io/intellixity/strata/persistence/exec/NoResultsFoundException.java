package io.intellixity.strata.persistence.exec;

import io.intellixity.strata.persistence.StrataException;

public final class NoResultsFoundException extends StrataException {
  public NoResultsFoundException(String collection) {
    super("Query for find_one on '" + collection + "' returned no results");
  }
}

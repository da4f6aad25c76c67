package io.intellixity.strata.persistence.exec;

import io.intellixity.strata.persistence.StrataException;

public final class MultipleResultsFoundException extends StrataException {
  private final long count;

  public MultipleResultsFoundException(String collection, long count) {
    super("Query for find_one on '" + collection + "' must return exactly one result; returned " + count);
    this.count = count;
  }

  public long count() { return count; }
}

package io.intellixity.strata.persistence.query;

/** A {@link LogicalGroup} whose clause is not one of AND, OR, NOT. */
public final class InvalidQueryGroupException extends MalformedQueryException {
  public InvalidQueryGroupException(String message) {
    super(message);
  }
}

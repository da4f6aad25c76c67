package io.intellixity.strata.persistence.query;

import io.intellixity.strata.persistence.StrataException;

/**
 * Raised when a query tree is built with an invalid shape: unknown operator name, wrong node count
 * for a group, or an argument the operator cannot accept.
 * <p>
 * Always thrown at construction time, so translators and matchers may assume a well-formed tree.
 */
public class MalformedQueryException extends StrataException {
  public MalformedQueryException(String message) {
    super(message);
  }

  public MalformedQueryException(String message, Throwable cause) {
    super(message, cause);
  }
}

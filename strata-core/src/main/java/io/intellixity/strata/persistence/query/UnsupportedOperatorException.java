package io.intellixity.strata.persistence.query;

import io.intellixity.strata.persistence.StrataException;

/** An operator/argument combination that a backend dialect cannot express natively. */
public final class UnsupportedOperatorException extends StrataException {
  private final Operator operator;
  private final String dialect;

  public UnsupportedOperatorException(String dialect, Operator operator, String reason) {
    super("Operator '" + operator.wireName() + "' is not translatable by " + dialect + ": " + reason);
    this.operator = operator;
    this.dialect = dialect;
  }

  public Operator operator() { return operator; }
  public String dialect() { return dialect; }
}

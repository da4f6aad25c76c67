package io.intellixity.strata.persistence.query;

import java.util.Locale;

public enum Operator {
  EQ("eq", OperatorGroup.EQUALITY),
  NE("ne", OperatorGroup.EQUALITY),
  GT("gt", OperatorGroup.RANGE),
  GTE("gte", OperatorGroup.RANGE),
  LT("lt", OperatorGroup.RANGE),
  LTE("lte", OperatorGroup.RANGE),

  IN("in", OperatorGroup.SET),
  NIN("nin", OperatorGroup.SET),

  CONTAINS("contains", OperatorGroup.STRING),
  ICONTAINS("icontains", OperatorGroup.STRING),
  STARTSWITH("startswith", OperatorGroup.STRING),
  ENDSWITH("endswith", OperatorGroup.STRING);

  private final String wireName;
  private final OperatorGroup group;

  Operator(String wireName, OperatorGroup group) {
    this.wireName = wireName;
    this.group = group;
  }

  /** Lower-case name used in query JSON and error messages. */
  public String wireName() { return wireName; }

  public OperatorGroup group() { return group; }

  /** Operators whose native form is "the positive operator, negated". */
  public boolean isNegation() {
    return this == NE || this == NIN;
  }

  /** Positive counterpart of a negation operator; identity for every other operator. */
  public Operator positive() {
    return switch (this) {
      case NE -> EQ;
      case NIN -> IN;
      default -> this;
    };
  }

  public static Operator fromName(String name) {
    if (name == null || name.isBlank()) throw new MalformedQueryException("Operator name must not be blank");
    String n = name.trim().toLowerCase(Locale.ROOT);
    for (Operator op : values()) {
      if (op.wireName.equals(n)) return op;
    }
    throw new MalformedQueryException("Unknown operator '" + name + "'");
  }
}

package io.intellixity.strata.persistence.query;

import java.util.Locale;

public enum Clause {
  AND,
  OR,
  NOT;

  public static Clause fromName(String name) {
    if (name == null) throw new InvalidQueryGroupException("Group clause must be <and>, <or>, or <not>; got null");
    try {
      return Clause.valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new InvalidQueryGroupException("Group clause must be <and>, <or>, or <not>; got '" + name + "'");
    }
  }
}

package io.intellixity.strata.persistence.spi.translate;

import io.intellixity.strata.persistence.query.*;

/**
 * Visitor-based translator base. Subclasses render leaves and groups; argument checks shared by
 * all dialects live here.
 */
public abstract class AbstractFilterTranslator<F> implements FilterTranslator<F>, QueryVisitor<F> {

  protected abstract F matchAll();

  @Override
  public final F translate(QueryElement query) {
    if (query == null) return matchAll();
    return query.accept(this);
  }

  /**
   * STRING operators are translated to pattern primitives, which only accept string arguments.
   * Collection-membership {@code contains} is an in-process matcher feature.
   */
  protected final String stringArgument(Condition c) {
    if (c.argument() instanceof CharSequence cs) return cs.toString();
    throw new UnsupportedOperatorException(dialect(), c.operator(),
        "argument for '" + c.attribute() + "' must be a string, got " + c.argument().getClass().getSimpleName());
  }

  protected final InvalidQueryGroupException invalidGroup(LogicalGroup g) {
    return new InvalidQueryGroupException("Group clause must be <and>, <or>, or <not>; got " + g.clause());
  }

  /** Backslash-escapes every character of {@code literal} that appears in {@code reserved}. */
  protected static String escape(String literal, String reserved) {
    StringBuilder out = new StringBuilder(literal.length() + 8);
    for (int i = 0; i < literal.length(); i++) {
      char ch = literal.charAt(i);
      if (reserved.indexOf(ch) >= 0) out.append('\\');
      out.append(ch);
    }
    return out.toString();
  }
}

package io.intellixity.strata.persistence.match;

import io.intellixity.strata.persistence.query.Operator;
import io.intellixity.strata.persistence.query.QueryTypeException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class OperatorRegistryTest {

  @Test
  void everyOperator_hasAPredicate() {
    for (Operator op : Operator.values()) assertNotNull(OperatorRegistry.predicate(op), op.wireName());
  }

  @Test
  void equality_isStructural() {
    assertTrue(OperatorRegistry.test(Operator.EQ, List.of(1, 2), List.of(1L, 2L)));
    assertTrue(OperatorRegistry.test(Operator.EQ, Map.of("a", 1), Map.of("a", 1.0)));
    assertTrue(OperatorRegistry.test(Operator.EQ, new BigDecimal("1.50"), 1.5));
    assertFalse(OperatorRegistry.test(Operator.EQ, "1", 1));
    assertTrue(OperatorRegistry.test(Operator.EQ, null, null));
    assertFalse(OperatorRegistry.test(Operator.NE, null, null));
  }

  @Test
  void setMembership_usesValueEquality() {
    assertTrue(OperatorRegistry.test(Operator.IN, 2L, List.of(1, 2)));
    assertTrue(OperatorRegistry.test(Operator.IN, null, Arrays.asList(1, null)));
    assertFalse(OperatorRegistry.test(Operator.NIN, 2L, List.of(1, 2)));
  }

  @Test
  void caseInsensitiveContains_foldsBothSides() {
    assertTrue(OperatorRegistry.test(Operator.ICONTAINS, "Steve@Example.org", "EXAMPLE"));
    assertFalse(OperatorRegistry.test(Operator.CONTAINS, "Steve@Example.org", "EXAMPLE"));
  }

  @Test
  void values_sortNullsFirst() {
    assertTrue(Values.compareNullsFirst(null, 1) < 0);
    assertTrue(Values.compareNullsFirst(1, null) > 0);
    assertEquals(0, Values.compareNullsFirst(null, null));
    assertThrows(QueryTypeException.class, () -> Values.compare("a", 1));
    assertThrows(QueryTypeException.class, () -> Values.compare(Double.NaN, 1));
  }
}

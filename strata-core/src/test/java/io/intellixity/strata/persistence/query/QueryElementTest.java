package io.intellixity.strata.persistence.query;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.intellixity.strata.persistence.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class QueryElementTest {

  @Test
  void where_parsesOperatorNames() {
    Condition c = where("age", "GTE", 18);
    assertEquals(Operator.GTE, c.operator());
    assertEquals("age", c.attribute());
    assertEquals(18, c.argument());
  }

  @Test
  void unknownOperator_isMalformed() {
    assertThrows(MalformedQueryException.class, () -> where("age", "between", 1));
    assertThrows(MalformedQueryException.class, () -> Operator.fromName(" "));
  }

  @Test
  void setOperators_requireCollection() {
    assertThrows(MalformedQueryException.class, () -> new Condition("age", Operator.IN, 1));
    Condition c = new Condition("age", Operator.NIN, new Object[]{1, 2});
    assertEquals(List.of(1, 2), c.arguments());
  }

  @Test
  void setArgument_isCopied() {
    List<Object> values = new ArrayList<>(List.of(1, 2));
    Condition c = in("age", values);
    values.add(3);
    assertEquals(List.of(1, 2), c.arguments());
    assertThrows(UnsupportedOperationException.class, () -> c.arguments().add(4));
  }

  @Test
  void equalityArgument_isCopied() {
    List<Object> tags = new ArrayList<>(List.of("a", "b"));
    Map<String, Object> address = new HashMap<>(Map.of("city", "Oslo"));
    Condition byTags = eq("tags", tags);
    Condition byAddress = ne("address", address);
    int hash = byTags.hashCode();

    tags.add("c");
    address.put("city", "Bergen");
    assertEquals(List.of("a", "b"), byTags.argument());
    assertEquals(Map.of("city", "Oslo"), byAddress.argument());
    assertEquals(hash, byTags.hashCode());
    assertEquals(eq("tags", List.of("a", "b")), byTags);
  }

  @Test
  void rangeAndStringOperators_rejectNull() {
    assertThrows(MalformedQueryException.class, () -> gt("age", null));
    assertThrows(MalformedQueryException.class, () -> startsWith("name", null));
    assertNull(eq("age", null).argument());
  }

  @Test
  void blankAttribute_isMalformed() {
    assertThrows(MalformedQueryException.class, () -> eq(" ", 1));
  }

  @Test
  void notGroup_holdsExactlyOneNode() {
    assertThrows(MalformedQueryException.class, () -> new LogicalGroup(Clause.NOT, List.of(eq("a", 1), eq("b", 2))));
    assertThrows(MalformedQueryException.class, () -> new LogicalGroup(Clause.AND, List.of()));
    assertThrows(InvalidQueryGroupException.class, () -> new LogicalGroup(null, List.of(eq("a", 1))));
  }

  @Test
  void combinators_buildNewTrees() {
    Condition a = eq("a", 1);
    Condition b = eq("b", 2);

    QueryElement and = a.and(b);
    QueryElement or = a.or(b);
    QueryElement not = a.not();

    assertEquals(and(a, b), and);
    assertEquals(or(a, b), or);
    assertEquals(Clause.NOT, ((LogicalGroup) not).clause());
    assertSame(a, ((LogicalGroup) not).operand());
    assertEquals(eq("a", 1), a);
  }

  @Test
  void negationOperators_knowTheirPositive() {
    assertEquals(Operator.EQ, Operator.NE.positive());
    assertEquals(Operator.IN, Operator.NIN.positive());
    assertEquals(Operator.GT, Operator.GT.positive());
    assertTrue(Operator.NIN.isNegation());
    assertFalse(Operator.ICONTAINS.isNegation());
  }

  @Test
  void sortField_parsesDirection() {
    assertEquals(new SortField("age", SortField.Direction.DESC), SortField.parse("-age"));
    assertFalse(SortField.parse("name").descending());
  }
}

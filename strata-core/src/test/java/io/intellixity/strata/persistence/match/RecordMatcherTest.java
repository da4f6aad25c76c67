package io.intellixity.strata.persistence.match;

import io.intellixity.strata.persistence.query.Condition;
import io.intellixity.strata.persistence.query.Operator;
import io.intellixity.strata.persistence.query.QueryElement;
import io.intellixity.strata.persistence.query.QueryTypeException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.*;

import static io.intellixity.strata.persistence.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class RecordMatcherTest {

  private static List<Map<String, Object>> foos() {
    List<Map<String, Object>> out = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      Map<String, Object> r = new LinkedHashMap<>();
      r.put("_id", i);
      r.put("integer_field", i);
      r.put("string_field", "Value: " + i);
      r.put("float_field", i + 100.0);
      r.put("list_field", List.of(10 * i + 1, 10 * i + 2, 10 * i + 3));
      out.add(r);
    }
    return out;
  }

  private static Set<Object> ids(QueryElement q) {
    Set<Object> out = new TreeSet<>();
    for (Map<String, Object> r : RecordMatcher.filter(foos(), q)) out.add(r.get("_id"));
    return out;
  }

  @Test
  void comparisonOperators_overThreeRecords() {
    assertEquals(Set.of(1), ids(eq("integer_field", 1)));
    assertEquals(Set.of(0, 2), ids(ne("integer_field", 1)));
    assertEquals(Set.of(2), ids(gt("integer_field", 1)));
    assertEquals(Set.of(1, 2), ids(gte("integer_field", 1)));
    assertEquals(Set.of(0), ids(lt("integer_field", 1)));
    assertEquals(Set.of(0, 1), ids(lte("integer_field", 1)));
    assertEquals(Set.of(1), ids(in("integer_field", List.of(1))));
    assertEquals(Set.of(0, 2), ids(nin("integer_field", List.of(1))));
    assertEquals(Set.of(1), ids(in("integer_field", List.of(1, 11, 21))));
  }

  @Test
  void numbersCompareByValue() {
    assertEquals(Set.of(1), ids(eq("integer_field", 1L)));
    assertEquals(Set.of(1), ids(eq("float_field", 101)));
    assertEquals(Set.of(2), ids(gt("float_field", 101L)));
  }

  @Test
  void stringOperators() {
    assertEquals(Set.of(0, 1, 2), ids(contains("string_field", "Value")));
    assertEquals(Set.of(0, 1, 2), ids(icontains("string_field", "vALUE")));
    assertEquals(Set.of(), ids(contains("string_field", "vALUE")));
    assertEquals(Set.of(2), ids(endsWith("string_field", ": 2")));
    assertEquals(Set.of(0, 1, 2), ids(startsWith("string_field", "Val")));
  }

  @Test
  void containsOnCollectionField_isMembershipForNonStrings() {
    assertTrue(RecordMatcher.matches(Map.of("tags", List.of("a", "b")), new Condition("tags", Operator.CONTAINS, "b")));
    assertEquals(Set.of(1), ids(new Condition("list_field", Operator.CONTAINS, 12)));
    assertThrows(QueryTypeException.class, () -> RecordMatcher.matches(Map.of("age", 12), new Condition("age", Operator.CONTAINS, 1)));
  }

  @Test
  void collectionFields_matchElementByElement() {
    Map<String, Object> r = Map.of("tags", List.of("apple", "pear"));
    assertTrue(RecordMatcher.matches(r, contains("tags", "pp")));
    assertTrue(RecordMatcher.matches(r, icontains("tags", "PEA")));
    assertTrue(RecordMatcher.matches(r, startsWith("tags", "pe")));
    assertTrue(RecordMatcher.matches(r, eq("tags", "apple")));
    assertFalse(RecordMatcher.matches(r, ne("tags", "apple")));
    assertTrue(RecordMatcher.matches(r, in("tags", List.of("apple", "plum"))));
    assertFalse(RecordMatcher.matches(r, nin("tags", List.of("apple"))));
    assertTrue(RecordMatcher.matches(r, eq("tags", List.of("apple", "pear"))));
    assertTrue(RecordMatcher.matches(r, ne("tags", "plum")));

    assertEquals(Set.of(1, 2), ids(gt("list_field", 12)));
    assertEquals(Set.of(0), ids(lte("list_field", 1)));
  }

  @Test
  void collectionWithoutValues_countsAsNull() {
    assertTrue(RecordMatcher.matches(Map.of("tags", List.of()), eq("tags", null)));
    assertTrue(RecordMatcher.matches(Map.of("tags", Arrays.asList(null, null)), in("tags", Arrays.asList("x", null))));
    assertFalse(RecordMatcher.matches(Map.of("tags", Arrays.asList(null, "x")), eq("tags", null)));
    assertTrue(RecordMatcher.matches(Map.of("tags", Arrays.asList(null, "x")), ne("tags", null)));
    assertFalse(RecordMatcher.matches(Map.of("tags", List.of()), gt("tags", 0)));
  }

  @Test
  void missingAttribute_isNull() {
    Map<String, Object> r = Map.of("name", "Foo");
    assertTrue(RecordMatcher.matches(r, eq("age", null)));
    assertTrue(RecordMatcher.matches(r, ne("age", 12)));
    assertFalse(RecordMatcher.matches(r, gt("age", 1)));
    assertFalse(RecordMatcher.matches(r, lte("age", 1)));
    assertFalse(RecordMatcher.matches(r, startsWith("email", "a")));
    assertTrue(RecordMatcher.matches(r, nin("age", List.of(1))));
  }

  @Test
  void nullQuery_matchesEverything() {
    assertEquals(Set.of(0, 1, 2), ids(null));
  }

  @Test
  void incomparableOperands_raiseQueryTypeException() {
    assertThrows(QueryTypeException.class, () -> RecordMatcher.matches(Map.of("age", "twelve"), gt("age", 1)));
    assertThrows(QueryTypeException.class, () -> RecordMatcher.matches(Map.of("age", 12), startsWith("age", "1")));
  }

  @Test
  void temporalValues_areOrdered() {
    Map<String, Object> r = Map.of("created", Instant.parse("2024-01-02T00:00:00Z"));
    assertTrue(RecordMatcher.matches(r, gt("created", Instant.parse("2024-01-01T00:00:00Z"))));
  }

  @Test
  void groups_andOrNot() {
    assertEquals(Set.of(1), ids(and(gte("integer_field", 1), lt("integer_field", 2))));
    assertEquals(Set.of(0, 2), ids(or(eq("integer_field", 0), eq("integer_field", 2))));
    assertEquals(Set.of(0, 2), ids(not(eq("integer_field", 1))));
  }

  @Test
  void negation_isTheComplement() {
    QueryElement q = or(gt("integer_field", 1), startsWith("string_field", "Value: 0"));
    Set<Object> all = ids(null);
    Set<Object> matched = ids(q);
    Set<Object> complement = new TreeSet<>(all);
    complement.removeAll(matched);
    assertEquals(complement, ids(not(q)));
  }

  @Test
  void deMorgan_holds() {
    QueryElement a = gte("integer_field", 1);
    QueryElement b = contains("string_field", "2");
    assertEquals(ids(not(and(a, b))), ids(or(not(a), not(b))));
    assertEquals(ids(not(or(a, b))), ids(and(not(a), not(b))));
  }
}

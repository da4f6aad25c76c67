package io.intellixity.strata.persistence.file;

import io.intellixity.strata.persistence.exec.KeyExistsException;
import io.intellixity.strata.persistence.exec.MultipleResultsFoundException;
import io.intellixity.strata.persistence.exec.NoResultsFoundException;
import io.intellixity.strata.persistence.query.QueryElement;
import io.intellixity.strata.persistence.queryset.QuerySet;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.*;

import static io.intellixity.strata.persistence.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class MemoryStorageTest {

  private static MemoryStorage foos() {
    MemoryStorage s = new MemoryStorage("foo", "_id");
    for (int i = 0; i < 3; i++) {
      s.insert(i, Map.of("integer_field", i, "string_field", "Value: " + i));
    }
    return s;
  }

  private static Set<Object> keys(MemoryStorage s, QueryElement q) {
    return new HashSet<>(s.findKeys(q));
  }

  @Test
  void comparisonScenario() {
    MemoryStorage s = foos();
    assertEquals(Set.of(2), keys(s, gt("integer_field", 1)));
    assertEquals(Set.of(1, 2), keys(s, gte("integer_field", 1)));
    assertEquals(Set.of(1), keys(s, in("integer_field", List.of(1))));
    assertEquals(Set.of(0, 2), keys(s, nin("integer_field", List.of(1))));
  }

  @Test
  void insert_isStrict() {
    MemoryStorage s = foos();
    assertThrows(KeyExistsException.class, () -> s.insert(1, Map.of("integer_field", 9)));
    assertThrows(KeyExistsException.class, () -> s.insert(1L, Map.of("integer_field", 9)));
    assertEquals(1, s.get(1).orElseThrow().get("integer_field"));
  }

  @Test
  void upsert_replacesRecord() {
    MemoryStorage s = foos();
    s.upsert(1, Map.of("integer_field", 9));
    Map<String, Object> r = s.get(1).orElseThrow();
    assertEquals(9, r.get("integer_field"));
    assertFalse(r.containsKey("string_field"));
  }

  @Test
  void get_returnsCopies() {
    MemoryStorage s = foos();
    s.get(0).orElseThrow().put("integer_field", 99);
    assertEquals(0, s.get(0).orElseThrow().get("integer_field"));
    assertTrue(s.get(7).isEmpty());
    assertFalse(s.contains(7));
  }

  @Test
  void update_mergesMatchingRecords() {
    MemoryStorage s = foos();
    assertEquals(2, s.update(gte("integer_field", 1), Map.of("flag", true)));
    assertEquals(Set.of(1, 2), keys(s, eq("flag", true)));
    assertEquals("Value: 1", s.get(1).orElseThrow().get("string_field"));
    assertEquals(0, s.update(eq("integer_field", 42), Map.of("flag", true)));
  }

  @Test
  void remove_deletesMatches() {
    MemoryStorage s = foos();
    assertEquals(2, s.remove(ne("integer_field", 1)));
    assertEquals(List.of(1), s.findKeys(null));
    assertEquals(1, s.remove(null));
    assertEquals(0, s.size());
  }

  @Test
  void findOne_cardinality() {
    MemoryStorage s = foos();
    assertEquals(1, s.findOne(eq("integer_field", 1)).get("_id"));
    assertThrows(NoResultsFoundException.class, () -> s.findOne(eq("integer_field", 5)));
    assertThrows(MultipleResultsFoundException.class, () -> s.findOne(lt("integer_field", 2)));
  }

  @Test
  void find_paginatesInMemory() {
    MemoryStorage s = new MemoryStorage("people", "_id");
    int[] ages = {5, 3, 1, 4, 2};
    for (int i = 0; i < ages.length; i++) s.insert("p" + i, Map.of("age", ages[i]));

    QuerySet<Map<String, Object>> qs = s.find().sort("age").offset(2).limit(2);
    List<Object> seen = new ArrayList<>();
    for (Map<String, Object> r : qs) seen.add(r.get("age"));
    assertEquals(List.of(3, 4), seen);
    assertEquals(2, qs.count());
  }

  @Test
  void flush_writesSnapshot() {
    MemoryStorage s = foos();
    assertEquals(0, s.snapshot().length);
    s.flush();
    String json = new String(s.snapshot(), StandardCharsets.UTF_8);
    assertTrue(json.contains("\"Value: 2\""));
  }
}

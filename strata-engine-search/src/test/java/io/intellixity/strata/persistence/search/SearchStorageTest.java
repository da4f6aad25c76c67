package io.intellixity.strata.persistence.search;

import io.intellixity.strata.persistence.exec.KeyExistsException;
import io.intellixity.strata.persistence.exec.MultipleResultsFoundException;
import io.intellixity.strata.persistence.exec.NoResultsFoundException;
import io.intellixity.strata.persistence.match.RecordMatcher;
import io.intellixity.strata.persistence.query.QueryElement;
import io.intellixity.strata.persistence.query.UnsupportedOperatorException;
import io.intellixity.strata.persistence.spi.StorageProviders;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.*;

import static io.intellixity.strata.persistence.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class SearchStorageTest {
  private InMemorySearchClient client;
  private SearchStorage store;
  private final List<Map<String, Object>> dataset = new ArrayList<>();

  @BeforeEach
  void setUp() {
    client = new InMemorySearchClient();
    store = new SearchStorage(client, "strata", "people", "_id");
    add("p1", "Foo", 12, "foo@Example.org", List.of("apple", "pear"));
    add("p2", "Bar", null, "bar@example.org", null);
    add("p3", "Baz", 40, null, List.of());
    add("p4", "a.b (c)", 7, "x@EXAMPLE.org", Arrays.asList("Plum", null));
  }

  private void add(String id, String name, Integer age, String email, List<String> tags) {
    Map<String, Object> r = new LinkedHashMap<>();
    r.put("_id", id);
    r.put("name", name);
    if (age != null) r.put("age", age);
    if (email != null) r.put("email", email);
    if (tags != null) r.put("tags", tags);
    r.put("created", Instant.parse("2024-01-01T00:00:00Z").plusSeconds(3600L * dataset.size()));
    store.insert(id, r);
    dataset.add(r);
  }

  @Test
  void insert_isStrict() {
    assertThrows(KeyExistsException.class, () -> store.insert("p1", Map.of("name", "Other")));
    assertEquals("Foo", store.get("p1").orElseThrow().get("name"));
  }

  @Test
  void get_restoresExtendedValues() {
    assertEquals(Instant.parse("2024-01-01T00:00:00Z"), store.get("p1").orElseThrow().get("created"));
    assertTrue(store.get("nope").isEmpty());
  }

  @Test
  void documents_holdSearchNativeValues() {
    store.insert("p9", Map.of("name", "Typed", "born", LocalDate.of(1990, 5, 17),
        "balance", new BigDecimal("12.50"), "visits", List.of(Instant.parse("2024-02-01T08:00:00.5Z"))));

    Map<String, Object> doc = client.stored("strata", "people", "p9");
    assertEquals("1990-05-17", doc.get("born"));
    assertEquals(new BigDecimal("12.50"), doc.get("balance"));
    assertEquals(List.of("2024-02-01T08:00:00.500000000Z"), doc.get("visits"));
    assertEquals(Map.of("balance", "decimal", "born", "local_date", "visits", "instant"), doc.get(SearchValues.TYPES_FIELD));

    Map<String, Object> back = store.get("p9").orElseThrow();
    assertEquals(LocalDate.of(1990, 5, 17), back.get("born"));
    assertEquals(new BigDecimal("12.50"), back.get("balance"));
    assertEquals(List.of(Instant.parse("2024-02-01T08:00:00.5Z")), back.get("visits"));
    assertFalse(back.containsKey(SearchValues.TYPES_FIELD));
    assertEquals(List.of("p9"), store.findKeys(lt("born", LocalDate.of(2000, 1, 1))));
  }

  @Test
  void update_reindexesWithCurrentTypes() {
    store.update(eq("name", "Foo"), Map.of("created", "unknown"));
    Map<String, Object> p1 = store.get("p1").orElseThrow();
    assertEquals("unknown", p1.get("created"));
    assertEquals(12, p1.get("age"));
    assertFalse(client.stored("strata", "people", "p1").containsKey(SearchValues.TYPES_FIELD));
  }

  @Test
  void wholeCollectionComparison_isUnsupported() {
    assertThrows(UnsupportedOperatorException.class, () -> store.findKeys(eq("tags", List.of("apple", "pear"))));
    assertThrows(UnsupportedOperatorException.class, () -> store.findKeys(in("tags", List.of(List.of("apple")))));
  }

  @Test
  void update_and_remove() {
    assertEquals(2, store.update(startsWith("name", "Ba"), Map.of("age", 50)));
    assertEquals(50, store.get("p2").orElseThrow().get("age"));
    assertThrows(IllegalArgumentException.class, () -> store.update(eq("name", "Foo"), Map.of("_id", "p9")));

    assertEquals(2, store.remove(eq("age", 50)));
    assertEquals(2, client.size());
    assertEquals(Set.of("p1", "p4"), new HashSet<>(store.findKeys(null)));
  }

  @Test
  void findOne_cardinality() {
    assertEquals("p1", store.findOne(eq("name", "Foo")).get("_id"));
    assertThrows(NoResultsFoundException.class, () -> store.findOne(eq("name", "Qux")));
    assertThrows(MultipleResultsFoundException.class, () -> store.findOne(icontains("email", "example")));
  }

  @Test
  void find_sortsInProcess() {
    assertEquals(List.of("p2", "p4", "p1", "p3"), store.find().sort("age").keys());
    assertEquals(List.of("p1", "p4"), store.find(icontains("email", "EXAMPLE")).sort("-age").limit(2).keys());
  }

  @Test
  void findKeys_agreesWithMatcher() {
    List<QueryElement> queries = List.of(
        eq("name", "Foo"), ne("age", 12), gt("age", 10), lte("age", 12), in("age", List.of(7, 40)),
        nin("age", List.of(12)), contains("name", "a"), contains("name", "b (c"), icontains("email", "example"),
        icontains("name", "BA"), startsWith("email", "bar"), endsWith("email", ".org"), eq("email", null),
        in("age", Arrays.asList(12, null)), gt("created", Instant.parse("2024-01-01T01:30:00Z")),
        not(and(gte("age", 10), icontains("email", "EXAMPLE"))),
        or(not(eq("name", "Foo")), nin("age", List.of(40))),
        and(not(or(startsWith("name", "B"), lt("age", 10))), ne("email", null)),
        contains("tags", "pp"), eq("tags", "apple"), ne("tags", "apple"), in("tags", List.of("apple", "kiwi")),
        nin("tags", List.of("Plum")), eq("tags", null), ne("tags", null), in("tags", Arrays.asList("pear", null)),
        nin("tags", Arrays.asList("kiwi", null)), icontains("tags", "PLU"), startsWith("tags", "pe"),
        not(endsWith("tags", "ar")), lte("created", Instant.parse("2024-01-01T01:00:00Z")));

    for (QueryElement q : queries) {
      Set<Object> expected = new HashSet<>();
      for (Map<String, Object> r : RecordMatcher.filter(dataset, q)) expected.add(r.get("_id"));
      assertEquals(expected, new HashSet<>(store.findKeys(q)), q.toString());
    }
  }

  @Test
  void flush_refreshesIndex() {
    store.flush();
    assertEquals(1, client.refreshes);
  }

  @Test
  void provider_isDiscoverable() {
    assertTrue(StorageProviders.discover().get("search") instanceof SearchStorageProvider);
    assertEquals("<SearchStorage: 'strata/people'>", store.toString());
  }
}

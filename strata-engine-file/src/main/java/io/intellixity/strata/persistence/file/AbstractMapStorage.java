package io.intellixity.strata.persistence.file;

import io.intellixity.strata.persistence.exec.KeyExistsException;
import io.intellixity.strata.persistence.match.RecordMatcher;
import io.intellixity.strata.persistence.query.QueryElement;
import io.intellixity.strata.persistence.queryset.ListQuerySource;
import io.intellixity.strata.persistence.queryset.QuerySource;
import io.intellixity.strata.persistence.spi.storage.AbstractStorage;

import java.math.BigInteger;
import java.util.*;

/**
 * Storage over an in-process key to record map, filtered with {@link RecordMatcher}.
 * <p>
 * Records handed out are copies; the map is only changed through the storage operations.
 */
public abstract class AbstractMapStorage extends AbstractStorage {
  private final Map<Object, Map<String, Object>> store = new LinkedHashMap<>();

  protected AbstractMapStorage(String collection, String primaryName) {
    super(collection, primaryName);
  }

  /** Called after every mutation. */
  protected abstract void afterWrite();

  /** Live view of the stored mapping for serialization by subclasses. */
  protected final Map<Object, Map<String, Object>> store() {
    return store;
  }

  /** Replaces the whole mapping, e.g. after reading it back from disk. */
  protected final void restore(Map<Object, Map<String, Object>> records) {
    store.clear();
    for (Map.Entry<Object, Map<String, Object>> e : records.entrySet()) {
      store.put(canonicalKey(e.getKey()), new LinkedHashMap<>(e.getValue()));
    }
  }

  @Override
  public Optional<Map<String, Object>> get(Object key) {
    Map<String, Object> r = store.get(canonicalKey(key));
    return (r == null) ? Optional.empty() : Optional.of(new LinkedHashMap<>(r));
  }

  @Override
  public boolean contains(Object key) {
    return store.containsKey(canonicalKey(key));
  }

  @Override
  public void insert(Object key, Map<String, Object> value) {
    Object k = canonicalKey(Objects.requireNonNull(key, "key"));
    if (store.containsKey(k)) throw new KeyExistsException(collection(), key);
    store.put(k, withPrimaryKey(key, value));
    afterWrite();
  }

  @Override
  public void upsert(Object key, Map<String, Object> value) {
    store.put(canonicalKey(Objects.requireNonNull(key, "key")), withPrimaryKey(key, value));
    afterWrite();
  }

  @Override
  public long update(QueryElement query, Map<String, Object> data) {
    Objects.requireNonNull(data, "data");
    List<Object> keys = matchingKeys(query);
    for (Object k : keys) checkUpdate(store.get(k).get(primaryName()), data);
    for (Object k : keys) store.put(k, merge(store.get(k), data));
    if (!keys.isEmpty()) afterWrite();
    return keys.size();
  }

  @Override
  public long remove(QueryElement query) {
    List<Object> keys = matchingKeys(query);
    for (Object k : keys) store.remove(k);
    if (!keys.isEmpty()) afterWrite();
    return keys.size();
  }

  @Override
  protected QuerySource select(QueryElement query) {
    List<Map<String, Object>> matches = new ArrayList<>();
    for (Map<String, Object> r : store.values()) {
      if (RecordMatcher.matches(r, query)) matches.add(new LinkedHashMap<>(r));
    }
    return new ListQuerySource(matches);
  }

  public int size() {
    return store.size();
  }

  private List<Object> matchingKeys(QueryElement query) {
    List<Object> keys = new ArrayList<>();
    for (Map.Entry<Object, Map<String, Object>> e : store.entrySet()) {
      if (RecordMatcher.matches(e.getValue(), query)) keys.add(e.getKey());
    }
    return keys;
  }

  /** Integral keys are stored as {@code Long} so 1, 1L and a JSON-read 1 address one record. */
  static Object canonicalKey(Object key) {
    if (key instanceof Byte || key instanceof Short || key instanceof Integer) return ((Number) key).longValue();
    if (key instanceof BigInteger bi && bi.bitLength() < 64) return bi.longValue();
    return key;
  }

  @Override
  public String toString() {
    return store.toString();
  }
}

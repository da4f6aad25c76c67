package io.intellixity.strata.persistence.spi.storage;

import io.intellixity.strata.persistence.query.QueryElement;
import io.intellixity.strata.persistence.queryset.QuerySet;
import io.intellixity.strata.persistence.queryset.RecordSchema;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Uniform CRUD + query contract implemented once per backend.
 * <p>
 * Every {@code query} argument may be null, meaning "every record in the collection". Query
 * translation errors are raised before the backend is contacted; backend transport errors
 * propagate unwrapped.
 */
public interface Storage {
  String collection();

  /** Name of the primary-key attribute stored inside every record. */
  String primaryName();

  /** Point lookup; never throws on a miss. */
  Optional<Map<String, Object>> get(Object key);

  default boolean contains(Object key) {
    return get(key).isPresent();
  }

  /**
   * Strict insert: fails with {@link io.intellixity.strata.persistence.exec.KeyExistsException}
   * if {@code key} is already stored. The primary key is injected into a copy of {@code value}
   * when absent; the caller's map is never mutated.
   */
  void insert(Object key, Map<String, Object> value);

  /** Stores {@code value} under {@code key}, replacing any existing record. */
  void upsert(Object key, Map<String, Object> value);

  /**
   * Overwrites exactly the attributes named in {@code data} on every matching record.
   *
   * @return number of records matched
   */
  long update(QueryElement query, Map<String, Object> data);

  /**
   * Deletes every matching record, retracting it from any secondary index first.
   *
   * @return number of records removed
   */
  long remove(QueryElement query);

  default QuerySet<Map<String, Object>> find() {
    return find(null);
  }

  /** Lazily evaluated matches, hydrated through {@link #get(Object)}. */
  QuerySet<Map<String, Object>> find(QueryElement query);

  <R> QuerySet<R> find(QueryElement query, RecordSchema<R> schema);

  /** Primary keys of the matching records. */
  default List<Object> findKeys(QueryElement query) {
    return find(query).keys();
  }

  /**
   * The single record matching {@code query}.
   *
   * @throws io.intellixity.strata.persistence.exec.NoResultsFoundException when nothing matches
   * @throws io.intellixity.strata.persistence.exec.MultipleResultsFoundException when more than one record matches
   */
  Map<String, Object> findOne(QueryElement query);

  /** Forces buffered writes to durable storage; a no-op for backends durable per write. */
  void flush();
}

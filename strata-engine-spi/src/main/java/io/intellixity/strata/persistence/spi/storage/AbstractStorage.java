package io.intellixity.strata.persistence.spi.storage;

import io.intellixity.strata.persistence.exec.MultipleResultsFoundException;
import io.intellixity.strata.persistence.exec.NoResultsFoundException;
import io.intellixity.strata.persistence.match.Values;
import io.intellixity.strata.persistence.query.QueryElement;
import io.intellixity.strata.persistence.queryset.QueryDirectives;
import io.intellixity.strata.persistence.queryset.QuerySet;
import io.intellixity.strata.persistence.queryset.QuerySource;
import io.intellixity.strata.persistence.queryset.RecordSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Template for storage adapters.
 * <p>
 * Subclasses provide point operations and a {@link QuerySource} for a query; this class builds the
 * lazy {@link QuerySet}, enforces find-one cardinality and prepares values for writing.
 */
public abstract class AbstractStorage implements Storage {
  private static final Logger log = LoggerFactory.getLogger(AbstractStorage.class);

  private final String collection;
  private final String primaryName;

  protected AbstractStorage(String collection, String primaryName) {
    this.collection = requireName(collection, "collection");
    this.primaryName = requireName(primaryName, "primaryName");
  }

  /** Backend-specific match source for {@code query} (null = all records). */
  protected abstract QuerySource select(QueryElement query);

  @Override
  public final String collection() { return collection; }

  @Override
  public final String primaryName() { return primaryName; }

  @Override
  public QuerySet<Map<String, Object>> find(QueryElement query) {
    return find(query, RecordSchema.of(primaryName, key -> get(key).orElse(null)));
  }

  @Override
  public <R> QuerySet<R> find(QueryElement query, RecordSchema<R> schema) {
    Objects.requireNonNull(schema, "schema");
    if (!primaryName.equals(schema.primaryName())) {
      throw new IllegalArgumentException("Schema primary key '" + schema.primaryName()
          + "' does not match storage primary key '" + primaryName + "'");
    }
    return new QuerySet<>(schema, select(query));
  }

  @Override
  public Map<String, Object> findOne(QueryElement query) {
    List<Map<String, Object>> matches = select(query).fetch(QueryDirectives.NONE);
    log.debug("find_one on '{}' matched {} record(s)", collection, matches.size());
    if (matches.isEmpty()) throw new NoResultsFoundException(collection);
    if (matches.size() > 1) throw new MultipleResultsFoundException(collection, matches.size());
    return matches.get(0);
  }

  /**
   * Copy of {@code value} carrying the primary key. A value that already names a different key is
   * rejected.
   */
  protected final Map<String, Object> withPrimaryKey(Object key, Map<String, Object> value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    Map<String, Object> out = new LinkedHashMap<>(value);
    if (!out.containsKey(primaryName)) {
      out.put(primaryName, key);
    } else if (!Values.equal(out.get(primaryName), key)) {
      throw new IllegalArgumentException("Record " + primaryName + "=" + out.get(primaryName)
          + " does not match key " + key);
    }
    return out;
  }

  /** Rejects partial updates that would move a record to another primary key. */
  protected final void checkUpdate(Object key, Map<String, Object> data) {
    if (data.containsKey(primaryName) && !Values.equal(data.get(primaryName), key)) {
      throw new IllegalArgumentException("update may not change primary key " + primaryName + " of record " + key);
    }
  }

  protected static Map<String, Object> merge(Map<String, Object> record, Map<String, Object> data) {
    Map<String, Object> out = new LinkedHashMap<>(record);
    out.putAll(data);
    return out;
  }

  private static String requireName(String v, String label) {
    if (v == null || v.isBlank()) throw new IllegalArgumentException(label + " must not be blank");
    return v;
  }
}

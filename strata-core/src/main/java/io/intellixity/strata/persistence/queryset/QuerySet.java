package io.intellixity.strata.persistence.queryset;

import io.intellixity.strata.persistence.query.SortField;

import java.util.*;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazily evaluated result of a {@code find}.
 * <p>
 * {@link #sort}, {@link #offset} and {@link #limit} only record directives and return a new
 * instance; nothing touches the source until the set is indexed, iterated or measured. Evaluation
 * always applies sort, then offset, then limit, and happens at most once per instance. Records are
 * hydrated through the {@link RecordSchema} one at a time from the cached key list.
 */
public final class QuerySet<R> implements Iterable<R> {
  private final RecordSchema<R> schema;
  private final QuerySource source;
  private final QueryDirectives directives;

  private List<Map<String, Object>> evaluated;

  public QuerySet(RecordSchema<R> schema, QuerySource source) {
    this(schema, source, QueryDirectives.NONE);
  }

  private QuerySet(RecordSchema<R> schema, QuerySource source, QueryDirectives directives) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.source = Objects.requireNonNull(source, "source");
    this.directives = Objects.requireNonNull(directives, "directives");
  }

  /** Attribute names, optionally prefixed with {@code -} for descending order. */
  public QuerySet<R> sort(String... keys) {
    List<SortField> fields = new ArrayList<>(keys.length);
    for (String k : keys) fields.add(SortField.parse(k));
    return sort(fields);
  }

  public QuerySet<R> sort(List<SortField> fields) {
    return new QuerySet<>(schema, source, directives.withSort(fields));
  }

  public QuerySet<R> offset(int n) {
    return new QuerySet<>(schema, source, directives.withOffset(n));
  }

  public QuerySet<R> limit(int n) {
    return new QuerySet<>(schema, source, directives.withLimit(n));
  }

  public QueryDirectives directives() { return directives; }

  public RecordSchema<R> schema() { return schema; }

  /** Hydrates the record at {@code index} of the evaluated sequence. */
  public R get(int index) {
    return schema.load(getKey(index));
  }

  public Object getKey(int index) {
    List<Map<String, Object>> rows = evaluate();
    if (index < 0 || index >= rows.size()) {
      throw new IndexOutOfBoundsException("Index " + index + " out of bounds for query set of size " + rows.size());
    }
    return rows.get(index).get(schema.primaryName());
  }

  public List<Object> keys() {
    List<Map<String, Object>> rows = evaluate();
    List<Object> out = new ArrayList<>(rows.size());
    for (Map<String, Object> r : rows) out.add(r.get(schema.primaryName()));
    return out;
  }

  /** The evaluated raw records, unhydrated. */
  public List<Map<String, Object>> raw() {
    return evaluate();
  }

  public Optional<R> first() {
    return isEmpty() ? Optional.empty() : Optional.ofNullable(get(0));
  }

  public int size() {
    return evaluate().size();
  }

  /**
   * Number of records in the evaluated set. Uses the source's native count (which honors
   * offset/limit) when this set has not been evaluated yet.
   */
  public long count() {
    synchronized (this) {
      if (evaluated != null) return evaluated.size();
    }
    long n = source.nativeCount(directives);
    return (n >= 0) ? n : size();
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  @Override
  public Iterator<R> iterator() {
    Iterator<Object> keys = keys().iterator();
    return new Iterator<>() {
      @Override public boolean hasNext() { return keys.hasNext(); }
      @Override public R next() { return schema.load(keys.next()); }
    };
  }

  public Stream<R> stream() {
    return StreamSupport.stream(spliterator(), false);
  }

  private synchronized List<Map<String, Object>> evaluate() {
    if (evaluated == null) {
      evaluated = Collections.unmodifiableList(new ArrayList<>(source.fetch(directives)));
    }
    return evaluated;
  }

  @Override
  public String toString() {
    return "<QuerySet: " + keys() + ">";
  }
}

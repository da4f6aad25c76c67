package io.intellixity.strata.persistence.queryset;

import java.util.Objects;
import java.util.function.Function;

/**
 * What a {@link QuerySet} needs from the record layer: the primary-key attribute name and a way to
 * hydrate a full record from its key.
 */
public interface RecordSchema<R> {
  String primaryName();

  /** Loads the record stored under {@code key}, or null if it no longer exists. */
  R load(Object key);

  static <R> RecordSchema<R> of(String primaryName, Function<Object, R> loader) {
    Objects.requireNonNull(primaryName, "primaryName");
    Objects.requireNonNull(loader, "loader");
    return new RecordSchema<>() {
      @Override public String primaryName() { return primaryName; }
      @Override public R load(Object key) { return loader.apply(key); }
    };
  }
}

package io.intellixity.strata.persistence.query;

import java.util.Objects;

public record SortField(String field, Direction direction) {
  /** Prefix marking a descending key in {@link #parse(String)}. */
  public static final String DESCENDING_MARKER = "-";

  public SortField {
    Objects.requireNonNull(field, "field");
    if (field.isBlank()) throw new IllegalArgumentException("sort field must not be blank");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public boolean descending() { return direction == Direction.DESC; }

  /** {@code "age"} sorts ascending, {@code "-age"} descending. */
  public static SortField parse(String key) {
    Objects.requireNonNull(key, "key");
    String k = key.trim();
    if (k.startsWith(DESCENDING_MARKER)) {
      return new SortField(k.substring(DESCENDING_MARKER.length()), Direction.DESC);
    }
    return new SortField(k, Direction.ASC);
  }

  public enum Direction { ASC, DESC }
}

package io.intellixity.strata.persistence.exec;

import io.intellixity.strata.persistence.StrataException;

public final class KeyExistsException extends StrataException {
  private final Object key;

  public KeyExistsException(String collection, Object key) {
    super("Key (" + key + ") already exists in '" + collection + "'");
    this.key = key;
  }

  public KeyExistsException(String collection, Object key, Throwable cause) {
    super("Key (" + key + ") already exists in '" + collection + "'", cause);
    this.key = key;
  }

  public Object key() { return key; }
}

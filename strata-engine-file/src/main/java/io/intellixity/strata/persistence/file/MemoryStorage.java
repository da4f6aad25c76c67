package io.intellixity.strata.persistence.file;

import io.intellixity.strata.persistence.codec.ExtendedJson;

/**
 * Ephemeral storage: records live only in this process. {@link #flush()} serializes the mapping
 * into an in-memory snapshot instead of a file.
 */
public final class MemoryStorage extends AbstractMapStorage {
  private byte[] snapshot = new byte[0];

  public MemoryStorage(String collection, String primaryName) {
    super(collection, primaryName);
  }

  @Override
  protected void afterWrite() {
    // nothing to persist until flush
  }

  @Override
  public void flush() {
    snapshot = ExtendedJson.encodeRecords(store().values());
  }

  /** Bytes written by the last {@link #flush()}. */
  public byte[] snapshot() {
    return snapshot.clone();
  }
}

package io.intellixity.strata.persistence.file;

import io.intellixity.strata.persistence.spi.StorageProvider;
import io.intellixity.strata.persistence.spi.config.StorageSettings;
import io.intellixity.strata.persistence.spi.storage.Storage;

public final class MemoryStorageProvider implements StorageProvider {
  @Override public String id() { return "memory"; }

  @Override
  public Storage open(String collection, String primaryName, StorageSettings settings) {
    return new MemoryStorage(collection, primaryName);
  }
}

package io.intellixity.strata.persistence.spi;

import io.intellixity.strata.persistence.spi.config.StorageSettings;
import io.intellixity.strata.persistence.spi.storage.Storage;

/**
 * Opens {@link Storage} adapters for one backend family. Implementations are registered in
 * {@code META-INF/strata.factories}.
 */
public interface StorageProvider {
  /** Backend id, e.g. {@code memory}, {@code file}, {@code redis}, {@code search}, {@code mongo}. */
  String id();

  Storage open(String collection, String primaryName, StorageSettings settings);
}

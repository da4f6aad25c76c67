package io.intellixity.strata.persistence.search;

import io.intellixity.strata.persistence.spi.StorageProvider;
import io.intellixity.strata.persistence.spi.config.StorageSettings;
import io.intellixity.strata.persistence.spi.storage.Storage;

public final class SearchStorageProvider implements StorageProvider {
  @Override public String id() { return "search"; }

  @Override
  public Storage open(String collection, String primaryName, StorageSettings settings) {
    SearchClient client = new HttpSearchClient(settings.searchEndpoint(), settings.searchTimeoutMs());
    return new SearchStorage(client, settings.searchIndex(), collection, primaryName);
  }
}

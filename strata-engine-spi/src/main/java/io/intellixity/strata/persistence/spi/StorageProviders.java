package io.intellixity.strata.persistence.spi;

import io.intellixity.strata.persistence.spi.config.StorageSettings;
import io.intellixity.strata.persistence.spi.storage.Storage;
import io.intellixity.strata.persistence.util.StrataFactoriesLoader;

import java.util.*;

/** Registry of discovered {@link StorageProvider}s, keyed by backend id. */
public final class StorageProviders {
  private final Map<String, StorageProvider> byId;

  public StorageProviders(Collection<? extends StorageProvider> providers) {
    Map<String, StorageProvider> m = new LinkedHashMap<>();
    for (StorageProvider p : providers) {
      StorageProvider prev = m.putIfAbsent(p.id(), p);
      if (prev != null) {
        throw new IllegalStateException("Duplicate storage provider id '" + p.id() + "': "
            + prev.getClass().getName() + ", " + p.getClass().getName());
      }
    }
    this.byId = Collections.unmodifiableMap(m);
  }

  /** Providers listed in every {@code META-INF/strata.factories} on the classpath. */
  public static StorageProviders discover() {
    return new StorageProviders(StrataFactoriesLoader.load(StorageProvider.class));
  }

  public Set<String> ids() {
    return byId.keySet();
  }

  public StorageProvider get(String id) {
    StorageProvider p = byId.get(id);
    if (p == null) throw new IllegalArgumentException("No storage provider '" + id + "'; available: " + byId.keySet());
    return p;
  }

  public Storage open(String id, String collection, String primaryName, StorageSettings settings) {
    return get(id).open(collection, primaryName, settings);
  }
}

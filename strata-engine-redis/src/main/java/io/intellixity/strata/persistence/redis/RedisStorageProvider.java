package io.intellixity.strata.persistence.redis;

import io.intellixity.strata.persistence.spi.StorageProvider;
import io.intellixity.strata.persistence.spi.config.StorageSettings;
import io.intellixity.strata.persistence.spi.storage.Storage;

public final class RedisStorageProvider implements StorageProvider {
  @Override public String id() { return "redis"; }

  @Override
  public Storage open(String collection, String primaryName, StorageSettings settings) {
    return new RedisStorage(JedisKeyValueClient.connect(settings.redisUri()), collection, primaryName);
  }
}

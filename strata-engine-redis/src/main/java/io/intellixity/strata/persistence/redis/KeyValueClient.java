package io.intellixity.strata.persistence.redis;

import java.util.Map;
import java.util.Set;

/** The Redis hash and set commands {@link RedisStorage} relies on. */
public interface KeyValueClient extends AutoCloseable {
  /** All fields of the hash, or an empty map when the key does not exist. */
  Map<String, String> hgetAll(String key);

  void hset(String key, Map<String, String> fields);

  boolean exists(String key);

  long del(String key);

  long sadd(String key, String member);

  long srem(String key, String member);

  boolean sismember(String key, String member);

  Set<String> smembers(String key);

  @Override
  void close();
}

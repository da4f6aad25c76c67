package io.intellixity.strata.persistence.redis;

import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.UnifiedJedis;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** {@link KeyValueClient} over a Jedis connection pool. */
public final class JedisKeyValueClient implements KeyValueClient {
  private final UnifiedJedis jedis;

  public JedisKeyValueClient(UnifiedJedis jedis) {
    this.jedis = Objects.requireNonNull(jedis, "jedis");
  }

  /** Pooled client for a {@code redis://host:port[/db]} URL. */
  public static JedisKeyValueClient connect(String url) {
    return new JedisKeyValueClient(new JedisPooled(url));
  }

  @Override public Map<String, String> hgetAll(String key) { return jedis.hgetAll(key); }
  @Override public void hset(String key, Map<String, String> fields) { jedis.hset(key, fields); }
  @Override public boolean exists(String key) { return jedis.exists(key); }
  @Override public long del(String key) { return jedis.del(key); }
  @Override public long sadd(String key, String member) { return jedis.sadd(key, member); }
  @Override public long srem(String key, String member) { return jedis.srem(key, member); }
  @Override public boolean sismember(String key, String member) { return jedis.sismember(key, member); }
  @Override public Set<String> smembers(String key) { return jedis.smembers(key); }

  @Override
  public void close() {
    jedis.close();
  }
}

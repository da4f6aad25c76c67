package io.intellixity.strata.persistence.redis;

import io.intellixity.strata.persistence.codec.ExtendedJson;
import io.intellixity.strata.persistence.exec.KeyExistsException;
import io.intellixity.strata.persistence.match.RecordMatcher;
import io.intellixity.strata.persistence.query.QueryElement;
import io.intellixity.strata.persistence.queryset.ListQuerySource;
import io.intellixity.strata.persistence.queryset.QuerySource;
import io.intellixity.strata.persistence.spi.storage.AbstractStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Storage over Redis hashes.
 * <p>
 * Each record is a hash named {@code <collection>:<pk>} mapping attribute names to extended-JSON
 * values. The set {@code <collection>_keys} holds every primary key of the collection. Redis has
 * no server-side filter for hash contents, so queries scan the key set and evaluate each record
 * with {@link RecordMatcher}.
 * <p>
 * Writes touch two structures without a transaction: records are written before their key is
 * indexed, and unindexed before they are deleted.
 */
public final class RedisStorage extends AbstractStorage implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(RedisStorage.class);

  private final KeyValueClient client;
  private final String keySetName;

  public RedisStorage(KeyValueClient client, String collection, String primaryName) {
    super(collection, primaryName);
    this.client = Objects.requireNonNull(client, "client");
    this.keySetName = collection + "_keys";
  }

  /** Name of the hash holding the record stored under {@code key}. */
  public String hashKey(Object key) {
    return collection() + ":" + member(key);
  }

  /** Members of the primary-key set. */
  public Set<String> keySet() {
    return client.smembers(keySetName);
  }

  @Override
  public Optional<Map<String, Object>> get(Object key) {
    Map<String, String> hash = client.hgetAll(hashKey(key));
    return (hash == null || hash.isEmpty()) ? Optional.empty() : Optional.of(decode(hash));
  }

  @Override
  public boolean contains(Object key) {
    return client.sismember(keySetName, member(key));
  }

  @Override
  public void insert(Object key, Map<String, Object> value) {
    Map<String, Object> record = withPrimaryKey(key, value);
    if (client.sismember(keySetName, member(key)) || client.exists(hashKey(key))) {
      throw new KeyExistsException(collection(), key);
    }
    client.hset(hashKey(key), encode(record));
    client.sadd(keySetName, member(key));
  }

  @Override
  public void upsert(Object key, Map<String, Object> value) {
    Map<String, Object> record = withPrimaryKey(key, value);
    client.del(hashKey(key));
    client.hset(hashKey(key), encode(record));
    client.sadd(keySetName, member(key));
  }

  @Override
  public long update(QueryElement query, Map<String, Object> data) {
    Objects.requireNonNull(data, "data");
    List<Map<String, Object>> matches = scan(query);
    for (Map<String, Object> r : matches) checkUpdate(r.get(primaryName()), data);
    if (data.isEmpty()) return matches.size();

    Map<String, String> fields = encode(data);
    for (Map<String, Object> r : matches) client.hset(hashKey(r.get(primaryName())), fields);
    return matches.size();
  }

  @Override
  public long remove(QueryElement query) {
    List<Map<String, Object>> matches = scan(query);
    for (Map<String, Object> r : matches) {
      Object key = r.get(primaryName());
      client.srem(keySetName, member(key));
      client.del(hashKey(key));
    }
    return matches.size();
  }

  @Override
  protected QuerySource select(QueryElement query) {
    return new ListQuerySource(scan(query));
  }

  @Override
  public void flush() {
    // every command is applied by the server as it is issued
  }

  @Override
  public void close() {
    client.close();
  }

  private List<Map<String, Object>> scan(QueryElement query) {
    Set<String> members = client.smembers(keySetName);
    List<Map<String, Object>> out = new ArrayList<>();
    for (String m : members) {
      Map<String, String> hash = client.hgetAll(collection() + ":" + m);
      if (hash == null || hash.isEmpty()) continue;
      Map<String, Object> record = decode(hash);
      if (RecordMatcher.matches(record, query)) out.add(record);
    }
    log.debug("Scanned {} key(s) of '{}', {} matched {}", members.size(), collection(), out.size(), query);
    return out;
  }

  private static String member(Object key) {
    return String.valueOf(Objects.requireNonNull(key, "key"));
  }

  private static Map<String, String> encode(Map<String, Object> record) {
    Map<String, String> out = new LinkedHashMap<>();
    for (Map.Entry<String, Object> e : record.entrySet()) out.put(e.getKey(), ExtendedJson.encode(e.getValue()));
    return out;
  }

  private static Map<String, Object> decode(Map<String, String> hash) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (Map.Entry<String, String> e : hash.entrySet()) out.put(e.getKey(), ExtendedJson.decode(e.getValue()));
    return out;
  }

  @Override
  public String toString() {
    return "<RedisStorage: '" + collection() + "'>";
  }
}

package io.intellixity.strata.persistence.redis;

import java.util.*;

/** Single-threaded stand-in for a Redis server holding hashes and sets. */
final class InMemoryKeyValueClient implements KeyValueClient {
  final Map<String, Map<String, String>> hashes = new HashMap<>();
  final Map<String, Set<String>> sets = new HashMap<>();
  final List<String> commands = new ArrayList<>();

  @Override
  public Map<String, String> hgetAll(String key) {
    commands.add("HGETALL " + key);
    return new HashMap<>(hashes.getOrDefault(key, Map.of()));
  }

  @Override
  public void hset(String key, Map<String, String> fields) {
    commands.add("HSET " + key);
    hashes.computeIfAbsent(key, k -> new LinkedHashMap<>()).putAll(fields);
  }

  @Override
  public boolean exists(String key) {
    return hashes.containsKey(key) || sets.containsKey(key);
  }

  @Override
  public long del(String key) {
    commands.add("DEL " + key);
    boolean removed = hashes.remove(key) != null | sets.remove(key) != null;
    return removed ? 1 : 0;
  }

  @Override
  public long sadd(String key, String member) {
    commands.add("SADD " + key + " " + member);
    return sets.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(member) ? 1 : 0;
  }

  @Override
  public long srem(String key, String member) {
    commands.add("SREM " + key + " " + member);
    Set<String> s = sets.get(key);
    if (s == null || !s.remove(member)) return 0;
    if (s.isEmpty()) sets.remove(key);
    return 1;
  }

  @Override
  public boolean sismember(String key, String member) {
    return sets.getOrDefault(key, Set.of()).contains(member);
  }

  @Override
  public Set<String> smembers(String key) {
    return new LinkedHashSet<>(sets.getOrDefault(key, Set.of()));
  }

  Set<String> keys() {
    Set<String> out = new TreeSet<>(hashes.keySet());
    out.addAll(sets.keySet());
    return out;
  }

  @Override
  public void close() {}
}

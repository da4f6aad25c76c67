package io.intellixity.strata.persistence.spi.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.*;

/**
 * Backend connection and layout settings.
 * <p>
 * Read from {@code strata.properties} on the classpath, overlaid by {@code strata.*} system
 * properties. Unset keys fall back to the defaults below.
 */
public final class StorageSettings {
  public static final String RESOURCE = "strata.properties";
  public static final String PREFIX = "strata.";

  public static final String FILE_DIRECTORY = "strata.file.directory";
  public static final String FILE_PREFIX = "strata.file.prefix";
  public static final String FILE_EXTENSION = "strata.file.extension";
  public static final String REDIS_URI = "strata.redis.uri";
  public static final String SEARCH_ENDPOINT = "strata.search.endpoint";
  public static final String SEARCH_INDEX = "strata.search.index";
  public static final String SEARCH_TIMEOUT_MS = "strata.search.timeout-ms";
  public static final String MONGO_URI = "strata.mongo.uri";
  public static final String MONGO_DATABASE = "strata.mongo.database";

  private final Map<String, String> values;

  public StorageSettings(Map<String, String> values) {
    this.values = Map.copyOf(values == null ? Map.of() : values);
  }

  public static StorageSettings of(Properties props) {
    Map<String, String> m = new LinkedHashMap<>();
    for (String name : props.stringPropertyNames()) m.put(name, props.getProperty(name));
    return new StorageSettings(m);
  }

  public static StorageSettings load() {
    return load(Thread.currentThread().getContextClassLoader());
  }

  public static StorageSettings load(ClassLoader cl) {
    Properties p = new Properties();
    if (cl == null) cl = StorageSettings.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(RESOURCE)) {
      if (in != null) p.load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + RESOURCE, e);
    }
    for (String name : System.getProperties().stringPropertyNames()) {
      if (name.startsWith(PREFIX)) p.setProperty(name, System.getProperty(name));
    }
    return of(p);
  }

  public StorageSettings with(String key, String value) {
    Map<String, String> m = new LinkedHashMap<>(values);
    m.put(key, value);
    return new StorageSettings(m);
  }

  public Optional<String> get(String key) {
    String v = values.get(key);
    return (v == null || v.isBlank()) ? Optional.empty() : Optional.of(v.trim());
  }

  public String get(String key, String defaultValue) {
    return get(key).orElse(defaultValue);
  }

  public int getInt(String key, int defaultValue) {
    Optional<String> v = get(key);
    if (v.isEmpty()) return defaultValue;
    try {
      return Integer.parseInt(v.get());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(key + " must be an integer, got '" + v.get() + "'", e);
    }
  }

  public Path fileDirectory() { return Path.of(get(FILE_DIRECTORY, ".")); }
  public String filePrefix() { return get(FILE_PREFIX, "db_"); }
  public String fileExtension() { return get(FILE_EXTENSION, "json"); }
  public String redisUri() { return get(REDIS_URI, "redis://localhost:6379"); }
  public String searchEndpoint() { return get(SEARCH_ENDPOINT, "http://localhost:9200"); }
  public String searchIndex() { return get(SEARCH_INDEX, "strata"); }
  public int searchTimeoutMs() { return getInt(SEARCH_TIMEOUT_MS, 5000); }
  public String mongoUri() { return get(MONGO_URI, "mongodb://localhost:27017"); }
  public String mongoDatabase() { return get(MONGO_DATABASE, "strata"); }

  @Override
  public String toString() {
    return "StorageSettings" + new TreeMap<>(values);
  }
}

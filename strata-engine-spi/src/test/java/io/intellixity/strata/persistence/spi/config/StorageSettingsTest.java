package io.intellixity.strata.persistence.spi.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

final class StorageSettingsTest {

  @Test
  void defaults_applyWhenUnset() {
    StorageSettings s = new StorageSettings(Map.of());
    assertEquals("db_", s.filePrefix());
    assertEquals("json", s.fileExtension());
    assertEquals(Path.of("."), s.fileDirectory());
    assertEquals("strata", s.mongoDatabase());
    assertEquals(5000, s.searchTimeoutMs());
  }

  @Test
  void properties_overrideDefaults() {
    Properties p = new Properties();
    p.setProperty(StorageSettings.REDIS_URI, "redis://cache:6380");
    p.setProperty(StorageSettings.FILE_EXTENSION, "  pkl ");
    StorageSettings s = StorageSettings.of(p);
    assertEquals("redis://cache:6380", s.redisUri());
    assertEquals("pkl", s.fileExtension());
  }

  @Test
  void load_readsClasspathResourceAndSystemProperties() {
    System.setProperty(StorageSettings.MONGO_DATABASE, "from-system");
    try {
      StorageSettings s = StorageSettings.load();
      assertEquals("people-test", s.searchIndex());
      assertEquals("test_", s.filePrefix());
      assertEquals("from-system", s.mongoDatabase());
    } finally {
      System.clearProperty(StorageSettings.MONGO_DATABASE);
    }
  }

  @Test
  void malformedInteger_isRejected() {
    StorageSettings s = new StorageSettings(Map.of()).with(StorageSettings.SEARCH_TIMEOUT_MS, "soon");
    assertThrows(IllegalArgumentException.class, s::searchTimeoutMs);
  }
}

package io.intellixity.strata.persistence.file;

import io.intellixity.strata.persistence.codec.ExtendedJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One file per collection, named {@code <prefix><collection>.<ext>}.
 * <p>
 * The whole key to record mapping is re-serialized and the file replaced on every mutating call;
 * there is no append log. The file is a JSON array of records, using {@link ExtendedJson} for
 * non-JSON values, so keys of different types with the same string form stay distinct. Keys are
 * recovered from each record's primary attribute on load.
 */
public final class FileStorage extends AbstractMapStorage {
  private static final Logger log = LoggerFactory.getLogger(FileStorage.class);

  public static final String DEFAULT_PREFIX = "db_";
  public static final String DEFAULT_EXTENSION = "json";

  private final Path file;

  public FileStorage(Path directory, String collection, String primaryName) {
    this(directory, collection, primaryName, DEFAULT_PREFIX, DEFAULT_EXTENSION);
  }

  public FileStorage(Path directory, String collection, String primaryName, String prefix, String extension) {
    super(collection, primaryName);
    Objects.requireNonNull(directory, "directory");
    this.file = directory.resolve(fileName(collection, prefix, extension));
    load();
  }

  public static String fileName(String collection, String prefix, String extension) {
    return (prefix == null ? "" : prefix) + collection + "." + Objects.requireNonNull(extension, "extension");
  }

  public Path file() { return file; }

  @Override
  protected void afterWrite() {
    flush();
  }

  @Override
  public void flush() {
    byte[] bytes = ExtendedJson.encodeRecords(store().values());
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) Files.createDirectories(parent);
      Path tmp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
      Files.write(tmp, bytes);
      try {
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write " + file, e);
    }
  }

  private void load() {
    if (!Files.exists(file)) return;
    byte[] bytes;
    try {
      bytes = Files.readAllBytes(file);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + file, e);
    }
    if (bytes.length == 0) return;

    Map<Object, Map<String, Object>> records = new LinkedHashMap<>();
    for (Map<String, Object> r : ExtendedJson.decodeRecords(bytes)) {
      Object key = r.get(primaryName());
      if (key == null) throw new IllegalStateException(file + " has a record without '" + primaryName() + "': " + r);
      if (records.put(canonicalKey(key), r) != null) throw new IllegalStateException(file + " repeats key " + key);
    }
    restore(records);
    log.info("Loaded {} record(s) for '{}' from {}", records.size(), collection(), file);
  }

  @Override
  public String toString() {
    return "<FileStorage: " + file + " " + super.toString() + ">";
  }
}

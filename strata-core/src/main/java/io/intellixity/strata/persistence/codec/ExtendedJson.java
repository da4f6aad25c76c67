package io.intellixity.strata.persistence.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.*;
import java.util.*;

/**
 * JSON encoding with symmetric support for values JSON has no type for.
 * <p>
 * Such values are written as single-key wrapper objects and restored on read:
 * <pre>
 * Instant        {"$date": "2024-01-01T00:00:00Z"}
 * Date           {"$date": "..."}           (read back as Instant)
 * LocalDate      {"$localDate": "2024-01-01"}
 * LocalDateTime  {"$localDateTime": "2024-01-01T10:15:30"}
 * OffsetDateTime {"$offsetDateTime": "..."}
 * UUID           {"$uuid": "..."}
 * BigDecimal     {"$numberDecimal": "12.50"}
 * byte[]         {"$binary": "base64"}
 * </pre>
 * A map whose only key is one of these wrapper names cannot be told apart from a wrapper and is
 * rejected on write.
 */
public final class ExtendedJson {
  private static final ObjectMapper JSON = new ObjectMapper();
  private static final TypeReference<List<LinkedHashMap<String, Object>>> RECORDS = new TypeReference<>() {};

  static final String DATE = "$date";
  static final String LOCAL_DATE = "$localDate";
  static final String LOCAL_DATE_TIME = "$localDateTime";
  static final String OFFSET_DATE_TIME = "$offsetDateTime";
  static final String UUID_KEY = "$uuid";
  static final String DECIMAL = "$numberDecimal";
  static final String BINARY = "$binary";

  private ExtendedJson() {}

  public static String encode(Object value) {
    try {
      return JSON.writeValueAsString(toPlain(value));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Value is not JSON-encodable: " + value, e);
    }
  }

  public static Object decode(String json) {
    if (json == null) return null;
    try {
      return fromPlain(JSON.readValue(json, Object.class));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed extended JSON: " + json, e);
    }
  }

  /** Writes records as a JSON array, in iteration order. */
  public static byte[] encodeRecords(Collection<? extends Map<String, ?>> records) {
    try {
      return JSON.writerWithDefaultPrettyPrinter().writeValueAsBytes(toPlain(records));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Records are not JSON-encodable", e);
    }
  }

  @SuppressWarnings("unchecked")
  public static List<Map<String, Object>> decodeRecords(byte[] bytes) {
    try {
      List<Map<String, Object>> out = new ArrayList<>();
      for (Map<String, Object> raw : JSON.readValue(bytes, RECORDS)) {
        out.add((Map<String, Object>) fromPlain(raw));
      }
      return out;
    } catch (IOException e) {
      throw new IllegalArgumentException("Malformed extended JSON record file", e);
    }
  }

  /** Rewrites a value graph into JSON-native types plus wrapper objects. */
  public static Object toPlain(Object v) {
    if (v == null || v instanceof String || v instanceof Boolean) return v;
    if (v instanceof BigDecimal bd) return Map.of(DECIMAL, bd.toPlainString());
    if (v instanceof Number) return v;
    if (v instanceof Instant i) return Map.of(DATE, i.toString());
    if (v instanceof Date d) return Map.of(DATE, d.toInstant().toString());
    if (v instanceof LocalDate d) return Map.of(LOCAL_DATE, d.toString());
    if (v instanceof LocalDateTime d) return Map.of(LOCAL_DATE_TIME, d.toString());
    if (v instanceof OffsetDateTime d) return Map.of(OFFSET_DATE_TIME, d.toString());
    if (v instanceof ZonedDateTime d) return Map.of(OFFSET_DATE_TIME, d.toOffsetDateTime().toString());
    if (v instanceof UUID u) return Map.of(UUID_KEY, u.toString());
    if (v instanceof byte[] b) return Map.of(BINARY, Base64.getEncoder().encodeToString(b));
    if (v instanceof Enum<?> e) return e.name();
    if (v instanceof Map<?, ?> m) {
      if (m.size() == 1 && isWrapperKey(String.valueOf(m.keySet().iterator().next()))) {
        throw new IllegalArgumentException("Map with the single key '" + m.keySet().iterator().next()
            + "' is reserved for extended JSON values");
      }
      Map<String, Object> out = new LinkedHashMap<>();
      for (Map.Entry<?, ?> e : m.entrySet()) out.put(String.valueOf(e.getKey()), toPlain(e.getValue()));
      return out;
    }
    if (v instanceof Collection<?> c) {
      List<Object> out = new ArrayList<>(c.size());
      for (Object x : c) out.add(toPlain(x));
      return out;
    }
    throw new IllegalArgumentException("Unsupported value type for extended JSON: " + v.getClass().getName());
  }

  /** Inverse of {@link #toPlain(Object)}. */
  public static Object fromPlain(Object v) {
    if (v instanceof Map<?, ?> m) {
      if (m.size() == 1) {
        Map.Entry<?, ?> only = m.entrySet().iterator().next();
        if (only.getValue() instanceof String s) {
          Object restored = restore(String.valueOf(only.getKey()), s);
          if (restored != null) return restored;
        }
      }
      Map<String, Object> out = new LinkedHashMap<>();
      for (Map.Entry<?, ?> e : m.entrySet()) out.put(String.valueOf(e.getKey()), fromPlain(e.getValue()));
      return out;
    }
    if (v instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object x : l) out.add(fromPlain(x));
      return out;
    }
    return v;
  }

  static boolean isWrapperKey(String key) {
    switch (key) {
      case DATE:
      case LOCAL_DATE:
      case LOCAL_DATE_TIME:
      case OFFSET_DATE_TIME:
      case UUID_KEY:
      case DECIMAL:
      case BINARY:
        return true;
      default:
        return false;
    }
  }

  private static Object restore(String key, String s) {
    switch (key) {
      case DATE: return Instant.parse(s);
      case LOCAL_DATE: return LocalDate.parse(s);
      case LOCAL_DATE_TIME: return LocalDateTime.parse(s);
      case OFFSET_DATE_TIME: return OffsetDateTime.parse(s);
      case UUID_KEY: return UUID.fromString(s);
      case DECIMAL: return new BigDecimal(s);
      case BINARY: return Base64.getDecoder().decode(s);
      default: return null;
    }
  }
}

package io.intellixity.strata.persistence.search;

import java.math.BigDecimal;
import java.time.*;
import java.time.format.DateTimeFormatter;
import java.util.*;

/**
 * Converts records to the engine's document form and back.
 * <p>
 * Values JSON has no type for are sent as scalars the engine maps natively:
 * <pre>
 * Instant, Date, OffsetDateTime  "2024-01-01T00:00:00.000000000Z"  (UTC)
 * LocalDateTime                  "2024-01-01T10:15:30.000000000"
 * LocalDate                      "2024-01-01"
 * UUID                           its string form
 * BigDecimal                     JSON number
 * byte[]                         base64 string
 * </pre>
 * Date-times use a fixed-width fraction so their string order is their time order. The Java type
 * of each converted attribute path is kept in the document's {@value #TYPES_FIELD} object, keyed
 * by dotted path with collection elements sharing their collection's path, and restored on read.
 * A path may hold only one kind of value.
 */
public final class SearchValues {
  public static final String TYPES_FIELD = "strata_types";

  static final DateTimeFormatter INSTANT = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSSSS'Z'")
      .withZone(ZoneOffset.UTC);
  static final DateTimeFormatter LOCAL_DATE_TIME = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSSSS");

  private static final String PLAIN = "plain";
  private static final String T_INSTANT = "instant";
  private static final String T_OFFSET_DATE_TIME = "offset_date_time";
  private static final String T_LOCAL_DATE_TIME = "local_date_time";
  private static final String T_LOCAL_DATE = "local_date";
  private static final String T_UUID = "uuid";
  private static final String T_DECIMAL = "decimal";
  private static final String T_BINARY = "binary";

  private SearchValues() {}

  /** A filter argument in the form documents store it; collections and maps are converted deeply. */
  public static Object toWire(Object v) {
    if (v instanceof Map<?, ?> m) {
      Map<String, Object> out = new LinkedHashMap<>();
      for (Map.Entry<?, ?> e : m.entrySet()) out.put(String.valueOf(e.getKey()), toWire(e.getValue()));
      return out;
    }
    if (v instanceof Collection<?> c) {
      List<Object> out = new ArrayList<>(c.size());
      for (Object x : c) out.add(toWire(x));
      return out;
    }
    return scalar(v);
  }

  public static Map<String, Object> toDocument(Map<String, Object> record) {
    if (record.containsKey(TYPES_FIELD)) {
      throw new IllegalArgumentException("'" + TYPES_FIELD + "' is reserved in search documents");
    }
    Map<String, String> types = new TreeMap<>();
    Map<String, Object> out = new LinkedHashMap<>();
    for (Map.Entry<String, Object> e : record.entrySet()) {
      out.put(e.getKey(), encode(e.getKey(), e.getValue(), types));
    }
    types.values().removeIf(PLAIN::equals);
    if (!types.isEmpty()) out.put(TYPES_FIELD, new LinkedHashMap<>(types));
    return out;
  }

  @SuppressWarnings("unchecked")
  public static Map<String, Object> fromDocument(Map<String, Object> document) {
    Object rawTypes = document.get(TYPES_FIELD);
    Map<String, Object> types = (rawTypes instanceof Map<?, ?> m) ? (Map<String, Object>) m : Map.of();
    Map<String, Object> out = new LinkedHashMap<>();
    for (Map.Entry<String, Object> e : document.entrySet()) {
      if (TYPES_FIELD.equals(e.getKey())) continue;
      out.put(e.getKey(), decode(e.getKey(), e.getValue(), types));
    }
    return out;
  }

  private static Object encode(String path, Object v, Map<String, String> types) {
    if (v instanceof Map<?, ?> m) {
      Map<String, Object> out = new LinkedHashMap<>();
      for (Map.Entry<?, ?> e : m.entrySet()) {
        String key = String.valueOf(e.getKey());
        out.put(key, encode(path + "." + key, e.getValue(), types));
      }
      return out;
    }
    if (v instanceof Collection<?> c) {
      List<Object> out = new ArrayList<>(c.size());
      for (Object x : c) out.add(encode(path, x, types));
      return out;
    }
    if (v == null) return null;
    String type = typeOf(v);
    String seen = types.putIfAbsent(path, type);
    if (seen != null && !seen.equals(type)) {
      throw new IllegalArgumentException("Attribute '" + path + "' mixes " + seen + " and " + type + " values");
    }
    return scalar(v);
  }

  private static String typeOf(Object v) {
    if (v instanceof Instant || v instanceof Date) return T_INSTANT;
    if (v instanceof OffsetDateTime || v instanceof ZonedDateTime) return T_OFFSET_DATE_TIME;
    if (v instanceof LocalDateTime) return T_LOCAL_DATE_TIME;
    if (v instanceof LocalDate) return T_LOCAL_DATE;
    if (v instanceof UUID) return T_UUID;
    if (v instanceof BigDecimal) return T_DECIMAL;
    if (v instanceof byte[]) return T_BINARY;
    return PLAIN;
  }

  private static Object scalar(Object v) {
    if (v == null || v instanceof String || v instanceof Boolean || v instanceof Number) return v;
    if (v instanceof Instant i) return INSTANT.format(i);
    if (v instanceof Date d) return INSTANT.format(d.toInstant());
    if (v instanceof OffsetDateTime d) return INSTANT.format(d.toInstant());
    if (v instanceof ZonedDateTime d) return INSTANT.format(d.toInstant());
    if (v instanceof LocalDateTime d) return LOCAL_DATE_TIME.format(d);
    if (v instanceof LocalDate d) return d.toString();
    if (v instanceof UUID u) return u.toString();
    if (v instanceof byte[] b) return Base64.getEncoder().encodeToString(b);
    if (v instanceof Enum<?> e) return e.name();
    throw new IllegalArgumentException("Unsupported value type for search documents: " + v.getClass().getName());
  }

  private static Object decode(String path, Object v, Map<String, Object> types) {
    if (v instanceof Map<?, ?> m) {
      Map<String, Object> out = new LinkedHashMap<>();
      for (Map.Entry<?, ?> e : m.entrySet()) {
        String key = String.valueOf(e.getKey());
        out.put(key, decode(path + "." + key, e.getValue(), types));
      }
      return out;
    }
    if (v instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object x : l) out.add(decode(path, x, types));
      return out;
    }
    if (v == null) return null;
    Object type = types.get(path);
    if (type == null) return (v instanceof BigDecimal bd) ? (Object) bd.doubleValue() : v;
    String s = String.valueOf(v);
    switch (String.valueOf(type)) {
      case T_INSTANT: return Instant.from(INSTANT.parse(s));
      case T_OFFSET_DATE_TIME: return OffsetDateTime.ofInstant(Instant.from(INSTANT.parse(s)), ZoneOffset.UTC);
      case T_LOCAL_DATE_TIME: return LocalDateTime.parse(s, LOCAL_DATE_TIME);
      case T_LOCAL_DATE: return LocalDate.parse(s);
      case T_UUID: return UUID.fromString(s);
      case T_DECIMAL: return (v instanceof BigDecimal bd) ? bd : new BigDecimal(s);
      case T_BINARY: return Base64.getDecoder().decode(s);
      default: throw new IllegalStateException("Unknown type '" + type + "' recorded for '" + path + "'");
    }
  }
}

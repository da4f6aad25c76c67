package io.intellixity.strata.persistence.mongo;

import org.bson.types.Decimal128;

import java.util.*;

/** Converts values read from the driver back to the types records are written with. */
final class MongoValues {
  private MongoValues() {}

  static Map<String, Object> toRecord(Map<String, Object> document) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (Map.Entry<String, Object> e : document.entrySet()) out.put(e.getKey(), fromBson(e.getValue()));
    return out;
  }

  @SuppressWarnings("unchecked")
  static Object fromBson(Object v) {
    if (v instanceof Date d) return d.toInstant();
    if (v instanceof Decimal128 dec) return dec.bigDecimalValue();
    if (v instanceof Map<?, ?> m) return toRecord((Map<String, Object>) m);
    if (v instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object x : l) out.add(fromBson(x));
      return out;
    }
    return v;
  }
}

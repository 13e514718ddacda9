package com.gentoro.tasktree.indexing;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cleans point payloads before they reach the vector store: drops null values, blank strings and
 * non-finite numbers, except that relationship fields may be null.
 */
public final class PayloadSanitizer {
  public static final Set<String> NULLABLE_FIELDS = Set.of("parent_task_id", "root_task_id");

  private PayloadSanitizer() {}

  public static Map<String, Object> sanitize(Map<String, ?> payload) {
    Map<String, Object> clean = new LinkedHashMap<>();
    if (payload == null) return clean;
    payload.forEach(
        (key, value) -> {
          if (key == null) return;
          Object v = clean(value);
          if (v != null) {
            clean.put(key, v);
          } else if (value == null && NULLABLE_FIELDS.contains(key)) {
            clean.put(key, null);
          }
        });
    return clean;
  }

  private static Object clean(Object value) {
    if (value == null) return null;
    if (value instanceof String s) return s.isBlank() ? null : s;
    if (value instanceof Double d) return d.isNaN() || d.isInfinite() ? null : d;
    if (value instanceof Float f) return f.isNaN() || f.isInfinite() ? null : f;
    if (value instanceof Map<?, ?> m) {
      Map<String, Object> nested = new LinkedHashMap<>();
      m.forEach(
          (k, v) -> {
            Object c = clean(v);
            if (k != null && c != null) nested.put(k.toString(), c);
          });
      return nested.isEmpty() ? null : nested;
    }
    if (value instanceof List<?> list) {
      List<Object> items = new ArrayList<>(list.size());
      for (Object item : list) {
        Object c = clean(item);
        if (c != null) items.add(c);
      }
      return items;
    }
    return value;
  }
}

package com.gentoro.tasktree.indexing.driver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Conjunction of exact payload matches. An empty filter matches every point. */
public final class PointFilter {
  private static final PointFilter NONE = new PointFilter(Map.of());

  private final Map<String, String> must;

  private PointFilter(Map<String, String> must) {
    this.must = must;
  }

  public static PointFilter none() {
    return NONE;
  }

  public static PointFilter of(String key, String value) {
    return none().and(key, value);
  }

  /** Returns a filter that also requires {@code key == value}; null or blank values are ignored. */
  public PointFilter and(String key, String value) {
    if (value == null || value.isBlank()) return this;
    Map<String, String> next = new LinkedHashMap<>(must);
    next.put(key, value);
    return new PointFilter(Collections.unmodifiableMap(next));
  }

  public Map<String, String> must() {
    return must;
  }

  public boolean isEmpty() {
    return must.isEmpty();
  }

  public boolean matches(Map<String, Object> payload) {
    for (Map.Entry<String, String> e : must.entrySet()) {
      Object actual = payload == null ? null : payload.get(e.getKey());
      if (actual == null || !e.getValue().equals(actual.toString())) return false;
    }
    return true;
  }

  @Override
  public String toString() {
    return "PointFilter" + must;
  }
}

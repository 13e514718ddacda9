package com.gentoro.tasktree.cache;

import com.gentoro.tasktree.model.TaskSkeleton;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/** Immutable view of the cache content at one version. Skeletons are ordered by task id. */
public final class CacheSnapshot {
  static final CacheSnapshot EMPTY = new CacheSnapshot(new TreeMap<>(), 0);

  private final Map<String, TaskSkeleton> skeletons;
  private final long version;

  CacheSnapshot(TreeMap<String, TaskSkeleton> skeletons, long version) {
    this.skeletons = Collections.unmodifiableMap(skeletons);
    this.version = version;
  }

  public Optional<TaskSkeleton> get(String taskId) {
    return taskId == null ? Optional.empty() : Optional.ofNullable(skeletons.get(taskId));
  }

  public Collection<TaskSkeleton> all() {
    return skeletons.values();
  }

  public Map<String, TaskSkeleton> asMap() {
    return skeletons;
  }

  public int size() {
    return skeletons.size();
  }

  public boolean isEmpty() {
    return skeletons.isEmpty();
  }

  /** Incremented on every content change. */
  public long version() {
    return version;
  }
}

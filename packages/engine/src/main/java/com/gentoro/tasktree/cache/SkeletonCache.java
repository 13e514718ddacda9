package com.gentoro.tasktree.cache;

import com.gentoro.tasktree.exception.ExceptionUtil;
import com.gentoro.tasktree.model.OutlineEntry;
import com.gentoro.tasktree.model.TaskSkeleton;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds one {@link TaskSkeleton} per known task and keeps it in step with the {@link
 * RecordScanner}.
 *
 * <p>Readers always see a complete {@link CacheSnapshot}: rebuilds work on a copy and publish it
 * with a single volatile write. Rebuilds are serialized. Scanner failures keep the last good
 * content.
 */
public class SkeletonCache {
  private static final org.slf4j.Logger log =
      com.gentoro.tasktree.logging.LoggingService.getLogger(SkeletonCache.class);

  public static final Duration DEFAULT_STALENESS = Duration.ofMinutes(5);

  private final RecordScanner scanner;
  private final Clock clock;
  private final Duration staleness;
  private final ReentrantLock rebuildLock = new ReentrantLock();
  // guarded by rebuildLock
  private final Map<ScanScope, Instant> lastScans = new HashMap<>();
  private volatile CacheSnapshot snapshot = CacheSnapshot.EMPTY;

  public SkeletonCache(RecordScanner scanner, Clock clock, Duration staleness) {
    this.scanner = Objects.requireNonNull(scanner, "scanner");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.staleness = staleness == null ? DEFAULT_STALENESS : staleness;
  }

  public RefreshOutcome ensureFresh() {
    return ensureFresh(ScanScope.all());
  }

  /**
   * Brings the cache up to date for {@code scope}: a full scan when the scope has never been
   * scanned successfully, an incremental scan when the last one is older than the staleness
   * window, nothing otherwise.
   */
  public RefreshOutcome ensureFresh(ScanScope scope) {
    ScanScope effective = scope == null ? ScanScope.all() : scope;
    rebuildLock.lock();
    try {
      Instant now = clock.instant();
      Instant last = lastScanOf(effective);
      // an empty scope that was scanned successfully stays empty until it is stale
      if (last == null) {
        return rebuild(effective, null, now) ? RefreshOutcome.FULL_REBUILD : RefreshOutcome.FAILED;
      }
      if (Duration.between(last, now).compareTo(staleness) < 0) {
        return RefreshOutcome.UP_TO_DATE;
      }
      return rebuild(effective, last, now) ? RefreshOutcome.INCREMENTAL : RefreshOutcome.FAILED;
    } finally {
      rebuildLock.unlock();
    }
  }

  /** Forgets scan timestamps so the next {@link #ensureFresh} rescans. Content is kept. */
  public void invalidate() {
    rebuildLock.lock();
    try {
      lastScans.clear();
    } finally {
      rebuildLock.unlock();
    }
  }

  public Optional<TaskSkeleton> get(String taskId) {
    return snapshot.get(taskId);
  }

  public Collection<TaskSkeleton> all() {
    return snapshot.all();
  }

  public CacheSnapshot snapshot() {
    return snapshot;
  }

  public int size() {
    return snapshot.size();
  }

  private Instant lastScanOf(ScanScope scope) {
    Instant global = lastScans.get(ScanScope.all());
    if (scope.isAll()) return global;
    Instant own = lastScans.get(scope);
    if (own == null) return global;
    if (global == null) return own;
    return own.isAfter(global) ? own : global;
  }

  private boolean rebuild(ScanScope scope, Instant since, Instant now) {
    ScanResult result;
    try {
      result = scanner.scan(scope, since);
    } catch (Exception e) {
      log.warn(
          "Scan of {} failed, keeping {} cached skeletons: {} at {}",
          describe(scope),
          snapshot.size(),
          e.getMessage(),
          ExceptionUtil.formatCompactStackTrace(e));
      return false;
    }
    if (result == null) {
      log.warn("Scanner returned no result for {}; keeping cached content", describe(scope));
      return false;
    }

    CacheSnapshot current = snapshot;
    TreeMap<String, TaskSkeleton> next = new TreeMap<>(current.asMap());
    if (since == null) {
      // a full scan is authoritative for its scope
      next.values().removeIf(s -> scope.covers(s.workspace()));
    }
    int accepted = 0;
    for (TaskRecord record : result.records()) {
      TaskSkeleton skeleton = toSkeleton(record);
      if (skeleton == null) continue;
      next.put(skeleton.taskId(), skeleton);
      accepted++;
    }
    int removed = 0;
    for (String deleted : result.deletedTaskIds()) {
      if (next.remove(deleted) != null) removed++;
    }

    lastScans.put(scope, now);
    if (!next.equals(current.asMap())) {
      snapshot = new CacheSnapshot(next, current.version() + 1);
    }
    log.debug(
        "{} scan of {}: {} records accepted, {} removed, {} skeletons cached",
        since == null ? "Full" : "Incremental",
        describe(scope),
        accepted,
        removed,
        snapshot.size());
    return true;
  }

  /** Converts a record, or returns null when it cannot identify a task. */
  static TaskSkeleton toSkeleton(TaskRecord record) {
    if (record == null || record.taskId() == null || record.taskId().isBlank()) {
      log.warn("Skipping task record without identifier: {}", record);
      return null;
    }
    String taskId = record.taskId().trim();
    String parent = record.parentTaskId();
    if (parent != null && (parent.isBlank() || parent.trim().equals(taskId))) {
      if (!parent.isBlank()) {
        log.warn("Task {} declares itself as parent; ignoring the reference", taskId);
      }
      parent = null;
    }

    List<OutlineEntry> outline = record.outline() == null ? List.of() : record.outline();
    int messages = 0;
    int actions = 0;
    long size = 0;
    for (OutlineEntry entry : outline) {
      if (entry == null) continue;
      switch (entry.kind()) {
        case USER, ASSISTANT -> messages++;
        case TOOL_CALL -> actions++;
        case TOOL_RESULT -> {}
      }
      size += entry.size();
    }

    return TaskSkeleton.builder(taskId)
        .parentTaskId(parent == null ? null : parent.trim())
        .workspace(record.workspace())
        .instruction(record.instruction())
        .title(record.title())
        .createdAt(record.createdAt())
        .lastActivity(record.lastActivity())
        .hostOs(record.hostOs())
        .messageCount(messages)
        .actionCount(actions)
        .totalSize(record.totalSize() > 0 ? record.totalSize() : size)
        .contentOutline(outline.stream().filter(Objects::nonNull).toList())
        .build();
  }

  private static String describe(ScanScope scope) {
    return scope.isAll() ? "all workspaces" : "workspace '" + scope.workspace() + "'";
  }
}

package com.gentoro.tasktree.indexing;

import com.gentoro.tasktree.model.TaskSkeleton;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides whether a task needs (re)indexing, from the outcome of earlier attempts.
 *
 * <p>A task is indexed when forced, never indexed before, changed since its last successful
 * indexing, or indexed longer ago than the time to live. Failed tasks are retried with an
 * exponential delay and given up after {@code maxFailures} attempts or a client-side failure.
 */
public class IndexingDecisionService {
  private static final Duration RETRY_BASE = Duration.ofMinutes(1);
  private static final Duration RETRY_CAP = Duration.ofHours(1);

  public record Decision(boolean index, String reason) {}

  private record State(
      Instant lastIndexedAt,
      Instant indexedContentAt,
      Instant lastFailureAt,
      int failures,
      boolean permanentlyFailed) {}

  private final Map<String, State> states = new ConcurrentHashMap<>();
  private final Duration ttl;
  private final int maxFailures;
  private final Clock clock;

  public IndexingDecisionService(Duration ttl, int maxFailures, Clock clock) {
    this.ttl = ttl;
    this.maxFailures = Math.max(1, maxFailures);
    this.clock = clock;
  }

  public Decision shouldIndex(TaskSkeleton skeleton, boolean force) {
    if (force) return new Decision(true, "forced");
    State s = states.get(skeleton.taskId());
    if (s == null) return new Decision(true, "never indexed");
    if (s.permanentlyFailed()) {
      return new Decision(false, "permanently failed after " + s.failures() + " attempt(s)");
    }
    Instant now = clock.instant();
    if (s.failures() > 0) {
      Instant retryAt = s.lastFailureAt().plus(retryDelay(s.failures()));
      return now.isBefore(retryAt)
          ? new Decision(false, "retry scheduled after " + retryAt)
          : new Decision(true, "retry " + (s.failures() + 1));
    }
    if (s.lastIndexedAt() == null) return new Decision(true, "never indexed");
    if (skeleton.lastActivity().isAfter(s.indexedContentAt())) {
      return new Decision(true, "content changed since " + s.indexedContentAt());
    }
    if (now.isBefore(s.lastIndexedAt().plus(ttl))) {
      return new Decision(false, "indexed at " + s.lastIndexedAt() + " and unchanged");
    }
    return new Decision(true, "index older than " + ttl);
  }

  public void markSuccess(TaskSkeleton skeleton) {
    states.put(
        skeleton.taskId(), new State(clock.instant(), skeleton.lastActivity(), null, 0, false));
  }

  /** Records a failed attempt; {@code permanent} failures are never retried automatically. */
  public void markFailure(String taskId, boolean permanent) {
    Instant now = clock.instant();
    states.compute(
        taskId,
        (id, s) -> {
          int failures = (s == null ? 0 : s.failures()) + 1;
          return new State(
              s == null ? null : s.lastIndexedAt(),
              s == null ? null : s.indexedContentAt(),
              now,
              failures,
              permanent || failures >= maxFailures);
        });
  }

  public void reset() {
    states.clear();
  }

  static Duration retryDelay(int failures) {
    Duration d = RETRY_BASE.multipliedBy(1L << Math.min(20, failures - 1));
    return d.compareTo(RETRY_CAP) > 0 ? RETRY_CAP : d;
  }
}

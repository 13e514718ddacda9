package com.gentoro.tasktree.cache;

import java.time.Instant;

/**
 * Source of task records, typically backed by on-disk task storage. Implementations must be
 * idempotent and free of side effects.
 */
@FunctionalInterface
public interface RecordScanner {

  /**
   * Returns the records of {@code scope} changed or added after {@code since}.
   *
   * @param since lower bound of the change window, null for a full scan
   * @throws Exception any failure; the cache treats it as "no new information"
   */
  ScanResult scan(ScanScope scope, Instant since) throws Exception;
}

package com.gentoro.tasktree.health;

import com.gentoro.tasktree.indexing.driver.CollectionInfo;
import java.time.Instant;

/** One health sample of the task chunk collection. */
public record CollectionHealth(
    String collection,
    String status,
    long pointCount,
    long segmentCount,
    long indexedVectorCount,
    String optimizerStatus,
    Instant checkedAt) {

  static CollectionHealth of(String collection, CollectionInfo info, Instant checkedAt) {
    return new CollectionHealth(
        collection,
        info.status(),
        info.pointCount(),
        info.segmentCount(),
        info.indexedVectorCount(),
        info.optimizerStatus(),
        checkedAt);
  }

  /** Points the store has not indexed yet. */
  public long unindexedPoints() {
    return Math.max(0, pointCount - indexedVectorCount);
  }
}

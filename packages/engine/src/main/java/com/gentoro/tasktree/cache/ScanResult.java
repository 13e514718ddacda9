package com.gentoro.tasktree.cache;

import java.util.List;
import java.util.Set;

/**
 * Records changed or added since the requested instant, plus ids whose records were deleted.
 */
public record ScanResult(List<TaskRecord> records, Set<String> deletedTaskIds) {
  public ScanResult {
    records = records == null ? List.of() : List.copyOf(records);
    deletedTaskIds = deletedTaskIds == null ? Set.of() : Set.copyOf(deletedTaskIds);
  }

  public static ScanResult of(List<TaskRecord> records) {
    return new ScanResult(records, Set.of());
  }
}

package com.gentoro.tasktree.indexing;

import com.gentoro.tasktree.exception.ErrorDetails;
import java.util.List;

/**
 * Outcome of indexing one task. An empty {@code chunkIds} list always comes with a reason.
 *
 * @param error details of the failure behind the outcome, null when none
 */
public record IndexingResult(
    String taskId,
    List<String> chunkIds,
    IndexingStatus status,
    String reason,
    ErrorDetails error) {

  public IndexingResult {
    chunkIds = chunkIds == null ? List.of() : List.copyOf(chunkIds);
    if (chunkIds.isEmpty() && (reason == null || reason.isBlank())) {
      throw new IllegalArgumentException("An indexing result without chunks needs a reason");
    }
  }

  public static IndexingResult indexed(String taskId, List<String> chunkIds, String note) {
    return new IndexingResult(taskId, chunkIds, IndexingStatus.INDEXED, note, null);
  }

  public static IndexingResult empty(String taskId, IndexingStatus status, String reason) {
    return new IndexingResult(taskId, List.of(), status, reason, null);
  }

  public static IndexingResult failed(
      String taskId, IndexingStatus status, String reason, ErrorDetails error) {
    return new IndexingResult(taskId, List.of(), status, reason, error);
  }

  public boolean isSuccess() {
    return status == IndexingStatus.INDEXED;
  }
}

package com.gentoro.tasktree.model;

/**
 * Parent assignment of one task.
 *
 * @param parentTaskId chosen parent, null when the task is a declared root
 * @param matchedPrefixLength canonical characters shared with the declaring fragment, 0 when the
 *     method is not prefix based
 * @param fragmentOrdinal position of the matched fragment within the parent, -1 when unknown
 * @param candidateCount number of prefix candidates considered
 */
public record ResolutionRecord(
    String taskId,
    String parentTaskId,
    ResolutionMethod method,
    double confidence,
    int matchedPrefixLength,
    int fragmentOrdinal,
    int candidateCount) {

  public static ResolutionRecord explicit(String taskId, String parentTaskId) {
    return new ResolutionRecord(
        taskId,
        parentTaskId,
        ResolutionMethod.EXPLICIT,
        ResolutionMethod.EXPLICIT.confidence(),
        0,
        -1,
        0);
  }

  public static ResolutionRecord rootFallback(String taskId, int candidateCount) {
    return new ResolutionRecord(
        taskId,
        null,
        ResolutionMethod.ROOT_FALLBACK,
        ResolutionMethod.ROOT_FALLBACK.confidence(),
        0,
        -1,
        candidateCount);
  }

  public static ResolutionRecord prefix(
      String taskId,
      String parentTaskId,
      ResolutionMethod method,
      int matchedPrefixLength,
      int fragmentOrdinal,
      int candidateCount) {
    return new ResolutionRecord(
        taskId,
        parentTaskId,
        method,
        method.confidence(),
        matchedPrefixLength,
        fragmentOrdinal,
        candidateCount);
  }

  public boolean isRoot() {
    return parentTaskId == null;
  }
}

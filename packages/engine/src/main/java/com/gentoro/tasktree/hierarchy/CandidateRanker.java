package com.gentoro.tasktree.hierarchy;

import com.gentoro.tasktree.model.TaskSkeleton;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Chooses among several declaring tasks for one child. Pure and total: the same inputs always give
 * the same winner.
 *
 * <p>Candidates created after the child are discarded. The rest are ranked by, in order: same
 * workspace as the child, longer matched prefix, latest creation time (closest before the child),
 * task id.
 */
public final class CandidateRanker {
  private CandidateRanker() {}

  public static Optional<Candidate> choose(TaskSkeleton child, List<Candidate> candidates) {
    return candidates.stream()
        .filter(c -> !c.parent().taskId().equals(child.taskId()))
        .filter(c -> !c.parent().createdAt().isAfter(child.createdAt()))
        .min(order(child));
  }

  /** Best candidate first. */
  public static Comparator<Candidate> order(TaskSkeleton child) {
    return Comparator.<Candidate>comparingInt(c -> sameWorkspace(child, c.parent()) ? 0 : 1)
        .thenComparing(
            Comparator.comparingInt((Candidate c) -> c.match().matchedPrefixLength()).reversed())
        .thenComparing(Comparator.comparing((Candidate c) -> c.parent().createdAt()).reversed())
        .thenComparing(c -> c.parent().taskId());
  }

  private static boolean sameWorkspace(TaskSkeleton child, TaskSkeleton parent) {
    return child.workspace() != null && Objects.equals(child.workspace(), parent.workspace());
  }
}

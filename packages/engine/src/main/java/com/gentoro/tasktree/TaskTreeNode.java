package com.gentoro.tasktree;

import com.gentoro.tasktree.model.ResolutionMethod;
import java.time.Instant;
import java.util.List;

/**
 * A task and its resolved descendants.
 *
 * @param summary the task's instruction, abbreviated
 * @param method how the task's parent was resolved, {@link ResolutionMethod#ROOT_FALLBACK} for a
 *     root
 * @param truncated true when children exist below the requested depth and were left out
 */
public record TaskTreeNode(
    String taskId,
    String title,
    String summary,
    String workspace,
    Instant createdAt,
    ResolutionMethod method,
    double confidence,
    List<TaskTreeNode> children,
    boolean truncated) {

  public TaskTreeNode {
    children = children == null ? List.of() : List.copyOf(children);
  }

  /** Number of nodes in this subtree, this one included. */
  public int size() {
    int n = 1;
    for (TaskTreeNode child : children) n += child.size();
    return n;
  }
}

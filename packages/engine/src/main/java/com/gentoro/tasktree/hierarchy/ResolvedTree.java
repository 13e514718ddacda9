package com.gentoro.tasktree.hierarchy;

import com.gentoro.tasktree.model.ResolutionRecord;
import com.gentoro.tasktree.model.TaskSkeleton;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Parent assignments of one reconstruction pass, with the derived children lists.
 *
 * <p>Children of a task are ordered by the position of the declaring fragment within the parent,
 * then by creation time, then by task id. Instances are immutable.
 */
public final class ResolvedTree {
  private static final ResolvedTree EMPTY = new ResolvedTree(Map.of(), Map.of(), List.of());

  private final Map<String, ResolutionRecord> records;
  private final Map<String, List<String>> children;
  private final List<String> roots;

  private ResolvedTree(
      Map<String, ResolutionRecord> records,
      Map<String, List<String>> children,
      List<String> roots) {
    this.records = records;
    this.children = children;
    this.roots = roots;
  }

  public static ResolvedTree empty() {
    return EMPTY;
  }

  static ResolvedTree build(
      Map<String, ResolutionRecord> records, Map<String, TaskSkeleton> skeletons) {
    Comparator<ResolutionRecord> childOrder =
        Comparator.comparingInt(
                (ResolutionRecord r) ->
                    r.fragmentOrdinal() < 0 ? Integer.MAX_VALUE : r.fragmentOrdinal())
            .thenComparing(r -> createdAt(skeletons, r.taskId()))
            .thenComparing(ResolutionRecord::taskId);

    Map<String, List<ResolutionRecord>> grouped = new TreeMap<>();
    List<String> roots = new ArrayList<>();
    for (ResolutionRecord r : records.values()) {
      if (r.isRoot()) {
        roots.add(r.taskId());
      } else {
        grouped.computeIfAbsent(r.parentTaskId(), k -> new ArrayList<>()).add(r);
      }
    }

    Map<String, List<String>> children = new TreeMap<>();
    grouped.forEach(
        (parent, list) -> {
          list.sort(childOrder);
          children.put(parent, list.stream().map(ResolutionRecord::taskId).toList());
        });
    Collections.sort(roots);
    return new ResolvedTree(
        Collections.unmodifiableMap(new TreeMap<>(records)),
        Collections.unmodifiableMap(children),
        List.copyOf(roots));
  }

  private static Instant createdAt(Map<String, TaskSkeleton> skeletons, String taskId) {
    TaskSkeleton s = skeletons.get(taskId);
    return s == null ? Instant.EPOCH : s.createdAt();
  }

  public Optional<ResolutionRecord> resolution(String taskId) {
    return Optional.ofNullable(records.get(taskId));
  }

  public Optional<String> getParent(String taskId) {
    ResolutionRecord r = records.get(taskId);
    return r == null ? Optional.empty() : Optional.ofNullable(r.parentTaskId());
  }

  public List<String> getChildren(String taskId) {
    return children.getOrDefault(taskId, List.of());
  }

  /** Top of the chain containing {@code taskId}; the task itself when it is a root or unknown. */
  public String rootOf(String taskId) {
    Set<String> visited = new HashSet<>();
    String current = taskId;
    while (visited.add(current)) {
      ResolutionRecord r = records.get(current);
      if (r == null || r.isRoot()) return current;
      current = r.parentTaskId();
    }
    return current;
  }

  /** Tasks resolved as roots, ordered by id. */
  public List<String> roots() {
    return roots;
  }

  public Map<String, ResolutionRecord> records() {
    return records;
  }

  public boolean contains(String taskId) {
    return records.containsKey(taskId);
  }

  public int size() {
    return records.size();
  }
}

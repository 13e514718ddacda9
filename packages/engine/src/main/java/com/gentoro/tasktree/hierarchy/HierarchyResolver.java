package com.gentoro.tasktree.hierarchy;

import com.gentoro.tasktree.index.InstructionCanonicalizer;
import com.gentoro.tasktree.index.PrefixIndex;
import com.gentoro.tasktree.index.PrefixMatch;
import com.gentoro.tasktree.model.DelegationFragment;
import com.gentoro.tasktree.model.ResolutionMethod;
import com.gentoro.tasktree.model.ResolutionRecord;
import com.gentoro.tasktree.model.TaskSkeleton;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Reconstructs parent-child relationships over a snapshot of task skeletons.
 *
 * <p>Phase 1 indexes every delegation fragment of every task in a fresh {@link PrefixIndex}. Phase
 * 2 resolves each task independently: an explicit parent that references a known task wins;
 * otherwise the task's own instruction is looked up in the index. A single declaring task is
 * accepted as is; several are ranked by {@link CandidateRanker}. Tasks left without a parent are
 * reported as roots, never as errors.
 *
 * <p>In strict mode only explicit parents and unique prefix matches are accepted, trading recall
 * for precision. Reconstruction never mutates the skeletons and is deterministic for a given
 * snapshot.
 */
public class HierarchyResolver {
  private static final org.slf4j.Logger log =
      com.gentoro.tasktree.logging.LoggingService.getLogger(HierarchyResolver.class);

  private final boolean strictMode;
  private final int prefixLength;
  private final DelegationExtractor extractor;

  public HierarchyResolver(boolean strictMode) {
    this(strictMode, InstructionCanonicalizer.DEFAULT_PREFIX_LENGTH);
  }

  public HierarchyResolver(boolean strictMode, int prefixLength) {
    this.strictMode = strictMode;
    this.prefixLength = prefixLength;
    this.extractor = new DelegationExtractor(prefixLength);
  }

  public boolean isStrictMode() {
    return strictMode;
  }

  public ReconstructionResult reconstruct(Collection<TaskSkeleton> snapshot) {
    long start = System.nanoTime();
    Map<String, TaskSkeleton> byId = index(snapshot);
    PrefixIndex prefixIndex = new PrefixIndex(prefixLength);

    // phase 1
    List<TaskSkeleton> creationOrder = new ArrayList<>(byId.values());
    creationOrder.sort(
        Comparator.comparing(TaskSkeleton::createdAt).thenComparing(TaskSkeleton::taskId));
    int parentsWithFragments = 0;
    int fragmentsIndexed = 0;
    int errors = 0;
    for (TaskSkeleton skeleton : creationOrder) {
      try {
        List<DelegationFragment> fragments = extractor.extract(skeleton);
        int inserted = 0;
        for (DelegationFragment fragment : fragments) {
          if (prefixIndex.insert(skeleton.taskId(), fragment.text())) inserted++;
        }
        if (inserted > 0) parentsWithFragments++;
        fragmentsIndexed += inserted;
      } catch (RuntimeException e) {
        errors++;
        log.warn("Could not index delegations of task {}: {}", skeleton.taskId(), e.toString());
      }
    }
    log.debug(
        "Phase 1 indexed {} fragments declared by {} tasks",
        fragmentsIndexed,
        parentsWithFragments);

    // phase 2
    Map<String, ResolutionRecord> records = new TreeMap<>();
    for (TaskSkeleton skeleton : byId.values()) {
      ResolutionRecord record;
      try {
        record = resolve(skeleton, byId, prefixIndex);
      } catch (RuntimeException e) {
        errors++;
        log.warn("Could not resolve task {}: {}", skeleton.taskId(), e.toString());
        record = ResolutionRecord.rootFallback(skeleton.taskId(), 0);
      }
      records.put(skeleton.taskId(), record);
    }
    int cyclesBroken = breakCycles(records);

    ResolvedTree tree = ResolvedTree.build(records, byId);
    ReconstructionStats stats =
        summarize(
            records,
            parentsWithFragments,
            fragmentsIndexed,
            errors,
            cyclesBroken,
            (System.nanoTime() - start) / 1_000_000);
    log.info(
        "Reconstructed {} tasks: {} with parent, {} roots, methods {} ({} ms{})",
        stats.processed(),
        stats.resolved(),
        stats.unresolved(),
        stats.methodCounts(),
        stats.elapsedMillis(),
        strictMode ? ", strict" : "");
    return new ReconstructionResult(tree, stats, prefixIndex.getStats());
  }

  ResolutionRecord resolve(
      TaskSkeleton child, Map<String, TaskSkeleton> byId, PrefixIndex prefixIndex) {
    String declared = child.parentTaskId();
    if (declared != null && !declared.equals(child.taskId()) && byId.containsKey(declared)) {
      return ResolutionRecord.explicit(child.taskId(), declared);
    }
    if (declared != null) {
      log.debug("Task {} references unknown parent {}", child.taskId(), declared);
    }

    List<PrefixMatch> hits =
        prefixIndex.searchExactPrefix(child.instruction(), prefixLength, child.taskId());
    List<Candidate> candidates = new ArrayList<>(hits.size());
    for (PrefixMatch hit : hits) {
      TaskSkeleton parent = byId.get(hit.taskId());
      if (parent != null) candidates.add(new Candidate(parent, hit));
    }

    if (candidates.size() == 1) {
      PrefixMatch match = candidates.get(0).match();
      return ResolutionRecord.prefix(
          child.taskId(),
          match.taskId(),
          ResolutionMethod.EXACT_PREFIX_UNIQUE,
          match.matchedPrefixLength(),
          match.fragmentOrdinal(),
          1);
    }
    if (candidates.size() > 1 && !strictMode) {
      Optional<Candidate> winner = CandidateRanker.choose(child, candidates);
      if (winner.isPresent()) {
        PrefixMatch match = winner.get().match();
        return ResolutionRecord.prefix(
            child.taskId(),
            match.taskId(),
            ResolutionMethod.EXACT_PREFIX_DISAMBIGUATED,
            match.matchedPrefixLength(),
            match.fragmentOrdinal(),
            candidates.size());
      }
    }
    return ResolutionRecord.rootFallback(child.taskId(), candidates.size());
  }

  /** Demotes the weakest link of every parent cycle to a root. Returns the number demoted. */
  static int breakCycles(Map<String, ResolutionRecord> records) {
    int broken = 0;
    Set<String> acyclic = new HashSet<>();
    for (String start : new ArrayList<>(records.keySet())) {
      while (true) {
        List<String> path = new ArrayList<>();
        Set<String> onPath = new HashSet<>();
        List<String> cycle = null;
        String current = start;
        while (current != null && !acyclic.contains(current)) {
          if (!onPath.add(current)) {
            cycle = new ArrayList<>(path.subList(path.indexOf(current), path.size()));
            break;
          }
          path.add(current);
          ResolutionRecord r = records.get(current);
          current = r == null ? null : r.parentTaskId();
        }
        if (cycle == null) {
          acyclic.addAll(path);
          break;
        }
        String weakest =
            cycle.stream()
                .min(
                    Comparator.comparingDouble((String id) -> records.get(id).confidence())
                        .thenComparing(Comparator.<String>reverseOrder()))
                .orElseThrow();
        log.warn("Parent cycle {} broken at task {}", cycle, weakest);
        records.put(
            weakest, ResolutionRecord.rootFallback(weakest, records.get(weakest).candidateCount()));
        broken++;
      }
    }
    return broken;
  }

  private static Map<String, TaskSkeleton> index(Collection<TaskSkeleton> snapshot) {
    Map<String, TaskSkeleton> byId = new TreeMap<>();
    for (TaskSkeleton skeleton : snapshot) {
      if (skeleton == null) continue;
      if (byId.putIfAbsent(skeleton.taskId(), skeleton) != null) {
        log.warn("Duplicate task id {} in snapshot; keeping the first", skeleton.taskId());
      }
    }
    return byId;
  }

  private static ReconstructionStats summarize(
      Map<String, ResolutionRecord> records,
      int parentsWithFragments,
      int fragmentsIndexed,
      int errors,
      int cyclesBroken,
      long elapsedMillis) {
    Map<ResolutionMethod, Integer> counts = new EnumMap<>(ResolutionMethod.class);
    for (ResolutionMethod m : ResolutionMethod.values()) counts.put(m, 0);
    double confidence = 0;
    for (ResolutionRecord r : records.values()) {
      counts.merge(r.method(), 1, Integer::sum);
      confidence += r.confidence();
    }
    int roots = counts.get(ResolutionMethod.ROOT_FALLBACK);
    return new ReconstructionStats(
        parentsWithFragments,
        fragmentsIndexed,
        records.size(),
        records.size() - roots,
        roots,
        java.util.Collections.unmodifiableMap(new LinkedHashMap<>(counts)),
        records.isEmpty() ? 0 : confidence / records.size(),
        errors,
        cyclesBroken,
        elapsedMillis);
  }
}

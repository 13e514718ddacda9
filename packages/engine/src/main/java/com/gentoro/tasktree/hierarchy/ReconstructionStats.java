package com.gentoro.tasktree.hierarchy;

import com.gentoro.tasktree.model.ResolutionMethod;
import java.util.Map;

/**
 * Counters of one reconstruction pass.
 *
 * @param parentsWithFragments tasks that declared at least one child (phase 1)
 * @param fragmentsIndexed declarations inserted into the prefix index (phase 1)
 * @param processed tasks resolved in phase 2
 * @param resolved tasks that received a parent
 * @param unresolved tasks reported as roots
 * @param methodCounts number of tasks per resolution method
 * @param errors tasks whose data raised an error in either phase
 * @param cyclesBroken links demoted to root because they closed a cycle
 */
public record ReconstructionStats(
    int parentsWithFragments,
    int fragmentsIndexed,
    int processed,
    int resolved,
    int unresolved,
    Map<ResolutionMethod, Integer> methodCounts,
    double averageConfidence,
    int errors,
    int cyclesBroken,
    long elapsedMillis) {}

package com.gentoro.tasktree.hierarchy;

import com.gentoro.tasktree.index.IndexStats;

public record ReconstructionResult(
    ResolvedTree tree, ReconstructionStats stats, IndexStats indexStats) {}

package com.gentoro.tasktree.hierarchy;

import com.gentoro.tasktree.index.PrefixMatch;
import com.gentoro.tasktree.model.TaskSkeleton;

/** A possible parent of a task, with the prefix match that nominated it. */
public record Candidate(TaskSkeleton parent, PrefixMatch match) {}

package com.gentoro.tasktree.search;

import java.time.Instant;

/** A task chunk matching a query, enriched with metadata of its task. */
public record SearchHit(
    String taskId,
    String chunkId,
    double score,
    String snippet,
    String title,
    String workspace,
    Instant lastActivity,
    String chunkType) {}

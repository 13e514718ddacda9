package com.gentoro.tasktree.indexing.driver;

import java.util.Map;

/** A search hit: stored point id, similarity score (higher is closer) and payload. */
public record ScoredPoint(String id, double score, Map<String, Object> payload) {}

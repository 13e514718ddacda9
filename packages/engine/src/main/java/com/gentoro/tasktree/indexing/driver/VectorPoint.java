package com.gentoro.tasktree.indexing.driver;

import java.util.Map;

/** A vector with its identifier and payload, as written to the store. */
public record VectorPoint(String id, float[] vector, Map<String, Object> payload) {}

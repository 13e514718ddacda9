package com.gentoro.tasktree.search;

/**
 * Restrictions applied to a semantic search. Null fields do not restrict.
 *
 * @param limit maximum number of hits, {@link #DEFAULT_LIMIT} when not positive
 */
public record SearchFilters(String taskId, String workspace, int limit) {
  public static final int DEFAULT_LIMIT = 10;

  public SearchFilters {
    if (limit <= 0) limit = DEFAULT_LIMIT;
  }

  public static SearchFilters none() {
    return new SearchFilters(null, null, DEFAULT_LIMIT);
  }

  public SearchFilters withWorkspace(String workspace) {
    return new SearchFilters(taskId, workspace, limit);
  }

  public SearchFilters withTaskId(String taskId) {
    return new SearchFilters(taskId, workspace, limit);
  }

  public SearchFilters withLimit(int limit) {
    return new SearchFilters(taskId, workspace, limit);
  }
}

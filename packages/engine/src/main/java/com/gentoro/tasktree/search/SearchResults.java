package com.gentoro.tasktree.search;

import java.util.List;

/**
 * Hits of one query, best first.
 *
 * @param reason why the fallback mode was used, null for semantic results
 */
public record SearchResults(List<SearchHit> hits, SearchMode mode, String reason) {
  public SearchResults {
    hits = hits == null ? List.of() : List.copyOf(hits);
  }

  public boolean isEmpty() {
    return hits.isEmpty();
  }
}

package com.gentoro.tasktree.search;

import com.gentoro.tasktree.cache.SkeletonCache;
import com.gentoro.tasktree.exception.TaskTreeErrorCode;
import com.gentoro.tasktree.exception.TaskTreeException;
import com.gentoro.tasktree.exception.ValidationException;
import com.gentoro.tasktree.indexing.driver.EmbeddingService;
import com.gentoro.tasktree.indexing.driver.PointFilter;
import com.gentoro.tasktree.indexing.driver.ScoredPoint;
import com.gentoro.tasktree.indexing.driver.VectorStore;
import com.gentoro.tasktree.model.OutlineEntry;
import com.gentoro.tasktree.model.TaskSkeleton;
import com.gentoro.tasktree.utility.StringUtility;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Answers free-text queries over indexed task chunks.
 *
 * <p>The query is embedded and matched against the vector store. When either call fails the
 * service falls back to matching query tokens against the cached skeletons, so a query still
 * returns something while the store is down.
 */
public class SemanticSearchService {
  private static final org.slf4j.Logger log =
      com.gentoro.tasktree.logging.LoggingService.getLogger(SemanticSearchService.class);

  static final int SNIPPET_LENGTH = 200;

  private final EmbeddingService embeddings;
  private final VectorStore store;
  private final SkeletonCache skeletons;

  public SemanticSearchService(
      EmbeddingService embeddings, VectorStore store, SkeletonCache skeletons) {
    this.embeddings = embeddings;
    this.store = store;
    this.skeletons = skeletons;
  }

  public SearchResults search(String query, SearchFilters filters) {
    if (StringUtility.isBlank(query)) {
      throw new ValidationException("Search query must not be blank");
    }
    SearchFilters f = filters == null ? SearchFilters.none() : filters;
    try {
      return new SearchResults(semantic(query, f), SearchMode.SEMANTIC, null);
    } catch (TaskTreeException e) {
      log.warn("Semantic search unavailable, using substring search: {}", e.getMessage());
      return new SearchResults(substring(query, f), SearchMode.SUBSTRING, e.getMessage());
    }
  }

  private List<SearchHit> semantic(String query, SearchFilters f) {
    List<float[]> vectors = embeddings.embed(List.of(query));
    if (vectors.size() != 1) {
      throw new TaskTreeException(
          TaskTreeErrorCode.EMBEDDING_ERROR,
          "Expected one query vector, got " + vectors.size());
    }
    PointFilter filter = PointFilter.none();
    if (f.taskId() != null) filter = filter.and("task_id", f.taskId());
    if (f.workspace() != null) filter = filter.and("workspace", f.workspace());

    List<SearchHit> hits = new ArrayList<>();
    for (ScoredPoint p : store.search(vectors.get(0), filter, f.limit())) {
      Map<String, Object> payload = p.payload();
      String taskId = asString(payload.get("task_id"));
      Optional<TaskSkeleton> skeleton =
          taskId == null ? Optional.empty() : skeletons.get(taskId);
      hits.add(
          new SearchHit(
              taskId,
              p.id(),
              p.score(),
              StringUtility.abbreviate(asString(payload.get("content")), SNIPPET_LENGTH),
              skeleton.map(TaskSkeleton::title).orElse(asString(payload.get("task_title"))),
              skeleton.map(TaskSkeleton::workspace).orElse(asString(payload.get("workspace"))),
              skeleton.map(TaskSkeleton::lastActivity).orElse(null),
              asString(payload.get("chunk_type"))));
    }
    log.debug("Semantic search returned {} hits for filters {}", hits.size(), f);
    return hits;
  }

  /** Scores skeletons by the fraction of query tokens found in their text. */
  private List<SearchHit> substring(String query, SearchFilters f) {
    List<String> tokens =
        Arrays.stream(query.toLowerCase(Locale.ROOT).split("\\s+"))
            .filter(t -> !t.isEmpty())
            .toList();
    List<SearchHit> hits = new ArrayList<>();
    for (TaskSkeleton s : skeletons.all()) {
      if (f.taskId() != null && !f.taskId().equals(s.taskId())) continue;
      if (f.workspace() != null && !f.workspace().equals(s.workspace())) continue;
      String text = searchableText(s);
      String lower = text.toLowerCase(Locale.ROOT);
      long found = tokens.stream().filter(lower::contains).count();
      if (found == 0) continue;
      int at = lower.indexOf(tokens.get(0));
      String snippet =
          StringUtility.abbreviate(
              StringUtility.squash(text.substring(Math.max(0, at))), SNIPPET_LENGTH);
      hits.add(
          new SearchHit(
              s.taskId(),
              null,
              (double) found / tokens.size(),
              snippet,
              s.title(),
              s.workspace(),
              s.lastActivity(),
              null));
    }
    hits.sort(
        Comparator.comparingDouble(SearchHit::score)
            .reversed()
            .thenComparing(SearchHit::taskId));
    return hits.size() > f.limit() ? hits.subList(0, f.limit()) : hits;
  }

  private static String searchableText(TaskSkeleton s) {
    StringBuilder sb = new StringBuilder();
    if (s.title() != null) sb.append(s.title()).append('\n');
    if (s.instruction() != null) sb.append(s.instruction()).append('\n');
    for (OutlineEntry e : s.contentOutline()) {
      if (e.kind().isMessage() && e.text() != null) sb.append(e.text()).append('\n');
    }
    return sb.toString();
  }

  private static String asString(Object value) {
    return value == null ? null : value.toString();
  }
}

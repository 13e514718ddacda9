package com.gentoro.tasktree.indexing;

import com.gentoro.tasktree.cache.ScanScope;
import com.gentoro.tasktree.cache.SkeletonCache;
import com.gentoro.tasktree.exception.EmbeddingException;
import com.gentoro.tasktree.exception.ExceptionUtil;
import com.gentoro.tasktree.exception.FailureKind;
import com.gentoro.tasktree.exception.VectorStoreException;
import com.gentoro.tasktree.indexing.driver.EmbeddingService;
import com.gentoro.tasktree.indexing.driver.PointFilter;
import com.gentoro.tasktree.indexing.driver.VectorPoint;
import com.gentoro.tasktree.indexing.driver.VectorStore;
import com.gentoro.tasktree.model.TaskSkeleton;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Extracts, embeds and upserts the chunks of a task.
 *
 * <p>Embedding and upsert calls are retried on transient failures. Every upsert attempt goes
 * through the shared {@link UpsertRateLimiter}, and the whole write path is guarded by a {@link
 * CircuitBreaker}. A vector that fails validation drops only its own chunk. A result without
 * chunk ids always says why.
 */
public class IndexingPipeline implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.tasktree.logging.LoggingService.getLogger(IndexingPipeline.class);

  private final SkeletonCache skeletons;
  private final ChunkExtractor extractor;
  private final EmbeddingService embeddings;
  private final VectorStore store;
  private final EmbeddingCache embeddingCache;
  private final VectorValidator validator;
  private final UpsertRateLimiter rateLimiter;
  private final RetryExecutor retry;
  private final CircuitBreaker circuitBreaker;
  private final IndexingDecisionService decisions;
  private final AtomicBoolean collectionReady = new AtomicBoolean(false);

  public IndexingPipeline(
      SkeletonCache skeletons,
      ChunkExtractor extractor,
      EmbeddingService embeddings,
      VectorStore store,
      EmbeddingCache embeddingCache,
      UpsertRateLimiter rateLimiter,
      RetryExecutor retry,
      CircuitBreaker circuitBreaker,
      IndexingDecisionService decisions) {
    this.skeletons = skeletons;
    this.extractor = extractor;
    this.embeddings = embeddings;
    this.store = store;
    this.embeddingCache = embeddingCache;
    this.validator = new VectorValidator(store.dimension());
    this.rateLimiter = rateLimiter;
    this.retry = retry;
    this.circuitBreaker = circuitBreaker;
    this.decisions = decisions;
  }

  /** Indexes every chunk of {@code taskId}, whatever was indexed before. */
  public IndexingResult indexTask(String taskId) {
    Optional<TaskSkeleton> skeleton = skeletons.get(taskId);
    if (skeleton.isEmpty()) {
      return report(
          IndexingResult.empty(
              taskId, IndexingStatus.TASK_NOT_FOUND, "task is not in the skeleton cache"));
    }

    List<Chunk> chunks = extractor.extract(taskId);
    if (chunks.isEmpty()) {
      return report(
          IndexingResult.empty(
              taskId,
              IndexingStatus.NO_CHUNKS,
              "no chunks extracted: the content outline is empty or unreadable"));
    }
    List<Chunk> indexable = chunks.stream().filter(Chunk::indexable).toList();
    if (indexable.isEmpty()) {
      return report(
          IndexingResult.empty(
              taskId,
              IndexingStatus.NO_INDEXABLE_CHUNKS,
              "%d chunks extracted but none indexable (tool interactions only)"
                  .formatted(chunks.size())));
    }

    if (!circuitBreaker.allowRequest()) {
      Instant retryAt = circuitBreaker.retryAt();
      return report(
          IndexingResult.empty(
              taskId,
              IndexingStatus.CIRCUIT_OPEN,
              retryAt == null
                  ? "vector store circuit half-open, a trial request is in flight"
                  : "vector store circuit open until " + retryAt));
    }
    try {
      return embedAndUpsert(skeleton.get(), chunks, indexable);
    } finally {
      // no-op unless this call held a half-open trial that ended without an outcome
      circuitBreaker.release();
    }
  }

  private IndexingResult embedAndUpsert(
      TaskSkeleton skeleton, List<Chunk> chunks, List<Chunk> indexable) {
    String taskId = skeleton.taskId();
    List<float[]> vectors;
    try {
      vectors = embed(taskId, indexable);
    } catch (RuntimeException e) {
      decisions.markFailure(taskId, !ExceptionUtil.failureKindOf(e).isRetryable());
      return report(
          IndexingResult.failed(
              taskId,
              IndexingStatus.EMBEDDING_FAILED,
              "embedding failed: " + e.getMessage(),
              ExceptionUtil.toErrorDetails(e)));
    }

    List<VectorPoint> points = new ArrayList<>();
    List<String> ids = new ArrayList<>();
    String firstProblem = null;
    for (int i = 0; i < indexable.size(); i++) {
      Chunk chunk = indexable.get(i);
      Optional<String> problem = validator.validate(vectors.get(i));
      if (problem.isPresent()) {
        log.warn("Dropping chunk {} of task {}: {}", chunk.chunkId(), taskId, problem.get());
        if (firstProblem == null) firstProblem = problem.get();
        continue;
      }
      points.add(
          new VectorPoint(
              chunk.chunkId(), vectors.get(i), PayloadSanitizer.sanitize(chunk.payload())));
      ids.add(chunk.chunkId());
    }
    if (points.isEmpty()) {
      decisions.markFailure(taskId, true);
      return report(
          IndexingResult.empty(
              taskId,
              IndexingStatus.NO_VALID_VECTORS,
              "all %d vectors failed validation, first: %s"
                  .formatted(indexable.size(), firstProblem)));
    }

    try {
      retry.execute(
          "Upsert of " + points.size() + " points for task " + taskId,
          () ->
              rateLimiter.execute(
                  () -> {
                    ensureCollection();
                    store.upsert(points);
                    return null;
                  }));
    } catch (RuntimeException e) {
      FailureKind kind = ExceptionUtil.failureKindOf(e);
      if (kind.isRetryable()) circuitBreaker.recordFailure();
      decisions.markFailure(taskId, !kind.isRetryable());
      return report(
          IndexingResult.failed(
              taskId,
              IndexingStatus.UPSERT_FAILED,
              "upsert failed (%s): %s".formatted(kind, e.getMessage()),
              ExceptionUtil.toErrorDetails(e)));
    }

    circuitBreaker.recordSuccess();
    decisions.markSuccess(skeleton);
    String note =
        points.size() == indexable.size()
            ? null
            : "%d of %d chunks dropped by vector validation"
                .formatted(indexable.size() - points.size(), indexable.size());
    log.info(
        "Indexed {} of {} chunks for task {}{}",
        ids.size(),
        chunks.size(),
        taskId,
        note == null ? "" : " (" + note + ")");
    return IndexingResult.indexed(taskId, ids, note);
  }

  /**
   * Indexes the cached tasks of {@code scope} that need it according to the {@link
   * IndexingDecisionService}. Skipped tasks are reported with status {@link
   * IndexingStatus#SKIPPED}.
   */
  public List<IndexingResult> indexPending(ScanScope scope, boolean force) {
    List<IndexingResult> results = new ArrayList<>();
    for (TaskSkeleton skeleton : skeletons.all()) {
      if (!scope.covers(skeleton.workspace())) continue;
      IndexingDecisionService.Decision decision = decisions.shouldIndex(skeleton, force);
      if (!decision.index()) {
        results.add(
            IndexingResult.empty(skeleton.taskId(), IndexingStatus.SKIPPED, decision.reason()));
        continue;
      }
      log.debug("Indexing task {}: {}", skeleton.taskId(), decision.reason());
      results.add(indexTask(skeleton.taskId()));
    }
    return results;
  }

  /** Drops and recreates the collection, forgetting what was indexed. */
  public void resetCollection() {
    String name = store.collectionName();
    log.warn("Resetting vector collection {}", name);
    try {
      if (store.getCollections().contains(name)) {
        store.deleteCollection(name);
      }
    } catch (VectorStoreException e) {
      if (e.getKind() != FailureKind.CLIENT) throw e;
      log.info("Collection {} could not be deleted ({}), recreating", name, e.getMessage());
    }
    collectionReady.set(false);
    ensureCollection();
    decisions.reset();
  }

  /** Number of stored points whose payload names host OS {@code hostOs}. */
  public long countPointsByHostOs(String hostOs) {
    return store.countPoints(PointFilter.of("host_os", hostOs));
  }

  public CircuitBreaker.State circuitState() {
    return circuitBreaker.state();
  }

  private void ensureCollection() {
    if (collectionReady.get()) return;
    synchronized (collectionReady) {
      if (!collectionReady.get()) {
        store.ensureCollection();
        collectionReady.set(true);
      }
    }
  }

  private List<float[]> embed(String taskId, List<Chunk> chunks) {
    float[][] vectors = new float[chunks.size()][];
    List<Integer> missing = new ArrayList<>();
    for (int i = 0; i < chunks.size(); i++) {
      Optional<float[]> cached = embeddingCache.get(chunks.get(i).content());
      if (cached.isPresent()) {
        vectors[i] = cached.get();
      } else {
        missing.add(i);
      }
    }
    if (!missing.isEmpty()) {
      List<String> texts = missing.stream().map(i -> chunks.get(i).content()).toList();
      List<float[]> fresh =
          retry.execute("Embedding for task " + taskId, () -> embeddings.embed(texts));
      if (fresh == null || fresh.size() != texts.size()) {
        throw new EmbeddingException(
            FailureKind.CLIENT,
            "embedding service returned %d vectors for %d texts"
                .formatted(fresh == null ? 0 : fresh.size(), texts.size()));
      }
      for (int j = 0; j < missing.size(); j++) {
        float[] v = fresh.get(j);
        vectors[missing.get(j)] = v;
        if (validator.validate(v).isEmpty()) embeddingCache.put(texts.get(j), v);
      }
    }
    log.debug(
        "Embedded {} chunks of task {} ({} from cache)",
        chunks.size(),
        taskId,
        chunks.size() - missing.size());
    return java.util.Arrays.asList(vectors);
  }

  private static IndexingResult report(IndexingResult result) {
    log.warn("Task {} not indexed [{}]: {}", result.taskId(), result.status(), result.reason());
    return result;
  }

  @Override
  public void close() {
    rateLimiter.close();
  }
}

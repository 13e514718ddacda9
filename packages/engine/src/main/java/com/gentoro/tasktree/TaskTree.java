package com.gentoro.tasktree;

import com.gentoro.tasktree.cache.CacheSnapshot;
import com.gentoro.tasktree.cache.RecordScanner;
import com.gentoro.tasktree.cache.ScanScope;
import com.gentoro.tasktree.cache.SkeletonCache;
import com.gentoro.tasktree.exception.ConfigException;
import com.gentoro.tasktree.exception.NotFoundException;
import com.gentoro.tasktree.exception.ValidationException;
import com.gentoro.tasktree.health.VectorStoreHealthMonitor;
import com.gentoro.tasktree.hierarchy.HierarchyResolver;
import com.gentoro.tasktree.hierarchy.ReconstructionResult;
import com.gentoro.tasktree.hierarchy.ResolvedTree;
import com.gentoro.tasktree.index.InstructionCanonicalizer;
import com.gentoro.tasktree.indexing.ChunkExtractor;
import com.gentoro.tasktree.indexing.CircuitBreaker;
import com.gentoro.tasktree.indexing.EmbeddingCache;
import com.gentoro.tasktree.indexing.IndexingDecisionService;
import com.gentoro.tasktree.indexing.IndexingPipeline;
import com.gentoro.tasktree.indexing.IndexingResult;
import com.gentoro.tasktree.indexing.RetryExecutor;
import com.gentoro.tasktree.indexing.Sleeper;
import com.gentoro.tasktree.indexing.UpsertRateLimiter;
import com.gentoro.tasktree.indexing.driver.DriverFactory;
import com.gentoro.tasktree.indexing.driver.EmbeddingService;
import com.gentoro.tasktree.indexing.driver.VectorStore;
import com.gentoro.tasktree.model.ResolutionMethod;
import com.gentoro.tasktree.model.ResolutionRecord;
import com.gentoro.tasktree.model.TaskSkeleton;
import com.gentoro.tasktree.search.SearchFilters;
import com.gentoro.tasktree.search.SearchResults;
import com.gentoro.tasktree.search.SemanticSearchService;
import com.gentoro.tasktree.utility.StringUtility;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/**
 * Entry point of the engine: wires the skeleton cache, hierarchy reconstruction, chunk indexing,
 * semantic search and vector store health from one configuration.
 *
 * <p>The resolved tree is rebuilt lazily, whenever a tree query finds that the cache content
 * changed since the last reconstruction.
 */
public class TaskTree implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.tasktree.logging.LoggingService.getLogger(TaskTree.class);

  static final int SUMMARY_LENGTH = 120;
  static final int EMBEDDING_CACHE_ENTRIES = 10_000;

  private final Configuration configuration;
  private final SkeletonCache skeletonCache;
  private final HierarchyResolver resolver;
  private final EmbeddingService embeddings;
  private final VectorStore vectorStore;
  private final IndexingPipeline pipeline;
  private final SemanticSearchService searchService;
  private final VectorStoreHealthMonitor healthMonitor;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private final Object treeLock = new Object();
  // guarded by treeLock
  private ReconstructionResult lastReconstruction;
  private long reconstructedVersion = -1;

  public TaskTree(StartupParameters parameters, RecordScanner scanner) {
    this(configure(parameters), scanner, Clock.systemUTC());
  }

  public TaskTree(Configuration configuration, RecordScanner scanner, Clock clock) {
    this.configuration = configuration;
    com.gentoro.tasktree.logging.LoggingService.applyConfiguration(configuration);

    int prefixLength =
        configuration.getInt("prefix.length", InstructionCanonicalizer.DEFAULT_PREFIX_LENGTH);
    if (prefixLength < 32) {
      throw new ConfigException("prefix.length must be at least 32, was " + prefixLength);
    }
    this.skeletonCache =
        new SkeletonCache(
            scanner,
            clock,
            Duration.ofMinutes(configuration.getLong("cache.stalenessMinutes", 5)));
    boolean strictMode = configuration.getBoolean("hierarchy.strictMode", false);
    this.resolver = new HierarchyResolver(strictMode, prefixLength);

    this.embeddings = DriverFactory.createEmbeddingService(configuration);
    this.vectorStore = DriverFactory.createVectorStore(configuration);
    this.pipeline =
        new IndexingPipeline(
            skeletonCache,
            new ChunkExtractor(
                skeletonCache,
                this::currentTree,
                configuration.getInt(
                    "chunking.maxChunkChars", ChunkExtractor.DEFAULT_MAX_CHUNK_CHARS)),
            embeddings,
            vectorStore,
            new EmbeddingCache(
                Duration.ofHours(configuration.getLong("embedding.cacheTtlHours", 168)),
                EMBEDDING_CACHE_ENTRIES,
                clock),
            new UpsertRateLimiter(
                configuration.getLong(
                    "vectorstore.rateLimit.minIntervalMs",
                    UpsertRateLimiter.DEFAULT_MIN_INTERVAL_MS)),
            new RetryExecutor(
                configuration.getInt("vectorstore.retry.maxRetries", 3),
                Duration.ofMillis(configuration.getLong("vectorstore.retry.baseDelayMs", 2000)),
                Sleeper.SYSTEM),
            new CircuitBreaker(
                configuration.getInt("vectorstore.circuitBreaker.failureThreshold", 3),
                Duration.ofMillis(
                    configuration.getLong("vectorstore.circuitBreaker.openMillis", 30_000)),
                clock),
            new IndexingDecisionService(
                Duration.ofHours(configuration.getLong("indexing.ttlHours", 24)),
                configuration.getInt("indexing.maxFailures", 3),
                clock));
    this.searchService = new SemanticSearchService(embeddings, vectorStore, skeletonCache);
    this.healthMonitor = new VectorStoreHealthMonitor(vectorStore, clock);
    log.info(
        "Task tree engine ready: prefix length {}, strict mode {}, collection {} ({} dims)",
        prefixLength,
        resolver.isStrictMode(),
        vectorStore.collectionName(),
        vectorStore.dimension());
  }

  public Configuration configuration() {
    return configuration;
  }

  public SkeletonCache skeletonCache() {
    return skeletonCache;
  }

  /** Refreshes the cache when stale and returns the tree resolved from its content. */
  public ResolvedTree tree() {
    skeletonCache.ensureFresh();
    return currentTree();
  }

  /** The last reconstruction pass, if any ran. */
  public Optional<ReconstructionResult> lastReconstruction() {
    synchronized (treeLock) {
      return Optional.ofNullable(lastReconstruction);
    }
  }

  private ResolvedTree currentTree() {
    synchronized (treeLock) {
      // read under the lock so an older snapshot never replaces a newer reconstruction
      CacheSnapshot snapshot = skeletonCache.snapshot();
      if (lastReconstruction == null || reconstructedVersion != snapshot.version()) {
        lastReconstruction = resolver.reconstruct(snapshot.all());
        reconstructedVersion = snapshot.version();
      }
      return lastReconstruction.tree();
    }
  }

  public Optional<String> getParent(String taskId) {
    ResolvedTree tree = tree();
    return tree.getParent(resolveTaskId(taskId));
  }

  public List<String> getChildren(String taskId) {
    ResolvedTree tree = tree();
    return tree.getChildren(resolveTaskId(taskId));
  }

  /**
   * Resolves a full task id or a unique prefix of one.
   *
   * @throws ValidationException when the prefix matches several tasks
   * @throws NotFoundException when nothing matches
   */
  public String resolveTaskId(String idOrPrefix) {
    if (StringUtility.isBlank(idOrPrefix)) {
      throw new ValidationException("Task id must not be blank");
    }
    String wanted = idOrPrefix.trim();
    CacheSnapshot snapshot = skeletonCache.snapshot();
    if (snapshot.get(wanted).isPresent()) return wanted;

    List<String> matches =
        snapshot.all().stream()
            .map(TaskSkeleton::taskId)
            .filter(id -> id.startsWith(wanted))
            .toList();
    if (matches.size() == 1) return matches.get(0);
    if (matches.isEmpty()) throw new NotFoundException("No task matches id '" + wanted + "'");
    throw new ValidationException(
        "Task id prefix '%s' is ambiguous: %d tasks match, e.g. %s"
            .formatted(wanted, matches.size(), matches.subList(0, Math.min(3, matches.size()))));
  }

  /**
   * The subtree rooted at {@code taskId}, down to {@code maxDepth} levels below it.
   *
   * @param maxDepth 0 returns the task alone
   */
  public TaskTreeNode getTree(String taskId, int maxDepth) {
    if (maxDepth < 0) {
      throw new ValidationException("maxDepth must not be negative, was " + maxDepth);
    }
    ResolvedTree tree = tree();
    return node(tree, resolveTaskId(taskId), maxDepth, new HashSet<>());
  }

  private TaskTreeNode node(ResolvedTree tree, String taskId, int depth, Set<String> path) {
    path.add(taskId);
    Optional<TaskSkeleton> skeleton = skeletonCache.get(taskId);
    ResolutionRecord record =
        tree.resolution(taskId).orElse(ResolutionRecord.rootFallback(taskId, 0));
    List<String> childIds = tree.getChildren(taskId);

    List<TaskTreeNode> children = new ArrayList<>();
    boolean truncated = false;
    if (depth == 0) {
      truncated = !childIds.isEmpty();
    } else {
      for (String child : childIds) {
        if (path.contains(child)) {
          log.warn("Skipping cyclic link {} -> {}", taskId, child);
          continue;
        }
        children.add(node(tree, child, depth - 1, path));
      }
    }
    path.remove(taskId);

    return new TaskTreeNode(
        taskId,
        skeleton.map(TaskSkeleton::title).orElse(null),
        StringUtility.abbreviate(
            StringUtility.squash(skeleton.map(TaskSkeleton::instruction).orElse("")),
            SUMMARY_LENGTH),
        skeleton.map(TaskSkeleton::workspace).orElse(null),
        skeleton.map(TaskSkeleton::createdAt).orElse(null),
        record.isRoot() ? ResolutionMethod.ROOT_FALLBACK : record.method(),
        record.confidence(),
        children,
        truncated);
  }

  public SearchResults search(String query, SearchFilters filters) {
    skeletonCache.ensureFresh();
    return searchService.search(query, filters);
  }

  /** Indexes one task, given by full id or unique prefix. */
  public IndexingResult indexTask(String taskId) {
    skeletonCache.ensureFresh();
    return pipeline.indexTask(resolveTaskId(taskId));
  }

  public List<IndexingResult> indexPending(ScanScope scope, boolean force) {
    ScanScope effective = scope == null ? ScanScope.all() : scope;
    skeletonCache.ensureFresh(effective);
    List<IndexingResult> results = pipeline.indexPending(effective, force);
    long indexed = results.stream().filter(IndexingResult::isSuccess).count();
    log.info("Indexing pass over {}: {} of {} tasks indexed", effective, indexed, results.size());
    return results;
  }

  public void resetCollection() {
    pipeline.resetCollection();
  }

  public VectorStoreHealthMonitor healthMonitor() {
    return healthMonitor;
  }

  /** Starts periodic health polling at {@code health.intervalMs}; no-op when not positive. */
  public void startHealthMonitoring() {
    long interval = configuration.getLong("health.intervalMs", 60_000);
    if (interval <= 0) {
      log.info("Health monitoring disabled (health.intervalMs={})", interval);
      return;
    }
    healthMonitor.start(interval);
  }

  /** Releases background threads and driver resources. Safe to call multiple times. */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) return;
    closeQuietly(healthMonitor);
    closeQuietly(pipeline);
    closeQuietly(vectorStore);
    closeQuietly(embeddings);
    log.info("Task tree engine closed");
  }

  private void closeQuietly(AutoCloseable closeable) {
    try {
      closeable.close();
    } catch (Exception e) {
      log.warn("Failed to close {}: {}", closeable.getClass().getSimpleName(), e.getMessage());
    }
  }

  private static Configuration configure(StartupParameters parameters) {
    Configuration config = new ConfigurationProvider(parameters.configFile()).config();
    parameters.applyOverrides(config);
    return config;
  }
}

package com.gentoro.tasktree.health;

import com.gentoro.tasktree.exception.ExceptionUtil;
import com.gentoro.tasktree.indexing.driver.PointFilter;
import com.gentoro.tasktree.indexing.driver.VectorStore;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Samples the health of the vector collection, on demand or periodically.
 *
 * <p>Periodic polling runs on a single daemon thread and never stops on a failed sample: the error
 * is logged and counted and the next tick tries again.
 */
public class VectorStoreHealthMonitor implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.tasktree.logging.LoggingService.getLogger(VectorStoreHealthMonitor.class);

  private final VectorStore store;
  private final Clock clock;
  private final AtomicReference<CollectionHealth> lastHealth = new AtomicReference<>();
  private final AtomicInteger consecutiveFailures = new AtomicInteger();
  private ScheduledExecutorService scheduler;

  public VectorStoreHealthMonitor(VectorStore store) {
    this(store, Clock.systemUTC());
  }

  public VectorStoreHealthMonitor(VectorStore store, Clock clock) {
    this.store = store;
    this.clock = clock;
  }

  /**
   * Reads the collection metrics.
   *
   * @throws com.gentoro.tasktree.exception.VectorStoreException when the store cannot be reached
   *     or the collection is missing
   */
  public CollectionHealth checkCollectionHealth() {
    String name = store.collectionName();
    CollectionHealth health = CollectionHealth.of(name, store.getCollection(name), clock.instant());
    lastHealth.set(health);
    return health;
  }

  /** Whether the collection exists and how many points it holds. */
  public CollectionStatus getCollectionStatus() {
    String name = store.collectionName();
    if (!store.getCollections().contains(name)) {
      return new CollectionStatus(false, 0);
    }
    return new CollectionStatus(true, store.countPoints(PointFilter.none()));
  }

  public synchronized void start(long intervalMs) {
    if (scheduler != null) {
      log.debug("Health monitor already running");
      return;
    }
    long interval = Math.max(1, intervalMs);
    scheduler =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, "vector-health");
              t.setDaemon(true);
              return t;
            });
    scheduler.scheduleAtFixedRate(this::poll, 0, interval, TimeUnit.MILLISECONDS);
    log.info("Vector store health monitor started, interval {} ms", interval);
  }

  public synchronized void stop() {
    if (scheduler == null) return;
    scheduler.shutdownNow();
    scheduler = null;
    log.info("Vector store health monitor stopped");
  }

  public synchronized boolean isRunning() {
    return scheduler != null;
  }

  public Optional<CollectionHealth> lastHealth() {
    return Optional.ofNullable(lastHealth.get());
  }

  public int consecutiveFailures() {
    return consecutiveFailures.get();
  }

  void poll() {
    try {
      CollectionHealth health = checkCollectionHealth();
      int failures = consecutiveFailures.getAndSet(0);
      if (failures > 0) {
        log.info("Vector store healthy again after {} failed checks", failures);
      }
      if (!"green".equalsIgnoreCase(health.status()) || !"ok".equals(health.optimizerStatus())) {
        log.warn(
            "Collection {} status {} optimizer {}",
            health.collection(),
            health.status(),
            health.optimizerStatus());
      } else {
        log.debug(
            "Collection {}: {} points, {} unindexed",
            health.collection(),
            health.pointCount(),
            health.unindexedPoints());
      }
    } catch (VirtualMachineError e) {
      throw e;
    } catch (Throwable t) {
      // anything escaping here would cancel the periodic schedule
      int failures = consecutiveFailures.incrementAndGet();
      log.error(
          "Vector store health check failed ({} in a row): {}",
          failures,
          ExceptionUtil.toErrorDetails(t));
    }
  }

  @Override
  public void close() {
    stop();
  }
}

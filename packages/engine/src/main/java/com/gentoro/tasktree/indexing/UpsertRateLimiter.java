package com.gentoro.tasktree.indexing;

import com.gentoro.tasktree.exception.StateException;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Serializes vector store writes through one worker thread, in submission order, starting calls
 * at least {@code minIntervalMs} apart.
 *
 * <p>Shared by every indexing caller, so the outbound call rate stays bounded however many tasks
 * are indexed concurrently.
 */
public class UpsertRateLimiter implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.tasktree.logging.LoggingService.getLogger(UpsertRateLimiter.class);

  public static final long DEFAULT_MIN_INTERVAL_MS = 100;

  private final long minIntervalNanos;
  private final ExecutorService worker;
  // only touched by the worker thread
  private long lastStartNanos;
  private boolean started;

  public UpsertRateLimiter(long minIntervalMs) {
    this.minIntervalNanos = TimeUnit.MILLISECONDS.toNanos(Math.max(0, minIntervalMs));
    this.worker =
        Executors.newSingleThreadExecutor(
            r -> {
              Thread t = new Thread(r, "vector-upsert");
              t.setDaemon(true);
              return t;
            });
  }

  /**
   * Runs {@code call} on the worker once its turn comes and waits for the result. Unchecked
   * exceptions of the call are rethrown as is.
   */
  public <T> T execute(Callable<T> call) {
    Future<T> future;
    try {
      future =
          worker.submit(
              () -> {
                awaitTurn();
                return call.call();
              });
    } catch (RejectedExecutionException e) {
      throw new StateException("Upsert rate limiter is shut down", e);
    }
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StateException("Interrupted while waiting for the upsert worker", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException re) throw re;
      if (cause instanceof Error err) throw err;
      throw new StateException("Upsert failed: " + cause, cause);
    }
  }

  private void awaitTurn() throws InterruptedException {
    if (started) {
      long waitNanos = lastStartNanos + minIntervalNanos - System.nanoTime();
      if (waitNanos > 0) {
        log.trace("Upsert throttled for {} ms", TimeUnit.NANOSECONDS.toMillis(waitNanos));
        TimeUnit.NANOSECONDS.sleep(waitNanos);
      }
    }
    started = true;
    lastStartNanos = System.nanoTime();
  }

  @Override
  public void close() {
    worker.shutdownNow();
  }
}

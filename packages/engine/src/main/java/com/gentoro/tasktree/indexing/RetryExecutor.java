package com.gentoro.tasktree.indexing;

import com.gentoro.tasktree.exception.ExceptionUtil;
import com.gentoro.tasktree.exception.FailureKind;
import com.gentoro.tasktree.exception.StateException;
import com.gentoro.tasktree.exception.TaskTreeErrorCode;
import com.gentoro.tasktree.exception.TaskTreeException;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Runs an operation with bounded exponential backoff.
 *
 * <p>States: {@code ATTEMPTING(n) -> BACKING_OFF(delay) -> ATTEMPTING(n+1)}, ending in {@code
 * SUCCEEDED} or {@code FAILED}. Only {@link FailureKind#TRANSIENT} failures are retried; the n-th
 * retry waits {@code baseDelay * 2^(n-1)}.
 */
public class RetryExecutor {
  private static final org.slf4j.Logger log =
      com.gentoro.tasktree.logging.LoggingService.getLogger(RetryExecutor.class);

  public enum State {
    ATTEMPTING,
    BACKING_OFF,
    SUCCEEDED,
    FAILED
  }

  private final int maxRetries;
  private final Duration baseDelay;
  private final Sleeper sleeper;

  public RetryExecutor(int maxRetries, Duration baseDelay, Sleeper sleeper) {
    this.maxRetries = Math.max(0, maxRetries);
    this.baseDelay = baseDelay;
    this.sleeper = sleeper;
  }

  public int maxRetries() {
    return maxRetries;
  }

  /** Delay before retry number {@code retry} (1-based). */
  public Duration backoff(int retry) {
    return baseDelay.multipliedBy(1L << Math.min(30, retry - 1));
  }

  /**
   * Returns the operation's result, or throws the last failure once it is not retryable or the
   * retries are exhausted. Checked failures are wrapped in {@link TaskTreeException}.
   */
  public <T> T execute(String operation, Callable<T> call) {
    State state = State.ATTEMPTING;
    int attempt = 1;
    T result = null;
    Exception failure = null;
    Duration delay = Duration.ZERO;

    while (true) {
      switch (state) {
        case ATTEMPTING -> {
          try {
            result = call.call();
            state = State.SUCCEEDED;
          } catch (Exception e) {
            failure = e;
            FailureKind kind = ExceptionUtil.failureKindOf(e);
            if (!kind.isRetryable() || attempt > maxRetries) {
              state = State.FAILED;
            } else {
              delay = backoff(attempt);
              state = State.BACKING_OFF;
              log.warn(
                  "{} failed on attempt {} ({}), retrying in {} ms",
                  operation,
                  attempt,
                  e.getMessage(),
                  delay.toMillis());
            }
          }
        }
        case BACKING_OFF -> {
          try {
            sleeper.sleep(delay);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StateException(operation + " interrupted during backoff", e);
          }
          attempt++;
          state = State.ATTEMPTING;
        }
        case SUCCEEDED -> {
          if (attempt > 1) log.info("{} succeeded on attempt {}", operation, attempt);
          return result;
        }
        case FAILED -> {
          log.warn(
              "{} failed after {} attempt(s): {}",
              operation,
              attempt,
              ExceptionUtil.toErrorDetails(failure));
          if (failure instanceof RuntimeException re) throw re;
          throw new TaskTreeException(
              TaskTreeErrorCode.UNKNOWN, operation + " failed: " + failure.getMessage(), failure);
        }
      }
    }
  }
}

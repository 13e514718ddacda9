package com.gentoro.tasktree.indexing;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Stops calls to the vector store after repeated failures.
 *
 * <p>{@code CLOSED} lets calls through and counts consecutive failures; reaching the threshold
 * opens the circuit. {@code OPEN} rejects calls until the open period has elapsed, then {@code
 * HALF_OPEN} lets a single trial through: success closes the circuit, failure opens it again,
 * and {@link #release()} without an outcome lets the next caller try.
 */
public class CircuitBreaker {
  private static final org.slf4j.Logger log =
      com.gentoro.tasktree.logging.LoggingService.getLogger(CircuitBreaker.class);

  public enum State {
    CLOSED,
    OPEN,
    HALF_OPEN
  }

  private final int failureThreshold;
  private final Duration openDuration;
  private final Clock clock;

  private State state = State.CLOSED;
  private int consecutiveFailures;
  private Instant openedAt;
  // thread holding the half-open trial, null when none is in flight
  private Thread trialOwner;

  public CircuitBreaker(int failureThreshold, Duration openDuration, Clock clock) {
    this.failureThreshold = Math.max(1, failureThreshold);
    this.openDuration = openDuration;
    this.clock = clock;
  }

  public synchronized boolean allowRequest() {
    if (state == State.OPEN) {
      if (clock.instant().isBefore(openedAt.plus(openDuration))) return false;
      state = State.HALF_OPEN;
      trialOwner = null;
      log.info("Circuit half-open, allowing a trial request");
    }
    if (state == State.HALF_OPEN) {
      if (trialOwner != null) return false;
      trialOwner = Thread.currentThread();
    }
    return true;
  }

  /**
   * Ends the calling thread's half-open trial without recording an outcome, e.g. when it failed
   * before reaching the vector store. Does nothing otherwise.
   */
  public synchronized void release() {
    if (state == State.HALF_OPEN && trialOwner == Thread.currentThread()) {
      trialOwner = null;
      log.debug("Half-open trial released without an outcome");
    }
  }

  public synchronized void recordSuccess() {
    if (state != State.CLOSED) log.info("Circuit closed after successful request");
    state = State.CLOSED;
    consecutiveFailures = 0;
    trialOwner = null;
  }

  public synchronized void recordFailure() {
    trialOwner = null;
    consecutiveFailures++;
    if (state == State.HALF_OPEN || consecutiveFailures >= failureThreshold) {
      if (state != State.OPEN) {
        log.warn(
            "Circuit opened after {} consecutive failures, rejecting calls for {} s",
            consecutiveFailures,
            openDuration.toSeconds());
      }
      state = State.OPEN;
      openedAt = clock.instant();
    }
  }

  public synchronized State state() {
    return state;
  }

  /** When the circuit may next let a request through; null unless open. */
  public synchronized Instant retryAt() {
    return state == State.OPEN ? openedAt.plus(openDuration) : null;
  }
}

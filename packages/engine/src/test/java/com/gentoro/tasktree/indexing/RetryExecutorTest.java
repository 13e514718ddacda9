package com.gentoro.tasktree.indexing;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.tasktree.exception.FailureKind;
import com.gentoro.tasktree.exception.StateException;
import com.gentoro.tasktree.exception.TaskTreeException;
import com.gentoro.tasktree.exception.VectorStoreException;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RetryExecutorTest {

  private final List<Duration> sleeps = new ArrayList<>();
  private final RetryExecutor retry = new RetryExecutor(3, Duration.ofSeconds(2), sleeps::add);

  @Test
  @DisplayName("Transient failures are retried three times with 2s, 4s and 8s delays")
  void exhaustsRetriesWithExponentialBackoff() {
    AtomicInteger attempts = new AtomicInteger();

    VectorStoreException thrown =
        assertThrows(
            VectorStoreException.class,
            () ->
                retry.execute(
                    "upsert",
                    () -> {
                      attempts.incrementAndGet();
                      throw new VectorStoreException(FailureKind.TRANSIENT, "503");
                    }));

    assertEquals("503", thrown.getMessage());
    assertEquals(4, attempts.get());
    assertEquals(
        List.of(Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofSeconds(8)), sleeps);
  }

  @Test
  void succeedsAfterTransientFailures() {
    AtomicInteger attempts = new AtomicInteger();

    String result =
        retry.execute(
            "upsert",
            () -> {
              if (attempts.incrementAndGet() < 3) {
                throw new VectorStoreException(FailureKind.TRANSIENT, "timeout");
              }
              return "ok";
            });

    assertEquals("ok", result);
    assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(4)), sleeps);
  }

  @Test
  @DisplayName("Client errors fail immediately")
  void clientErrorsAreNotRetried() {
    AtomicInteger attempts = new AtomicInteger();

    assertThrows(
        VectorStoreException.class,
        () ->
            retry.execute(
                "upsert",
                () -> {
                  attempts.incrementAndGet();
                  throw new VectorStoreException(FailureKind.CLIENT, "400 bad payload");
                }));

    assertEquals(1, attempts.get());
    assertTrue(sleeps.isEmpty());
  }

  @Test
  @DisplayName("Malformed requests are not retried")
  void invalidArgumentsAreNotRetried() {
    AtomicInteger attempts = new AtomicInteger();

    IllegalArgumentException thrown =
        assertThrows(
            IllegalArgumentException.class,
            () ->
                retry.execute(
                    "upsert",
                    () -> {
                      attempts.incrementAndGet();
                      throw new IllegalArgumentException("bad point");
                    }));

    assertEquals("bad point", thrown.getMessage());
    assertEquals(1, attempts.get());
    assertTrue(sleeps.isEmpty());
  }

  @Test
  void checkedFailuresAreWrappedAfterRetries() {
    TaskTreeException thrown =
        assertThrows(
            TaskTreeException.class,
            () ->
                retry.execute(
                    "embed",
                    () -> {
                      throw new IOException("connection reset");
                    }));

    assertInstanceOf(IOException.class, thrown.getCause());
    assertEquals(3, sleeps.size());
  }

  @Test
  void interruptedBackoffStopsRetrying() {
    RetryExecutor interrupted =
        new RetryExecutor(
            3,
            Duration.ofSeconds(2),
            d -> {
              throw new InterruptedException();
            });

    assertThrows(
        StateException.class,
        () ->
            interrupted.execute(
                "upsert",
                () -> {
                  throw new VectorStoreException(FailureKind.TRANSIENT, "503");
                }));
    assertTrue(Thread.interrupted());
  }

  @Test
  void backoffDoubles() {
    assertEquals(Duration.ofSeconds(2), retry.backoff(1));
    assertEquals(Duration.ofSeconds(8), retry.backoff(3));
    assertEquals(3, retry.maxRetries());
  }
}

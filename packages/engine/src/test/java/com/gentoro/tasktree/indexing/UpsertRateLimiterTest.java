package com.gentoro.tasktree.indexing;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.tasktree.exception.FailureKind;
import com.gentoro.tasktree.exception.StateException;
import com.gentoro.tasktree.exception.VectorStoreException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class UpsertRateLimiterTest {

  private static final long INTERVAL_MS = 40;

  private final UpsertRateLimiter limiter = new UpsertRateLimiter(INTERVAL_MS);

  @AfterEach
  void tearDown() {
    limiter.close();
  }

  @Test
  @DisplayName("N calls take at least (N-1) intervals")
  void spacesCalls() {
    int calls = 5;
    long start = System.nanoTime();
    for (int i = 0; i < calls; i++) {
      int n = i;
      int result = limiter.execute(() -> n);
      assertEquals(n, result);
    }
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

    assertTrue(elapsedMs >= (calls - 1) * INTERVAL_MS, "elapsed " + elapsedMs + " ms");
  }

  @Test
  void concurrentCallersAreSerialized() throws Exception {
    AtomicInteger running = new AtomicInteger();
    AtomicInteger maxRunning = new AtomicInteger();
    ExecutorService callers = Executors.newFixedThreadPool(4);
    try {
      List<Future<Integer>> futures = new ArrayList<>();
      for (int i = 0; i < 4; i++) {
        futures.add(
            callers.submit(
                () ->
                    limiter.execute(
                        () -> {
                          int now = running.incrementAndGet();
                          maxRunning.accumulateAndGet(now, Math::max);
                          Thread.sleep(5);
                          running.decrementAndGet();
                          return now;
                        })));
      }
      for (Future<Integer> f : futures) f.get(5, TimeUnit.SECONDS);
    } finally {
      callers.shutdownNow();
    }

    assertEquals(1, maxRunning.get());
  }

  @Test
  void runtimeFailuresPropagateUnchanged() {
    VectorStoreException failure = new VectorStoreException(FailureKind.CLIENT, "bad");

    VectorStoreException thrown =
        assertThrows(
            VectorStoreException.class,
            () ->
                limiter.execute(
                    () -> {
                      throw failure;
                    }));

    assertSame(failure, thrown);
  }

  @Test
  void checkedFailuresAreWrapped() {
    StateException thrown =
        assertThrows(
            StateException.class,
            () ->
                limiter.execute(
                    () -> {
                      throw new IOException("io");
                    }));

    assertInstanceOf(IOException.class, thrown.getCause());
  }

  @Test
  void rejectsCallsAfterClose() {
    limiter.close();

    assertThrows(StateException.class, () -> limiter.execute(() -> 1));
  }
}

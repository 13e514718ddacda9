package com.gentoro.tasktree.health;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.gentoro.tasktree.TaskFixtures;
import com.gentoro.tasktree.exception.FailureKind;
import com.gentoro.tasktree.exception.VectorStoreException;
import com.gentoro.tasktree.indexing.driver.CollectionInfo;
import com.gentoro.tasktree.indexing.driver.PointFilter;
import com.gentoro.tasktree.indexing.driver.VectorStore;
import com.gentoro.tasktree.indexing.driver.memory.InMemoryVectorStore;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class VectorStoreHealthMonitorTest {

  @Mock private VectorStore store;

  private final Clock clock = Clock.fixed(TaskFixtures.T0, ZoneOffset.UTC);

  @Test
  void checksCollectionHealth() {
    when(store.collectionName()).thenReturn("tasks");
    when(store.getCollection("tasks")).thenReturn(new CollectionInfo("yellow", 10, 3, 7, "ok"));
    VectorStoreHealthMonitor monitor = new VectorStoreHealthMonitor(store, clock);

    CollectionHealth health = monitor.checkCollectionHealth();

    assertEquals(new CollectionHealth("tasks", "yellow", 10, 3, 7, "ok", TaskFixtures.T0), health);
    assertEquals(3, health.unindexedPoints());
    assertEquals(health, monitor.lastHealth().orElseThrow());
  }

  @Test
  void reportsMissingCollection() {
    when(store.collectionName()).thenReturn("tasks");
    when(store.getCollections()).thenReturn(List.of("other"));

    assertEquals(
        new CollectionStatus(false, 0),
        new VectorStoreHealthMonitor(store, clock).getCollectionStatus());
    verify(store, never()).countPoints(any());
  }

  @Test
  void countsPointsOfExistingCollection() {
    when(store.collectionName()).thenReturn("tasks");
    when(store.getCollections()).thenReturn(List.of("tasks"));
    when(store.countPoints(PointFilter.none())).thenReturn(12L);

    assertEquals(
        new CollectionStatus(true, 12),
        new VectorStoreHealthMonitor(store, clock).getCollectionStatus());
  }

  @Test
  void pollingSurvivesFailuresAndRecovers() {
    when(store.collectionName()).thenReturn("tasks");
    when(store.getCollection("tasks"))
        .thenThrow(new VectorStoreException(FailureKind.TRANSIENT, "connection refused"))
        .thenThrow(new VectorStoreException(FailureKind.TRANSIENT, "connection refused"))
        .thenReturn(new CollectionInfo("green", 1, 1, 1, "ok"));
    VectorStoreHealthMonitor monitor = new VectorStoreHealthMonitor(store, clock);

    monitor.poll();
    monitor.poll();
    assertEquals(2, monitor.consecutiveFailures());
    assertTrue(monitor.lastHealth().isEmpty());

    monitor.poll();
    assertEquals(0, monitor.consecutiveFailures());
    assertEquals("green", monitor.lastHealth().orElseThrow().status());
  }

  @Test
  void pollingSurvivesErrorsFromTheDriver() {
    when(store.collectionName()).thenReturn("tasks");
    when(store.getCollection("tasks"))
        .thenThrow(new NoClassDefFoundError("okhttp3/internal/Util"))
        .thenReturn(new CollectionInfo("green", 1, 1, 1, "ok"));
    VectorStoreHealthMonitor monitor = new VectorStoreHealthMonitor(store, clock);

    assertDoesNotThrow(monitor::poll);
    assertEquals(1, monitor.consecutiveFailures());

    monitor.poll();
    assertEquals(0, monitor.consecutiveFailures());
  }

  @Test
  void virtualMachineErrorsAreNotSwallowed() {
    when(store.collectionName()).thenReturn("tasks");
    when(store.getCollection("tasks")).thenThrow(new OutOfMemoryError("heap"));

    assertThrows(OutOfMemoryError.class, new VectorStoreHealthMonitor(store, clock)::poll);
  }

  @Test
  void startsAndStopsPolling() throws InterruptedException {
    InMemoryVectorStore memory = new InMemoryVectorStore("tasks", 4);
    memory.ensureCollection();
    try (VectorStoreHealthMonitor monitor = new VectorStoreHealthMonitor(memory, clock)) {
      monitor.start(50);
      monitor.start(50);
      assertTrue(monitor.isRunning());

      long deadline = System.currentTimeMillis() + 5_000;
      while (monitor.lastHealth().isEmpty() && System.currentTimeMillis() < deadline) {
        Thread.sleep(10);
      }
      assertEquals("green", monitor.lastHealth().orElseThrow().status());

      monitor.stop();
      assertFalse(monitor.isRunning());
    }
  }
}

package com.gentoro.tasktree.indexing;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.tasktree.TaskFixtures;
import com.gentoro.tasktree.TaskFixtures.MutableClock;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class EmbeddingCacheTest {

  private final MutableClock clock = new MutableClock(TaskFixtures.T0);

  @Test
  void returnsStoredVectorUntilExpiry() {
    EmbeddingCache cache = new EmbeddingCache(Duration.ofHours(1), 10, clock);
    float[] vector = {1f, 0f};
    cache.put("hello", vector);

    assertSame(vector, cache.get("hello").orElseThrow());
    assertTrue(cache.get("other").isEmpty());

    clock.advance(Duration.ofHours(1));
    assertTrue(cache.get("hello").isEmpty());
    assertEquals(0, cache.size());
  }

  @Test
  void fullCacheStillAdmitsNewEntries() {
    EmbeddingCache cache = new EmbeddingCache(Duration.ofMinutes(10), 2, clock);
    cache.put("a", new float[] {1f});
    cache.put("b", new float[] {2f});
    cache.put("c", new float[] {3f});

    assertEquals(2, cache.size());
    assertArrayEquals(new float[] {3f}, cache.get("c").orElseThrow());

    cache.clear();
    assertEquals(0, cache.size());
    assertTrue(cache.get("c").isEmpty());
  }

  @Test
  void keyIsSha256Hex() {
    assertEquals(
        "2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824",
        EmbeddingCache.key("hello"));
  }
}

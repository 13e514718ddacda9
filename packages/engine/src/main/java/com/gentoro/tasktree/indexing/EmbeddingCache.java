package com.gentoro.tasktree.indexing;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Embeddings keyed by the SHA-256 of their text, kept for a fixed time to live. Size-bounded; a
 * full cache evicts older entries to admit new ones.
 */
public class EmbeddingCache {
  public static final Duration DEFAULT_TTL = Duration.ofDays(7);

  private final Cache<String, float[]> entries;

  public EmbeddingCache(Duration ttl, int maxEntries, Clock clock) {
    this.entries =
        Caffeine.newBuilder()
            .maximumSize(maxEntries)
            .expireAfterWrite(ttl)
            .ticker(() -> Duration.between(Instant.EPOCH, clock.instant()).toNanos())
            // maintenance on the calling thread keeps eviction deterministic
            .executor(Runnable::run)
            .build();
  }

  public Optional<float[]> get(String text) {
    return Optional.ofNullable(entries.getIfPresent(key(text)));
  }

  public void put(String text, float[] vector) {
    entries.put(key(text), vector);
  }

  public long size() {
    entries.cleanUp();
    return entries.estimatedSize();
  }

  public void clear() {
    entries.invalidateAll();
  }

  static String key(String text) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}

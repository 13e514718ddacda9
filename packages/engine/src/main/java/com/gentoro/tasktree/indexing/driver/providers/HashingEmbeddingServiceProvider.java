package com.gentoro.tasktree.indexing.driver.providers;

import com.gentoro.tasktree.indexing.driver.EmbeddingService;
import com.gentoro.tasktree.indexing.driver.memory.HashingEmbeddingService;
import com.gentoro.tasktree.indexing.driver.spi.EmbeddingServiceProvider;
import org.apache.commons.configuration2.Configuration;

/** Service provider for offline hashing embeddings. */
public class HashingEmbeddingServiceProvider implements EmbeddingServiceProvider {
  @Override
  public String id() {
    return "in-memory";
  }

  @Override
  public EmbeddingService create(Configuration config) {
    return new HashingEmbeddingService(
        config.getInt("dimension", QdrantVectorStoreProvider.DEFAULT_DIMENSION));
  }
}

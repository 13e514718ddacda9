package com.gentoro.tasktree.indexing.driver.providers;

import com.gentoro.tasktree.indexing.driver.VectorStore;
import com.gentoro.tasktree.indexing.driver.memory.InMemoryVectorStore;
import com.gentoro.tasktree.indexing.driver.spi.VectorStoreProvider;
import org.apache.commons.configuration2.Configuration;

/** Service provider for the process-local vector store. */
public class InMemoryVectorStoreProvider implements VectorStoreProvider {
  @Override
  public String id() {
    return "in-memory";
  }

  @Override
  public VectorStore create(Configuration config) {
    return new InMemoryVectorStore(
        config.getString("collection", QdrantVectorStoreProvider.DEFAULT_COLLECTION),
        config.getInt("dimension", QdrantVectorStoreProvider.DEFAULT_DIMENSION));
  }
}

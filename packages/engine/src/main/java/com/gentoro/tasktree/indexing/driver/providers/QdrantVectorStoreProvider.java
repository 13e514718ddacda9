package com.gentoro.tasktree.indexing.driver.providers;

import com.gentoro.tasktree.exception.ConfigException;
import com.gentoro.tasktree.http.OkHttpFactory;
import com.gentoro.tasktree.indexing.driver.VectorStore;
import com.gentoro.tasktree.indexing.driver.qdrant.QdrantVectorStore;
import com.gentoro.tasktree.indexing.driver.spi.VectorStoreProvider;
import org.apache.commons.configuration2.Configuration;

/** Service provider for the Qdrant REST vector store. */
public class QdrantVectorStoreProvider implements VectorStoreProvider {
  public static final String DEFAULT_COLLECTION = "roo_tasks_semantic_index";
  public static final int DEFAULT_DIMENSION = 1536;

  @Override
  public String id() {
    return "qdrant";
  }

  @Override
  public VectorStore create(Configuration config) {
    String url = config.getString("qdrant.url", null);
    if (url == null || url.isBlank()) {
      throw new ConfigException("Missing vectorstore.qdrant.url");
    }
    return new QdrantVectorStore(
        OkHttpFactory.create(
            "api-key",
            config.getString("qdrant.apiKey", null),
            config.getLong("qdrant.timeoutMs", 30_000L)),
        url.trim(),
        config.getString("collection", DEFAULT_COLLECTION),
        config.getInt("dimension", DEFAULT_DIMENSION),
        config.getInt("qdrant.maxIndexingThreads", 2));
  }
}

package com.gentoro.tasktree.indexing.driver;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.tasktree.exception.ConfigException;
import com.gentoro.tasktree.indexing.driver.memory.HashingEmbeddingService;
import com.gentoro.tasktree.indexing.driver.memory.InMemoryVectorStore;
import com.gentoro.tasktree.indexing.driver.qdrant.QdrantVectorStore;
import java.util.List;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;

class DriverFactoryTest {

  @Test
  void defaultsToInMemoryDrivers() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("vectorstore.collection", "tasks");
    config.setProperty("vectorstore.dimension", 32);
    config.setProperty("embedding.dimension", 32);

    VectorStore store = DriverFactory.createVectorStore(config);
    EmbeddingService embeddings = DriverFactory.createEmbeddingService(config);

    assertInstanceOf(InMemoryVectorStore.class, store);
    assertEquals("tasks", store.collectionName());
    assertEquals(32, store.dimension());
    assertInstanceOf(HashingEmbeddingService.class, embeddings);
    assertEquals(32, embeddings.embed(List.of("hello")).get(0).length);
  }

  @Test
  void createsQdrantStoreWithoutContactingIt() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("vectorstore.provider", " Qdrant ");
    config.setProperty("vectorstore.qdrant.url", "http://localhost:6333");

    VectorStore store = DriverFactory.createVectorStore(config);

    assertInstanceOf(QdrantVectorStore.class, store);
    assertEquals("roo_tasks_semantic_index", store.collectionName());
    assertEquals(1536, store.dimension());
  }

  @Test
  void qdrantRequiresUrl() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("vectorstore.provider", "qdrant");

    assertThrows(ConfigException.class, () -> DriverFactory.createVectorStore(config));
  }

  @Test
  void openAiRequiresApiKey() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("embedding.provider", "openai");

    ConfigException e =
        assertThrows(ConfigException.class, () -> DriverFactory.createEmbeddingService(config));
    assertTrue(e.getMessage().contains("OPENAI_API_KEY"));
  }

  @Test
  void unknownProviderListsAvailableOnes() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("vectorstore.provider", "pinecone");

    ConfigException e =
        assertThrows(ConfigException.class, () -> DriverFactory.createVectorStore(config));
    assertTrue(e.getMessage().contains("qdrant"), e.getMessage());
    assertTrue(e.getMessage().contains("in-memory"), e.getMessage());
  }
}

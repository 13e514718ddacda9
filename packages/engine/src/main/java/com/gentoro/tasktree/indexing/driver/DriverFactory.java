package com.gentoro.tasktree.indexing.driver;

import com.gentoro.tasktree.exception.ConfigException;
import com.gentoro.tasktree.indexing.driver.spi.EmbeddingServiceProvider;
import com.gentoro.tasktree.indexing.driver.spi.VectorStoreProvider;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.ServiceLoader;
import org.apache.commons.configuration2.Configuration;

/**
 * Creates the configured {@link VectorStore} and {@link EmbeddingService} through {@link
 * ServiceLoader}.
 *
 * <pre>
 *   vectorstore.provider = qdrant
 *   vectorstore.qdrant.url = http://localhost:6333
 *   embedding.provider = openai
 *   embedding.openai.apiKey = ${env:OPENAI_API_KEY}
 * </pre>
 */
public final class DriverFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.tasktree.logging.LoggingService.getLogger(DriverFactory.class);

  private DriverFactory() {}

  public static VectorStore createVectorStore(Configuration config) {
    String desired = providerId(config, "vectorstore.provider");
    List<String> known = new ArrayList<>();
    for (VectorStoreProvider p : ServiceLoader.load(VectorStoreProvider.class)) {
      known.add(p.id());
      if (desired.equals(p.id())) {
        log.info("Using vector store provider '{}'", desired);
        return p.create(config.subset("vectorstore"));
      }
    }
    throw new ConfigException(
        "Unknown vectorstore.provider '%s'; available: %s".formatted(desired, known));
  }

  public static EmbeddingService createEmbeddingService(Configuration config) {
    String desired = providerId(config, "embedding.provider");
    List<String> known = new ArrayList<>();
    for (EmbeddingServiceProvider p : ServiceLoader.load(EmbeddingServiceProvider.class)) {
      known.add(p.id());
      if (desired.equals(p.id())) {
        log.info("Using embedding provider '{}'", desired);
        return p.create(config.subset("embedding"));
      }
    }
    throw new ConfigException(
        "Unknown embedding.provider '%s'; available: %s".formatted(desired, known));
  }

  private static String providerId(Configuration config, String key) {
    return config.getString(key, "in-memory").trim().toLowerCase(Locale.ROOT);
  }
}

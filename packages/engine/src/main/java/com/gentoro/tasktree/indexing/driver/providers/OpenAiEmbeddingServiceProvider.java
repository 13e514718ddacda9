package com.gentoro.tasktree.indexing.driver.providers;

import com.gentoro.tasktree.exception.ConfigException;
import com.gentoro.tasktree.http.OkHttpFactory;
import com.gentoro.tasktree.indexing.driver.EmbeddingService;
import com.gentoro.tasktree.indexing.driver.openai.OpenAiEmbeddingService;
import com.gentoro.tasktree.indexing.driver.spi.EmbeddingServiceProvider;
import org.apache.commons.configuration2.Configuration;

/** Service provider for OpenAI compatible embedding endpoints. */
public class OpenAiEmbeddingServiceProvider implements EmbeddingServiceProvider {
  @Override
  public String id() {
    return "openai";
  }

  @Override
  public EmbeddingService create(Configuration config) {
    String apiKey = config.getString("openai.apiKey", null);
    if (apiKey == null || apiKey.isBlank() || apiKey.startsWith("${")) {
      throw new ConfigException("Missing embedding.openai.apiKey (set OPENAI_API_KEY)");
    }
    return new OpenAiEmbeddingService(
        OkHttpFactory.create(
            "Authorization",
            "Bearer " + apiKey.trim(),
            config.getLong("openai.timeoutMs", 60_000L)),
        config.getString("openai.baseUrl", "https://api.openai.com/v1"),
        config.getString("openai.model", "text-embedding-3-small"),
        config.getInt("openai.batchSize", 64));
  }
}

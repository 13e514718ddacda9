package com.gentoro.tasktree.indexing.driver.spi;

import com.gentoro.tasktree.indexing.driver.EmbeddingService;
import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface for embedding services, selected by {@code embedding.provider}.
 * Registered in {@code
 * META-INF/services/com.gentoro.tasktree.indexing.driver.spi.EmbeddingServiceProvider}.
 */
public interface EmbeddingServiceProvider {

  String id();

  EmbeddingService create(Configuration embeddingConfig);
}

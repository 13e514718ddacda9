package com.gentoro.tasktree.indexing.driver.spi;

import com.gentoro.tasktree.indexing.driver.VectorStore;
import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface for pluggable vector stores.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and selected by matching
 * {@code vectorstore.provider} against {@link #id()}. Register a provider in {@code
 * META-INF/services/com.gentoro.tasktree.indexing.driver.spi.VectorStoreProvider}.
 */
public interface VectorStoreProvider {

  /** Stable lowercase identifier, e.g. "qdrant". */
  String id();

  /**
   * Creates a store from the {@code vectorstore.*} configuration subset.
   *
   * @throws com.gentoro.tasktree.exception.ConfigException when required settings are missing
   */
  VectorStore create(Configuration vectorStoreConfig);
}

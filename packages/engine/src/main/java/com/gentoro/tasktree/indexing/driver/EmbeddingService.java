package com.gentoro.tasktree.indexing.driver;

import java.util.List;

/**
 * Turns texts into fixed-dimension vectors. Failures are reported as {@link
 * com.gentoro.tasktree.exception.EmbeddingException}.
 */
public interface EmbeddingService extends AutoCloseable {

  /** One vector per input text, in input order. */
  List<float[]> embed(List<String> texts);

  String model();

  default void shutdown() {}

  @Override
  default void close() {
    shutdown();
  }
}

package com.gentoro.tasktree.indexing.driver;

import java.util.List;

/**
 * Client of an external vector store holding one collection of task chunks.
 *
 * <p>Every operation reports failures as {@link
 * com.gentoro.tasktree.exception.VectorStoreException} with a failure kind that tells whether a
 * retry can help.
 */
public interface VectorStore extends AutoCloseable {

  /** Name of the collection this store writes to. */
  String collectionName();

  /** Dimensionality of the vectors accepted by the collection. */
  int dimension();

  /** Creates the collection when it does not exist yet. */
  void ensureCollection();

  /** Inserts or replaces points by id. */
  void upsert(List<VectorPoint> points);

  /** Nearest points to {@code vector} among those matching {@code filter}, closest first. */
  List<ScoredPoint> search(float[] vector, PointFilter filter, int limit);

  /** Health metrics of collection {@code name}. */
  CollectionInfo getCollection(String name);

  List<String> getCollections();

  long countPoints(PointFilter filter);

  void deleteCollection(String name);

  default void shutdown() {}

  @Override
  default void close() {
    shutdown();
  }
}

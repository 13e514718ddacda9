package com.gentoro.tasktree.indexing;

public enum IndexingStatus {
  INDEXED,
  TASK_NOT_FOUND,
  NO_CHUNKS,
  NO_INDEXABLE_CHUNKS,
  NO_VALID_VECTORS,
  EMBEDDING_FAILED,
  UPSERT_FAILED,
  CIRCUIT_OPEN,
  SKIPPED
}

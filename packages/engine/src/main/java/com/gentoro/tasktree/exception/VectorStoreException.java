package com.gentoro.tasktree.exception;

import java.util.Map;

/** Failure reported by a vector store driver. */
public class VectorStoreException extends TaskTreeException {
  private final FailureKind kind;

  public VectorStoreException(FailureKind kind, String message) {
    super(TaskTreeErrorCode.VECTOR_STORE_ERROR, message, Map.of("kind", kind));
    this.kind = kind;
  }

  public VectorStoreException(FailureKind kind, String message, Throwable cause) {
    super(TaskTreeErrorCode.VECTOR_STORE_ERROR, message, Map.of("kind", kind), cause);
    this.kind = kind;
  }

  public FailureKind getKind() {
    return kind;
  }
}

package com.gentoro.tasktree.exception;

import java.util.Map;

/** Failure reported by an embedding service. */
public class EmbeddingException extends TaskTreeException {
  private final FailureKind kind;

  public EmbeddingException(FailureKind kind, String message) {
    super(TaskTreeErrorCode.EMBEDDING_ERROR, message, Map.of("kind", kind));
    this.kind = kind;
  }

  public EmbeddingException(FailureKind kind, String message, Throwable cause) {
    super(TaskTreeErrorCode.EMBEDDING_ERROR, message, Map.of("kind", kind), cause);
    this.kind = kind;
  }

  public FailureKind getKind() {
    return kind;
  }
}

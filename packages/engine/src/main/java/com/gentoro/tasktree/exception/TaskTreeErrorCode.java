package com.gentoro.tasktree.exception;

/**
 * Error codes shared by all engine exceptions. Codes are stable and safe to log or forward to a
 * protocol layer. Prefer the most specific code that reflects where the failure originated.
 */
public enum TaskTreeErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,

  // Configuration
  CONFIGURATION_ERROR,
  SERIALIZATION_ERROR,

  // Domain specific
  EMBEDDING_ERROR,
  VECTOR_STORE_ERROR,
}

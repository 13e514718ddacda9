package com.gentoro.tasktree.exception;

/** Classifies an infrastructure failure for retry decisions. */
public enum FailureKind {
  /** Service unavailable, timeouts, throttling; worth retrying. */
  TRANSIENT,
  /** Malformed request or rejected payload; retrying cannot help. */
  CLIENT;

  public boolean isRetryable() {
    return this == TRANSIENT;
  }

  /** Maps an HTTP status code to a failure kind. */
  public static FailureKind fromHttpStatus(int status) {
    if (status == 408 || status == 429 || status >= 500) return TRANSIENT;
    return CLIENT;
  }
}

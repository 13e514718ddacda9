package com.gentoro.tasktree.exception;

import java.time.Instant;
import java.util.Map;

/**
 * Structured view of a failure, attached to indexing results and written to logs.
 *
 * @param type simple class name of the exception
 * @param kind whether retrying may help
 * @param context diagnostic values of an engine exception, empty otherwise
 */
public record ErrorDetails(
    String type,
    String message,
    TaskTreeErrorCode code,
    FailureKind kind,
    Map<String, Object> context,
    Instant timestamp) {

  @Override
  public String toString() {
    return "%s[%s/%s]: %s%s"
        .formatted(type, code, kind, message, context.isEmpty() ? "" : " " + context);
  }
}

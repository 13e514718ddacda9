package com.gentoro.tasktree.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Root of the engine's unchecked exceptions. Each one carries a {@link TaskTreeErrorCode} and an
 * immutable map of diagnostic values such as the task id or the collection name.
 */
public class TaskTreeException extends RuntimeException {
  private final TaskTreeErrorCode code;
  private final Map<String, Object> context;

  public TaskTreeException(TaskTreeErrorCode code, String message) {
    this(code, message, Map.of(), null);
  }

  public TaskTreeException(TaskTreeErrorCode code, String message, Throwable cause) {
    this(code, message, Map.of(), cause);
  }

  public TaskTreeException(TaskTreeErrorCode code, String message, Map<String, ?> context) {
    this(code, message, context, null);
  }

  public TaskTreeException(
      TaskTreeErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context =
        context == null || context.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  public TaskTreeErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return context;
  }

  @Override
  public String toString() {
    String text = getClass().getSimpleName() + "[" + code + "]: " + getMessage();
    return context.isEmpty() ? text : text + " " + context;
  }
}

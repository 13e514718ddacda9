package com.gentoro.tasktree.exception;

/** JSON/YAML serialization or deserialization error. */
public class SerializationException extends TaskTreeException {
  public SerializationException(String message) {
    super(TaskTreeErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(TaskTreeErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}

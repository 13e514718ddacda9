package com.gentoro.tasktree.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends TaskTreeException {
  public ValidationException(String message) {
    super(TaskTreeErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(TaskTreeErrorCode.INVALID_ARGUMENT, message, cause);
  }
}

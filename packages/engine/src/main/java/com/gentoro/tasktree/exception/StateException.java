package com.gentoro.tasktree.exception;

/** Illegal or unexpected state encountered. */
public class StateException extends TaskTreeException {
  public StateException(String message) {
    super(TaskTreeErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(TaskTreeErrorCode.FAILED_PRECONDITION, message, cause);
  }
}

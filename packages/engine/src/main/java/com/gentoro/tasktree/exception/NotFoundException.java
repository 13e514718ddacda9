package com.gentoro.tasktree.exception;

/** Requested task or resource was not found. */
public class NotFoundException extends TaskTreeException {
  public NotFoundException(String message) {
    super(TaskTreeErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(TaskTreeErrorCode.NOT_FOUND, message, cause);
  }
}

package com.gentoro.tasktree.exception;

/** Configuration or environment problem detected at startup or runtime. */
public class ConfigException extends TaskTreeException {
  public ConfigException(String message) {
    super(TaskTreeErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(TaskTreeErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}

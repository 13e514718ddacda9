package com.gentoro.tasktree.model;

/** Discriminator of the {@link OutlineEntry} variants. */
public enum OutlineKind {
  USER,
  ASSISTANT,
  TOOL_CALL,
  TOOL_RESULT;

  /** User and assistant text carry conversational content. */
  public boolean isMessage() {
    return this == USER || this == ASSISTANT;
  }
}

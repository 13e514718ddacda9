package com.gentoro.tasktree.indexing;

public enum ChunkType {
  MESSAGE_EXCHANGE("message_exchange"),
  TOOL_INTERACTION("tool_interaction");

  private final String tag;

  ChunkType(String tag) {
    this.tag = tag;
  }

  public String tag() {
    return tag;
  }
}

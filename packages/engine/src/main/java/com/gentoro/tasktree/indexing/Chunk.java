package com.gentoro.tasktree.indexing;

import com.gentoro.tasktree.utility.StringUtility;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** A bounded slice of one task's content outline, prepared for embedding. */
public final class Chunk {
  static final int SUMMARY_LENGTH = 200;

  private final String chunkId;
  private final String taskId;
  private final String parentTaskId;
  private final String rootTaskId;
  private final ChunkType chunkType;
  private final int sequenceOrder;
  private final Instant timestamp;
  private final String content;
  private final String role;
  private final boolean indexable;
  private final int chunkIndex;
  private final int totalChunks;
  private final String workspace;
  private final String taskTitle;
  private final String hostOs;

  Chunk(
      String chunkId,
      String taskId,
      String parentTaskId,
      String rootTaskId,
      ChunkType chunkType,
      int sequenceOrder,
      Instant timestamp,
      String content,
      String role,
      boolean indexable,
      int chunkIndex,
      int totalChunks,
      String workspace,
      String taskTitle,
      String hostOs) {
    this.chunkId = chunkId;
    this.taskId = taskId;
    this.parentTaskId = parentTaskId;
    this.rootTaskId = rootTaskId;
    this.chunkType = chunkType;
    this.sequenceOrder = sequenceOrder;
    this.timestamp = timestamp;
    this.content = content;
    this.role = role;
    this.indexable = indexable;
    this.chunkIndex = chunkIndex;
    this.totalChunks = totalChunks;
    this.workspace = workspace;
    this.taskTitle = taskTitle;
    this.hostOs = hostOs;
  }

  public String chunkId() {
    return chunkId;
  }

  public String taskId() {
    return taskId;
  }

  public String parentTaskId() {
    return parentTaskId;
  }

  public String rootTaskId() {
    return rootTaskId;
  }

  public ChunkType chunkType() {
    return chunkType;
  }

  public int sequenceOrder() {
    return sequenceOrder;
  }

  public Instant timestamp() {
    return timestamp;
  }

  public String content() {
    return content;
  }

  public String role() {
    return role;
  }

  /** Tool interactions are kept for context but not embedded. */
  public boolean indexable() {
    return indexable;
  }

  /** 1-based part number when an outline entry had to be split, otherwise 1. */
  public int chunkIndex() {
    return chunkIndex;
  }

  public int totalChunks() {
    return totalChunks;
  }

  public String workspace() {
    return workspace;
  }

  /**
   * Raw payload for the vector store. Run it through {@link PayloadSanitizer} before writing;
   * absent optional values appear here as null.
   */
  public Map<String, Object> payload() {
    Map<String, Object> p = new LinkedHashMap<>();
    p.put("chunk_id", chunkId);
    p.put("task_id", taskId);
    p.put("parent_task_id", parentTaskId);
    p.put("root_task_id", rootTaskId);
    p.put("chunk_type", chunkType.tag());
    p.put("sequence_order", sequenceOrder);
    p.put("timestamp", timestamp == null ? null : timestamp.toString());
    p.put("content", content);
    p.put("content_summary", StringUtility.abbreviate(content, SUMMARY_LENGTH));
    p.put("role", role);
    p.put("workspace", workspace);
    p.put("task_title", taskTitle);
    p.put("host_os", hostOs);
    p.put("chunk_index", chunkIndex);
    p.put("total_chunks", totalChunks);
    return p;
  }

  @Override
  public String toString() {
    return "Chunk{"
        + "chunkId='"
        + chunkId
        + '\''
        + ", taskId='"
        + taskId
        + '\''
        + ", type="
        + chunkType.tag()
        + ", sequence="
        + sequenceOrder
        + ", contentLength="
        + (content == null ? 0 : content.length())
        + '}';
  }
}

package com.gentoro.tasktree.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * In-memory summary of one recorded task: identity, relationship hints, activity counters and the
 * content outline. Instances are immutable; a rescan replaces the whole skeleton.
 */
public final class TaskSkeleton {
  private final String taskId;
  private final String parentTaskId;
  private final String workspace;
  private final String instruction;
  private final String title;
  private final Instant createdAt;
  private final Instant lastActivity;
  private final int messageCount;
  private final int actionCount;
  private final long totalSize;
  private final String hostOs;
  private final List<OutlineEntry> contentOutline;

  private TaskSkeleton(Builder b) {
    this.taskId = Objects.requireNonNull(b.taskId, "taskId");
    this.parentTaskId = b.parentTaskId;
    this.workspace = b.workspace;
    this.instruction = b.instruction == null ? "" : b.instruction;
    this.title = b.title;
    this.createdAt = b.createdAt == null ? Instant.EPOCH : b.createdAt;
    this.lastActivity = b.lastActivity == null ? this.createdAt : b.lastActivity;
    this.messageCount = b.messageCount;
    this.actionCount = b.actionCount;
    this.totalSize = b.totalSize;
    this.hostOs = b.hostOs;
    this.contentOutline = b.contentOutline == null ? List.of() : List.copyOf(b.contentOutline);
  }

  public static Builder builder(String taskId) {
    return new Builder(taskId);
  }

  public Builder toBuilder() {
    return new Builder(taskId)
        .parentTaskId(parentTaskId)
        .workspace(workspace)
        .instruction(instruction)
        .title(title)
        .createdAt(createdAt)
        .lastActivity(lastActivity)
        .messageCount(messageCount)
        .actionCount(actionCount)
        .totalSize(totalSize)
        .hostOs(hostOs)
        .contentOutline(contentOutline);
  }

  public String taskId() {
    return taskId;
  }

  /** Parent declared by the record itself; may be null or reference an unknown task. */
  public String parentTaskId() {
    return parentTaskId;
  }

  public String workspace() {
    return workspace;
  }

  /** Raw leading instruction text of the task. */
  public String instruction() {
    return instruction;
  }

  public String title() {
    return title;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Instant lastActivity() {
    return lastActivity;
  }

  public int messageCount() {
    return messageCount;
  }

  public int actionCount() {
    return actionCount;
  }

  public long totalSize() {
    return totalSize;
  }

  public String hostOs() {
    return hostOs;
  }

  public List<OutlineEntry> contentOutline() {
    return contentOutline;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TaskSkeleton that)) return false;
    return messageCount == that.messageCount
        && actionCount == that.actionCount
        && totalSize == that.totalSize
        && taskId.equals(that.taskId)
        && Objects.equals(parentTaskId, that.parentTaskId)
        && Objects.equals(workspace, that.workspace)
        && instruction.equals(that.instruction)
        && Objects.equals(title, that.title)
        && createdAt.equals(that.createdAt)
        && lastActivity.equals(that.lastActivity)
        && Objects.equals(hostOs, that.hostOs)
        && contentOutline.equals(that.contentOutline);
  }

  @Override
  public int hashCode() {
    return Objects.hash(taskId, parentTaskId, workspace, createdAt, lastActivity);
  }

  @Override
  public String toString() {
    return "TaskSkeleton{"
        + "taskId='"
        + taskId
        + '\''
        + ", parentTaskId="
        + parentTaskId
        + ", workspace="
        + workspace
        + ", createdAt="
        + createdAt
        + ", entries="
        + contentOutline.size()
        + '}';
  }

  public static final class Builder {
    private final String taskId;
    private String parentTaskId;
    private String workspace;
    private String instruction;
    private String title;
    private Instant createdAt;
    private Instant lastActivity;
    private int messageCount;
    private int actionCount;
    private long totalSize;
    private String hostOs;
    private List<OutlineEntry> contentOutline;

    private Builder(String taskId) {
      this.taskId = taskId;
    }

    public Builder parentTaskId(String parentTaskId) {
      this.parentTaskId = parentTaskId;
      return this;
    }

    public Builder workspace(String workspace) {
      this.workspace = workspace;
      return this;
    }

    public Builder instruction(String instruction) {
      this.instruction = instruction;
      return this;
    }

    public Builder title(String title) {
      this.title = title;
      return this;
    }

    public Builder createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public Builder lastActivity(Instant lastActivity) {
      this.lastActivity = lastActivity;
      return this;
    }

    public Builder messageCount(int messageCount) {
      this.messageCount = messageCount;
      return this;
    }

    public Builder actionCount(int actionCount) {
      this.actionCount = actionCount;
      return this;
    }

    public Builder totalSize(long totalSize) {
      this.totalSize = totalSize;
      return this;
    }

    public Builder hostOs(String hostOs) {
      this.hostOs = hostOs;
      return this;
    }

    public Builder contentOutline(List<OutlineEntry> contentOutline) {
      this.contentOutline = contentOutline;
      return this;
    }

    public TaskSkeleton build() {
      return new TaskSkeleton(this);
    }
  }
}

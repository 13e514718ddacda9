package com.gentoro.tasktree;

import com.gentoro.tasktree.cache.TaskRecord;
import com.gentoro.tasktree.model.OutlineEntry;
import com.gentoro.tasktree.model.TaskSkeleton;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Builders for task data shared by the tests. */
public final class TaskFixtures {
  public static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

  private TaskFixtures() {}

  public static Instant at(int minutes) {
    return T0.plus(Duration.ofMinutes(minutes));
  }

  /** Assistant text delegating {@code message} through a new_task block. */
  public static OutlineEntry delegation(String message) {
    return OutlineEntry.AssistantMessage.of(
        "I will delegate this.\n<new_task>\n<mode>code</mode>\n<message>"
            + message
            + "</message>\n</new_task>");
  }

  public static OutlineEntry newTaskCall(String message) {
    return OutlineEntry.ToolCall.of("new_task", Map.of("mode", "code", "message", message));
  }

  public static TaskSkeleton task(String id, int createdMinute, String instruction) {
    return skeleton(id, createdMinute, instruction).build();
  }

  public static TaskSkeleton.Builder skeleton(String id, int createdMinute, String instruction) {
    return TaskSkeleton.builder(id)
        .workspace("/ws/main")
        .instruction(instruction)
        .title(instruction)
        .createdAt(at(createdMinute))
        .lastActivity(at(createdMinute + 1))
        .contentOutline(List.of(OutlineEntry.UserMessage.of(instruction)));
  }

  /** Task whose outline delegates each of {@code children} after its own instruction. */
  public static TaskSkeleton parent(
      String id, int createdMinute, String instruction, String... children) {
    List<OutlineEntry> outline = new ArrayList<>();
    outline.add(OutlineEntry.UserMessage.of(instruction));
    for (String child : children) outline.add(delegation(child));
    return skeleton(id, createdMinute, instruction).contentOutline(outline).build();
  }

  public static TaskRecord record(String id, String workspace, String instruction, int minute) {
    return new TaskRecord(
        id,
        null,
        workspace,
        instruction,
        instruction,
        at(minute),
        at(minute),
        "linux",
        List.of(OutlineEntry.UserMessage.of(instruction)),
        0);
  }

  /** Clock that only moves when told to. */
  public static final class MutableClock extends Clock {
    private volatile Instant now;

    public MutableClock(Instant start) {
      this.now = start;
    }

    public void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}

package com.gentoro.tasktree.cache;

import com.gentoro.tasktree.model.OutlineEntry;
import java.time.Instant;
import java.util.List;

/**
 * A task as reported by the {@link RecordScanner}.
 *
 * @param totalSize size of the stored transcript in bytes, or 0 to derive it from the outline
 */
public record TaskRecord(
    String taskId,
    String parentTaskId,
    String workspace,
    String instruction,
    String title,
    Instant createdAt,
    Instant lastActivity,
    String hostOs,
    List<OutlineEntry> outline,
    long totalSize) {}

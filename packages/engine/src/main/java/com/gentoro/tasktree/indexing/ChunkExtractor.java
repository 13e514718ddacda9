package com.gentoro.tasktree.indexing;

import com.gentoro.tasktree.cache.SkeletonCache;
import com.gentoro.tasktree.hierarchy.ResolvedTree;
import com.gentoro.tasktree.model.OutlineEntry;
import com.gentoro.tasktree.model.OutlineKind;
import com.gentoro.tasktree.model.TaskSkeleton;
import com.gentoro.tasktree.utility.StringUtility;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Splits a task's content outline into chunks of at most {@code maxChunkChars} characters.
 *
 * <p>Consecutive user and assistant entries are packed into {@code message_exchange} chunks and
 * split only at entry boundaries; a single entry larger than the bound is cut into numbered parts.
 * Every tool call or result becomes its own {@code tool_interaction} chunk, which is not indexed.
 * Chunk ids are derived from the task id and position, so re-extracting unchanged content yields
 * the same ids.
 */
public class ChunkExtractor {
  private static final org.slf4j.Logger log =
      com.gentoro.tasktree.logging.LoggingService.getLogger(ChunkExtractor.class);

  public static final int DEFAULT_MAX_CHUNK_CHARS = 800;

  private final SkeletonCache cache;
  private final Supplier<ResolvedTree> tree;
  private final int maxChunkChars;

  /**
   * @param tree current resolved hierarchy, used for parent and root ids; may return null
   */
  public ChunkExtractor(SkeletonCache cache, Supplier<ResolvedTree> tree, int maxChunkChars) {
    if (maxChunkChars < 16) {
      throw new IllegalArgumentException("maxChunkChars too small: " + maxChunkChars);
    }
    this.cache = cache;
    this.tree = tree;
    this.maxChunkChars = maxChunkChars;
  }

  /** Chunks of {@code taskId}; empty when the task is unknown, empty or malformed. */
  public List<Chunk> extract(String taskId) {
    Optional<TaskSkeleton> skeleton = cache.get(taskId);
    if (skeleton.isEmpty()) {
      log.warn("Cannot extract chunks: task {} is not in the skeleton cache", taskId);
      return List.of();
    }
    try {
      List<Chunk> chunks = new Builder(skeleton.get(), relations(skeleton.get())).build();
      log.debug("Extracted {} chunks from task {}", chunks.size(), taskId);
      return chunks;
    } catch (RuntimeException e) {
      log.warn("Malformed record for task {}, no chunks extracted: {}", taskId, e.toString());
      return List.of();
    }
  }

  private String[] relations(TaskSkeleton skeleton) {
    ResolvedTree resolved = tree == null ? null : tree.get();
    if (resolved != null && resolved.contains(skeleton.taskId())) {
      return new String[] {
        resolved.getParent(skeleton.taskId()).orElse(null), resolved.rootOf(skeleton.taskId())
      };
    }
    String parent = skeleton.parentTaskId();
    return new String[] {parent, parent == null ? skeleton.taskId() : null};
  }

  private final class Builder {
    private final TaskSkeleton skeleton;
    private final String parentTaskId;
    private final String rootTaskId;
    private final List<Chunk> out = new ArrayList<>();
    private final StringBuilder pending = new StringBuilder();
    private String pendingRole;

    Builder(TaskSkeleton skeleton, String[] relations) {
      this.skeleton = skeleton;
      this.parentTaskId = relations[0];
      this.rootTaskId = relations[1];
    }

    List<Chunk> build() {
      for (OutlineEntry entry : skeleton.contentOutline()) {
        switch (entry.kind()) {
          case USER, ASSISTANT -> addMessage(entry);
          case TOOL_CALL, TOOL_RESULT -> addToolInteraction(entry);
        }
      }
      flush();
      return List.copyOf(out);
    }

    private void addMessage(OutlineEntry entry) {
      String body = entry.text().strip();
      if (body.isEmpty()) return;
      String role = entry.kind() == OutlineKind.USER ? "user" : "assistant";
      String line = role + ": " + body;

      if (line.length() > maxChunkChars) {
        flush();
        List<String> parts = split(line);
        int sequence = out.size();
        for (int i = 0; i < parts.size(); i++) {
          out.add(
              chunk(ChunkType.MESSAGE_EXCHANGE, sequence, i + 1, parts.size(), parts.get(i), role));
        }
        return;
      }
      if (pending.length() > 0 && pending.length() + 1 + line.length() > maxChunkChars) {
        flush();
      }
      if (pending.length() > 0) pending.append('\n');
      pending.append(line);
      pendingRole = pendingRole == null || pendingRole.equals(role) ? role : "conversation";
    }

    private void addToolInteraction(OutlineEntry entry) {
      flush();
      String tool =
          entry instanceof OutlineEntry.ToolCall call
              ? call.toolName()
              : ((OutlineEntry.ToolResult) entry).toolName();
      String prefix = entry.kind() == OutlineKind.TOOL_CALL ? "tool call " : "tool result ";
      String content =
          StringUtility.abbreviate(prefix + tool + ": " + entry.text().strip(), maxChunkChars);
      out.add(chunk(ChunkType.TOOL_INTERACTION, out.size(), 1, 1, content, "tool"));
    }

    private void flush() {
      if (pending.length() == 0) return;
      out.add(
          chunk(ChunkType.MESSAGE_EXCHANGE, out.size(), 1, 1, pending.toString(), pendingRole));
      pending.setLength(0);
      pendingRole = null;
    }

    private Chunk chunk(
        ChunkType type, int sequence, int part, int parts, String content, String role) {
      String seed = skeleton.taskId() + ":" + sequence + ":" + part;
      String id = UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8)).toString();
      return new Chunk(
          id,
          skeleton.taskId(),
          parentTaskId,
          rootTaskId,
          type,
          out.size(),
          skeleton.lastActivity(),
          content,
          role,
          type == ChunkType.MESSAGE_EXCHANGE,
          part,
          parts,
          skeleton.workspace(),
          skeleton.title(),
          skeleton.hostOs());
    }
  }

  /** Cuts {@code text} into pieces no longer than the bound, preferring whitespace. */
  List<String> split(String text) {
    List<String> parts = new ArrayList<>();
    int pos = 0;
    while (pos < text.length()) {
      int end = Math.min(text.length(), pos + maxChunkChars);
      if (end < text.length()) {
        int space = text.lastIndexOf(' ', end);
        if (space > pos + maxChunkChars / 2) end = space;
      }
      String part = text.substring(pos, end).strip();
      if (!part.isEmpty()) parts.add(part);
      pos = end;
    }
    return parts;
  }
}

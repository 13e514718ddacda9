package com.gentoro.tasktree.indexing;

import static com.gentoro.tasktree.TaskFixtures.parent;
import static com.gentoro.tasktree.TaskFixtures.task;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.tasktree.cache.SkeletonCache;
import com.gentoro.tasktree.hierarchy.HierarchyResolver;
import com.gentoro.tasktree.hierarchy.ResolvedTree;
import com.gentoro.tasktree.model.OutlineEntry;
import com.gentoro.tasktree.model.TaskSkeleton;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ChunkExtractorTest {

  @Mock private SkeletonCache cache;

  private ChunkExtractor extractor(int maxChars) {
    return new ChunkExtractor(cache, () -> null, maxChars);
  }

  private void cached(TaskSkeleton skeleton) {
    when(cache.get(skeleton.taskId())).thenReturn(Optional.of(skeleton));
  }

  private static TaskSkeleton withOutline(OutlineEntry... entries) {
    return task("t1", 0, "hello").toBuilder().contentOutline(List.of(entries)).build();
  }

  @Test
  @DisplayName("Consecutive messages share one message exchange chunk")
  void groupsMessages() {
    cached(
        withOutline(
            OutlineEntry.UserMessage.of("hello"), OutlineEntry.AssistantMessage.of("hi there")));

    List<Chunk> chunks = extractor(800).extract("t1");

    assertEquals(1, chunks.size());
    Chunk chunk = chunks.get(0);
    assertEquals(ChunkType.MESSAGE_EXCHANGE, chunk.chunkType());
    assertEquals("user: hello\nassistant: hi there", chunk.content());
    assertEquals("conversation", chunk.role());
    assertTrue(chunk.indexable());
  }

  @Test
  @DisplayName("Tool interactions get their own chunks and are not indexable")
  void toolInteractionsSeparateExchanges() {
    cached(
        withOutline(
            OutlineEntry.UserMessage.of("read the config"),
            OutlineEntry.ToolCall.of("read_file", Map.of("path", "app.yaml")),
            OutlineEntry.ToolResult.of("read_file", "port: 8080"),
            OutlineEntry.AssistantMessage.of("The port is 8080")));

    List<Chunk> chunks = extractor(800).extract("t1");

    assertEquals(
        List.of(
            ChunkType.MESSAGE_EXCHANGE,
            ChunkType.TOOL_INTERACTION,
            ChunkType.TOOL_INTERACTION,
            ChunkType.MESSAGE_EXCHANGE),
        chunks.stream().map(Chunk::chunkType).toList());
    assertEquals(List.of(0, 1, 2, 3), chunks.stream().map(Chunk::sequenceOrder).toList());
    assertFalse(chunks.get(1).indexable());
    assertEquals("tool result read_file: port: 8080", chunks.get(2).content());
    assertEquals("assistant", chunks.get(3).role());
  }

  @Test
  @DisplayName("A long message is split into bounded parts")
  void splitsLongMessages() {
    String longText = "word ".repeat(70).strip();
    cached(withOutline(OutlineEntry.AssistantMessage.of(longText)));

    List<Chunk> chunks = extractor(100).extract("t1");

    assertTrue(chunks.size() > 1);
    for (int i = 0; i < chunks.size(); i++) {
      Chunk c = chunks.get(i);
      assertTrue(c.content().length() <= 100, c.content());
      assertEquals(i + 1, c.chunkIndex());
      assertEquals(chunks.size(), c.totalChunks());
    }
    assertTrue(chunks.get(0).content().startsWith("assistant: word"));
  }

  @Test
  void chunkIdsAreStableAndUnique() {
    cached(
        withOutline(
            OutlineEntry.UserMessage.of("one"),
            OutlineEntry.ToolCall.of("list_files", null),
            OutlineEntry.AssistantMessage.of("two")));
    ChunkExtractor extractor = extractor(800);

    List<String> first = extractor.extract("t1").stream().map(Chunk::chunkId).toList();
    List<String> second = extractor.extract("t1").stream().map(Chunk::chunkId).toList();

    assertEquals(first, second);
    assertEquals(3, first.stream().distinct().count());
  }

  @Test
  void unknownOrEmptyTasksGiveNoChunks() {
    when(cache.get("missing")).thenReturn(Optional.empty());
    cached(withOutline());

    assertTrue(extractor(800).extract("missing").isEmpty());
    assertTrue(extractor(800).extract("t1").isEmpty());
  }

  @Test
  @DisplayName("Parent and root ids come from the resolved tree")
  void relationsFromTree() {
    TaskSkeleton root = parent("P", 0, "Build the web app", "Implement the login page");
    TaskSkeleton child = task("C", 5, "Implement the login page");
    ResolvedTree tree = new HierarchyResolver(false).reconstruct(List.of(root, child)).tree();
    cached(child);

    List<Chunk> chunks = new ChunkExtractor(cache, () -> tree, 800).extract("C");

    Map<String, Object> payload = chunks.get(0).payload();
    assertEquals("P", payload.get("parent_task_id"));
    assertEquals("P", payload.get("root_task_id"));
    assertEquals("C", payload.get("task_id"));
    assertEquals("message_exchange", payload.get("chunk_type"));
    assertEquals("/ws/main", payload.get("workspace"));
  }

  @Test
  void relationsWithoutTree() {
    cached(task("R", 0, "standalone"));
    cached(task("K", 1, "child").toBuilder().parentTaskId("R").build());

    Chunk root = extractor(800).extract("R").get(0);
    Chunk child = extractor(800).extract("K").get(0);

    assertNull(root.parentTaskId());
    assertEquals("R", root.rootTaskId());
    assertEquals("R", child.parentTaskId());
    assertNull(child.rootTaskId());
  }

  @Test
  void splitPrefersWhitespace() {
    ChunkExtractor extractor = extractor(20);

    List<String> parts = extractor.split("alpha beta gamma delta epsilon zeta");

    assertEquals(List.of("alpha beta gamma", "delta epsilon zeta"), parts);
  }

  @Test
  void rejectsTinyBound() {
    assertThrows(IllegalArgumentException.class, () -> new ChunkExtractor(cache, () -> null, 8));
  }
}

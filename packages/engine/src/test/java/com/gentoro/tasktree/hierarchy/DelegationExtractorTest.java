package com.gentoro.tasktree.hierarchy;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.tasktree.index.InstructionCanonicalizer;
import com.gentoro.tasktree.model.DelegationFragment;
import com.gentoro.tasktree.model.OutlineEntry;
import com.gentoro.tasktree.model.TaskSkeleton;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DelegationExtractorTest {

  private final DelegationExtractor extractor =
      new DelegationExtractor(InstructionCanonicalizer.DEFAULT_PREFIX_LENGTH);

  private static TaskSkeleton withOutline(OutlineEntry... entries) {
    return TaskSkeleton.builder("t").contentOutline(List.of(entries)).build();
  }

  private static List<String> texts(List<DelegationFragment> fragments) {
    return fragments.stream().map(DelegationFragment::text).toList();
  }

  @Test
  @DisplayName("Reads message and mode of new_task blocks")
  void newTaskBlock() {
    List<DelegationFragment> fragments =
        extractor.extract(
            withOutline(
                OutlineEntry.AssistantMessage.of(
                    "Delegating.\n<new_task>\n<mode>code</mode>\n"
                        + "<message>Implement the parser</message>\n</new_task>")));

    assertEquals(1, fragments.size());
    assertEquals(new DelegationFragment("Implement the parser", "code", 0), fragments.get(0));
  }

  @Test
  void newTaskToolCall() {
    List<DelegationFragment> fragments =
        extractor.extract(
            withOutline(
                OutlineEntry.ToolCall.of(
                    "new_task", Map.of("mode", "debug", "message", "Find the memory leak"))));

    assertEquals(List.of(new DelegationFragment("Find the memory leak", "debug", 0)), fragments);
  }

  @Test
  void bracketMarkersAndTaskBlocks() {
    List<DelegationFragment> fragments =
        extractor.extract(
            withOutline(
                OutlineEntry.AssistantMessage.of(
                    "[new_task in architect mode: 'Design the schema'] and later "
                        + "<task>Write the migration</task>")));

    assertEquals(List.of("Design the schema", "Write the migration"), texts(fragments));
    assertEquals("architect", fragments.get(0).mode());
    assertEquals(1, fragments.get(1).ordinal());
  }

  @Test
  void decodesEscapedMarkup() {
    List<DelegationFragment> fragments =
        extractor.extract(
            withOutline(
                OutlineEntry.AssistantMessage.of(
                    "&lt;new_task&gt;&lt;message&gt;Escaped delegation&lt;/message&gt;"
                        + "&lt;/new_task&gt;")));

    assertEquals(List.of("Escaped delegation"), texts(fragments));
  }

  @Test
  @DisplayName("Ignores user messages, tool results, short and duplicate fragments")
  void ignoredContent() {
    List<DelegationFragment> fragments =
        extractor.extract(
            withOutline(
                OutlineEntry.UserMessage.of("<task>User typed this task</task>"),
                OutlineEntry.ToolResult.of("read_file", "<task>From a file content</task>"),
                OutlineEntry.AssistantMessage.of("<task>Do it</task>"),
                OutlineEntry.AssistantMessage.of("<task>Deploy the service</task>"),
                OutlineEntry.AssistantMessage.of("<task>deploy   THE service</task>")));

    assertEquals(List.of("Deploy the service"), texts(fragments));
  }

  @Test
  void taskBlockInsideNewTaskIsNotCountedTwice() {
    List<DelegationFragment> fragments =
        extractor.extract(
            withOutline(
                OutlineEntry.AssistantMessage.of(
                    "<new_task><message><task>Nested work item</task></message></new_task>")));

    assertEquals(List.of("Nested work item"), texts(fragments));
  }

  @Test
  void emptyOutline() {
    assertTrue(extractor.extract(TaskSkeleton.builder("t").build()).isEmpty());
  }
}

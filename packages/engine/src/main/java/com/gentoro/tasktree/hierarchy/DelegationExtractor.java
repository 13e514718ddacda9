package com.gentoro.tasktree.hierarchy;

import com.gentoro.tasktree.index.InstructionCanonicalizer;
import com.gentoro.tasktree.model.DelegationFragment;
import com.gentoro.tasktree.model.OutlineEntry;
import com.gentoro.tasktree.model.TaskSkeleton;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the directives by which a task delegates work to child tasks.
 *
 * <p>Recognized forms, in assistant text and tool calls:
 *
 * <ul>
 *   <li>a {@code new_task} tool call with a {@code message} (or {@code content}) argument;
 *   <li>{@code <new_task>} blocks, using their {@code <message>} element when present;
 *   <li>{@code [new_task in <mode> mode: '<message>']} markers;
 *   <li>{@code <task>...</task>} blocks.
 * </ul>
 *
 * User messages are not scanned: they carry the task's own instruction, not delegations.
 */
public class DelegationExtractor {
  static final int MIN_FRAGMENT_LENGTH = 6;

  private static final Pattern NEW_TASK_BLOCK =
      Pattern.compile(
          "<new_task\\b[^>]*>(.*?)</new_task\\s*>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  private static final Pattern MESSAGE =
      Pattern.compile("<message>(.*?)</message>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  private static final Pattern MODE =
      Pattern.compile("<mode>(.*?)</mode>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  private static final Pattern BRACKET_MARKER =
      Pattern.compile(
          "\\[new_task in (.+?) mode:\\s*'(.*?)'\\s*\\]",
          Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  private static final Pattern TASK_BLOCK =
      Pattern.compile("<task>(.*?)</task>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  private static final Pattern TAG = Pattern.compile("<[^>]*>");

  private final int prefixLength;

  public DelegationExtractor(int prefixLength) {
    this.prefixLength = prefixLength;
  }

  /** Fragments declared by {@code skeleton}, in outline order, without canonical duplicates. */
  public List<DelegationFragment> extract(TaskSkeleton skeleton) {
    List<DelegationFragment> fragments = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (OutlineEntry entry : skeleton.contentOutline()) {
      List<Found> found =
          switch (entry.kind()) {
            case ASSISTANT -> fromText(entry.text());
            case TOOL_CALL -> fromToolCall((OutlineEntry.ToolCall) entry);
            case USER, TOOL_RESULT -> List.of();
          };
      for (Found f : found) {
        String text = f.text.strip();
        if (text.length() < MIN_FRAGMENT_LENGTH) continue;
        String key = InstructionCanonicalizer.canonicalize(text, prefixLength);
        if (key.isEmpty() || !seen.add(key)) continue;
        fragments.add(new DelegationFragment(text, f.mode, fragments.size()));
      }
    }
    return fragments;
  }

  private List<Found> fromToolCall(OutlineEntry.ToolCall call) {
    String name = call.toolName().replace("_", "").toLowerCase(Locale.ROOT);
    if (name.equals("newtask")) {
      String message = call.argument("message");
      if (message == null) message = call.argument("content");
      if (message != null) {
        String mode = call.argument("mode");
        return List.of(new Found(0, InstructionCanonicalizer.decode(message), mode));
      }
    }
    // tool calls rendered as text can still carry markers
    return fromText(call.text());
  }

  private List<Found> fromText(String raw) {
    if (raw == null || raw.isEmpty()) return List.of();
    String text = InstructionCanonicalizer.decode(raw);
    List<Found> found = new ArrayList<>();

    Matcher block = NEW_TASK_BLOCK.matcher(text);
    while (block.find()) {
      String inner = block.group(1);
      Matcher message = MESSAGE.matcher(inner);
      Matcher mode = MODE.matcher(inner);
      String modeValue = mode.find() ? stripTags(mode.group(1)) : null;
      String body = message.find() ? message.group(1) : inner;
      found.add(new Found(block.start(), stripTags(body), modeValue));
    }

    Matcher marker = BRACKET_MARKER.matcher(text);
    while (marker.find()) {
      found.add(new Found(marker.start(), marker.group(2), marker.group(1).strip()));
    }

    Matcher task = TASK_BLOCK.matcher(text);
    while (task.find()) {
      if (insideNewTaskBlock(task.start(), text)) continue;
      found.add(new Found(task.start(), stripTags(task.group(1)), null));
    }

    found.sort(Comparator.comparingInt(f -> f.position));
    return found;
  }

  private static boolean insideNewTaskBlock(int position, String text) {
    Matcher block = NEW_TASK_BLOCK.matcher(text);
    while (block.find()) {
      if (position >= block.start() && position < block.end()) return true;
    }
    return false;
  }

  private static String stripTags(String text) {
    return TAG.matcher(text).replaceAll(" ").replaceAll("\\s+", " ").strip();
  }

  private record Found(int position, String text, String mode) {}
}

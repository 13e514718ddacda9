package com.gentoro.tasktree.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of a task's content outline.
 *
 * <p>The four variants are {@link UserMessage}, {@link AssistantMessage}, {@link ToolCall} and
 * {@link ToolResult}. Consumers switch on {@link #kind()}.
 */
public interface OutlineEntry {

  OutlineKind kind();

  /** Text of the entry, possibly truncated by the scanner. */
  String text();

  /** Size of the original content in characters. */
  int size();

  boolean truncated();

  record UserMessage(String text, int size, boolean truncated) implements OutlineEntry {
    public UserMessage {
      text = Objects.requireNonNullElse(text, "");
    }

    public static UserMessage of(String text) {
      return new UserMessage(text, text == null ? 0 : text.length(), false);
    }

    @Override
    public OutlineKind kind() {
      return OutlineKind.USER;
    }
  }

  record AssistantMessage(String text, int size, boolean truncated) implements OutlineEntry {
    public AssistantMessage {
      text = Objects.requireNonNullElse(text, "");
    }

    public static AssistantMessage of(String text) {
      return new AssistantMessage(text, text == null ? 0 : text.length(), false);
    }

    @Override
    public OutlineKind kind() {
      return OutlineKind.ASSISTANT;
    }
  }

  /** A tool invocation; {@code arguments} holds the decoded call parameters. */
  record ToolCall(
      String toolName, Map<String, Object> arguments, String text, int size, boolean truncated)
      implements OutlineEntry {
    public ToolCall {
      toolName = Objects.requireNonNullElse(toolName, "");
      arguments =
          arguments == null
              ? Map.of()
              : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
      text = Objects.requireNonNullElse(text, "");
    }

    public static ToolCall of(String toolName, Map<String, Object> arguments) {
      String rendered = toolName + " " + (arguments == null ? "{}" : arguments.toString());
      return new ToolCall(toolName, arguments, rendered, rendered.length(), false);
    }

    public String argument(String name) {
      Object value = arguments.get(name);
      return value == null ? null : value.toString();
    }

    @Override
    public OutlineKind kind() {
      return OutlineKind.TOOL_CALL;
    }
  }

  record ToolResult(String toolName, String text, int size, boolean truncated)
      implements OutlineEntry {
    public ToolResult {
      toolName = Objects.requireNonNullElse(toolName, "");
      text = Objects.requireNonNullElse(text, "");
    }

    public static ToolResult of(String toolName, String text) {
      return new ToolResult(toolName, text, text == null ? 0 : text.length(), false);
    }

    @Override
    public OutlineKind kind() {
      return OutlineKind.TOOL_RESULT;
    }
  }
}

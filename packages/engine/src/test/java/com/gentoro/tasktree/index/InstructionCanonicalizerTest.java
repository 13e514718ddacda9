package com.gentoro.tasktree.index;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InstructionCanonicalizerTest {

  @Test
  @DisplayName("Moves new_task content after the surrounding text and drops the tags")
  void newTaskBlockContentIsKept() {
    String canonical =
        InstructionCanonicalizer.canonicalize("<new_task>\nDo X\n</new_task> some narration");

    assertTrue(canonical.contains("do x"), canonical);
    assertFalse(canonical.contains("new_task"), canonical);
    assertFalse(canonical.contains("<"), canonical);
    assertEquals("some narration do x", canonical);
  }

  @Test
  void lowercasesAndCollapsesWhitespace() {
    assertEquals(
        "fix the login bug",
        InstructionCanonicalizer.canonicalize("  Fix   the\tLOGIN\r\n\n bug  "));
  }

  @Test
  void decodesEscapesAndEntities() {
    assertEquals("fix the bug", InstructionCanonicalizer.canonicalize("Fix\\nthe\\tbug"));
    assertEquals(
        "bold text", InstructionCanonicalizer.canonicalize("&lt;b&gt;Bold&lt;/b&gt; text"));
    assertEquals("a & b", InstructionCanonicalizer.canonicalize("a &amp;amp; b"));
  }

  @Test
  void stripsByteOrderMarks() {
    assertEquals(
        "hello world", InstructionCanonicalizer.canonicalize("\uFEFFHello \uFEFFworld"));
  }

  @Test
  void truncatesToRequestedLength() {
    String canonical = InstructionCanonicalizer.canonicalize("a".repeat(500));
    assertEquals(InstructionCanonicalizer.DEFAULT_PREFIX_LENGTH, canonical.length());

    assertEquals(32, InstructionCanonicalizer.canonicalize("b".repeat(100), 32).length());
  }

  @Test
  void emptyInputsGiveEmptyPrefix() {
    assertEquals("", InstructionCanonicalizer.canonicalize(null));
    assertEquals("", InstructionCanonicalizer.canonicalize(""));
    assertEquals("", InstructionCanonicalizer.canonicalize("   \n\t "));
    assertEquals("", InstructionCanonicalizer.canonicalize("<br/><hr>"));
    assertEquals("", InstructionCanonicalizer.canonicalize("text", 0));
  }

  @Test
  @DisplayName("Canonicalizing a canonical prefix returns it unchanged")
  void idempotent() {
    String[] inputs = {
      "<new_task><mode>code</mode><message>Build the &quot;parser&quot;\\n now</message>"
          + "</new_task>",
      "Plain instruction with &amp;lt; entities &#65; and \\\\n escapes",
      "<message>Refactor</message> then <b>test</b> & deploy > prod",
      "x".repeat(300) + " tail",
      "Ünïcödé TEXT 😀 with emoji"
    };
    for (String input : inputs) {
      String once = InstructionCanonicalizer.canonicalize(input);
      assertEquals(once, InstructionCanonicalizer.canonicalize(once), input);
    }
  }

  @Test
  void declarationAndChildInstructionCanonicalizeAlike() {
    String declared =
        "<new_task>\n<mode>code</mode>\n<message>Implement the OAuth login page</message>\n"
            + "</new_task>";
    String child = "Implement the OAuth login page";

    String parentSide = InstructionCanonicalizer.canonicalize(declared);
    String childSide = InstructionCanonicalizer.canonicalize(child);
    assertTrue(parentSide.endsWith(childSide), parentSide);
  }
}

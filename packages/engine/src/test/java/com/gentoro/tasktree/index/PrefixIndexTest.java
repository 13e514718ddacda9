package com.gentoro.tasktree.index;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PrefixIndexTest {

  private static final String COMMON = "abcdefghij".repeat(6);

  @Test
  @DisplayName("A unique declaration is found for the identical child instruction")
  void uniqueExactMatch() {
    PrefixIndex index = new PrefixIndex();
    assertTrue(index.insert("P", "Implement the login page with OAuth support"));

    List<PrefixMatch> matches =
        index.searchExactPrefix("Implement the login page with OAuth support");

    assertEquals(1, matches.size());
    assertEquals("P", matches.get(0).taskId());
    assertEquals(
        "implement the login page with oauth support".length(),
        matches.get(0).matchedPrefixLength());
    assertEquals(0, matches.get(0).fragmentOrdinal());
  }

  @Test
  @DisplayName("Falls back to shorter lengths when the full prefixes differ")
  void decreasingLengths() {
    PrefixIndex index = new PrefixIndex();
    index.insert("P", COMMON + "declaredtailthatdiffers");

    List<PrefixMatch> matches = index.searchExactPrefix(COMMON + "childtail");

    assertEquals(1, matches.size());
    assertEquals("P", matches.get(0).taskId());
    assertEquals(COMMON.length(), matches.get(0).matchedPrefixLength());
  }

  @Test
  void shortTextMatchesOnlyWhenIdentical() {
    PrefixIndex index = new PrefixIndex();
    index.insert("P", "run tests");

    assertEquals(1, index.searchExactPrefix("Run   TESTS").size());
    assertTrue(index.searchExactPrefix("run tests now").isEmpty());
    assertTrue(index.searchExactPrefix("run").isEmpty());
  }

  @Test
  @DisplayName("Returns every declaring task of a colliding prefix")
  void allHitsAreReturned() {
    PrefixIndex index = new PrefixIndex();
    index.insert("A", "Write the release notes for version two");
    index.insert("B", "Write the release notes for version two");
    index.insert("C", "Something else entirely, nothing shared");

    List<PrefixMatch> matches = index.searchExactPrefix("Write the release notes for version two");

    assertEquals(List.of("A", "B"), matches.stream().map(PrefixMatch::taskId).toList());
  }

  @Test
  void excludedTaskIsNeverReported() {
    PrefixIndex index = new PrefixIndex();
    index.insert("self", "Write the release notes for version two");

    assertTrue(
        index.searchExactPrefix("Write the release notes for version two", 192, "self").isEmpty());
  }

  @Test
  void rejectsBlankAndDuplicateDeclarations() {
    PrefixIndex index = new PrefixIndex();
    assertFalse(index.insert("P", "   "));
    assertTrue(index.insert("P", "Deploy to staging"));
    assertFalse(index.insert("P", "deploy   to STAGING"));
    assertTrue(index.insert("Q", "Deploy to staging"));

    assertEquals(List.of("deploy to staging"), index.getInstructions("P"));
    assertEquals(List.of(), index.getInstructions("unknown"));
  }

  @Test
  void statsAndClear() {
    PrefixIndex index = new PrefixIndex();
    index.insert("P", "first declaration");
    index.insert("P", "second declaration");
    index.insert("Q", "first declaration");

    assertEquals(new IndexStats(3, 2, 2), index.getStats());

    index.clear();
    assertEquals(new IndexStats(0, 0, 0), index.getStats());
    assertTrue(index.searchExactPrefix("first declaration").isEmpty());
  }

  @Test
  void searchLengthSchedule() {
    List<Integer> lengths = PrefixIndex.searchLengths(192);
    assertEquals(192, lengths.get(0));
    assertEquals(176, lengths.get(1));
    assertEquals(List.of(48, 32, 16), lengths.subList(lengths.size() - 3, lengths.size()));

    assertEquals(List.of(40, 16), PrefixIndex.searchLengths(40));
    assertEquals(List.of(20, 16), PrefixIndex.searchLengths(20));
  }

  @Test
  void rejectsNonPositiveLength() {
    assertThrows(IllegalArgumentException.class, () -> new PrefixIndex(0));
  }
}

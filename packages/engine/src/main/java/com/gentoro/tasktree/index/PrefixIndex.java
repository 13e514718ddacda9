package com.gentoro.tasktree.index;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Character trie from canonical delegation prefixes to the tasks that declared them.
 *
 * <p>Lookups try decreasing prefix lengths and return every declaring task at the longest length
 * that matches. Colliding declarations from several parents are all kept. The index is not thread
 * safe; it is built and queried by a single reconstruction pass.
 */
public class PrefixIndex {
  private static final int LENGTH_STEP = 16;
  private static final int MIN_STEPPED_LENGTH = 32;

  private final int prefixLength;
  private final Node root = new Node();
  private final Map<String, List<Entry>> byParent = new LinkedHashMap<>();
  private long sequence = 0;
  private int totalInstructions = 0;
  private int distinctPrefixes = 0;

  public PrefixIndex() {
    this(InstructionCanonicalizer.DEFAULT_PREFIX_LENGTH);
  }

  public PrefixIndex(int prefixLength) {
    if (prefixLength <= 0) {
      throw new IllegalArgumentException("prefixLength must be positive: " + prefixLength);
    }
    this.prefixLength = prefixLength;
  }

  public int prefixLength() {
    return prefixLength;
  }

  /**
   * Canonicalizes {@code fragmentText} and records it as declared by {@code taskId}.
   *
   * @return false when the fragment is blank after canonicalization or already declared by the
   *     same task
   */
  public boolean insert(String taskId, String fragmentText) {
    Objects.requireNonNull(taskId, "taskId");
    String prefix = InstructionCanonicalizer.canonicalize(fragmentText, prefixLength);
    if (prefix.isEmpty()) return false;

    List<Entry> declared = byParent.computeIfAbsent(taskId, k -> new ArrayList<>());
    for (Entry e : declared) {
      if (e.prefix.equals(prefix)) return false;
    }

    Node node = root;
    for (int i = 0; i < prefix.length(); i++) {
      node = node.children.computeIfAbsent(prefix.charAt(i), c -> new Node());
    }
    if (node.terminal.isEmpty()) distinctPrefixes++;

    Entry entry = new Entry(taskId, prefix, fragmentText.length(), declared.size(), sequence++);
    node.terminal.add(entry);
    declared.add(entry);
    totalInstructions++;
    return true;
  }

  public List<PrefixMatch> searchExactPrefix(String childText) {
    return searchExactPrefix(childText, prefixLength, null);
  }

  public List<PrefixMatch> searchExactPrefix(String childText, int maxLength) {
    return searchExactPrefix(childText, maxLength, null);
  }

  /**
   * Finds the tasks whose declarations match the child's instruction.
   *
   * <p>The child text is canonicalized, then lengths {@code maxLength}, {@code maxLength - 16},
   * ... 32, 16 are tried in turn. At length L a declaration matches when both strings have at
   * least L characters and agree on the first L, or when both are identical. All matches of the
   * first length that yields any are returned, one per task, longest shared prefix first.
   *
   * @param excludeTaskId task never reported as a match (the child itself), may be null
   */
  public List<PrefixMatch> searchExactPrefix(
      String childText, int maxLength, String excludeTaskId) {
    String child = InstructionCanonicalizer.canonicalize(childText, maxLength);
    if (child.isEmpty()) return List.of();

    for (int length : searchLengths(maxLength)) {
      List<Entry> hits = lookup(child, length);
      if (excludeTaskId != null) hits.removeIf(e -> e.taskId.equals(excludeTaskId));
      if (!hits.isEmpty()) {
        return toMatches(child, hits);
      }
    }
    return List.of();
  }

  /** Canonical declarations of one task, in insertion order. */
  public List<String> getInstructions(String taskId) {
    List<Entry> declared = byParent.get(taskId);
    if (declared == null) return List.of();
    List<String> out = new ArrayList<>(declared.size());
    for (Entry e : declared) out.add(e.prefix);
    return Collections.unmodifiableList(out);
  }

  public IndexStats getStats() {
    return new IndexStats(totalInstructions, byParent.size(), distinctPrefixes);
  }

  public void clear() {
    root.children.clear();
    root.terminal.clear();
    byParent.clear();
    sequence = 0;
    totalInstructions = 0;
    distinctPrefixes = 0;
  }

  static List<Integer> searchLengths(int maxLength) {
    List<Integer> lengths = new ArrayList<>();
    for (int l = maxLength; l >= MIN_STEPPED_LENGTH; l -= LENGTH_STEP) {
      lengths.add(l);
    }
    if (lengths.isEmpty()) {
      lengths.add(maxLength);
      if (maxLength > LENGTH_STEP) lengths.add(LENGTH_STEP);
    } else if (lengths.get(lengths.size() - 1) > LENGTH_STEP) {
      lengths.add(LENGTH_STEP);
    }
    return lengths;
  }

  private List<Entry> lookup(String child, int length) {
    List<Entry> hits = new ArrayList<>();
    if (child.length() >= length) {
      Node node = walk(child, length);
      if (node != null) collect(node, hits);
    } else {
      Node node = walk(child, child.length());
      if (node != null) hits.addAll(node.terminal);
    }
    return hits;
  }

  private Node walk(String text, int length) {
    Node node = root;
    for (int i = 0; i < length && node != null; i++) {
      node = node.children.get(text.charAt(i));
    }
    return node;
  }

  private static void collect(Node start, List<Entry> out) {
    Deque<Node> stack = new ArrayDeque<>();
    stack.push(start);
    while (!stack.isEmpty()) {
      Node node = stack.pop();
      out.addAll(node.terminal);
      for (Node child : node.children.values()) stack.push(child);
    }
  }

  private static List<PrefixMatch> toMatches(String child, List<Entry> hits) {
    hits.sort(Comparator.comparingLong(e -> e.sequence));
    Map<String, PrefixMatch> best = new LinkedHashMap<>();
    for (Entry e : hits) {
      int shared = commonPrefixLength(child, e.prefix);
      PrefixMatch current = best.get(e.taskId);
      if (current == null || shared > current.matchedPrefixLength()) {
        best.put(e.taskId, new PrefixMatch(e.taskId, shared, e.ordinal, e.prefix));
      }
    }
    List<PrefixMatch> matches = new ArrayList<>(best.values());
    // stable sort keeps insertion order among equal lengths
    matches.sort(Comparator.comparingInt(PrefixMatch::matchedPrefixLength).reversed());
    return Collections.unmodifiableList(matches);
  }

  private static int commonPrefixLength(String a, String b) {
    int n = Math.min(a.length(), b.length());
    int i = 0;
    while (i < n && a.charAt(i) == b.charAt(i)) i++;
    return i;
  }

  private static final class Node {
    private final Map<Character, Node> children = new HashMap<>();
    private final List<Entry> terminal = new ArrayList<>(1);
  }

  private record Entry(
      String taskId, String prefix, int fragmentLength, int ordinal, long sequence) {}
}

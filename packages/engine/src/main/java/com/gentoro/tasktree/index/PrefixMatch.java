package com.gentoro.tasktree.index;

/**
 * A declaring task found for a child instruction.
 *
 * @param taskId the declaring (candidate parent) task
 * @param matchedPrefixLength canonical characters shared by the child and the declaration
 * @param fragmentOrdinal position of the matching fragment within the declaring task
 * @param prefix the canonical declaration that matched
 */
public record PrefixMatch(
    String taskId, int matchedPrefixLength, int fragmentOrdinal, String prefix) {}

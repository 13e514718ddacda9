package com.gentoro.tasktree.indexing.driver;

/**
 * Health metrics of one collection as reported by the store.
 *
 * @param status store specific status, e.g. green, yellow, red
 * @param optimizerStatus "ok" or the optimizer error message
 */
public record CollectionInfo(
    String status,
    long pointCount,
    long segmentCount,
    long indexedVectorCount,
    String optimizerStatus) {}

package com.gentoro.tasktree.index;

public record IndexStats(int totalInstructions, int parentCount, int distinctPrefixes) {}

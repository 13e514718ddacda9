package com.gentoro.tasktree.search;

public enum SearchMode {
  SEMANTIC,
  /** Token matching over cached skeletons, used when the vector path is unavailable. */
  SUBSTRING
}

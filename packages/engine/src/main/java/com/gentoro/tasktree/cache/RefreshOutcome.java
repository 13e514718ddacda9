package com.gentoro.tasktree.cache;

public enum RefreshOutcome {
  FULL_REBUILD,
  INCREMENTAL,
  UP_TO_DATE,
  FAILED
}

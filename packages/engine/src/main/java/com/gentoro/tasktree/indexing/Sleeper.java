package com.gentoro.tasktree.indexing;

import java.time.Duration;

/** Blocking delay, replaceable in tests. */
@FunctionalInterface
public interface Sleeper {
  Sleeper SYSTEM = d -> Thread.sleep(d.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}

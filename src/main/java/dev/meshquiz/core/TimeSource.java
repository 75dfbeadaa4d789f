package dev.meshquiz.core;

import java.time.Instant;

/** Wall clock plus a monotonic counter for pacing. Replaced by a fake in tests. */
public interface TimeSource {
  Instant now();

  long nanoTime();

  static TimeSource system() { return SystemTime.INSTANCE; }

  enum SystemTime implements TimeSource {
    INSTANCE;

    @Override public Instant now() { return Instant.now(); }

    @Override public long nanoTime() { return System.nanoTime(); }
  }
}

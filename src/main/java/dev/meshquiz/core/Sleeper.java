package dev.meshquiz.core;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {
  void sleep(Duration duration) throws InterruptedException;

  /** Blocks the calling thread; zero and negative durations return at once. */
  static Sleeper thread() {
    return duration -> {
      if (duration.isZero() || duration.isNegative()) {
        return;
      }
      long millis = duration.toMillis();
      int nanos = (int) (duration.toNanos() - millis * 1_000_000L);
      Thread.sleep(millis, Math.max(0, nanos));
    };
  }
}

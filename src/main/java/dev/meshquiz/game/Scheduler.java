package dev.meshquiz.game;

import java.time.Duration;
import java.time.Instant;

/**
 * Delayed callbacks for the game session. Callbacks may run on any thread; the session
 * serializes them against commands with its own lock.
 */
public interface Scheduler {
  Instant now();

  /**
   * Runs {@code task} once after {@code delay}.
   *
   * @throws java.util.concurrent.RejectedExecutionException if the timer cannot be scheduled
   */
  TimerHandle after(Duration delay, Runnable task);

  default boolean cancel(TimerHandle handle) {
    return handle != null && handle.cancel();
  }
}

package dev.meshquiz.game;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** {@link Scheduler} backed by one daemon thread. Rejects new timers once closed. */
public final class ExecutorScheduler implements Scheduler, AutoCloseable {
  private static final Logger LOGGER = LogManager.getLogger("MeshQuiz/Scheduler");

  private final Clock clock;
  private final ScheduledThreadPoolExecutor executor;

  public ExecutorScheduler(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.executor = new ScheduledThreadPoolExecutor(1, r -> {
      Thread t = new Thread(r, "MeshQuiz-Scheduler");
      t.setDaemon(true);
      return t;
    });
    this.executor.setRemoveOnCancelPolicy(true);
    this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
  }

  @Override
  public Instant now() { return clock.instant(); }

  @Override
  public TimerHandle after(Duration delay, Runnable task) {
    Objects.requireNonNull(task, "task");
    long nanos = Math.max(0L, delay.toNanos());
    ScheduledFuture<?> future = executor.schedule(() -> runSafely(task), nanos, TimeUnit.NANOSECONDS);
    return () -> future.cancel(false);
  }

  int pending() { return executor.getQueue().size(); }

  private static void runSafely(Runnable task) {
    try {
      task.run();
    } catch (RuntimeException e) {
      LOGGER.error("Scheduled task failed", e);
    }
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }
}

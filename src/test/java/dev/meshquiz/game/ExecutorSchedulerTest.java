package dev.meshquiz.game;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class ExecutorSchedulerTest {
  @Test
  void runsTaskAfterDelay() throws Exception {
    try (ExecutorScheduler scheduler = new ExecutorScheduler(Clock.systemUTC())) {
      CountDownLatch ran = new CountDownLatch(1);

      scheduler.after(Duration.ofMillis(20), ran::countDown);

      assertTrue(ran.await(2, TimeUnit.SECONDS));
    }
  }

  @Test
  void cancelledTaskNeverRuns() throws Exception {
    try (ExecutorScheduler scheduler = new ExecutorScheduler(Clock.systemUTC())) {
      AtomicBoolean ran = new AtomicBoolean();
      TimerHandle handle = scheduler.after(Duration.ofMillis(200), () -> ran.set(true));

      assertTrue(scheduler.cancel(handle));
      assertEquals(0, scheduler.pending());
      Thread.sleep(300);

      assertFalse(ran.get());
      assertFalse(scheduler.cancel(null));
    }
  }

  @Test
  void failingTaskDoesNotKillTheTimerThread() throws Exception {
    try (ExecutorScheduler scheduler = new ExecutorScheduler(Clock.systemUTC())) {
      CountDownLatch ran = new CountDownLatch(1);
      scheduler.after(Duration.ZERO, () -> {
        throw new IllegalStateException("boom");
      });
      scheduler.after(Duration.ofMillis(10), ran::countDown);

      assertTrue(ran.await(2, TimeUnit.SECONDS));
    }
  }

  @Test
  void closedSchedulerRejectsNewTimers() {
    Instant fixed = Instant.parse("2026-01-01T00:00:00Z");
    ExecutorScheduler scheduler = new ExecutorScheduler(Clock.fixed(fixed, ZoneOffset.UTC));
    assertEquals(fixed, scheduler.now());

    scheduler.close();

    assertThrows(
        RejectedExecutionException.class, () -> scheduler.after(Duration.ofSeconds(1), () -> {}));
  }
}

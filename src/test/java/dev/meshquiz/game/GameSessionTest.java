package dev.meshquiz.game;

import static org.junit.jupiter.api.Assertions.*;

import dev.meshquiz.api.Announcement;
import dev.meshquiz.api.Outbox;
import dev.meshquiz.api.SendResult;
import dev.meshquiz.game.IntakeResult.RejectReason;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.Test;

class GameSessionTest {
  private static final String ADMIN = "!admin01";
  private static final Duration WINDOW = Duration.ofSeconds(120);
  private static final Duration INTERVAL = Duration.ofSeconds(180);

  private final ManualScheduler scheduler = new ManualScheduler();
  private final RecordingOutbox outbox = new RecordingOutbox();

  @Test
  void startByNonAdminIsUnauthorizedAndSessionStaysIdle() {
    GameSession session = session(3, new InMemoryLedger());

    CommandResult result = session.start("!player");

    assertFalse(result.ok());
    assertEquals(ErrorKind.UNAUTHORIZED, result.error());
    assertEquals(GameStatus.IDLE, session.snapshot().status());
    assertEquals(0, scheduler.pending());
    assertTrue(outbox.announcements.isEmpty());
  }

  @Test
  void adminIdsMatchWithOrWithoutLeadingBang() {
    GameSession session = session(3, new InMemoryLedger());

    assertTrue(session.start("ADMIN01").ok());
  }

  @Test
  void startOpensFirstRoundAndAnnouncesIt() {
    GameSession session = session(3, new InMemoryLedger());

    CommandResult result = session.start(ADMIN);

    assertTrue(result.ok());
    GameSession.Snapshot snapshot = session.snapshot();
    assertEquals(GameStatus.RUNNING, snapshot.status());
    assertEquals(1, snapshot.roundNumber());
    assertEquals(RoundStatus.OPEN, snapshot.roundStatus());
    assertEquals(scheduler.now().plus(WINDOW), snapshot.closesAt());
    assertEquals(
        List.of(Announcement.Kind.GAME_STARTED, Announcement.Kind.ROUND_OPENED), outbox.kinds());
    assertTrue(outbox.announcements.get(1).text().contains("What port does SSH use?"));
  }

  @Test
  void startWhileRunningIsInvalidState() {
    GameSession session = session(3, new InMemoryLedger());
    session.start(ADMIN);

    CommandResult again = session.start(ADMIN);

    assertEquals(ErrorKind.INVALID_STATE, again.error());
    assertEquals(1, session.snapshot().roundNumber());
  }

  @Test
  void answersAreGradedOnlyWhenTheRoundCloses() {
    InMemoryLedger ledger = new InMemoryLedger();
    GameSession session = session(3, ledger);
    session.start(ADMIN);

    assertTrue(session.submit("!alice", "Alice", "  TWENTY-TWO ").accepted());
    assertTrue(session.submit("!bob", "Bob", "23").accepted());
    assertEquals(0, ledger.totalOf("alice"));
    assertEquals(0, ledger.totalOf("bob"));

    scheduler.advance(WINDOW);

    assertEquals(100, ledger.totalOf("alice"));
    assertEquals(-100, ledger.totalOf("bob"));
    assertEquals(0, ledger.totalOf("carol"));
    Settlement settlement = session.lastSettlement();
    assertEquals(1, settlement.roundNumber());
    assertEquals(0, settlement.deltaSum());
    assertEquals(RoundStatus.CLOSED, session.snapshot().roundStatus());
    String text = outbox.last(Announcement.Kind.ROUND_SETTLED);
    assertTrue(text.startsWith("Round 1 answer: 22"));
    assertTrue(text.contains("+100 Alice"));
    assertTrue(text.contains("-100 Bob"));
  }

  @Test
  void secondSubmissionIsDuplicateEvenWhenFirstWasWrong() {
    InMemoryLedger ledger = new InMemoryLedger();
    GameSession session = session(3, ledger);
    session.start(ADMIN);

    assertTrue(session.submit("!alice", "Alice", "21").accepted());
    IntakeResult retry = session.submit("!ALICE", "Alice", "22");

    assertFalse(retry.accepted());
    assertEquals(RejectReason.DUPLICATE_SUBMISSION, retry.reason());
    scheduler.advance(WINDOW);
    assertEquals(-100, ledger.totalOf("alice"));
  }

  @Test
  void bannedPlayerIsRejectedAndUnbanRestoresPlay() {
    GameSession session = session(3, new InMemoryLedger());
    session.start(ADMIN);

    assertTrue(session.ban(ADMIN, "mallory").ok());
    assertEquals(RejectReason.BANNED, session.submit("!mallory", "M", "22").reason());

    assertTrue(session.unban(ADMIN, "!mallory").ok());
    assertTrue(session.submit("!mallory", "M", "22").accepted());
  }

  @Test
  void banKeepsScoresAlreadyEarned() {
    InMemoryLedger ledger = new InMemoryLedger();
    GameSession session = session(3, ledger);
    session.start(ADMIN);
    session.submit("!alice", "Alice", "22");
    session.submit("!bob", "Bob", "21");
    scheduler.advance(WINDOW);
    assertEquals(100, ledger.totalOf("alice"));

    assertTrue(session.ban(ADMIN, "!alice").ok());
    scheduler.advance(INTERVAL.minus(WINDOW));
    assertEquals(2, session.snapshot().roundNumber());
    assertEquals(RejectReason.BANNED, session.submit("!alice", "Alice", "cross-site scripting").reason());
    scheduler.advance(WINDOW);

    assertEquals(100, ledger.totalOf("alice"));
    List<Standing> board = session.leaderboard();
    assertEquals("alice", board.get(0).playerId());
    assertEquals(100, board.get(0).total());
    assertEquals(List.of("alice"), session.bans().snapshot());
  }

  @Test
  void banRequiresAdminAndTarget() {
    GameSession session = session(3, new InMemoryLedger());

    assertEquals(ErrorKind.UNAUTHORIZED, session.ban("!player", "x").error());
    assertEquals(ErrorKind.INVALID_ARGUMENT, session.ban(ADMIN, "  ").error());
    assertEquals(ErrorKind.INVALID_ARGUMENT, session.unban(ADMIN, "!").error());
  }

  @Test
  void submissionsOutsideAnOpenRoundAreRejected() {
    GameSession session = session(3, new InMemoryLedger());
    assertEquals(RejectReason.NO_OPEN_ROUND, session.submit("!alice", "Alice", "22").reason());

    session.start(ADMIN);
    scheduler.advance(WINDOW);

    assertEquals(RejectReason.NO_OPEN_ROUND, session.submit("!alice", "Alice", "22").reason());
  }

  @Test
  void nextRoundOpensOneIntervalAfterThePreviousOpen() {
    GameSession session = session(3, new InMemoryLedger());
    Instant firstOpen = scheduler.now();
    session.start(ADMIN);

    scheduler.advance(INTERVAL.minusSeconds(1));
    assertEquals(1, session.snapshot().roundNumber());
    assertEquals(RoundStatus.CLOSED, session.snapshot().roundStatus());

    scheduler.advance(Duration.ofSeconds(1));
    GameSession.Snapshot snapshot = session.snapshot();
    assertEquals(2, snapshot.roundNumber());
    assertEquals(RoundStatus.OPEN, snapshot.roundStatus());
    assertEquals(firstOpen.plus(INTERVAL).plus(WINDOW), snapshot.closesAt());
  }

  @Test
  void skipClosesTheRoundOnceAndKeepsTheOpenSchedule() {
    InMemoryLedger ledger = new InMemoryLedger();
    GameSession session = session(3, ledger);
    Instant firstOpen = scheduler.now();
    session.start(ADMIN);
    session.submit("!alice", "Alice", "22");

    scheduler.advance(Duration.ofSeconds(30));
    assertTrue(session.skip(ADMIN).ok());
    assertEquals(1, outbox.count(Announcement.Kind.ROUND_SETTLED));

    scheduler.advance(WINDOW);
    assertEquals(1, outbox.count(Announcement.Kind.ROUND_SETTLED));
    assertEquals(100, ledger.totalOf("alice"));

    scheduler.advance(INTERVAL.minus(WINDOW).minusSeconds(30));
    assertEquals(2, session.snapshot().roundNumber());
    assertEquals(firstOpen.plus(INTERVAL), scheduler.now());
  }

  @Test
  void skipWithoutOpenRoundIsInvalidState() {
    GameSession session = session(3, new InMemoryLedger());
    assertEquals(ErrorKind.INVALID_STATE, session.skip(ADMIN).error());

    session.start(ADMIN);
    scheduler.advance(WINDOW);

    assertEquals(ErrorKind.INVALID_STATE, session.skip(ADMIN).error());
  }

  @Test
  void nonAdminCannotSkipOrStop() {
    GameSession session = session(3, new InMemoryLedger());
    session.start(ADMIN);

    assertEquals(ErrorKind.UNAUTHORIZED, session.skip("!player").error());
    assertEquals(ErrorKind.UNAUTHORIZED, session.stop("!player").error());
    assertEquals(GameStatus.RUNNING, session.snapshot().status());
    assertEquals(RoundStatus.OPEN, session.snapshot().roundStatus());
  }

  @Test
  void lateCloseCallbackAfterSkipIsANoOp() {
    scheduler.ignoreCancel = true;
    InMemoryLedger ledger = new InMemoryLedger();
    GameSession session = session(3, ledger);
    session.start(ADMIN);
    session.submit("!alice", "Alice", "22");

    session.skip(ADMIN);
    scheduler.advance(WINDOW);

    assertEquals(1, outbox.count(Announcement.Kind.ROUND_SETTLED));
    assertEquals(100, ledger.totalOf("alice"));
  }

  @Test
  void stopSettlesOpenRoundAndCancelsAllTimers() {
    InMemoryLedger ledger = new InMemoryLedger();
    GameSession session = session(3, ledger);
    session.start(ADMIN);
    session.submit("!alice", "Alice", "22");

    CommandResult result = session.stop(ADMIN);

    assertTrue(result.ok());
    assertEquals(GameStatus.STOPPED, session.snapshot().status());
    assertEquals(100, ledger.totalOf("alice"));
    assertEquals(0, scheduler.pending());
    assertTrue(outbox.last(Announcement.Kind.GAME_STOPPED).contains("1. Alice: 100 pts"));

    int announced = outbox.announcements.size();
    scheduler.advance(Duration.ofHours(1));
    assertEquals(announced, outbox.announcements.size());
    assertEquals(ErrorKind.INVALID_STATE, session.stop(ADMIN).error());
  }

  @Test
  void staleTimersFromAnEarlierSessionAreIgnored() {
    scheduler.ignoreCancel = true;
    GameSession session = session(3, new InMemoryLedger());
    session.start(ADMIN);
    session.stop(ADMIN);

    scheduler.advance(Duration.ofSeconds(10));
    session.start(ADMIN);
    scheduler.advance(INTERVAL.minusSeconds(5));

    GameSession.Snapshot snapshot = session.snapshot();
    assertEquals(2, snapshot.sessionNumber());
    assertEquals(1, snapshot.roundNumber());

    scheduler.advance(Duration.ofSeconds(5));
    assertEquals(2, session.snapshot().roundNumber());
  }

  @Test
  void gameFinishesWhenTheLastRoundSettles() {
    GameSession session = session(2, new InMemoryLedger());
    session.start(ADMIN);

    scheduler.advance(INTERVAL);
    assertEquals(2, session.snapshot().roundNumber());
    assertEquals(1, scheduler.pending());

    scheduler.advance(WINDOW);

    assertEquals(GameStatus.STOPPED, session.snapshot().status());
    assertEquals(2, session.snapshot().roundCounter());
    assertEquals(0, scheduler.pending());
    List<Announcement> tail = outbox.announcements.subList(
        outbox.announcements.size() - 3, outbox.announcements.size());
    assertEquals(Announcement.Kind.ROUND_SETTLED, tail.get(0).kind());
    assertEquals("Final round complete!", tail.get(1).text());
    assertEquals(Announcement.Kind.GAME_STOPPED, tail.get(2).kind());
  }

  @Test
  void runningOutOfQuestionsStopsTheGame() {
    GameSession session = new GameSession(
        settings(5), () -> List.of(QUESTIONS.get(0)), new InMemoryLedger(), scheduler, outbox);
    session.start(ADMIN);

    scheduler.advance(INTERVAL);

    assertEquals(GameStatus.STOPPED, session.snapshot().status());
    assertTrue(outbox.kinds().contains(Announcement.Kind.NOTICE));
    assertEquals(Announcement.Kind.GAME_STOPPED, outbox.kinds().get(outbox.kinds().size() - 1));
  }

  @Test
  void startWithNoQuestionsIsRejected() {
    GameSession session =
        new GameSession(settings(3), List::of, new InMemoryLedger(), scheduler, outbox);

    assertEquals(ErrorKind.INVALID_STATE, session.start(ADMIN).error());
    assertEquals(GameStatus.IDLE, session.snapshot().status());
  }

  @Test
  void startAfterStopBeginsANewSessionAndKeepsTotals() {
    InMemoryLedger ledger = new InMemoryLedger();
    GameSession session = session(3, ledger);
    session.start(ADMIN);
    session.submit("!alice", "Alice", "22");
    session.join("!alice", "Alice");
    scheduler.advance(INTERVAL);
    session.stop(ADMIN);

    assertTrue(session.start(ADMIN).ok());

    GameSession.Snapshot snapshot = session.snapshot();
    assertEquals(2, snapshot.sessionNumber());
    assertEquals(1, snapshot.roundCounter());
    assertEquals(0, snapshot.players());
    assertTrue(outbox.last(Announcement.Kind.ROUND_OPENED).contains("What port does SSH use?"));
    assertEquals(100, ledger.totalOf("alice"));
    assertTrue(session.submit("!alice", "Alice", "22").accepted());
  }

  @Test
  void failedLedgerWriteIsRetriedWithoutDoubleCounting() {
    FlakyLedger ledger = new FlakyLedger(2);
    GameSession session = session(3, ledger);
    session.start(ADMIN);
    session.submit("!alice", "Alice", "22");
    session.submit("!bob", "Bob", "22");

    scheduler.advance(WINDOW);

    assertEquals(3, ledger.calls);
    assertEquals(100, ledger.totalOf("alice"));
    assertEquals(100, ledger.totalOf("bob"));
    assertEquals(2, session.lastSettlement().scores().size());
  }

  @Test
  void settlementThatKeepsFailingStillClosesTheRound() {
    FlakyLedger ledger = new FlakyLedger(1, 2, 3);
    GameSession session = session(3, ledger);
    session.start(ADMIN);
    session.submit("!alice", "Alice", "22");

    scheduler.advance(WINDOW);

    assertEquals(RoundStatus.CLOSED, session.snapshot().roundStatus());
    assertEquals(0, ledger.totalOf("alice"));
    assertNull(session.lastSettlement());
    assertTrue(outbox.last(Announcement.Kind.NOTICE).contains("Scoring failed"));

    scheduler.advance(INTERVAL.minus(WINDOW));
    assertEquals(2, session.snapshot().roundNumber());
  }

  @Test
  void schedulerRejectionAtStartLeavesTheSessionStopped() {
    scheduler.rejecting = true;
    GameSession session = session(3, new InMemoryLedger());

    CommandResult result = session.start(ADMIN);

    assertEquals(ErrorKind.INTERNAL, result.error());
    assertEquals(GameStatus.STOPPED, session.snapshot().status());
    assertEquals(RejectReason.NO_OPEN_ROUND, session.submit("!alice", "Alice", "22").reason());
  }

  @Test
  void joinedPlayersReceiveEachQuestionByDirectMessage() {
    GameSession session = session(3, new InMemoryLedger());
    assertEquals(ErrorKind.INVALID_STATE, session.join("!alice", "Alice").error());

    session.start(ADMIN);
    assertTrue(session.join("!alice", "Alice").message().contains("1 players"));
    assertEquals("You're already in the game!", session.join("!ALICE", "Alice").message());
    assertEquals(1, outbox.directs.size());
    assertEquals("!alice", outbox.directs.get(0).nodeId());

    scheduler.advance(INTERVAL);

    assertEquals(2, outbox.directs.size());
    assertTrue(outbox.directs.get(1).text().startsWith("ROUND 2/3"));
  }

  @Test
  void resetScoresOnlyWhenNotRunning() {
    InMemoryLedger ledger = new InMemoryLedger();
    GameSession session = session(3, ledger);
    session.start(ADMIN);
    session.submit("!alice", "Alice", "22");
    scheduler.advance(WINDOW);

    assertEquals(ErrorKind.INVALID_STATE, session.resetScores(ADMIN).error());
    session.stop(ADMIN);
    assertEquals(ErrorKind.UNAUTHORIZED, session.resetScores("!alice").error());
    assertTrue(session.resetScores(ADMIN).ok());
    assertTrue(session.leaderboard().isEmpty());
  }

  private static final List<Question> QUESTIONS = List.of(
      new Question("q1", "What port does SSH use?", 100, List.of("22", "twenty-two")),
      new Question("q2", "What does XSS stand for?", 200, List.of("cross-site scripting")),
      new Question("q3", "Default HTTPS port?", 300, List.of("443")));

  private GameSession session(int maxRounds, Ledger ledger) {
    return new GameSession(settings(maxRounds), () -> QUESTIONS, ledger, scheduler, outbox);
  }

  private static GameSettings settings(int maxRounds) {
    return new GameSettings(List.of(ADMIN), INTERVAL, WINDOW, maxRounds, 5, 3, 3);
  }

  /** Fails the persist calls whose 1-based index is listed. */
  private static final class FlakyLedger extends InMemoryLedger {
    private final List<Integer> failing;
    int calls;

    FlakyLedger(Integer... failing) {
      this.failing = List.of(failing);
    }

    @Override
    protected void persist(List<Standing> standings, long lastSequence) {
      calls++;
      if (failing.contains(calls)) {
        throw new LedgerException("disk full", null);
      }
    }
  }

  private static final class ManualScheduler implements Scheduler {
    private final List<Timer> timers = new ArrayList<>();
    private Instant now = Instant.parse("2026-01-01T12:00:00Z");
    private long sequence;
    boolean rejecting;
    boolean ignoreCancel;

    @Override
    public Instant now() {
      return now;
    }

    @Override
    public TimerHandle after(Duration delay, Runnable task) {
      if (rejecting) {
        throw new RejectedExecutionException("scheduler closed");
      }
      Timer timer = new Timer(now.plus(delay), sequence++, task);
      timers.add(timer);
      return timer;
    }

    void advance(Duration duration) {
      Instant target = now.plus(duration);
      while (true) {
        Timer next = timers.stream()
            .filter(t -> !t.done && !t.due.isAfter(target))
            .min(Comparator.comparing((Timer t) -> t.due).thenComparingLong(t -> t.order))
            .orElse(null);
        if (next == null) {
          break;
        }
        now = next.due;
        next.done = true;
        next.task.run();
      }
      now = target;
    }

    int pending() {
      return (int) timers.stream().filter(t -> !t.done).count();
    }

    private final class Timer implements TimerHandle {
      final Instant due;
      final long order;
      final Runnable task;
      boolean done;

      Timer(Instant due, long order, Runnable task) {
        this.due = due;
        this.order = order;
        this.task = task;
      }

      @Override
      public boolean cancel() {
        if (done || ignoreCancel) {
          return false;
        }
        done = true;
        return true;
      }
    }
  }

  private static final class RecordingOutbox implements Outbox {
    final List<Announcement> announcements = new ArrayList<>();
    final List<Direct> directs = new ArrayList<>();

    @Override
    public CompletableFuture<SendResult> announce(Announcement announcement) {
      announcements.add(announcement);
      return CompletableFuture.completedFuture(new SendResult(true, "OK", "Sent", "test"));
    }

    @Override
    public CompletableFuture<SendResult> direct(String nodeId, String text) {
      directs.add(new Direct(nodeId, text));
      return CompletableFuture.completedFuture(new SendResult(true, "OK", "Sent", "test"));
    }

    List<Announcement.Kind> kinds() {
      return announcements.stream().map(Announcement::kind).toList();
    }

    long count(Announcement.Kind kind) {
      return announcements.stream().filter(a -> a.kind() == kind).count();
    }

    String last(Announcement.Kind kind) {
      for (int i = announcements.size() - 1; i >= 0; i--) {
        if (announcements.get(i).kind() == kind) {
          return announcements.get(i).text();
        }
      }
      fail("No " + kind + " announcement");
      return null;
    }

    record Direct(String nodeId, String text) {}
  }
}

package dev.meshquiz.game;

import dev.meshquiz.api.Announcement;
import dev.meshquiz.api.Outbox;
import dev.meshquiz.perms.AdminGate;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Hacker Jeopardy session state machine: IDLE, RUNNING, STOPPED.
 *
 * <p>Commands, answer submissions and timer callbacks all go through {@link #lock}, which is
 * the single serialization point for session, round and submission state. Each round
 * schedules two independent timers when it opens: its own close after the answer window,
 * and the next round's open after the question interval. Both are measured from the open.
 *
 * <p>A start after a stop begins a new session with the round counter, roster and
 * submissions cleared. Ledger totals carry over until an admin resets them.
 */
public final class GameSession implements AutoCloseable {
  private static final Logger LOGGER = LogManager.getLogger("MeshQuiz/Session");

  private enum FinishReason { ADMIN_STOP, FINAL_ROUND, OUT_OF_QUESTIONS, SCHEDULER_FAILURE }

  private final ReentrantLock lock = new ReentrantLock();
  private final GameSettings settings;
  private final AdminGate admins;
  private final QuestionSource questionSource;
  private final Ledger ledger;
  private final Scheduler scheduler;
  private final Outbox outbox;
  private final BanList bans = new BanList();
  private final AnswerIntake intake;
  private final Map<String, String> roster = new LinkedHashMap<>();
  // round id -> players whose delta already reached the ledger
  private final Map<Long, Set<String>> applied = new HashMap<>();

  private GameStatus status = GameStatus.IDLE;
  private long sessionNumber;
  private long roundSequence;
  private int roundCounter;
  private List<Question> questions = List.of();
  private int nextQuestion;
  private Round currentRound;
  private Settlement lastSettlement;
  private TimerHandle closeTimer;
  private TimerHandle openTimer;

  public GameSession(
      GameSettings settings,
      QuestionSource questionSource,
      Ledger ledger,
      Scheduler scheduler,
      Outbox outbox) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.admins = new AdminGate(settings.adminIds());
    this.questionSource = Objects.requireNonNull(questionSource, "questionSource");
    this.ledger = Objects.requireNonNull(ledger, "ledger");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.outbox = Objects.requireNonNull(outbox, "outbox");
    this.intake = new AnswerIntake(lock, bans);
    if (!admins.configured()) {
      LOGGER.warn("No admin node ids configured; nobody can start a game");
    }
  }

  public AdminGate admins() { return admins; }

  public GameSettings settings() { return settings; }

  public CommandResult start(String adminId) {
    lock.lock();
    try {
      if (!admins.isAdmin(adminId)) {
        LOGGER.info("Rejected start from non-admin {}", adminId);
        return CommandResult.failure(ErrorKind.UNAUTHORIZED, "Only admins can start games.");
      }
      if (status == GameStatus.RUNNING) {
        return CommandResult.failure(ErrorKind.INVALID_STATE, "Game already in progress!");
      }
      List<Question> bank;
      try {
        bank = List.copyOf(questionSource.questions());
      } catch (RuntimeException e) {
        LOGGER.error("Failed to load questions", e);
        return CommandResult.failure(ErrorKind.INTERNAL, "Could not load questions.");
      }
      if (bank.isEmpty()) {
        return CommandResult.failure(ErrorKind.INVALID_STATE, "No questions loaded.");
      }
      sessionNumber++;
      questions = bank;
      nextQuestion = 0;
      roundCounter = 0;
      currentRound = null;
      lastSettlement = null;
      intake.reset();
      roster.clear();
      applied.clear();
      status = GameStatus.RUNNING;
      LOGGER.info(
          "Game #{} started by {} ({} questions, {} rounds, window {}, interval {})",
          sessionNumber,
          adminId,
          bank.size(),
          settings.maxRounds(),
          settings.answerWindow(),
          settings.questionInterval());
      post(Announcements.gameStarted(sessionNumber, settings));
      try {
        openNextRound();
      } catch (RejectedExecutionException e) {
        LOGGER.error("Could not schedule round timers; game #{} aborted", sessionNumber, e);
        abort();
        return CommandResult.failure(
            ErrorKind.INTERNAL, "Could not schedule rounds; game not started.");
      }
      return CommandResult.ok("Game #" + sessionNumber + " started! Players can !hj join");
    } finally {
      lock.unlock();
    }
  }

  public CommandResult stop(String adminId) {
    lock.lock();
    try {
      if (!admins.isAdmin(adminId)) {
        LOGGER.info("Rejected stop from non-admin {}", adminId);
        return CommandResult.failure(ErrorKind.UNAUTHORIZED, "Only admins can stop games.");
      }
      if (status != GameStatus.RUNNING) {
        return CommandResult.failure(ErrorKind.INVALID_STATE, "No game in progress!");
      }
      finish(FinishReason.ADMIN_STOP);
      return CommandResult.ok("Game stopped!");
    } finally {
      lock.unlock();
    }
  }

  /** Closes the open round now, as if its answer window had elapsed. */
  public CommandResult skip(String adminId) {
    lock.lock();
    try {
      if (!admins.isAdmin(adminId)) {
        LOGGER.info("Rejected skip from non-admin {}", adminId);
        return CommandResult.failure(ErrorKind.UNAUTHORIZED, "Only admins can skip questions.");
      }
      Round round = currentRound;
      if (status != GameStatus.RUNNING || round == null || !round.isOpen()) {
        return CommandResult.failure(ErrorKind.INVALID_STATE, "No open question to skip.");
      }
      scheduler.cancel(closeTimer);
      closeTimer = null;
      LOGGER.info("Round {} skipped by {}", round.number(), adminId);
      closeRound(round);
      finishIfLastRound();
      return CommandResult.ok("Question skipped!");
    } finally {
      lock.unlock();
    }
  }

  public CommandResult ban(String adminId, String target) {
    lock.lock();
    try {
      if (!admins.isAdmin(adminId)) {
        return CommandResult.failure(ErrorKind.UNAUTHORIZED, "Only admins can ban users!");
      }
      String clean = AdminGate.normalize(target);
      if (clean.isEmpty()) {
        return CommandResult.failure(ErrorKind.INVALID_ARGUMENT, "Usage: !hj ban <node id>");
      }
      boolean added = bans.ban(clean);
      LOGGER.info("{} banned {}{}", adminId, clean, added ? "" : " (already banned)");
      return CommandResult.ok(
          added ? "Banned " + AdminGate.display(clean) : AdminGate.display(clean) + " is already banned");
    } finally {
      lock.unlock();
    }
  }

  public CommandResult unban(String adminId, String target) {
    lock.lock();
    try {
      if (!admins.isAdmin(adminId)) {
        return CommandResult.failure(ErrorKind.UNAUTHORIZED, "Only admins can unban users!");
      }
      String clean = AdminGate.normalize(target);
      if (clean.isEmpty()) {
        return CommandResult.failure(ErrorKind.INVALID_ARGUMENT, "Usage: !hj unban <node id>");
      }
      boolean removed = bans.unban(clean);
      LOGGER.info("{} unbanned {}{}", adminId, clean, removed ? "" : " (was not banned)");
      return CommandResult.ok(
          removed ? "Unbanned " + AdminGate.display(clean) : AdminGate.display(clean) + " was not banned");
    } finally {
      lock.unlock();
    }
  }

  /** Clears cumulative ledger totals. Not allowed while a game is running. */
  public CommandResult resetScores(String adminId) {
    lock.lock();
    try {
      if (!admins.isAdmin(adminId)) {
        return CommandResult.failure(ErrorKind.UNAUTHORIZED, "Only admins can reset scores!");
      }
      if (status == GameStatus.RUNNING) {
        return CommandResult.failure(
            ErrorKind.INVALID_STATE, "Stop the game before resetting scores.");
      }
      try {
        ledger.reset();
      } catch (LedgerException e) {
        LOGGER.error("Score reset failed", e);
        return CommandResult.failure(ErrorKind.INTERNAL, "Score reset failed.");
      }
      LOGGER.info("Scores reset by {}", adminId);
      return CommandResult.ok("All scores reset.");
    } finally {
      lock.unlock();
    }
  }

  /** Records an answer attempt against the open round. Grading waits for the round to close. */
  public IntakeResult submit(String playerId, String displayName, String text) {
    lock.lock();
    try {
      Round round = currentRound;
      long roundId = round != null ? round.id() : -1L;
      IntakeResult result = intake.submit(playerId, displayName, roundId, text, scheduler.now());
      if (result.accepted()) {
        LOGGER.debug("Accepted answer from {} for round {}", playerId, round.number());
      }
      return result;
    } finally {
      lock.unlock();
    }
  }

  /** Adds the player to the roster that receives each question by DM. */
  public CommandResult join(String playerId, String displayName) {
    lock.lock();
    try {
      if (status != GameStatus.RUNNING) {
        return CommandResult.failure(
            ErrorKind.INVALID_STATE, "No game in progress. Wait for an admin to start one!");
      }
      String id = AdminGate.normalize(playerId);
      if (id.isEmpty()) {
        return CommandResult.failure(ErrorKind.INVALID_ARGUMENT, "Unknown sender.");
      }
      if (roster.putIfAbsent(id, displayName != null ? displayName : id) != null) {
        return CommandResult.ok("You're already in the game!");
      }
      Round round = currentRound;
      if (round != null && round.isOpen()) {
        direct(id, Announcements.questionDirect(round, settings.maxRounds()));
      }
      LOGGER.info("{} joined game #{} ({} players)", id, sessionNumber, roster.size());
      return CommandResult.ok("You're in! " + roster.size() + " players joined. Good luck!");
    } finally {
      lock.unlock();
    }
  }

  public Snapshot snapshot() {
    lock.lock();
    try {
      Round round = currentRound;
      return new Snapshot(
          status,
          sessionNumber,
          roundCounter,
          settings.maxRounds(),
          round != null ? round.number() : 0,
          round != null ? round.status() : null,
          round != null && round.isOpen() ? round.closesAt() : null,
          roster.size(),
          bans.snapshot().size());
    } finally {
      lock.unlock();
    }
  }

  public List<Standing> leaderboard() {
    return ledger.topN(settings.finalLeaderboardSize());
  }

  public Settlement lastSettlement() {
    lock.lock();
    try {
      return lastSettlement;
    } finally {
      lock.unlock();
    }
  }

  public BanList bans() { return bans; }

  public AnswerIntake intake() { return intake; }

  /** Cancels pending timers without announcing anything; used on process shutdown. */
  @Override
  public void close() {
    lock.lock();
    try {
      cancelTimers();
    } finally {
      lock.unlock();
    }
  }

  private void openNextRound() {
    if (currentRound != null && currentRound.isOpen()) {
      // interval shorter than the window after clock skew; never leave two rounds open
      scheduler.cancel(closeTimer);
      closeTimer = null;
      closeRound(currentRound);
      if (status != GameStatus.RUNNING) {
        return;
      }
    }
    if (roundCounter >= settings.maxRounds()) {
      finish(FinishReason.FINAL_ROUND);
      return;
    }
    if (nextQuestion >= questions.size()) {
      post(Announcements.notice("Out of questions!"));
      finish(FinishReason.OUT_OF_QUESTIONS);
      return;
    }
    Question question = questions.get(nextQuestion++);
    roundCounter++;
    Instant now = scheduler.now();
    Round round =
        new Round(++roundSequence, roundCounter, question, now, now.plus(settings.answerWindow()));
    currentRound = round;
    intake.open(round);
    long epoch = sessionNumber;
    closeTimer = scheduler.after(settings.answerWindow(), () -> onCloseTimer(epoch, round.id()));
    if (roundCounter < settings.maxRounds()) {
      openTimer = scheduler.after(settings.questionInterval(), () -> onOpenTimer(epoch));
    }
    LOGGER.info(
        "Round {}/{} open: {} ({} pts), closes {}",
        round.number(),
        settings.maxRounds(),
        question.id(),
        question.value(),
        round.closesAt());
    post(Announcements.roundOpened(round, settings.maxRounds(), settings.answerWindow()));
    String questionText = Announcements.questionDirect(round, settings.maxRounds());
    for (String player : roster.keySet()) {
      direct(player, questionText);
    }
  }

  private void onCloseTimer(long epoch, long roundId) {
    lock.lock();
    try {
      Round round = currentRound;
      if (epoch != sessionNumber
          || status != GameStatus.RUNNING
          || round == null
          || round.id() != roundId
          || !round.isOpen()) {
        LOGGER.debug("Ignoring stale close timer for round id {}", roundId);
        return;
      }
      closeTimer = null;
      closeRound(round);
      finishIfLastRound();
    } finally {
      lock.unlock();
    }
  }

  private void onOpenTimer(long epoch) {
    lock.lock();
    try {
      if (epoch != sessionNumber || status != GameStatus.RUNNING) {
        LOGGER.debug("Ignoring stale open timer from game #{}", epoch);
        return;
      }
      openTimer = null;
      try {
        openNextRound();
      } catch (RejectedExecutionException e) {
        LOGGER.error("Could not schedule round timers; stopping game #{}", sessionNumber, e);
        finish(FinishReason.SCHEDULER_FAILURE);
      }
    } finally {
      lock.unlock();
    }
  }

  private void closeRound(Round round) {
    if (!round.beginGrading()) {
      return;
    }
    intake.close(round.id());
    try {
      Settlement settlement = settle(round);
      lastSettlement = settlement;
      LOGGER.info(
          "Round {} settled: {} scored, net {}",
          round.number(),
          settlement.scores().size(),
          settlement.deltaSum());
      post(Announcements.roundSettled(settlement));
    } catch (RuntimeException e) {
      LOGGER.error(
          "Settlement of round {} failed; round closed without further scoring", round.number(), e);
      post(Announcements.notice(
          "Round " + round.number() + " answer: " + round.question().revealedAnswer()
              + "\nScoring failed this round."));
    } finally {
      round.markClosed();
    }
  }

  private Settlement settle(Round round) {
    Question question = round.question();
    List<Settlement.Score> scores = new ArrayList<>();
    for (Submission submission : intake.submissionsFor(round.id())) {
      scores.add(
          new Settlement.Score(
              submission.playerId(),
              submission.displayName(),
              Grader.isCorrect(question, submission.text()),
              Grader.delta(question, submission)));
    }
    Set<String> done = applied.computeIfAbsent(round.id(), k -> new HashSet<>());
    for (int attempt = 1; ; attempt++) {
      try {
        for (Settlement.Score score : scores) {
          if (done.contains(score.playerId())) {
            continue;
          }
          ledger.applyDelta(score.playerId(), score.displayName(), score.delta());
          done.add(score.playerId());
        }
        break;
      } catch (LedgerException e) {
        if (attempt >= settings.settlementAttempts()) {
          throw e;
        }
        LOGGER.warn(
            "Ledger write failed settling round {} (attempt {}/{}): {}",
            round.number(),
            attempt,
            settings.settlementAttempts(),
            e.toString());
      }
    }
    return new Settlement(
        round.id(),
        round.number(),
        question,
        scores,
        ledger.topN(settings.roundLeaderboardSize()));
  }

  private void finishIfLastRound() {
    if (status == GameStatus.RUNNING && roundCounter >= settings.maxRounds()) {
      finish(FinishReason.FINAL_ROUND);
    }
  }

  private void finish(FinishReason reason) {
    cancelTimers();
    Round round = currentRound;
    if (round != null && round.isOpen()) {
      closeRound(round);
    }
    status = GameStatus.STOPPED;
    LOGGER.info("Game #{} stopped ({}) after {} rounds", sessionNumber, reason, roundCounter);
    if (reason == FinishReason.FINAL_ROUND) {
      post(Announcements.notice("Final round complete!"));
    }
    post(Announcements.gameOver(ledger.topN(settings.finalLeaderboardSize())));
  }

  private void abort() {
    cancelTimers();
    Round round = currentRound;
    if (round != null) {
      intake.close(round.id());
      round.markClosed();
    }
    status = GameStatus.STOPPED;
  }

  private void cancelTimers() {
    scheduler.cancel(closeTimer);
    scheduler.cancel(openTimer);
    closeTimer = null;
    openTimer = null;
  }

  private void post(Announcement announcement) {
    try {
      outbox.announce(announcement).whenComplete((result, error) -> {
        if (error != null) {
          LOGGER.error("{} announcement failed: {}", announcement.kind(), error.toString());
        } else if (!result.ok()) {
          LOGGER.error(
              "{} announcement not delivered: {} {}",
              announcement.kind(),
              result.code(),
              result.message());
        }
      });
    } catch (RuntimeException e) {
      LOGGER.error("Failed to queue {} announcement: {}", announcement.kind(), e.toString());
    }
  }

  private void direct(String playerId, String text) {
    try {
      outbox.direct(AdminGate.display(playerId), text).whenComplete((result, error) -> {
        if (error != null) {
          LOGGER.warn("DM to {} failed: {}", playerId, error.toString());
        } else if (!result.ok()) {
          LOGGER.warn("DM to {} not delivered: {} {}", playerId, result.code(), result.message());
        }
      });
    } catch (RuntimeException e) {
      LOGGER.warn("Failed to queue DM to {}: {}", playerId, e.toString());
    }
  }

  /** Read-only view for status replies. Round fields are zero/null before the first round. */
  public record Snapshot(
      GameStatus status,
      long sessionNumber,
      int roundCounter,
      int maxRounds,
      int roundNumber,
      RoundStatus roundStatus,
      Instant closesAt,
      int players,
      int banned) {}
}

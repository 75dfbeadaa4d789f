package dev.meshquiz.game;

import dev.meshquiz.game.IntakeResult.RejectReason;
import dev.meshquiz.perms.AdminGate;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Records answer submissions against the open round.
 *
 * <p>Every operation runs under the owning session's lock, so the ban check, duplicate check,
 * open-round check and insert happen as one step. Submissions are stored ungraded; grading
 * happens at round close.
 */
public final class AnswerIntake {
  private static final Logger LOGGER = LogManager.getLogger("MeshQuiz/Intake");

  private final ReentrantLock lock;
  private final BanList bans;
  private final Map<Long, Map<String, Submission>> byRound = new HashMap<>();
  private Round openRound;

  public AnswerIntake(ReentrantLock lock, BanList bans) {
    this.lock = Objects.requireNonNull(lock, "lock");
    this.bans = Objects.requireNonNull(bans, "bans");
  }

  public IntakeResult submit(
      String playerId, String displayName, long roundId, String text, Instant arrivedAt) {
    Objects.requireNonNull(arrivedAt, "arrivedAt");
    String id = AdminGate.normalize(playerId);
    lock.lock();
    try {
      if (bans.isBanned(id)) {
        LOGGER.debug("Rejected submission from banned node {}", id);
        return IntakeResult.rejected(RejectReason.BANNED);
      }
      Map<String, Submission> existing = byRound.get(roundId);
      if (existing != null && existing.containsKey(id)) {
        LOGGER.debug("Rejected duplicate submission from {} for round id {}", id, roundId);
        return IntakeResult.rejected(RejectReason.DUPLICATE_SUBMISSION);
      }
      Round round = openRound;
      if (round == null || round.id() != roundId || !round.isOpen()) {
        LOGGER.debug("Rejected submission from {}: round id {} is not open", id, roundId);
        return IntakeResult.rejected(RejectReason.NO_OPEN_ROUND);
      }
      Submission submission =
          new Submission(id, displayName != null ? displayName : id, roundId,
              text != null ? text : "", arrivedAt);
      byRound.computeIfAbsent(roundId, k -> new LinkedHashMap<>()).put(id, submission);
      return IntakeResult.accepted(submission);
    } finally {
      lock.unlock();
    }
  }

  /** Accepted submissions for a round in arrival order. */
  public List<Submission> submissionsFor(long roundId) {
    lock.lock();
    try {
      Map<String, Submission> submissions = byRound.get(roundId);
      return submissions == null ? List.of() : List.copyOf(new ArrayList<>(submissions.values()));
    } finally {
      lock.unlock();
    }
  }

  public Optional<Round> openRound() {
    lock.lock();
    try {
      return Optional.ofNullable(openRound);
    } finally {
      lock.unlock();
    }
  }

  void open(Round round) {
    lock.lock();
    try {
      openRound = Objects.requireNonNull(round, "round");
      byRound.putIfAbsent(round.id(), new LinkedHashMap<>());
    } finally {
      lock.unlock();
    }
  }

  /** Stops accepting answers for the given round. Its recorded submissions stay readable. */
  void close(long roundId) {
    lock.lock();
    try {
      if (openRound != null && openRound.id() == roundId) {
        openRound = null;
      }
    } finally {
      lock.unlock();
    }
  }

  /** Drops every round's submissions; used when a new session starts. */
  void reset() {
    lock.lock();
    try {
      openRound = null;
      byRound.clear();
    } finally {
      lock.unlock();
    }
  }
}

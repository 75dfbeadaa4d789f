package dev.meshquiz.game;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable game timing and limits, built once from configuration.
 *
 * @param settlementAttempts how many times a round's ledger writes are tried before giving up
 */
public record GameSettings(
    List<String> adminIds,
    Duration questionInterval,
    Duration answerWindow,
    int maxRounds,
    int finalLeaderboardSize,
    int roundLeaderboardSize,
    int settlementAttempts) {
  public GameSettings {
    adminIds = List.copyOf(Objects.requireNonNull(adminIds, "adminIds"));
    Objects.requireNonNull(questionInterval, "questionInterval");
    Objects.requireNonNull(answerWindow, "answerWindow");
    if (answerWindow.isZero() || answerWindow.isNegative()) {
      throw new IllegalArgumentException("answerWindow must be > 0");
    }
    if (questionInterval.compareTo(answerWindow) < 0) {
      throw new IllegalArgumentException("questionInterval must be >= answerWindow");
    }
    if (maxRounds <= 0) {
      throw new IllegalArgumentException("maxRounds must be > 0");
    }
    if (finalLeaderboardSize <= 0 || roundLeaderboardSize <= 0) {
      throw new IllegalArgumentException("leaderboard sizes must be > 0");
    }
    if (settlementAttempts <= 0) {
      throw new IllegalArgumentException("settlementAttempts must be > 0");
    }
  }
}

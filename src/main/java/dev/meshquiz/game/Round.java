package dev.meshquiz.game;

import java.time.Instant;
import java.util.Objects;

/**
 * One timed question-and-answer cycle. Status only moves forward: OPEN, GRADING, CLOSED.
 * Mutated only while the owning session's lock is held.
 */
public final class Round {
  private final long id;
  private final int number;
  private final Question question;
  private final Instant opensAt;
  private final Instant closesAt;
  private volatile RoundStatus status = RoundStatus.OPEN;

  Round(long id, int number, Question question, Instant opensAt, Instant closesAt) {
    this.id = id;
    this.number = number;
    this.question = Objects.requireNonNull(question, "question");
    this.opensAt = Objects.requireNonNull(opensAt, "opensAt");
    this.closesAt = Objects.requireNonNull(closesAt, "closesAt");
  }

  public long id() { return id; }

  public int number() { return number; }

  public Question question() { return question; }

  public Instant opensAt() { return opensAt; }

  public Instant closesAt() { return closesAt; }

  public RoundStatus status() { return status; }

  public boolean isOpen() { return status == RoundStatus.OPEN; }

  /** Moves OPEN to GRADING; returns false if the round was no longer open. */
  boolean beginGrading() {
    if (status != RoundStatus.OPEN) {
      return false;
    }
    status = RoundStatus.GRADING;
    return true;
  }

  void markClosed() { status = RoundStatus.CLOSED; }

  @Override
  public String toString() {
    return "Round[" + number + " id=" + id + " " + status + " q=" + question.id() + "]";
  }
}

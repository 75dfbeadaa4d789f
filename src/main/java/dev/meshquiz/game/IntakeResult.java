package dev.meshquiz.game;

import java.util.Objects;

/** Result of one submission attempt: accepted, or rejected with a reason. */
public record IntakeResult(boolean accepted, RejectReason reason, Submission submission) {
  public enum RejectReason {
    BANNED,
    NO_OPEN_ROUND,
    DUPLICATE_SUBMISSION
  }

  static IntakeResult accepted(Submission submission) {
    return new IntakeResult(true, null, Objects.requireNonNull(submission, "submission"));
  }

  static IntakeResult rejected(RejectReason reason) {
    return new IntakeResult(false, Objects.requireNonNull(reason, "reason"), null);
  }
}

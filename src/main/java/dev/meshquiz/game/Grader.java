package dev.meshquiz.game;

import java.util.Locale;

/** Exact-match grading after trimming and case folding. No fuzzy matching. */
public final class Grader {
  private Grader() {}

  public static String normalize(String raw) {
    return raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
  }

  public static boolean isCorrect(Question question, String text) {
    String candidate = normalize(text);
    if (candidate.isEmpty()) {
      return false;
    }
    for (String accepted : question.answers()) {
      if (normalize(accepted).equals(candidate)) {
        return true;
      }
    }
    return false;
  }

  /** Signed score change for the single counted submission of a player. */
  public static int delta(Question question, Submission submission) {
    return isCorrect(question, submission.text()) ? question.value() : -question.value();
  }
}

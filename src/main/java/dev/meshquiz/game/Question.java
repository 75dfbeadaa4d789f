package dev.meshquiz.game;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Immutable question: prompt, signed point value and the accepted answer strings. */
public record Question(String id, String prompt, int value, List<String> answers) {
  public static final int MIN_MAGNITUDE = 100;
  public static final int MAX_MAGNITUDE = 500;

  public Question {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(prompt, "prompt");
    Objects.requireNonNull(answers, "answers");
    if (prompt.isBlank()) {
      throw new IllegalArgumentException("Question prompt may not be blank");
    }
    int magnitude = Math.abs(value);
    if (magnitude < MIN_MAGNITUDE || magnitude > MAX_MAGNITUDE) {
      throw new IllegalArgumentException(
          "Question value must have magnitude " + MIN_MAGNITUDE + ".." + MAX_MAGNITUDE + ": " + value);
    }
    List<String> cleaned = new ArrayList<>();
    for (String answer : answers) {
      if (answer != null && !answer.isBlank()) {
        cleaned.add(answer.trim());
      }
    }
    if (cleaned.isEmpty()) {
      throw new IllegalArgumentException("Question " + id + " has no accepted answers");
    }
    prompt = prompt.trim();
    answers = List.copyOf(cleaned);
  }

  /** The answer revealed when the round settles. */
  public String revealedAnswer() { return answers.get(0); }
}

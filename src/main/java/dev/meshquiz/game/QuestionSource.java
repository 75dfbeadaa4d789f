package dev.meshquiz.game;

import java.util.List;

/** Ordered question bank, read once when a session starts. */
@FunctionalInterface
public interface QuestionSource {
  List<Question> questions();
}

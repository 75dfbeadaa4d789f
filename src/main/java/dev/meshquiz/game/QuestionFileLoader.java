package dev.meshquiz.game;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reads questions in the {@code Q:<points>: prompt} / {@code A: answer} text format.
 *
 * <pre>
 * Q:100: What port does SSH use?
 * A: 22
 * A: twenty-two
 * </pre>
 *
 * A {@code Q:} line without a numeric point value is worth 100. A missing file yields a small
 * built-in bank.
 */
public final class QuestionFileLoader implements QuestionSource {
  private static final Logger LOGGER = LogManager.getLogger("MeshQuiz/Questions");
  private static final int DEFAULT_POINTS = 100;

  static final List<Question> BUILT_IN = List.of(
      new Question("builtin-1", "What port does SSH use by default?", 100, List.of("22", "twenty-two")),
      new Question("builtin-2", "What does XSS stand for?", 200,
          List.of("cross-site scripting", "cross site scripting")),
      new Question("builtin-3", "What is the default port for HTTPS?", 100,
          List.of("443", "four forty-three")));

  private final Path file;

  public QuestionFileLoader(Path file) {
    this.file = Objects.requireNonNull(file, "file");
  }

  @Override
  public List<Question> questions() {
    if (!Files.exists(file)) {
      LOGGER.warn("{} not found; using {} built-in questions", file, BUILT_IN.size());
      return BUILT_IN;
    }
    try {
      List<Question> parsed = parse(Files.readAllLines(file, StandardCharsets.UTF_8));
      LOGGER.info("Loaded {} questions from {}", parsed.size(), file);
      return parsed;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read questions from " + file, e);
    }
  }

  static List<Question> parse(List<String> lines) {
    List<Question> questions = new ArrayList<>();
    String prompt = null;
    int points = DEFAULT_POINTS;
    List<String> answers = new ArrayList<>();
    for (String raw : lines) {
      String line = raw.trim();
      if (line.isEmpty()) {
        continue;
      }
      if (line.startsWith("Q:")) {
        addIfComplete(questions, prompt, points, answers);
        answers = new ArrayList<>();
        String rest = line.substring(2);
        int colon = rest.indexOf(':');
        String head = colon >= 0 ? rest.substring(0, colon).trim() : "";
        if (colon >= 0 && head.matches("-?\\d+")) {
          prompt = rest.substring(colon + 1).trim();
          try {
            points = Integer.parseInt(head);
          } catch (NumberFormatException e) {
            LOGGER.warn("Skipping question \"{}\": point value {} out of range", prompt, head);
            prompt = null;
          }
        } else {
          points = DEFAULT_POINTS;
          prompt = rest.trim();
        }
      } else if (line.startsWith("A:")) {
        answers.add(line.substring(2).trim());
      }
    }
    addIfComplete(questions, prompt, points, answers);
    return List.copyOf(questions);
  }

  private static void addIfComplete(
      List<Question> questions, String prompt, int points, List<String> answers) {
    if (prompt == null || prompt.isEmpty() || answers.isEmpty()) {
      return;
    }
    String id = "q" + (questions.size() + 1);
    try {
      questions.add(new Question(id, prompt, points, answers));
    } catch (IllegalArgumentException e) {
      LOGGER.warn("Skipping question \"{}\": {}", prompt, e.getMessage());
    }
  }
}

package dev.meshquiz.game;

import dev.meshquiz.api.Announcement;
import dev.meshquiz.api.Announcement.Kind;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/** Text rendering for everything the session posts to the channel or DMs to players. */
public final class Announcements {
  private static final DateTimeFormatter CLOCK =
      DateTimeFormatter.ofPattern("HH:mm:ss").withZone(ZoneOffset.UTC);

  private Announcements() {}

  static Announcement gameStarted(long sessionNumber, GameSettings settings) {
    String text = "HACKER JEOPARDY #" + sessionNumber + " - GAME ON!\n"
        + "Send !hj join to play. Questions post here and by DM.\n"
        + "DM your answers to me within " + formatDuration(settings.answerWindow()) + ".\n"
        + "Correct = +points | Wrong = -points | No answer = 0\n"
        + settings.maxRounds() + " rounds total. Good luck!";
    return new Announcement(Kind.GAME_STARTED, text);
  }

  static Announcement roundOpened(Round round, int maxRounds, Duration answerWindow) {
    Question question = round.question();
    String text = "ROUND " + round.number() + "/" + maxRounds + " - " + question.value() + " POINTS\n"
        + question.prompt() + "\n"
        + "DM your answer within " + formatDuration(answerWindow)
        + " (closes " + CLOCK.format(round.closesAt()) + " UTC)";
    return new Announcement(Kind.ROUND_OPENED, text);
  }

  static String questionDirect(Round round, int maxRounds) {
    Question question = round.question();
    return "ROUND " + round.number() + "/" + maxRounds + " - " + question.value() + " pts\n"
        + question.prompt();
  }

  static Announcement roundSettled(Settlement settlement) {
    StringBuilder text = new StringBuilder();
    text.append("Round ").append(settlement.roundNumber()).append(" answer: ")
        .append(settlement.question().revealedAnswer());
    if (settlement.scores().isEmpty()) {
      text.append("\nNo answers this round.");
    } else {
      text.append('\n');
      boolean first = true;
      for (Settlement.Score score : settlement.scores()) {
        if (!first) {
          text.append(", ");
        }
        text.append(score.delta() >= 0 ? "+" : "").append(score.delta()).append(' ')
            .append(score.displayName());
        first = false;
      }
    }
    if (!settlement.standings().isEmpty()) {
      text.append("\nTop: ");
      appendInline(text, settlement.standings());
    }
    return new Announcement(Kind.ROUND_SETTLED, text.toString());
  }

  static Announcement gameOver(List<Standing> standings) {
    if (standings.isEmpty()) {
      return new Announcement(Kind.GAME_STOPPED, "Game over! No scores recorded.");
    }
    StringBuilder text = new StringBuilder("GAME OVER - FINAL SCORES:\n");
    text.append(leaderboard(standings));
    text.append("\nThanks for playing!");
    return new Announcement(Kind.GAME_STOPPED, text.toString());
  }

  static Announcement notice(String text) {
    return new Announcement(Kind.NOTICE, text);
  }

  /** One line per standing: {@code "1. alice: 200 pts"}. */
  public static String leaderboard(List<Standing> standings) {
    StringBuilder text = new StringBuilder();
    int rank = 1;
    for (Standing standing : standings) {
      if (rank > 1) {
        text.append('\n');
      }
      text.append(rank++).append(". ").append(standing.displayName()).append(": ")
          .append(standing.total()).append(" pts");
    }
    return text.toString();
  }

  public static String formatDuration(Duration duration) {
    long seconds = duration.getSeconds();
    if (seconds >= 60 && seconds % 60 == 0) {
      long minutes = seconds / 60;
      return minutes + (minutes == 1 ? " minute" : " minutes");
    }
    return seconds + (seconds == 1 ? " second" : " seconds");
  }

  public static String formatClock(Instant instant) { return CLOCK.format(instant) + " UTC"; }

  private static void appendInline(StringBuilder text, List<Standing> standings) {
    int rank = 1;
    for (Standing standing : standings) {
      if (rank > 1) {
        text.append(" | ");
      }
      text.append(rank++).append(". ").append(standing.displayName()).append(' ')
          .append(standing.total());
    }
  }
}

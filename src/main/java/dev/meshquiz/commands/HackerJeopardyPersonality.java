package dev.meshquiz.commands;

import dev.meshquiz.api.InboundMessage;
import dev.meshquiz.api.Personality;
import dev.meshquiz.core.TimeSource;
import dev.meshquiz.game.Announcements;
import dev.meshquiz.game.CommandResult;
import dev.meshquiz.game.GameSession;
import dev.meshquiz.game.GameStatus;
import dev.meshquiz.game.IntakeResult;
import dev.meshquiz.game.Standing;
import dev.meshquiz.perms.AdminGate;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Text front end for {@link GameSession}. {@code !hj <command>} runs a command, {@code !join}
 * joins the roster, any other {@code !} text is unknown, and plain text is an answer.
 */
public final class HackerJeopardyPersonality implements Personality {
  private static final Logger LOGGER = LogManager.getLogger("MeshQuiz/Commands");

  private final GameSession session;
  private final String prefix;
  private final Duration cooldown;
  private final TimeSource timeSource;
  private final Supplier<String> diagnostics;
  private final Map<String, Long> cooldowns = new ConcurrentHashMap<>();

  public HackerJeopardyPersonality(
      GameSession session,
      String prefix,
      Duration cooldown,
      TimeSource timeSource,
      Supplier<String> diagnostics) {
    this.session = Objects.requireNonNull(session, "session");
    this.prefix = Objects.requireNonNull(prefix, "prefix").toLowerCase(Locale.ROOT);
    this.cooldown = Objects.requireNonNull(cooldown, "cooldown");
    this.timeSource = Objects.requireNonNull(timeSource, "timeSource");
    this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
  }

  @Override
  public String name() { return "hackerjeopardy"; }

  @Override
  public Optional<String> handle(InboundMessage message) {
    String text = message.text().strip();
    if (text.isEmpty()) {
      return Optional.empty();
    }
    String lower = text.toLowerCase(Locale.ROOT);
    if (lower.equals("!join")) {
      return reply(session.join(message.senderId(), message.senderName()));
    }
    if (lower.equals(prefix) || lower.startsWith(prefix + " ")) {
      return Optional.of(command(message, text.substring(prefix.length()).strip()));
    }
    if (text.startsWith("!")) {
      return Optional.of("Unknown command. Send " + prefix + " help");
    }
    return Optional.of(answer(message, text));
  }

  @Override
  public String help() {
    return "HACKER JEOPARDY\n"
        + prefix + " join - join the game\n"
        + "DM your answer while a question is open\n"
        + prefix + " status - current round\n"
        + prefix + " scores - leaderboard";
  }

  private String adminHelp() {
    return "\nAdmin: " + prefix + " start | stop | next | ban <id> | unban <id> | reset | diag";
  }

  private String command(InboundMessage message, String rest) {
    String[] parts = rest.split("\\s+", 2);
    String sub = parts[0].toLowerCase(Locale.ROOT);
    String arg = parts.length > 1 ? parts[1].strip() : "";
    String sender = message.senderId();
    LOGGER.debug("{} ran '{} {}'", sender, prefix, rest);
    return switch (sub) {
      case "", "help" -> session.admins().isAdmin(sender) ? help() + adminHelp() : help();
      case "join" -> session.join(sender, message.senderName()).message();
      case "status", "info" -> cooled(sender, this::status);
      case "scores", "leaderboard" -> cooled(sender, this::scores);
      case "start" -> session.start(sender).message();
      case "stop" -> session.stop(sender).message();
      case "next", "skip" -> session.skip(sender).message();
      case "ban" -> session.ban(sender, arg).message();
      case "unban" -> session.unban(sender, arg).message();
      case "reset" -> session.resetScores(sender).message();
      case "diag" -> session.admins().isAdmin(sender)
          ? diagnostics.get()
          : "Only admins can view diagnostics.";
      default -> "Unknown command: " + sub + ". Send " + prefix + " help";
    };
  }

  private String answer(InboundMessage message, String text) {
    IntakeResult result = session.submit(message.senderId(), message.senderName(), text);
    if (result.accepted()) {
      return "Answer received! Results when the round closes.";
    }
    return switch (result.reason()) {
      case BANNED -> "You are banned from playing.";
      case DUPLICATE_SUBMISSION -> "You already answered this question!";
      case NO_OPEN_ROUND -> session.snapshot().status() == GameStatus.RUNNING
          ? "No active question right now. Wait for the next round!"
          : "No game in progress. Send " + prefix + " help";
    };
  }

  private String status() {
    GameSession.Snapshot s = session.snapshot();
    return switch (s.status()) {
      case IDLE -> "No game has been played yet.";
      case STOPPED -> "Game #" + s.sessionNumber() + " is over after " + s.roundCounter() + " rounds.";
      case RUNNING -> {
        StringBuilder sb = new StringBuilder("Game #").append(s.sessionNumber()).append(": ");
        if (s.closesAt() != null) {
          sb.append("round ").append(s.roundNumber()).append('/').append(s.maxRounds())
              .append(" open, closes ").append(Announcements.formatClock(s.closesAt()));
        } else {
          sb.append("waiting for round ").append(s.roundCounter() + 1).append('/').append(s.maxRounds());
        }
        yield sb.append(". ").append(s.players()).append(" players.").toString();
      }
    };
  }

  private String scores() {
    List<Standing> standings = session.leaderboard();
    if (standings.isEmpty()) {
      return "No scores yet.";
    }
    return "Leaderboard:\n" + Announcements.leaderboard(standings);
  }

  private String cooled(String sender, Supplier<String> action) {
    if (cooldown.isZero()) {
      return action.get();
    }
    String key = AdminGate.normalize(sender);
    long now = timeSource.now().toEpochMilli();
    Long last = cooldowns.get(key);
    if (last != null && now - last < cooldown.toMillis()) {
      long remaining = cooldown.toMillis() - (now - last);
      return String.format(Locale.ROOT, "Slow down! Try again in %.1fs", remaining / 1000.0);
    }
    cooldowns.values().removeIf(stamp -> now - stamp >= cooldown.toMillis());
    cooldowns.put(key, now);
    return action.get();
  }

  int trackedCooldowns() { return cooldowns.size(); }

  private static Optional<String> reply(CommandResult result) {
    return Optional.of(result.message());
  }
}

package dev.meshquiz.core;

import dev.meshquiz.game.GameSettings;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/** Immutable runtime configuration for MeshQuiz. */
public final class Config {
  private final Game game;
  private final Channels channels;
  private final Outbound outbound;
  private final Queue queue;
  private final Retry retry;
  private final RateLimit ratelimit;
  private final Commands commands;
  private final Log log;

  private Config(
      Game game,
      Channels channels,
      Outbound outbound,
      Queue queue,
      Retry retry,
      RateLimit ratelimit,
      Commands commands,
      Log log) {
    this.game = game;
    this.channels = channels;
    this.outbound = outbound;
    this.queue = queue;
    this.retry = retry;
    this.ratelimit = ratelimit;
    this.commands = commands;
    this.log = log;
  }

  public Game game() { return game; }

  public Channels channels() { return channels; }

  public Outbound outbound() { return outbound; }

  public Queue queue() { return queue; }

  public Retry retry() { return retry; }

  public RateLimit ratelimit() { return ratelimit; }

  public Commands commands() { return commands; }

  public Log log() { return log; }

  /** Game settings derived from the {@code game} and {@code retry} sections. */
  public GameSettings gameSettings() {
    return new GameSettings(
        game.adminIds(),
        game.questionInterval(),
        game.answerWindow(),
        game.maxRounds(),
        game.finalLeaderboardSize(),
        game.roundLeaderboardSize(),
        retry.maxAttempts());
  }

  public static Builder builder() { return new Builder(); }

  public static Config defaultConfig() { return builder().build(); }

  public static final class Builder {
    private Game game = Game.DEFAULTS;
    private Channels channels = Channels.DEFAULTS;
    private Outbound outbound = Outbound.DEFAULTS;
    private Queue queue = Queue.DEFAULTS;
    private Retry retry = Retry.DEFAULTS;
    private RateLimit ratelimit = RateLimit.DEFAULTS;
    private Commands commands = Commands.DEFAULTS;
    private Log log = Log.DEFAULTS;

    public Builder game(Game game) {
      this.game = Objects.requireNonNull(game, "game");
      return this;
    }

    public Builder channels(Channels channels) {
      this.channels = Objects.requireNonNull(channels, "channels");
      return this;
    }

    public Builder outbound(Outbound outbound) {
      this.outbound = Objects.requireNonNull(outbound, "outbound");
      return this;
    }

    public Builder queue(Queue queue) {
      this.queue = Objects.requireNonNull(queue, "queue");
      return this;
    }

    public Builder retry(Retry retry) {
      this.retry = Objects.requireNonNull(retry, "retry");
      return this;
    }

    public Builder ratelimit(RateLimit ratelimit) {
      this.ratelimit = Objects.requireNonNull(ratelimit, "ratelimit");
      return this;
    }

    public Builder commands(Commands commands) {
      this.commands = Objects.requireNonNull(commands, "commands");
      return this;
    }

    public Builder log(Log log) {
      this.log = Objects.requireNonNull(log, "log");
      return this;
    }

    public Config build() {
      return new Config(game, channels, outbound, queue, retry, ratelimit, commands, log);
    }
  }

  public static final class Game {
    static final Game DEFAULTS =
        new Game(
            List.of(),
            Duration.ofSeconds(180),
            Duration.ofSeconds(120),
            10,
            5,
            3,
            "data/hj_questions.txt",
            "data/hj_ledger.json");
    private final List<String> adminIds;
    private final Duration questionInterval;
    private final Duration answerWindow;
    private final int maxRounds;
    private final int finalLeaderboardSize;
    private final int roundLeaderboardSize;
    private final String questionsFile;
    private final String ledgerFile;

    public Game(
        List<String> adminIds,
        Duration questionInterval,
        Duration answerWindow,
        int maxRounds,
        int finalLeaderboardSize,
        int roundLeaderboardSize,
        String questionsFile,
        String ledgerFile) {
      Objects.requireNonNull(questionInterval, "questionInterval");
      Objects.requireNonNull(answerWindow, "answerWindow");
      if (answerWindow.isZero() || answerWindow.isNegative()) {
        throw new IllegalArgumentException("game.answerWindowSeconds must be > 0");
      }
      if (questionInterval.compareTo(answerWindow) < 0) {
        throw new IllegalArgumentException(
            "game.questionIntervalSeconds must be >= game.answerWindowSeconds");
      }
      if (maxRounds <= 0) {
        throw new IllegalArgumentException("game.maxRounds must be > 0");
      }
      if (finalLeaderboardSize <= 0 || roundLeaderboardSize <= 0) {
        throw new IllegalArgumentException("game leaderboard sizes must be > 0");
      }
      this.adminIds = List.copyOf(Objects.requireNonNullElse(adminIds, List.of()));
      this.questionInterval = questionInterval;
      this.answerWindow = answerWindow;
      this.maxRounds = maxRounds;
      this.finalLeaderboardSize = finalLeaderboardSize;
      this.roundLeaderboardSize = roundLeaderboardSize;
      this.questionsFile = Objects.requireNonNullElse(questionsFile, "data/hj_questions.txt");
      this.ledgerFile = Objects.requireNonNullElse(ledgerFile, "");
    }

    public List<String> adminIds() { return adminIds; }

    public Duration questionInterval() { return questionInterval; }

    public Duration answerWindow() { return answerWindow; }

    public int maxRounds() { return maxRounds; }

    public int finalLeaderboardSize() { return finalLeaderboardSize; }

    public int roundLeaderboardSize() { return roundLeaderboardSize; }

    public String questionsFile() { return questionsFile; }

    /** Blank means scores are kept in memory only. */
    public String ledgerFile() { return ledgerFile; }
  }

  public static final class Channels {
    static final Channels DEFAULTS = new Channels("jeopardy", true);
    private final String game;
    private final boolean fallbackToPrimary;

    public Channels(String game, boolean fallbackToPrimary) {
      String name = Objects.requireNonNullElse(game, "jeopardy").trim();
      if (name.isEmpty()) {
        throw new IllegalArgumentException("channels.game may not be blank");
      }
      this.game = name;
      this.fallbackToPrimary = fallbackToPrimary;
    }

    public String game() { return game; }

    public boolean fallbackToPrimary() { return fallbackToPrimary; }
  }

  public static final class Outbound {
    static final Outbound DEFAULTS = new Outbound(200, Duration.ofMillis(500));
    private final int maxChunkChars;
    private final Duration chunkDelay;

    public Outbound(int maxChunkChars, Duration chunkDelay) {
      if (maxChunkChars <= 0) {
        throw new IllegalArgumentException("outbound.maxChunkChars must be > 0");
      }
      Objects.requireNonNull(chunkDelay, "chunkDelay");
      if (chunkDelay.isNegative()) {
        throw new IllegalArgumentException("outbound.chunkDelayMs must be >= 0");
      }
      this.maxChunkChars = maxChunkChars;
      this.chunkDelay = chunkDelay;
    }

    public int maxChunkChars() { return maxChunkChars; }

    public Duration chunkDelay() { return chunkDelay; }
  }

  public enum QueueOverflowPolicy {
    DROP_OLDEST,
    DROP_NEWEST,
    REJECT;

    static QueueOverflowPolicy from(String raw) {
      if (raw == null) {
        return DROP_OLDEST;
      }
      return switch (raw.toLowerCase(Locale.ROOT)) {
        case "dropoldest" -> DROP_OLDEST;
        case "dropnewest" -> DROP_NEWEST;
        case "reject" -> REJECT;
        default -> throw new IllegalArgumentException("Unknown queue policy: " + raw);
      };
    }
  }

  public static final class Queue {
    static final Queue DEFAULTS = new Queue(256, QueueOverflowPolicy.DROP_OLDEST);
    private final int maxSize;
    private final QueueOverflowPolicy onOverflow;

    public Queue(int maxSize, QueueOverflowPolicy onOverflow) {
      if (maxSize <= 0) {
        throw new IllegalArgumentException("queue.maxSize must be > 0");
      }
      this.maxSize = maxSize;
      this.onOverflow = Objects.requireNonNull(onOverflow, "onOverflow");
    }

    public int maxSize() { return maxSize; }

    public QueueOverflowPolicy onOverflow() { return onOverflow; }
  }

  public static final class Retry {
    static final Retry DEFAULTS =
        new Retry(4, Duration.ofMillis(500), Duration.ofMillis(8_000), true);
    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final boolean jitter;

    public Retry(int maxAttempts, Duration baseDelay, Duration maxDelay, boolean jitter) {
      if (maxAttempts <= 0) {
        throw new IllegalArgumentException("retry.maxAttempts must be > 0");
      }
      this.maxAttempts = maxAttempts;
      this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay");
      this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
      this.jitter = jitter;
    }

    public int maxAttempts() { return maxAttempts; }

    public Duration baseDelay() { return baseDelay; }

    public Duration maxDelay() { return maxDelay; }

    public boolean jitter() { return jitter; }
  }

  public static final class RateLimit {
    static final RateLimit DEFAULTS = new RateLimit(5, 1);
    private final int perDestinationBurst;
    private final int perDestinationRefillPerSec;

    public RateLimit(int perDestinationBurst, int perDestinationRefillPerSec) {
      if (perDestinationBurst <= 0) {
        throw new IllegalArgumentException("ratelimit.perDestinationBurst must be > 0");
      }
      if (perDestinationRefillPerSec <= 0) {
        throw new IllegalArgumentException("ratelimit.perDestinationRefillPerSec must be > 0");
      }
      this.perDestinationBurst = perDestinationBurst;
      this.perDestinationRefillPerSec = perDestinationRefillPerSec;
    }

    public int perDestinationBurst() { return perDestinationBurst; }

    public int perDestinationRefillPerSec() { return perDestinationRefillPerSec; }
  }

  public static final class Commands {
    static final Commands DEFAULTS = new Commands("!hj", Duration.ofMillis(2000));
    private final String prefix;
    private final Duration cooldown;

    public Commands(String prefix, Duration cooldown) {
      String p = Objects.requireNonNullElse(prefix, "!hj").trim().toLowerCase(Locale.ROOT);
      if (!p.startsWith("!") || p.length() < 2) {
        throw new IllegalArgumentException("commands.prefix must look like !name");
      }
      Objects.requireNonNull(cooldown, "cooldown");
      if (cooldown.isNegative()) {
        throw new IllegalArgumentException("commands.cooldownMs must be >= 0");
      }
      this.prefix = p;
      this.cooldown = cooldown;
    }

    public String prefix() { return prefix; }

    public Duration cooldown() { return cooldown; }
  }

  public static final class Log {
    static final Log DEFAULTS = new Log("INFO");
    private final String level;

    public Log(String level) {
      this.level = Objects.requireNonNullElse(level, "INFO").toUpperCase(Locale.ROOT);
    }

    public String level() { return level; }
  }

  public static Config fromRaw(Raw raw) {
    if (raw == null) {
      return defaultConfig();
    }
    return builder()
        .game(raw.game != null ? raw.game.toGame() : Game.DEFAULTS)
        .channels(raw.channels != null ? raw.channels.toChannels() : Channels.DEFAULTS)
        .outbound(raw.outbound != null ? raw.outbound.toOutbound() : Outbound.DEFAULTS)
        .queue(raw.queue != null ? raw.queue.toQueue() : Queue.DEFAULTS)
        .retry(raw.retry != null ? raw.retry.toRetry() : Retry.DEFAULTS)
        .ratelimit(raw.ratelimit != null ? raw.ratelimit.toRateLimit() : RateLimit.DEFAULTS)
        .commands(raw.commands != null ? raw.commands.toCommands() : Commands.DEFAULTS)
        .log(raw.log != null ? raw.log.toLog() : Log.DEFAULTS)
        .build();
  }

  public static final class Raw {
    public RawGame game;
    public RawChannels channels;
    public RawOutbound outbound;
    public RawQueue queue;
    public RawRetry retry;
    public RawRateLimit ratelimit;
    public RawCommands commands;
    public RawLog log;
  }

  public static final class RawGame {
    public List<String> adminIds;
    public Integer questionIntervalSeconds;
    public Integer answerWindowSeconds;
    public Integer maxRounds;
    public Integer finalLeaderboardSize;
    public Integer roundLeaderboardSize;
    public String questionsFile;
    public String ledgerFile;

    Game toGame() {
      Game d = Game.DEFAULTS;
      return new Game(
          adminIds != null ? adminIds : d.adminIds(),
          questionIntervalSeconds != null
              ? Duration.ofSeconds(questionIntervalSeconds)
              : d.questionInterval(),
          answerWindowSeconds != null ? Duration.ofSeconds(answerWindowSeconds) : d.answerWindow(),
          maxRounds != null ? maxRounds : d.maxRounds(),
          finalLeaderboardSize != null ? finalLeaderboardSize : d.finalLeaderboardSize(),
          roundLeaderboardSize != null ? roundLeaderboardSize : d.roundLeaderboardSize(),
          questionsFile != null ? questionsFile : d.questionsFile(),
          ledgerFile != null ? ledgerFile : d.ledgerFile());
    }
  }

  public static final class RawChannels {
    public String game;
    public Boolean fallbackToPrimary;

    Channels toChannels() {
      return new Channels(
          game != null ? game : Channels.DEFAULTS.game(),
          fallbackToPrimary != null ? fallbackToPrimary : Channels.DEFAULTS.fallbackToPrimary());
    }
  }

  public static final class RawOutbound {
    public Integer maxChunkChars;
    public Integer chunkDelayMs;

    Outbound toOutbound() {
      Outbound d = Outbound.DEFAULTS;
      return new Outbound(
          maxChunkChars != null ? maxChunkChars : d.maxChunkChars(),
          chunkDelayMs != null ? Duration.ofMillis(chunkDelayMs) : d.chunkDelay());
    }
  }

  public static final class RawQueue {
    public Integer maxSize;
    public String onOverflow;

    Queue toQueue() {
      int size = maxSize != null ? maxSize : Queue.DEFAULTS.maxSize();
      QueueOverflowPolicy policy = QueueOverflowPolicy.from(onOverflow);
      return new Queue(size, policy);
    }
  }

  public static final class RawRetry {
    public Integer maxAttempts;
    public Integer baseDelayMs;
    public Integer maxDelayMs;
    public Boolean jitter;

    Retry toRetry() {
      int attempts = maxAttempts != null ? maxAttempts : Retry.DEFAULTS.maxAttempts();
      Duration base =
          Duration.ofMillis(baseDelayMs != null ? baseDelayMs : Retry.DEFAULTS.baseDelay().toMillis());
      Duration max =
          Duration.ofMillis(maxDelayMs != null ? maxDelayMs : Retry.DEFAULTS.maxDelay().toMillis());
      boolean useJitter = jitter != null ? jitter : Retry.DEFAULTS.jitter();
      if (base.isZero() || base.isNegative()) {
        throw new IllegalArgumentException("retry.baseDelayMs must be > 0");
      }
      if (max.compareTo(base) < 0) {
        throw new IllegalArgumentException("retry.maxDelayMs must be >= baseDelayMs");
      }
      return new Retry(attempts, base, max, useJitter);
    }
  }

  public static final class RawRateLimit {
    public Integer perDestinationBurst;
    public Integer perDestinationRefillPerSec;

    RateLimit toRateLimit() {
      int burst =
          perDestinationBurst != null ? perDestinationBurst : RateLimit.DEFAULTS.perDestinationBurst();
      int refill =
          perDestinationRefillPerSec != null
              ? perDestinationRefillPerSec
              : RateLimit.DEFAULTS.perDestinationRefillPerSec();
      return new RateLimit(burst, refill);
    }
  }

  public static final class RawCommands {
    public String prefix;
    public Integer cooldownMs;

    Commands toCommands() {
      return new Commands(
          prefix != null ? prefix : Commands.DEFAULTS.prefix(),
          cooldownMs != null ? Duration.ofMillis(cooldownMs) : Commands.DEFAULTS.cooldown());
    }
  }

  public static final class RawLog {
    public String level;

    Log toLog() { return new Log(level); }
  }
}

package dev.meshquiz.core;

import dev.meshquiz.api.InboundMessage;
import dev.meshquiz.commands.HackerJeopardyPersonality;
import dev.meshquiz.game.ExecutorScheduler;
import dev.meshquiz.game.GameSession;
import dev.meshquiz.game.InMemoryLedger;
import dev.meshquiz.game.JsonFileLedger;
import dev.meshquiz.game.Ledger;
import dev.meshquiz.game.QuestionFileLoader;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Wires the outbox, scheduler, ledger, game session and personality for one bot process. */
public final class MeshQuizRuntime implements AutoCloseable {
  private static final Logger LOGGER = LogManager.getLogger("MeshQuiz/Runtime");

  private final Config config;
  private final MeshOutbox outbox;
  private final ExecutorScheduler scheduler;
  private final GameSession session;
  private final HackerJeopardyPersonality personality;
  private final InboundRouter inbound;

  public MeshQuizRuntime(Config config, MeshTransport transport) {
    this(config, transport, TimeSource.system(), Sleeper.thread());
  }

  MeshQuizRuntime(Config config, MeshTransport transport, TimeSource timeSource, Sleeper sleeper) {
    this.config = Objects.requireNonNull(config, "config");
    ChannelRouter router = new ChannelRouter(transport, config.channels().fallbackToPrimary());
    this.outbox = new MeshOutbox(config, router, transport, timeSource, sleeper);
    this.scheduler = new ExecutorScheduler(Clock.systemUTC());
    this.session =
        new GameSession(
            config.gameSettings(),
            new QuestionFileLoader(Path.of(config.game().questionsFile())),
            openLedger(config.game().ledgerFile()),
            scheduler,
            outbox);
    this.personality =
        new HackerJeopardyPersonality(
            session,
            config.commands().prefix(),
            config.commands().cooldown(),
            timeSource,
            () -> outbox.diagnostics().describe());
    this.inbound = new InboundRouter(personality, outbox, config.commands().prefix());
    LOGGER.info(
        "MeshQuiz ready: personality={}, channel={}, admins={}",
        personality.name(),
        config.channels().game(),
        session.admins().admins().size());
  }

  private static Ledger openLedger(String file) {
    if (file.isBlank()) {
      LOGGER.info("No ledger file configured; scores are kept in memory only");
      return new InMemoryLedger();
    }
    return JsonFileLedger.open(Path.of(file));
  }

  public Optional<String> onMessage(InboundMessage message) {
    return inbound.dispatch(message);
  }

  public Config config() { return config; }

  public GameSession session() { return session; }

  public MeshOutbox outbox() { return outbox; }

  public HackerJeopardyPersonality personality() { return personality; }

  @Override
  public void close() {
    session.close();
    scheduler.close();
    outbox.close();
  }
}

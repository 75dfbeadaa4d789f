package dev.meshquiz;

import dev.meshquiz.api.InboundMessage;
import dev.meshquiz.core.Config;
import dev.meshquiz.core.ConfigLoader;
import dev.meshquiz.core.LoggingMeshTransport;
import dev.meshquiz.core.MeshQuizRuntime;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;

/**
 * Console driver. Each stdin line is one inbound packet: {@code <nodeId> <text>} is a direct
 * message, {@code @<nodeId> <text>} is a message on the game channel. Radio output goes to the log.
 */
public final class MeshQuizBot {
  private static final Logger LOGGER = LogManager.getLogger("MeshQuiz");

  private MeshQuizBot() {}

  public static void main(String[] args) throws IOException {
    Path configPath = args.length > 0 ? Path.of(args[0]) : ConfigLoader.DEFAULT_PATH;
    Config config = new ConfigLoader(configPath).load();
    Configurator.setRootLevel(Level.toLevel(config.log().level(), Level.INFO));

    LoggingMeshTransport transport =
        new LoggingMeshTransport(List.of("primary", config.channels().game()));
    MeshQuizRuntime runtime = new MeshQuizRuntime(config, transport);
    Runtime.getRuntime().addShutdownHook(new Thread(runtime::close, "MeshQuiz-Shutdown"));

    try (BufferedReader in =
        new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
      String line;
      while ((line = in.readLine()) != null) {
        Optional<InboundMessage> message = parseLine(line, 1);
        if (message.isEmpty()) {
          if (!line.isBlank()) {
            LOGGER.warn("Ignoring input line; expected '<nodeId> <text>' or '@<nodeId> <text>'");
          }
          continue;
        }
        runtime.onMessage(message.get());
      }
    } finally {
      runtime.close();
    }
  }

  static Optional<InboundMessage> parseLine(String line, int gameChannel) {
    String trimmed = line.strip();
    int space = trimmed.indexOf(' ');
    if (space <= 0) {
      return Optional.empty();
    }
    String sender = trimmed.substring(0, space);
    String text = trimmed.substring(space + 1).strip();
    if (text.isEmpty()) {
      return Optional.empty();
    }
    if (sender.startsWith("@")) {
      sender = sender.substring(1);
      if (sender.isEmpty()) {
        return Optional.empty();
      }
      return Optional.of(new InboundMessage(sender, sender, gameChannel, false, text));
    }
    return Optional.of(new InboundMessage(sender, sender, 0, true, text));
  }
}

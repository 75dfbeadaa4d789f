package dev.meshquiz.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hjson.JsonValue;
import org.hjson.Stringify;

/**
 * Loads {@link Config} from an Hjson file. A missing file is seeded from the example contents;
 * a file that does not parse or validate fails startup.
 */
public final class ConfigLoader {
  private static final Logger LOGGER = LogManager.getLogger("MeshQuiz/Config");

  public static final Path DEFAULT_PATH = Path.of("config/meshquiz.json5");

  private final ObjectMapper mapper =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  private final Path live;
  private final Path example;

  public ConfigLoader(Path live) {
    this.live = Objects.requireNonNull(live, "live");
    this.example = live.resolveSibling(live.getFileName() + ".example");
  }

  public Path path() { return live; }

  public Config load() {
    ensureExampleConfig();
    if (!Files.exists(live)) {
      LOGGER.warn("{} missing; using defaults", live);
      return Config.defaultConfig();
    }
    try {
      Config cfg = parse(Files.readString(live, StandardCharsets.UTF_8));
      if (cfg.game().adminIds().isEmpty()) {
        LOGGER.warn("game.adminIds is empty; nobody will be able to start a game");
      }
      LOGGER.info(
          "Loaded {} (rounds={}, window={}s, interval={}s)",
          live,
          cfg.game().maxRounds(),
          cfg.game().answerWindow().toSeconds(),
          cfg.game().questionInterval().toSeconds());
      return cfg;
    } catch (IOException | RuntimeException e) {
      LOGGER.error("Failed to load {}: {}", live, e.toString());
      throw new IllegalStateException("No valid configuration available in " + live, e);
    }
  }

  Config parse(String hjson) throws IOException {
    String json = JsonValue.readHjson(hjson).toString(Stringify.PLAIN);
    return Config.fromRaw(mapper.readValue(json, Config.Raw.class));
  }

  private void ensureExampleConfig() {
    try {
      Path dir = live.toAbsolutePath().getParent();
      if (dir != null) {
        Files.createDirectories(dir);
      }
      if (!Files.exists(example)) {
        Files.writeString(example, exampleContents(), StandardCharsets.UTF_8);
        LOGGER.info("Wrote example config to {}", example);
      }
      if (!Files.exists(live)) {
        Files.copy(example, live, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      // Defaults still work without a writable config directory.
      LOGGER.warn("Could not write example config {}: {}", example, e.toString());
    }
  }

  static String exampleContents() {
    return """
        {
          game: {
            # node ids allowed to run !hj start/stop/next/ban/unban/reset/diag
            adminIds: ["!abcd1234"],
            questionIntervalSeconds: 180,
            answerWindowSeconds: 120,
            maxRounds: 10,
            finalLeaderboardSize: 5,
            roundLeaderboardSize: 3,
            questionsFile: "data/hj_questions.txt",
            # blank keeps scores in memory only
            ledgerFile: "data/hj_ledger.json"
          },
          channels: { game: "jeopardy", fallbackToPrimary: true },
          outbound: { maxChunkChars: 200, chunkDelayMs: 500 },
          queue: { maxSize: 256, onOverflow: "dropOldest" },
          retry: { maxAttempts: 4, baseDelayMs: 500, maxDelayMs: 8000, jitter: true },
          ratelimit: { perDestinationBurst: 5, perDestinationRefillPerSec: 1 },
          commands: { prefix: "!hj", cooldownMs: 2000 },
          log: { level: "INFO" }
        }
        """;
  }
}

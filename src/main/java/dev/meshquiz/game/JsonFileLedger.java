package dev.meshquiz.game;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Ledger that rewrites a JSON snapshot file after every change. */
public final class JsonFileLedger extends InMemoryLedger {
  private static final Logger LOGGER = LogManager.getLogger("MeshQuiz/Ledger");

  private final Path file;
  private final ObjectMapper mapper;

  private JsonFileLedger(Path file) {
    this.file = Objects.requireNonNull(file, "file");
    this.mapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .enable(SerializationFeature.INDENT_OUTPUT);
  }

  /**
   * Opens the ledger stored at {@code file}, creating parent directories as needed.
   *
   * @throws UncheckedIOException if an existing file cannot be read
   */
  public static JsonFileLedger open(Path file) {
    JsonFileLedger ledger = new JsonFileLedger(file);
    ledger.load();
    return ledger;
  }

  public Path file() { return file; }

  private void load() {
    if (!Files.exists(file)) {
      LOGGER.info("No ledger at {}; starting empty", file);
      return;
    }
    try {
      Snapshot snapshot = mapper.readValue(file.toFile(), Snapshot.class);
      List<Standing> standings = new ArrayList<>();
      long highest = snapshot.sequence;
      if (snapshot.players != null) {
        for (PlayerRow row : snapshot.players) {
          if (row.id == null || row.id.isBlank()) {
            continue;
          }
          standings.add(
              new Standing(row.id, row.name != null ? row.name : row.id, row.total, row.reachedAt));
          highest = Math.max(highest, row.reachedAt);
        }
      }
      restore(standings, highest);
      LOGGER.info("Loaded {} player totals from {}", standings.size(), file);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read ledger " + file, e);
    }
  }

  @Override
  protected void persist(List<Standing> standings, long lastSequence) {
    Snapshot snapshot = new Snapshot();
    snapshot.sequence = lastSequence;
    snapshot.players = new ArrayList<>();
    for (Standing standing : standings) {
      PlayerRow row = new PlayerRow();
      row.id = standing.playerId();
      row.name = standing.displayName();
      row.total = standing.total();
      row.reachedAt = standing.reachedAt();
      snapshot.players.add(row);
    }
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
      mapper.writeValue(tmp.toFile(), snapshot);
      try {
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      throw new LedgerException("Failed to write ledger " + file, e);
    }
  }

  public static final class Snapshot {
    public long sequence;
    public List<PlayerRow> players;
  }

  public static final class PlayerRow {
    public String id;
    public String name;
    public long total;
    public long reachedAt;
  }
}

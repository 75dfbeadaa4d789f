package dev.meshquiz.game;

import dev.meshquiz.perms.AdminGate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Ledger kept in memory. Subclasses make each change durable through {@link #persist}. */
public class InMemoryLedger implements Ledger {
  private final Map<String, Standing> players = new LinkedHashMap<>();
  private long sequence;

  @Override
  public synchronized long applyDelta(String playerId, String displayName, long delta) {
    String id = AdminGate.normalize(playerId);
    if (id.isEmpty()) {
      throw new IllegalArgumentException("playerId may not be blank");
    }
    Standing previous = players.get(id);
    long previousSequence = sequence;
    String name = displayName != null && !displayName.isBlank()
        ? displayName
        : previous != null ? previous.displayName() : id;
    long total = (previous != null ? previous.total() : 0L) + delta;
    long reachedAt = previous != null && delta == 0 ? previous.reachedAt() : ++sequence;
    players.put(id, new Standing(id, name, total, reachedAt));
    try {
      persist(List.copyOf(players.values()), sequence);
    } catch (LedgerException e) {
      if (previous != null) {
        players.put(id, previous);
      } else {
        players.remove(id);
      }
      sequence = previousSequence;
      throw e;
    }
    return total;
  }

  @Override
  public synchronized List<Standing> topN(int n) {
    if (n <= 0) {
      return List.of();
    }
    List<Standing> sorted = new ArrayList<>(players.values());
    sorted.sort(Standing.RANKING);
    return List.copyOf(sorted.subList(0, Math.min(n, sorted.size())));
  }

  @Override
  public synchronized long totalOf(String playerId) {
    Standing standing = players.get(AdminGate.normalize(playerId));
    return standing != null ? standing.total() : 0L;
  }

  @Override
  public synchronized void reset() {
    Map<String, Standing> previous = new LinkedHashMap<>(players);
    long previousSequence = sequence;
    players.clear();
    sequence = 0;
    try {
      persist(List.of(), 0);
    } catch (LedgerException e) {
      players.putAll(previous);
      sequence = previousSequence;
      throw e;
    }
  }

  /** Seeds state loaded from storage. Only for use by subclasses before the ledger is shared. */
  protected final synchronized void restore(List<Standing> standings, long lastSequence) {
    Objects.requireNonNull(standings, "standings");
    players.clear();
    for (Standing standing : standings) {
      players.put(standing.playerId(), standing);
    }
    sequence = lastSequence;
  }

  /**
   * Called with the full table after every change, while the ledger lock is held.
   *
   * @throws LedgerException to reject the change
   */
  protected void persist(List<Standing> standings, long lastSequence) {}
}

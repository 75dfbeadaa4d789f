package dev.meshquiz.game;

import java.util.List;

/**
 * Durable per-player score totals.
 *
 * <p>A failed {@link #applyDelta} must leave the total unchanged so the caller can retry the
 * same delta. Deciding whether a delta was already applied is the caller's job.
 */
public interface Ledger {
  /**
   * Adds {@code delta} to the player's total and returns the new total.
   *
   * @throws LedgerException if the change could not be made durable
   */
  long applyDelta(String playerId, String displayName, long delta);

  /** Top {@code n} standings, highest total first. */
  List<Standing> topN(int n);

  long totalOf(String playerId);

  /** Clears every total. */
  void reset();
}

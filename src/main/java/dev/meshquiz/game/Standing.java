package dev.meshquiz.game;

import java.util.Comparator;

/**
 * A player's cumulative total. {@code reachedAt} is the ledger sequence number of the change
 * that produced the current total and breaks ties between equal totals: earlier wins.
 */
public record Standing(String playerId, String displayName, long total, long reachedAt) {
  public static final Comparator<Standing> RANKING =
      Comparator.comparingLong(Standing::total)
          .reversed()
          .thenComparingLong(Standing::reachedAt)
          .thenComparing(Standing::playerId);
}

package dev.meshquiz.game;

import java.util.List;

/** Graded result of one round: each counted submission's delta and the standings afterwards. */
public record Settlement(
    long roundId, int roundNumber, Question question, List<Score> scores, List<Standing> standings) {
  public Settlement {
    scores = List.copyOf(scores);
    standings = List.copyOf(standings);
  }

  public long deltaSum() {
    long sum = 0;
    for (Score score : scores) {
      sum += score.delta();
    }
    return sum;
  }

  public record Score(String playerId, String displayName, boolean correct, int delta) {}
}

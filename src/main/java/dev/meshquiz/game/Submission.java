package dev.meshquiz.game;

import java.time.Instant;

/** An accepted answer. At most one exists per (player, round). */
public record Submission(
    String playerId, String displayName, long roundId, String text, Instant arrivedAt) {}

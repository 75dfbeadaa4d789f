package dev.meshquiz.api;

import java.util.Objects;

/** Plain-text payload destined for the public game channel. */
public record Announcement(Kind kind, String text) {
  public enum Kind {
    GAME_STARTED,
    ROUND_OPENED,
    ROUND_SETTLED,
    GAME_STOPPED,
    NOTICE
  }

  public Announcement {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(text, "text");
  }
}

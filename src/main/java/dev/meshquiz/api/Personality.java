package dev.meshquiz.api;

import java.util.Optional;

/** A game mode the bot can run. Exactly one is active for the life of the process. */
public interface Personality {
  String name();

  /** Handles one inbound message and returns the reply for the sender, if any. */
  Optional<String> handle(InboundMessage message);

  String help();
}

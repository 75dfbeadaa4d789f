package dev.meshquiz.core;

import dev.meshquiz.api.InboundMessage;
import dev.meshquiz.api.Outbox;
import dev.meshquiz.api.Personality;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Hands inbound mesh text to the active personality. Direct messages are always handled;
 * channel traffic only when it starts with the command prefix. Replies go back by DM.
 */
public final class InboundRouter {
  private static final Logger LOGGER = LogManager.getLogger("MeshQuiz/Inbound");

  private final Personality personality;
  private final Outbox outbox;
  private final String prefix;

  public InboundRouter(Personality personality, Outbox outbox, String prefix) {
    this.personality = Objects.requireNonNull(personality, "personality");
    this.outbox = Objects.requireNonNull(outbox, "outbox");
    this.prefix = Objects.requireNonNull(prefix, "prefix").toLowerCase(Locale.ROOT);
  }

  public Optional<String> dispatch(InboundMessage message) {
    String text = message.text().strip();
    if (text.isEmpty()) {
      return Optional.empty();
    }
    if (!message.directMessage() && !text.toLowerCase(Locale.ROOT).startsWith(prefix)) {
      LOGGER.trace("Ignoring channel {} chatter from {}", message.channel(), message.senderId());
      return Optional.empty();
    }
    Optional<String> reply;
    try {
      reply = personality.handle(message);
    } catch (RuntimeException e) {
      LOGGER.error(
          "{} failed handling message from {}: {}", personality.name(), message.senderId(), text, e);
      reply = Optional.of("Something went wrong handling that. Please try again.");
    }
    reply.ifPresent(r -> outbox.direct(message.senderId(), r));
    return reply;
  }
}

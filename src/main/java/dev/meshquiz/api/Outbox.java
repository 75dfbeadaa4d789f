package dev.meshquiz.api;

import java.util.concurrent.CompletableFuture;

/** Outbound side of the bot: public channel announcements and direct messages. */
public interface Outbox {
  CompletableFuture<SendResult> announce(Announcement announcement);

  CompletableFuture<SendResult> direct(String nodeId, String text);
}

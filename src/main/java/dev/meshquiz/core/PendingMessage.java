package dev.meshquiz.core;

import dev.meshquiz.api.SendResult;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

final class PendingMessage {
  final UUID requestId;
  final ChannelRouter.Resolution resolution;
  final List<String> chunks;
  final boolean fallback;
  final CompletableFuture<SendResult> future;
  final Instant enqueuedAt;

  PendingMessage(
      UUID requestId,
      ChannelRouter.Resolution resolution,
      List<String> chunks,
      CompletableFuture<SendResult> future,
      Instant enqueuedAt) {
    this.requestId = requestId;
    this.resolution = resolution;
    this.chunks = List.copyOf(chunks);
    this.fallback = resolution.status() == ChannelRouter.Status.FALLBACK;
    this.future = future;
    this.enqueuedAt = enqueuedAt;
  }

  String destinationKey() { return resolution.requested().key(); }

  void completeQueueFull() {
    future.complete(new SendResult(false, "QUEUE_FULL", "Queue full", requestId.toString()));
  }
}

package dev.meshquiz.core;

import dev.meshquiz.api.Announcement;
import dev.meshquiz.api.Destination;
import dev.meshquiz.api.Outbox;
import dev.meshquiz.api.SendResult;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Queues outbound text for the radio. A single worker thread drains the queue, splits long
 * messages into chunks, paces them per destination and retries transient transport failures.
 */
public final class MeshOutbox implements Outbox, AutoCloseable {
  private static final Logger LOGGER = LogManager.getLogger("MeshQuiz/Outbox");

  private final Config config;
  private final ChannelRouter router;
  private final MeshTransport transport;
  private final DispatchQueue queue;
  private final RateLimiterRegistry rateLimiter;
  private final TimeSource timeSource;
  private final Sleeper sleeper;
  private final Diagnostics diagnostics = new Diagnostics();
  private final SendWorker worker;
  private final Thread workerThread;
  private final AtomicBoolean closed = new AtomicBoolean();

  public MeshOutbox(
      Config config,
      ChannelRouter router,
      MeshTransport transport,
      TimeSource timeSource,
      Sleeper sleeper) {
    this.config = Objects.requireNonNull(config, "config");
    this.router = Objects.requireNonNull(router, "router");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.timeSource = Objects.requireNonNull(timeSource, "timeSource");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.queue = new DispatchQueue(config.queue().maxSize(), config.queue().onOverflow());
    this.rateLimiter = new RateLimiterRegistry(config.ratelimit(), timeSource);
    this.worker = new SendWorker(config.retry());
    this.workerThread = new Thread(worker, "MeshQuiz-Outbox");
    this.workerThread.setDaemon(true);
    this.workerThread.start();
  }

  @Override
  public CompletableFuture<SendResult> announce(Announcement announcement) {
    Objects.requireNonNull(announcement, "announcement");
    return send(Destination.channel(config.channels().game()), announcement.text());
  }

  @Override
  public CompletableFuture<SendResult> direct(String nodeId, String text) {
    return send(Destination.node(Objects.requireNonNull(nodeId, "nodeId")), text);
  }

  public CompletableFuture<SendResult> send(Destination destination, String text) {
    UUID requestId = UUID.randomUUID();
    if (closed.get()) {
      return CompletableFuture.completedFuture(
          new SendResult(false, "GIVE_UP", "MeshQuiz shutting down", requestId.toString()));
    }
    if (text == null || text.isBlank()) {
      return CompletableFuture.completedFuture(
          new SendResult(false, "BAD_PAYLOAD", "Text required", requestId.toString()));
    }
    ChannelRouter.Resolution resolution = router.resolve(destination);
    if (!resolution.ok()) {
      return CompletableFuture.completedFuture(
          new SendResult(
              false, "BAD_ROUTE", "Unknown destination: " + destination.key(), requestId.toString()));
    }
    CompletableFuture<SendResult> future = new CompletableFuture<>();
    PendingMessage pending =
        new PendingMessage(
            requestId,
            resolution,
            chunk(text, config.outbound().maxChunkChars()),
            future,
            timeSource.now());
    DispatchQueue.PushResult push = queue.enqueue(pending);
    if (!push.accepted()) {
      LOGGER.warn("Outbound queue full; rejected message to {}", destination.key());
      pending.completeQueueFull();
      return future;
    }
    PendingMessage dropped = push.dropped();
    if (dropped != null) {
      LOGGER.warn("Outbound queue full; dropped oldest message to {}", dropped.destinationKey());
      dropped.completeQueueFull();
    }
    return future;
  }

  public DiagnosticsSnapshot diagnostics() {
    return new DiagnosticsSnapshot(queue.size(), queue.capacity(), diagnostics.snapshot());
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      worker.stop();
      queue.close();
      workerThread.interrupt();
      try {
        workerThread.join(2000);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * Splits {@code text} into pieces of at most {@code max} characters, breaking at whitespace
   * where possible.
   */
  static List<String> chunk(String text, int max) {
    List<String> chunks = new ArrayList<>();
    String rest = text.strip();
    while (rest.length() > max) {
      int cut = -1;
      for (int i = max; i > 0; i--) {
        if (Character.isWhitespace(rest.charAt(i))) {
          cut = i;
          break;
        }
      }
      if (cut <= 0) {
        cut = max;
      }
      chunks.add(rest.substring(0, cut).stripTrailing());
      rest = rest.substring(cut).stripLeading();
    }
    if (!rest.isEmpty()) {
      chunks.add(rest);
    }
    return chunks;
  }

  public record DiagnosticsSnapshot(
      int queueSize, int queueCapacity, Map<String, Diagnostics.DestinationSnapshot> destinations) {
    public String describe() {
      StringBuilder sb = new StringBuilder();
      sb.append("Queue ").append(queueSize).append('/').append(queueCapacity);
      if (destinations.isEmpty()) {
        sb.append("\nNo sends yet.");
      }
      destinations.forEach((key, s) -> {
        sb.append('\n').append(key).append(": ")
            .append(s.chunksSent()).append(" chunks, ")
            .append(s.retries()).append(" retries, ")
            .append(s.failures()).append(" failed");
        if (s.failing()) {
          sb.append(", last ").append(s.lastFailureCode()).append(" at ").append(s.lastFailure());
        } else {
          sb.append(", last ok at ").append(s.lastSuccess());
        }
      });
      return sb.toString();
    }
  }

  private final class SendWorker implements Runnable {
    private final Config.Retry retry;
    private volatile boolean running = true;

    SendWorker(Config.Retry retry) {
      this.retry = retry;
    }

    void stop() { running = false; }

    @Override
    public void run() {
      while (running && !Thread.currentThread().isInterrupted()) {
        PendingMessage message;
        try {
          message = queue.take();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          break;
        }
        if (message == null) {
          break;
        }
        process(message);
      }
    }

    private void process(PendingMessage message) {
      String key = message.destinationKey();
      Airtime airtime = new Airtime();
      try {
        SendResult result = deliverAll(message, airtime);
        Instant now = timeSource.now();
        if (result.ok()) {
          diagnostics.recordDelivered(key, now, airtime.chunks, airtime.retries);
        } else {
          diagnostics.recordFailed(key, now, airtime.chunks, airtime.retries, result.code());
          LOGGER.error("Delivery to {} failed: {} {}", key, result.code(), result.message());
        }
        message.future.complete(result);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        message.future.complete(
            new SendResult(false, "GIVE_UP", "Interrupted", message.requestId.toString()));
      } catch (RuntimeException e) {
        LOGGER.error("Worker failed: {}", e.toString());
        diagnostics.recordFailed(key, timeSource.now(), airtime.chunks, airtime.retries, "GIVE_UP");
        message.future.complete(
            new SendResult(false, "GIVE_UP", "Worker failure", message.requestId.toString()));
      }
    }

    private SendResult deliverAll(PendingMessage message, Airtime airtime)
        throws InterruptedException {
      String requestId = message.requestId.toString();
      MeshTransport.Target target = message.resolution.target();
      for (int i = 0; i < message.chunks.size(); i++) {
        if (i > 0) {
          sleeper.sleep(config.outbound().chunkDelay());
        }
        Duration wait = rateLimiter.acquire(message.destinationKey());
        if (!wait.isZero()) {
          sleeper.sleep(wait);
        }
        String failure = deliver(message.chunks.get(i), target, airtime);
        if (failure != null) {
          return new SendResult(
              false,
              "GIVE_UP",
              String.format("Chunk %d/%d: %s", i + 1, message.chunks.size(), failure),
              requestId);
        }
      }
      if (message.fallback) {
        return new SendResult(true, "FALLBACK", "Sent via " + target + " (fallback)", requestId);
      }
      return new SendResult(true, "OK", "Sent", requestId);
    }

    /** Returns null on success, otherwise a description of the final failure. */
    private String deliver(String text, MeshTransport.Target target, Airtime airtime)
        throws InterruptedException {
      Duration delay = retry.baseDelay();
      String lastError = "unknown";
      for (int attempt = 1; attempt <= retry.maxAttempts(); attempt++) {
        MeshTransport.TransportResponse response;
        try {
          response = transport.sendText(text, target);
        } catch (RuntimeException e) {
          response = MeshTransport.TransportResponse.retry(e);
        }
        if (response.success()) {
          airtime.chunks++;
          return null;
        }
        lastError = response.error() != null ? response.error().toString() : "transport failure";
        if (!response.retryable()) {
          return "Transport rejected message: " + lastError;
        }
        if (attempt >= retry.maxAttempts()) {
          break;
        }
        LOGGER.warn(
            "Send to {} failed (attempt {}/{}): {}", target, attempt, retry.maxAttempts(), lastError);
        sleeper.sleep(applyJitter(delay));
        delay = nextDelay(delay);
        airtime.retries++;
      }
      return String.format(
          "Retries exhausted after %d attempts (last=%s)", retry.maxAttempts(), lastError);
    }

    private Duration nextDelay(Duration current) {
      long currentMs = Math.max(1, current.toMillis());
      long doubled = Math.min(retry.maxDelay().toMillis(), currentMs * 2);
      return Duration.ofMillis(doubled);
    }

    private Duration applyJitter(Duration delay) {
      if (!retry.jitter()) {
        return delay;
      }
      double factor = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
      long millis = Math.max(1, Math.round(delay.toMillis() * factor));
      long clamped = Math.min(retry.maxDelay().toMillis(), millis);
      return Duration.ofMillis(clamped);
    }
  }

  /** Chunks keyed and transport retries for one message. */
  private static final class Airtime {
    int chunks;
    int retries;
  }
}

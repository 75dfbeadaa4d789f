package dev.meshquiz.core;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/** Per-destination token buckets that pace traffic onto the shared radio. */
final class RateLimiterRegistry {
  private final Map<String, TokenBucket> buckets = new ConcurrentHashMap<>();
  private final Config.RateLimit rateLimit;
  private final TimeSource timeSource;

  RateLimiterRegistry(Config.RateLimit rateLimit, TimeSource timeSource) {
    this.rateLimit = Objects.requireNonNull(rateLimit, "rateLimit");
    this.timeSource = Objects.requireNonNull(timeSource, "timeSource");
  }

  /** Takes a token for {@code key} and returns how long the caller must wait before sending. */
  Duration acquire(String key) {
    TokenBucket bucket =
        buckets.computeIfAbsent(
            key,
            k ->
                new TokenBucket(
                    rateLimit.perDestinationBurst(),
                    rateLimit.perDestinationRefillPerSec(),
                    timeSource.nanoTime()));
    return bucket.acquire(timeSource.nanoTime());
  }

  private static final class TokenBucket {
    private final double capacity;
    private final double refillPerSecond;
    private double tokens;
    private long lastCheck;

    TokenBucket(double capacity, double refillPerSecond, long now) {
      this.capacity = capacity;
      this.refillPerSecond = refillPerSecond;
      this.tokens = capacity;
      this.lastCheck = now;
    }

    synchronized Duration acquire(long now) {
      refill(now);
      if (tokens >= 1.0d) {
        tokens -= 1.0d;
        return Duration.ZERO;
      }
      double needed = 1.0d - tokens;
      double seconds = needed / Math.max(0.0001d, refillPerSecond);
      long nanos = (long) Math.ceil(seconds * 1_000_000_000L);
      // the waiting caller owns the next token; debt is bounded by one burst
      tokens = Math.max(-capacity, tokens - 1.0d);
      return Duration.ofNanos(Math.max(0L, nanos));
    }

    private void refill(long now) {
      long elapsed = now - lastCheck;
      if (elapsed <= 0L) {
        return;
      }
      double seconds = elapsed / 1_000_000_000d;
      tokens = Math.min(capacity, tokens + seconds * refillPerSecond);
      lastCheck = now;
    }
  }
}

package dev.meshquiz.core;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Airtime counters per destination: chunks keyed onto the radio, transport retries, messages
 * given up on, and the outcome of the most recent message.
 */
public final class Diagnostics {
  private final ConcurrentHashMap<String, DestinationSnapshot> destinations =
      new ConcurrentHashMap<>();

  void recordDelivered(String destination, Instant when, int chunks, int retries) {
    destinations.merge(
        destination,
        DestinationSnapshot.EMPTY.delivered(when, chunks, retries),
        DestinationSnapshot::plus);
  }

  void recordFailed(String destination, Instant when, int chunks, int retries, String code) {
    destinations.merge(
        destination,
        DestinationSnapshot.EMPTY.failed(when, chunks, retries, code),
        DestinationSnapshot::plus);
  }

  /** Sorted by destination key. */
  Map<String, DestinationSnapshot> snapshot() {
    return new TreeMap<>(destinations);
  }

  public record DestinationSnapshot(
      long chunksSent,
      long retries,
      long failures,
      Instant lastSuccess,
      Instant lastFailure,
      String lastFailureCode) {
    static final DestinationSnapshot EMPTY = new DestinationSnapshot(0, 0, 0, null, null, null);

    DestinationSnapshot delivered(Instant when, int chunks, int moreRetries) {
      return new DestinationSnapshot(
          chunksSent + chunks, retries + moreRetries, failures, when, null, null);
    }

    DestinationSnapshot failed(Instant when, int chunks, int moreRetries, String code) {
      return new DestinationSnapshot(
          chunksSent + chunks, retries + moreRetries, failures + 1, lastSuccess, when, code);
    }

    /** Folds a single-message record {@code next} into the running totals. */
    DestinationSnapshot plus(DestinationSnapshot next) {
      return next.lastFailure() != null
          ? failed(next.lastFailure(), (int) next.chunksSent(), (int) next.retries(),
              next.lastFailureCode())
          : delivered(next.lastSuccess(), (int) next.chunksSent(), (int) next.retries());
    }

    boolean failing() { return lastFailure != null; }
  }
}

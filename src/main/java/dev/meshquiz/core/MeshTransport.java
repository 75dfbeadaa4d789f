package dev.meshquiz.core;

import java.util.Objects;
import java.util.OptionalInt;

/** The radio link. Implementations must be safe to call from the outbound worker thread. */
public interface MeshTransport {
  /** Sends one payload that already fits the radio's message budget. */
  TransportResponse sendText(String text, Target target);

  /** Index of the channel with the given name, matched case-insensitively. */
  OptionalInt findChannel(String name);

  /** Exactly one of {@code channelIndex} (>= 0) or {@code nodeId} is set. */
  record Target(int channelIndex, String nodeId) {
    public Target {
      if ((channelIndex >= 0) == (nodeId != null)) {
        throw new IllegalArgumentException("target needs a channel index or a node id");
      }
    }

    public static Target channel(int index) {
      if (index < 0) {
        throw new IllegalArgumentException("channel index must be >= 0");
      }
      return new Target(index, null);
    }

    public static Target node(String nodeId) {
      return new Target(-1, Objects.requireNonNull(nodeId, "nodeId"));
    }

    public boolean isDirect() { return nodeId != null; }

    @Override
    public String toString() {
      return isDirect() ? "node " + nodeId : "channel " + channelIndex;
    }
  }

  /** {@code retryable} is meaningful only for failures: busy radio, lost link, timeout. */
  record TransportResponse(boolean success, boolean retryable, Throwable error) {
    public static TransportResponse ok() { return new TransportResponse(true, false, null); }

    public static TransportResponse retry(Throwable error) {
      return new TransportResponse(false, true, error);
    }

    public static TransportResponse fatal(Throwable error) {
      return new TransportResponse(false, false, error);
    }
  }
}

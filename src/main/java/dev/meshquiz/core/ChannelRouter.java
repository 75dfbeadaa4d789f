package dev.meshquiz.core;

import dev.meshquiz.api.Destination;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Resolves logical destinations to radio targets. */
public final class ChannelRouter {
  private static final Logger LOGGER = LogManager.getLogger("MeshQuiz/Router");

  private final MeshTransport transport;
  private final boolean fallbackToPrimary;
  private final Map<String, Integer> channelCache = new ConcurrentHashMap<>();

  public ChannelRouter(MeshTransport transport, boolean fallbackToPrimary) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.fallbackToPrimary = fallbackToPrimary;
  }

  public Resolution resolve(Destination destination) {
    Objects.requireNonNull(destination, "destination");
    String value = destination.value().trim();
    if (value.isEmpty()) {
      return new Resolution(destination, null, Status.NO_ROUTE);
    }
    if (destination.kind() == Destination.Kind.NODE) {
      return new Resolution(destination, MeshTransport.Target.node(value), Status.OK);
    }
    String name = value.toLowerCase(Locale.ROOT);
    Integer cached = channelCache.get(name);
    if (cached != null) {
      return new Resolution(destination, MeshTransport.Target.channel(cached), Status.OK);
    }
    OptionalInt found = lookup(name);
    if (found.isPresent()) {
      channelCache.put(name, found.getAsInt());
      return new Resolution(destination, MeshTransport.Target.channel(found.getAsInt()), Status.OK);
    }
    if (fallbackToPrimary) {
      // not cached: the channel may be created on the radio later
      LOGGER.warn("Channel '{}' not found; falling back to primary channel", name);
      return new Resolution(destination, MeshTransport.Target.channel(0), Status.FALLBACK);
    }
    return new Resolution(destination, null, Status.NO_ROUTE);
  }

  private OptionalInt lookup(String name) {
    try {
      return transport.findChannel(name);
    } catch (RuntimeException e) {
      LOGGER.warn("Channel lookup for '{}' failed: {}", name, e.toString());
      return OptionalInt.empty();
    }
  }

  public record Resolution(Destination requested, MeshTransport.Target target, Status status) {
    public boolean ok() {
      return status == Status.OK || status == Status.FALLBACK;
    }
  }

  public enum Status {
    OK,
    FALLBACK,
    NO_ROUTE
  }
}

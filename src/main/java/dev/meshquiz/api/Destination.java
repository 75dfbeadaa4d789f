package dev.meshquiz.api;

import java.util.Objects;

/** Logical outbound address: a named channel or a single node. */
public record Destination(Kind kind, String value) {
  public enum Kind { CHANNEL, NODE }

  public Destination {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(value, "value");
  }

  public static Destination channel(String name) { return new Destination(Kind.CHANNEL, name); }

  public static Destination node(String nodeId) { return new Destination(Kind.NODE, nodeId); }

  public String key() {
    return (kind == Kind.CHANNEL ? "channel:" : "node:") + value;
  }
}

package dev.meshquiz.api;

import java.util.Objects;

/**
 * A text message received from the mesh.
 *
 * @param senderId mesh node id of the sender, usually in {@code !a1b2c3d4} form
 * @param senderName best-effort display name; may be the node id when unknown
 * @param channel channel index the packet arrived on
 * @param directMessage true when the packet was addressed to this node only
 * @param text raw message text
 */
public record InboundMessage(
    String senderId, String senderName, int channel, boolean directMessage, String text) {
  public InboundMessage {
    Objects.requireNonNull(senderId, "senderId");
    Objects.requireNonNull(text, "text");
    if (senderName == null || senderName.isBlank()) {
      senderName = senderId;
    }
  }
}

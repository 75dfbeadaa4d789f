package dev.meshquiz.api;

/**
 * Outcome of an outbound send. {@code code} is one of {@code OK}, {@code FALLBACK},
 * {@code BAD_PAYLOAD}, {@code BAD_ROUTE}, {@code QUEUE_FULL} or {@code GIVE_UP}.
 */
public record SendResult(boolean ok, String code, String message, String requestId) {}

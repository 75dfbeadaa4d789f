package dev.meshquiz.game;

/** A ledger write could not be made durable. The in-memory total was left unchanged. */
public class LedgerException extends RuntimeException {
  public LedgerException(String message, Throwable cause) {
    super(message, cause);
  }
}

package dev.meshquiz.game;

import java.util.Objects;

/** Outcome of a game command. Failures always carry an {@link ErrorKind}. */
public record CommandResult(boolean ok, ErrorKind error, String message) {
  public CommandResult {
    Objects.requireNonNull(message, "message");
    if (ok != (error == null)) {
      throw new IllegalArgumentException("error must be set exactly when ok is false");
    }
  }

  public static CommandResult ok(String message) { return new CommandResult(true, null, message); }

  public static CommandResult failure(ErrorKind error, String message) {
    return new CommandResult(false, Objects.requireNonNull(error, "error"), message);
  }
}

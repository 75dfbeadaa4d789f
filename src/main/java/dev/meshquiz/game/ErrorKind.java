package dev.meshquiz.game;

public enum ErrorKind {
  /** Privileged command from a node outside the admin allow-list. */
  UNAUTHORIZED,
  /** Command not valid in the current session state. */
  INVALID_STATE,
  /** Command is missing or has a malformed argument. */
  INVALID_ARGUMENT,
  /** The session could not perform the command, e.g. a timer could not be scheduled. */
  INTERNAL
}

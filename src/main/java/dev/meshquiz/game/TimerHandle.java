package dev.meshquiz.game;

/** A pending scheduler callback. */
public interface TimerHandle {
  /** Prevents the callback from running if it has not started. Returns false if too late. */
  boolean cancel();
}

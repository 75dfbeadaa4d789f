package dev.meshquiz.game;

public enum RoundStatus {
  OPEN,
  GRADING,
  CLOSED
}

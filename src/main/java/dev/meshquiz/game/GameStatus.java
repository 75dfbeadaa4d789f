package dev.meshquiz.game;

public enum GameStatus {
  IDLE,
  RUNNING,
  STOPPED
}

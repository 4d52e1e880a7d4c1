package com.inferencelab.backend.chat.graph;

public enum TurnState {
  READY,
  INVOKING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  boolean canTransitionTo(TurnState next) {
    return switch (this) {
      case READY -> next == INVOKING || next == FAILED;
      case INVOKING -> next == COMPLETED || next == FAILED;
      case COMPLETED, FAILED -> false;
    };
  }
}

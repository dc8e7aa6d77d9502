package com.codeheadsystems.oluso.server.journey;

/**
 * Lifecycle of a journey. Everything but {@link #IN_PROGRESS} is terminal.
 */
public enum JourneyStatus {
  IN_PROGRESS,
  COMPLETED,
  FAILED,
  EXPIRED,
  CANCELLED;

  public boolean isTerminal() {
    return this != IN_PROGRESS;
  }
}

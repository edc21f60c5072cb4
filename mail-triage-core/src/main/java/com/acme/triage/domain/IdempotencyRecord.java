package com.acme.triage.domain;

import java.time.Instant;

public record IdempotencyRecord(
    String key,
    String messageId,
    String schemaVersion,
    State state,
    String claimedBy,
    Instant claimedAt,
    Instant completedAt) {

  public enum State {
    CLAIMED,
    COMPLETED
  }

  public boolean isCompleted() {
    return state == State.COMPLETED;
  }
}

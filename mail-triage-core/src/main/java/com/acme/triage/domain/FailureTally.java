package com.acme.triage.domain;

import java.time.Instant;

/** Consecutive terminal failures recorded against a tally key. */
public record FailureTally(
    String tallyKey,
    int consecutiveFailures,
    Instant lastFailureAt,
    String lastErrorClass,
    String lastErrorMessage) {

  public static FailureTally empty(String tallyKey) {
    return new FailureTally(tallyKey, 0, null, null, null);
  }
}

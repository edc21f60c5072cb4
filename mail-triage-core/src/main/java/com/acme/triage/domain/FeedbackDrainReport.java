package com.acme.triage.domain;

import java.time.Duration;

/** Totals of one feedback drain. */
public record FeedbackDrainReport(int incorporated, int skipped, int failed, Duration elapsed) {

  public int total() {
    return incorporated + skipped + failed;
  }
}

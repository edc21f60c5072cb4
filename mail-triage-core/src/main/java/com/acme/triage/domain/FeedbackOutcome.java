package com.acme.triage.domain;

public enum FeedbackOutcome {
  INCORPORATED,
  SKIPPED,
  FAILED;

  public String tag() {
    return name().toLowerCase();
  }
}

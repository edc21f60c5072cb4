package com.acme.triage.domain;

/** Result of a quarantine release request. */
public enum ReleaseOutcome {
  RELEASED_TO_PENDING,
  RELEASED_AS_CLASSIFIED,
  NOT_QUARANTINED,
  NOT_FOUND
}

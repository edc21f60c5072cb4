package com.acme.triage.domain;

public enum ClaimResult {
  /** This worker owns the key for the current attempt. */
  ACQUIRED,
  /** A result already exists for the key. */
  ALREADY_PROCESSED,
  /** Another worker holds the claim. */
  IN_FLIGHT
}

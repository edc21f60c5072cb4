package com.acme.triage.config;

/** Granularity at which consecutive failures are counted toward quarantine. */
public enum TallyScope {
  /** One tally per message identity, shared across schema versions. */
  MESSAGE,

  /** One tally per (message identity, schema version). */
  MESSAGE_AND_SCHEMA
}

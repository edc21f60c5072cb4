package com.acme.triage.domain;

import java.time.Instant;

/** A stored, retrievable context snippet. Upserts by id overwrite. */
public record ContextEntry(
    String id, String text, String category, String source, Instant createdAt, Instant updatedAt) {

  public static final String SOURCE_FEEDBACK = "feedback";
  public static final String SOURCE_SEED = "seed";
}

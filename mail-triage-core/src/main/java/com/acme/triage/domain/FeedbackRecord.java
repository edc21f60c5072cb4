package com.acme.triage.domain;

import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A user's correction of a classification. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackRecord {

  private UUID id;
  private UUID messagePk;
  private String originalCategory;
  private String correctedCategory;
  private String reason;
  private Instant submittedAt;
  private boolean incorporated;
  private Instant incorporatedAt;

  public static FeedbackRecord newSubmission(
      UUID messagePk, String originalCategory, String correctedCategory, String reason) {
    return new FeedbackRecord(
        UUID.randomUUID(),
        messagePk,
        originalCategory,
        correctedCategory,
        reason,
        Instant.now(),
        false,
        null);
  }

  /** Deterministic id of the context entry this record produces. */
  public String contextEntryId() {
    return "feedback-" + id;
  }
}

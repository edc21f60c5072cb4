package com.acme.triage.domain;

import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Summary of one polling invocation. Inserted at start, finalized once at end. */
@Getter
@Setter
@NoArgsConstructor
public class ProcessingCycle {

  private UUID id;
  private Instant startedAt;
  private Instant finishedAt;
  private int scanned;
  private int classified;
  private int failed;
  private int quarantined;
  private int skipped;
  private long queueDepthBefore;
  private long queueDepthAfter;
  private long durationMs;
  private boolean timedOut;

  public static ProcessingCycle start(long queueDepth) {
    ProcessingCycle c = new ProcessingCycle();
    c.setId(UUID.randomUUID());
    c.setStartedAt(Instant.now());
    c.setQueueDepthBefore(queueDepth);
    return c;
  }

  public void finish(long queueDepth) {
    this.finishedAt = Instant.now();
    this.queueDepthAfter = queueDepth;
    this.durationMs = finishedAt.toEpochMilli() - startedAt.toEpochMilli();
  }
}

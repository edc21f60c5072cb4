package com.acme.triage.domain;

import java.util.EnumSet;
import java.util.Set;

/** Lifecycle of a message in the classification workflow. */
public enum MessageStatus {
  PENDING,
  CLASSIFYING,
  CLASSIFIED,
  FAILED,
  QUARANTINED;

  /** States a worker may move into {@link #CLASSIFYING}. */
  public static final Set<MessageStatus> CLAIMABLE = EnumSet.of(PENDING, FAILED, CLASSIFIED);

  /** States counted as queue depth. */
  public static final Set<MessageStatus> QUEUED = EnumSet.of(PENDING, FAILED);

  public String dbValue() {
    return name().toLowerCase();
  }

  public static MessageStatus fromDb(String value) {
    return valueOf(value.toUpperCase());
  }
}

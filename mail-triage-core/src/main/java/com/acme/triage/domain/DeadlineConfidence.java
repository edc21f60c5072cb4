package com.acme.triage.domain;

/** How a deadline was obtained: read from the text, inferred from it, or absent. */
public enum DeadlineConfidence {
  EXTRACTED,
  INFERRED,
  NONE;

  public String dbValue() {
    return name().toLowerCase();
  }

  public static DeadlineConfidence fromDb(String value) {
    return valueOf(value.toUpperCase());
  }
}

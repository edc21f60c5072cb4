package com.acme.triage.domain;

public enum Sentiment {
  POSITIVE,
  NEUTRAL,
  NEGATIVE,
  URGENT;

  public String dbValue() {
    return name().toLowerCase();
  }

  public static Sentiment fromDb(String value) {
    return valueOf(value.toUpperCase());
  }
}

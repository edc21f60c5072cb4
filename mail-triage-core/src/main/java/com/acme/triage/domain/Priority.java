package com.acme.triage.domain;

public enum Priority {
  LOW,
  NORMAL,
  HIGH,
  URGENT;

  public String dbValue() {
    return name().toLowerCase();
  }

  public static Priority fromDb(String value) {
    return valueOf(value.toUpperCase());
  }
}

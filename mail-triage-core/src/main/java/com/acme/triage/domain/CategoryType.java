package com.acme.triage.domain;

/** Top-level grouping of taxonomy tags. */
public enum CategoryType {
  ACADEMIC,
  CAREER,
  ADMIN,
  CLUBS,
  SPORTS,
  CULTURAL,
  ACTION,
  FINANCE,
  PERSONAL,
  LEARNING,
  PROMOTION,
  SYSTEM,
  SPAM
}

package com.acme.triage.core;

import java.time.Duration;
import java.util.Optional;

/** Dependency refused the call because of a rate limit. Retryable. */
public class RateLimitedException extends TransientException {

  private final Duration retryAfter;

  public RateLimitedException(String message) {
    this(message, null);
  }

  public RateLimitedException(String message, Duration retryAfter) {
    super(message);
    this.retryAfter = retryAfter;
  }

  public Optional<Duration> getRetryAfter() {
    return Optional.ofNullable(retryAfter);
  }
}

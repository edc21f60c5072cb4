package com.acme.triage.core;

/**
 * Failure expected to succeed on a later attempt: connectivity, timeouts, rate limits, transient
 * storage errors. Counts toward a dependency's circuit breaker window.
 */
public class TransientException extends RuntimeException {
  public TransientException(String message) {
    super(message);
  }

  public TransientException(String message, Throwable e) {
    super(message, e);
  }
}

package com.acme.triage.core;

/**
 * Failure caused by invalid input or a contract violation. Never retried and never counted
 * against a dependency's health.
 */
public class PermanentException extends RuntimeException {
  public PermanentException(String message) {
    super(message);
  }

  public PermanentException(String message, Throwable e) {
    super(message, e);
  }
}

package com.acme.triage.core;

/**
 * A message was left in classifying past the claim timeout, typically by a worker that crashed or
 * hung. Counts as a transient failure of that attempt.
 */
public class StuckClassificationException extends TransientException {
  public StuckClassificationException(String message) {
    super(message);
  }
}

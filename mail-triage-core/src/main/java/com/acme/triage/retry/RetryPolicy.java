package com.acme.triage.retry;

import com.acme.triage.config.TriageConfig;
import com.acme.triage.core.DependencyUnavailableException;
import com.acme.triage.core.ErrorKind;
import com.acme.triage.core.PermanentException;
import com.acme.triage.core.TransientException;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a failed dependency call is retried and how long to wait before the next
 * attempt. Stateless; one instance is shared by all workers.
 */
public class RetryPolicy {

  private final int maxAttempts;
  private final Duration initialBackoff;
  private final Duration maxBackoff;

  public RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.maxAttempts = maxAttempts;
    this.initialBackoff = initialBackoff;
    this.maxBackoff = maxBackoff;
  }

  public static RetryPolicy from(TriageConfig config) {
    return new RetryPolicy(
        config.getMaxRetryAttempts(), config.getInitialBackoff(), config.getMaxBackoff());
  }

  /** Same backoff, different attempt budget (context retrieval uses its own). */
  public RetryPolicy withMaxAttempts(int attempts) {
    return new RetryPolicy(attempts, initialBackoff, maxBackoff);
  }

  public static ErrorKind classify(Throwable error) {
    Throwable e = unwrap(error);
    if (e instanceof DependencyUnavailableException) {
      return ErrorKind.FAST_FAIL;
    }
    if (e instanceof PermanentException) {
      return ErrorKind.PERMANENT;
    }
    if (e instanceof TransientException) {
      return ErrorKind.TRANSIENT;
    }
    // JsonProcessingException extends IOException but a malformed payload will not heal
    if (e instanceof JsonProcessingException || e instanceof IllegalArgumentException) {
      return ErrorKind.PERMANENT;
    }
    if (e instanceof IOException
        || e instanceof TimeoutException
        || e instanceof CancellationException
        || e instanceof InterruptedException) {
      return ErrorKind.TRANSIENT;
    }
    return ErrorKind.TRANSIENT;
  }

  /**
   * @param attempt the attempt that just failed, starting at 1
   */
  public boolean shouldRetry(ErrorKind kind, int attempt) {
    return kind == ErrorKind.TRANSIENT && attempt < maxAttempts;
  }

  /** Backoff before attempt {@code attempt + 1}: initial * 2^(attempt-1), capped. */
  public Duration nextDelay(int attempt) {
    int exponent = Math.max(0, Math.min(attempt - 1, 30));
    long millis = initialBackoff.toMillis() * (1L << exponent);
    if (millis < 0 || millis > maxBackoff.toMillis()) {
      return maxBackoff;
    }
    return Duration.ofMillis(millis);
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  private static Throwable unwrap(Throwable error) {
    Throwable e = error;
    while (e instanceof ExecutionException && e.getCause() != null) {
      e = e.getCause();
    }
    return e;
  }
}

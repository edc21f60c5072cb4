package com.acme.triage.processor.workflow;

import com.acme.triage.config.TriageConfig;
import com.acme.triage.core.ErrorKind;
import com.acme.triage.core.RateLimitedException;
import com.acme.triage.core.TransientException;
import com.acme.triage.processor.metrics.MetricNames;
import com.acme.triage.retry.CircuitBreakers;
import com.acme.triage.retry.RetryPolicy;
import com.acme.triage.spi.MetricsSink;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Every external dependency call goes through here: a per-call timeout on a dedicated executor,
 * the dependency's circuit breaker, and the retry policy. No database connection or lock is held
 * while a call is in flight.
 */
@Singleton
public class DependencyGateway implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(DependencyGateway.class);

  private final CircuitBreakers breakers;
  private final MetricsSink metrics;
  private final long callTimeoutMillis;
  private final ExecutorService callExecutor;

  public DependencyGateway(CircuitBreakers breakers, MetricsSink metrics, TriageConfig config) {
    this.breakers = breakers;
    this.metrics = metrics;
    this.callTimeoutMillis = config.getCallTimeoutMillis();
    AtomicInteger seq = new AtomicInteger();
    this.callExecutor =
        Executors.newCachedThreadPool(
            r -> {
              Thread t = new Thread(r, "triage-call-" + seq.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
    breakers.onStateChange(
        (name, state) ->
            metrics.gauge(MetricNames.CIRCUIT_BREAKER_STATE, gaugeValue(state), "dependency", name));
    publishState(CircuitBreakers.CLASSIFIER);
    publishState(CircuitBreakers.CONTEXT_RETRIEVER);
  }

  /**
   * Calls {@code call} behind the named breaker, retrying transient failures as {@code policy}
   * allows. The last failure is rethrown unchanged once the policy gives up.
   */
  public <T> T call(String dependency, RetryPolicy policy, Callable<T> call) {
    int attempt = 1;
    while (true) {
      try {
        return breakers.execute(dependency, () -> callWithTimeout(dependency, call));
      } catch (RuntimeException e) {
        ErrorKind kind = RetryPolicy.classify(e);
        if (!policy.shouldRetry(kind, attempt) || Thread.currentThread().isInterrupted()) {
          throw e;
        }
        Duration delay = backoff(policy, attempt, e);
        LOG.debug(
            "Retrying {} after attempt {} failed ({}), backing off {}ms",
            dependency,
            attempt,
            e.getMessage(),
            delay.toMillis());
        metrics.increment(MetricNames.RETRY_ATTEMPTS, "dependency", dependency);
        sleep(delay);
        attempt++;
      }
    }
  }

  <T> T callWithTimeout(String dependency, Callable<T> call) {
    Future<T> future = callExecutor.submit(call);
    try {
      return future.get(callTimeoutMillis, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new TransientException(
          dependency + " call timed out after " + callTimeoutMillis + "ms", e);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new TransientException(dependency + " call interrupted", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException re) {
        throw re;
      }
      if (cause instanceof Error err) {
        throw err;
      }
      throw new TransientException(dependency + " call failed: " + cause.getMessage(), cause);
    }
  }

  private static Duration backoff(RetryPolicy policy, int attempt, RuntimeException e) {
    Duration delay = policy.nextDelay(attempt);
    if (e instanceof RateLimitedException rl && rl.getRetryAfter().isPresent()) {
      Duration retryAfter = rl.getRetryAfter().get();
      return retryAfter.compareTo(delay) > 0 ? retryAfter : delay;
    }
    return delay;
  }

  private static void sleep(Duration delay) {
    try {
      Thread.sleep(delay.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransientException("Interrupted during retry backoff", e);
    }
  }

  private void publishState(String dependency) {
    metrics.gauge(
        MetricNames.CIRCUIT_BREAKER_STATE,
        gaugeValue(breakers.state(dependency)),
        "dependency",
        dependency);
  }

  static double gaugeValue(CircuitBreaker.State state) {
    switch (state) {
      case OPEN:
      case FORCED_OPEN:
        return 2;
      case HALF_OPEN:
        return 1;
      default:
        return 0;
    }
  }

  @PreDestroy
  @Override
  public void close() {
    callExecutor.shutdownNow();
  }
}

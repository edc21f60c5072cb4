package com.acme.triage.retry;

import com.acme.triage.config.TriageConfig;
import com.acme.triage.core.DependencyUnavailableException;
import com.acme.triage.core.ErrorKind;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One Resilience4j breaker per dependency. A breaker opens once the last {@code threshold}
 * recorded calls all failed and admits a single trial call after the cooldown. Only transient
 * failures are recorded.
 */
public class CircuitBreakers {
  public static final String CLASSIFIER = "classifier";
  public static final String CONTEXT_RETRIEVER = "context-retriever";

  private static final Logger LOG = LoggerFactory.getLogger(CircuitBreakers.class);

  private final CircuitBreakerRegistry registry;
  private volatile BiConsumer<String, CircuitBreaker.State> stateListener = (name, state) -> {};

  public CircuitBreakers(TriageConfig config) {
    int threshold = config.getBreakerFailureThreshold();
    CircuitBreakerConfig breakerConfig =
        CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(threshold)
            .minimumNumberOfCalls(threshold)
            .failureRateThreshold(100.0f)
            .permittedNumberOfCallsInHalfOpenState(1)
            .waitDurationInOpenState(config.getBreakerCooldown())
            .automaticTransitionFromOpenToHalfOpenEnabled(false)
            .build();
    this.registry = CircuitBreakerRegistry.of(breakerConfig);
    registry
        .getEventPublisher()
        .onEntryAdded(
            added -> {
              CircuitBreaker cb = added.getAddedEntry();
              cb.getEventPublisher()
                  .onStateTransition(
                      event -> {
                        CircuitBreaker.StateTransition transition = event.getStateTransition();
                        LOG.info("Circuit breaker '{}' {}", cb.getName(), transition);
                        stateListener.accept(cb.getName(), transition.getToState());
                      });
            });
  }

  /** Receives every state change; used to publish the breaker state gauge. */
  public void onStateChange(BiConsumer<String, CircuitBreaker.State> listener) {
    this.stateListener = listener;
  }

  public CircuitBreaker forDependency(String name) {
    return registry.circuitBreaker(name);
  }

  public CircuitBreaker.State state(String name) {
    return forDependency(name).getState();
  }

  /**
   * Runs {@code call} behind the named breaker.
   *
   * @throws DependencyUnavailableException if the breaker rejects the call
   */
  public <T> T execute(String name, Supplier<T> call) {
    CircuitBreaker cb = forDependency(name);
    if (!cb.tryAcquirePermission()) {
      throw new DependencyUnavailableException(name);
    }
    long start = System.nanoTime();
    try {
      T result = call.get();
      cb.onSuccess(System.nanoTime() - start, TimeUnit.NANOSECONDS);
      return result;
    } catch (RuntimeException e) {
      if (RetryPolicy.classify(e) == ErrorKind.TRANSIENT) {
        cb.onError(System.nanoTime() - start, TimeUnit.NANOSECONDS, e);
      } else {
        cb.releasePermission();
      }
      throw e;
    }
  }
}

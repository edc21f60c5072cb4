package com.acme.triage.core;

/**
 * Fast-fail raised while a dependency's circuit breaker is open. The dependency was not invoked,
 * so the failure consumes no retry budget and is not recorded in the breaker window.
 */
public class DependencyUnavailableException extends RuntimeException {

  private final String dependency;

  public DependencyUnavailableException(String dependency) {
    super("Circuit breaker open for dependency '" + dependency + "'");
    this.dependency = dependency;
  }

  public String getDependency() {
    return dependency;
  }
}

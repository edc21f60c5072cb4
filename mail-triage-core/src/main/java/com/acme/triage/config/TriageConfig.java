package com.acme.triage.config;

import java.time.Duration;

/**
 * Retry, breaker, quarantine, concurrency and timeout settings for the classification workflow.
 * Pure POJO - no framework dependencies.
 */
public class TriageConfig {

  private String schemaVersion = "v2";

  // Retry policy
  private int maxRetryAttempts = 3;
  private Duration initialBackoff = Duration.ofMillis(200);
  private Duration maxBackoff = Duration.ofSeconds(10);

  // Context retrieval
  private int contextMaxAttempts = 2;
  private int contextLimit = 5;

  // Circuit breaker
  private int breakerFailureThreshold = 5;
  private Duration breakerCooldown = Duration.ofSeconds(30);

  // Quarantine
  private int quarantineThreshold = 3;
  private TallyScope tallyScope = TallyScope.MESSAGE;

  // Workers and timeouts
  private int workerConcurrency = 2;
  private Duration callTimeout = Duration.ofSeconds(30);
  private Duration cycleTimeout = Duration.ofMinutes(5);
  private int batchSize = 50;
  private Duration claimTimeout = Duration.ofMinutes(10);
  private Duration pollInterval = Duration.ofSeconds(30);

  // Feedback loop
  private int feedbackBatchSize = 100;
  private Duration feedbackInterval = Duration.ofSeconds(60);

  /**
   * Rejects settings the workflow cannot honour.
   *
   * @throws IllegalStateException naming the first offending setting
   */
  public void validate() {
    require(schemaVersion != null && !schemaVersion.isBlank(), "schema-version must be set");
    require(maxRetryAttempts >= 1, "max-retry-attempts must be >= 1");
    require(contextMaxAttempts >= 1, "context-max-attempts must be >= 1");
    require(contextLimit >= 0, "context-limit must be >= 0");
    require(breakerFailureThreshold >= 1, "breaker-failure-threshold must be >= 1");
    require(quarantineThreshold >= 1, "quarantine-threshold must be >= 1");
    require(workerConcurrency >= 1, "worker-concurrency must be >= 1");
    require(batchSize >= 1, "batch-size must be >= 1");
    require(feedbackBatchSize >= 1, "feedback-batch-size must be >= 1");
    require(isPositive(initialBackoff), "initial-backoff must be positive");
    require(
        isPositive(maxBackoff) && maxBackoff.compareTo(initialBackoff) >= 0,
        "max-backoff must be >= initial-backoff");
    require(isPositive(breakerCooldown), "breaker-cooldown must be positive");
    require(isPositive(callTimeout), "call-timeout must be positive");
    require(
        isPositive(cycleTimeout) && callTimeout.compareTo(cycleTimeout) < 0,
        "call-timeout must be shorter than cycle-timeout");
    require(isPositive(claimTimeout), "claim-timeout must be positive");
  }

  private static boolean isPositive(Duration d) {
    return d != null && !d.isNegative() && !d.isZero();
  }

  private static void require(boolean condition, String message) {
    if (!condition) {
      throw new IllegalStateException("Invalid triage configuration: " + message);
    }
  }

  public String getSchemaVersion() {
    return schemaVersion;
  }

  public void setSchemaVersion(String schemaVersion) {
    this.schemaVersion = schemaVersion;
  }

  public int getMaxRetryAttempts() {
    return maxRetryAttempts;
  }

  public void setMaxRetryAttempts(int maxRetryAttempts) {
    this.maxRetryAttempts = maxRetryAttempts;
  }

  public Duration getInitialBackoff() {
    return initialBackoff;
  }

  public void setInitialBackoff(Duration initialBackoff) {
    this.initialBackoff = initialBackoff;
  }

  public Duration getMaxBackoff() {
    return maxBackoff;
  }

  public void setMaxBackoff(Duration maxBackoff) {
    this.maxBackoff = maxBackoff;
  }

  public int getContextMaxAttempts() {
    return contextMaxAttempts;
  }

  public void setContextMaxAttempts(int contextMaxAttempts) {
    this.contextMaxAttempts = contextMaxAttempts;
  }

  public int getContextLimit() {
    return contextLimit;
  }

  public void setContextLimit(int contextLimit) {
    this.contextLimit = contextLimit;
  }

  public int getBreakerFailureThreshold() {
    return breakerFailureThreshold;
  }

  public void setBreakerFailureThreshold(int breakerFailureThreshold) {
    this.breakerFailureThreshold = breakerFailureThreshold;
  }

  public Duration getBreakerCooldown() {
    return breakerCooldown;
  }

  public void setBreakerCooldown(Duration breakerCooldown) {
    this.breakerCooldown = breakerCooldown;
  }

  public int getQuarantineThreshold() {
    return quarantineThreshold;
  }

  public void setQuarantineThreshold(int quarantineThreshold) {
    this.quarantineThreshold = quarantineThreshold;
  }

  public TallyScope getTallyScope() {
    return tallyScope;
  }

  public void setTallyScope(TallyScope tallyScope) {
    this.tallyScope = tallyScope;
  }

  public int getWorkerConcurrency() {
    return workerConcurrency;
  }

  public void setWorkerConcurrency(int workerConcurrency) {
    this.workerConcurrency = workerConcurrency;
  }

  public Duration getCallTimeout() {
    return callTimeout;
  }

  public void setCallTimeout(Duration callTimeout) {
    this.callTimeout = callTimeout;
  }

  public long getCallTimeoutMillis() {
    return callTimeout.toMillis();
  }

  public Duration getCycleTimeout() {
    return cycleTimeout;
  }

  public void setCycleTimeout(Duration cycleTimeout) {
    this.cycleTimeout = cycleTimeout;
  }

  public long getCycleTimeoutMillis() {
    return cycleTimeout.toMillis();
  }

  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(int batchSize) {
    this.batchSize = batchSize;
  }

  public Duration getClaimTimeout() {
    return claimTimeout;
  }

  public void setClaimTimeout(Duration claimTimeout) {
    this.claimTimeout = claimTimeout;
  }

  public Duration getPollInterval() {
    return pollInterval;
  }

  public void setPollInterval(Duration pollInterval) {
    this.pollInterval = pollInterval;
  }

  public int getFeedbackBatchSize() {
    return feedbackBatchSize;
  }

  public void setFeedbackBatchSize(int feedbackBatchSize) {
    this.feedbackBatchSize = feedbackBatchSize;
  }

  public Duration getFeedbackInterval() {
    return feedbackInterval;
  }

  public void setFeedbackInterval(Duration feedbackInterval) {
    this.feedbackInterval = feedbackInterval;
  }
}

package com.acme.triage.processor.metrics;

/** Metric names emitted by the workflow. */
public final class MetricNames {
  public static final String RETRY_ATTEMPTS = "triage_retry_attempts_total";
  public static final String PERMANENT_ERRORS = "triage_permanent_errors_total";
  public static final String MESSAGES_FAILED = "triage_messages_failed_total";
  public static final String MESSAGES_PROCESSED = "triage_messages_processed_total";
  public static final String QUARANTINED = "triage_quarantined_messages_total";
  public static final String QUARANTINE_RELEASES = "triage_quarantine_releases_total";
  public static final String CLASSIFICATION_LATENCY = "triage_classification_latency_ms";
  public static final String CONTEXT_DEGRADED = "triage_context_degraded_total";
  public static final String CIRCUIT_BREAKER_STATE = "triage_circuit_breaker_state";
  public static final String QUEUE_DEPTH = "triage_queue_depth";
  public static final String CYCLE_DURATION = "triage_cycle_duration_ms";
  public static final String FEEDBACK_LATENCY = "triage_feedback_processing_latency_ms";
  public static final String FEEDBACK_THROUGHPUT = "triage_feedback_batch_throughput";
  public static final String FEEDBACK_RECORDS = "triage_feedback_records_total";

  private MetricNames() {}
}

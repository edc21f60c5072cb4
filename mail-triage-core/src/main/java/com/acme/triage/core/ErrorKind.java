package com.acme.triage.core;

/** Classification of a failed dependency call, decided once where the call returns. */
public enum ErrorKind {
  /** Retryable; feeds the circuit breaker window. */
  TRANSIENT,

  /** Input or contract defect; aborts immediately. */
  PERMANENT,

  /** Breaker open; the dependency was not called. */
  FAST_FAIL
}

package com.acme.triage.service;

import com.acme.triage.domain.ClaimResult;

/**
 * Service for exactly-once classification - one claim per (message, schema version) key
 */
public interface IdempotencyService {

    /**
     * Deterministic key for a message under a schema version
     */
    String keyFor(String messageId, String schemaVersion);

    /**
     * @return true if a result has already been stored under the key
     */
    boolean alreadyProcessed(String key);

    /**
     * Atomically claim the key; among racing workers exactly one receives ACQUIRED
     */
    ClaimResult tryClaim(String key, String messageId, String schemaVersion);

    /**
     * Mark a held claim completed after the result is stored
     */
    void complete(String key);

    /**
     * Drop a held claim after a terminal failure so a later cycle may retry
     */
    void release(String key);

    /**
     * Drop claims abandoned by crashed workers
     *
     * @return number of claims recovered
     */
    int recoverStaleClaims();
}

package com.acme.triage.repository;

import com.acme.triage.domain.IdempotencyRecord;
import java.time.Duration;
import java.util.Optional;

/**
 * Repository for idempotency claims - one row per (message, schema version) key
 */
public interface IdempotencyKeyRepository {

    /**
     * Insert a CLAIMED row for the key if none exists
     *
     * @return number of rows inserted (1 if claimed, 0 if the key is already present)
     */
    int insertClaim(String key, String messageId, String schemaVersion, String claimedBy);

    /**
     * Insert a COMPLETED row, or complete an existing claim
     */
    void upsertCompleted(String key, String messageId, String schemaVersion);

    Optional<IdempotencyRecord> find(String key);

    /**
     * Mark a CLAIMED key COMPLETED
     *
     * @return true if a claim was completed
     */
    boolean markCompleted(String key);

    /**
     * Drop a CLAIMED key so a later cycle may retry; completed keys are left alone
     */
    int deleteClaim(String key);

    /**
     * Drop claims that have been CLAIMED for longer than {@code olderThan}
     */
    int recoverStale(Duration olderThan);
}

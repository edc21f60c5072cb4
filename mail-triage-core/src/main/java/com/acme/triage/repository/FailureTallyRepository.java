package com.acme.triage.repository;

import com.acme.triage.domain.FailureTally;
import java.util.Optional;

/** Durable consecutive-failure counters */
public interface FailureTallyRepository {

    /**
     * Atomically add one failure to the tally, creating it if absent
     *
     * @return the tally after the increment
     */
    FailureTally increment(String tallyKey, String errorClass, String errorMessage);

    Optional<FailureTally> find(String tallyKey);

    /**
     * Reset the tally to zero (deletes the row)
     */
    void reset(String tallyKey);
}

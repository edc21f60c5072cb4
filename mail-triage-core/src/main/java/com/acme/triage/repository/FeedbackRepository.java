package com.acme.triage.repository;

import com.acme.triage.domain.FeedbackRecord;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Repository for user classification corrections */
public interface FeedbackRepository {

    void insert(FeedbackRecord record);

    Optional<FeedbackRecord> findById(UUID id);

    /**
     * Records not yet incorporated, oldest first
     */
    List<FeedbackRecord> findPending(int limit);

    /**
     * Flip the incorporated flag; only a record still unincorporated is updated
     *
     * @return true if this call flipped the flag
     */
    boolean markIncorporated(UUID id);
}

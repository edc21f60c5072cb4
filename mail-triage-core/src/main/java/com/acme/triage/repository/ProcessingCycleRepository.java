package com.acme.triage.repository;

import com.acme.triage.domain.ProcessingCycle;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Append-only history of polling cycles */
public interface ProcessingCycleRepository {

    void insert(ProcessingCycle cycle);

    /**
     * Write end timestamp, counts and queue depth after
     */
    void finish(ProcessingCycle cycle);

    Optional<ProcessingCycle> findById(UUID id);

    List<ProcessingCycle> findRecent(int limit);
}

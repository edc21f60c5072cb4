package com.acme.triage.repository;

import com.acme.triage.domain.ClassificationResult;
import java.util.List;
import java.util.Optional;

/** Repository for immutable classification results */
public interface ClassificationResultRepository {

    /**
     * Insert the result unless one exists for its (messageId, schemaVersion) or idempotency key
     *
     * @return number of rows inserted (1 if inserted, 0 if duplicate)
     */
    int insertIfAbsent(ClassificationResult result);

    Optional<ClassificationResult> find(String messageId, String schemaVersion);

    List<ClassificationResult> findByMessageId(String messageId);

    long countByMessageId(String messageId);
}

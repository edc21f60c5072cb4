package com.acme.triage.processor.services;

import com.acme.triage.config.TriageConfig;
import com.acme.triage.domain.ClaimResult;
import com.acme.triage.domain.IdempotencyRecord;
import com.acme.triage.idempotency.IdempotencyKeys;
import com.acme.triage.repository.IdempotencyKeyRepository;
import com.acme.triage.service.IdempotencyService;
import jakarta.inject.Singleton;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Singleton
public class IdempotencyServiceImpl implements IdempotencyService {
    private static final Logger LOG = LoggerFactory.getLogger(IdempotencyServiceImpl.class);

    private final IdempotencyKeyRepository repository;
    private final TriageConfig config;
    private final String instanceId = UUID.randomUUID().toString().substring(0, 8);

    public IdempotencyServiceImpl(IdempotencyKeyRepository repository, TriageConfig config) {
        this.repository = repository;
        this.config = config;
    }

    @Override
    public String keyFor(String messageId, String schemaVersion) {
        return IdempotencyKeys.keyFor(messageId, schemaVersion);
    }

    @Override
    public boolean alreadyProcessed(String key) {
        return repository.find(key).map(IdempotencyRecord::isCompleted).orElse(false);
    }

    @Override
    public ClaimResult tryClaim(String key, String messageId, String schemaVersion) {
        if (repository.insertClaim(key, messageId, schemaVersion, claimant()) == 1) {
            return ClaimResult.ACQUIRED;
        }
        Optional<IdempotencyRecord> existing = repository.find(key);
        if (existing.isPresent() && existing.get().isCompleted()) {
            return ClaimResult.ALREADY_PROCESSED;
        }
        // held by another worker, or released between the insert and the read
        LOG.debug("Key {} for messageId={} is in flight", key, messageId);
        return ClaimResult.IN_FLIGHT;
    }

    @Override
    public void complete(String key) {
        repository.markCompleted(key);
    }

    @Override
    public void release(String key) {
        repository.deleteClaim(key);
    }

    @Override
    public int recoverStaleClaims() {
        return repository.recoverStale(config.getClaimTimeout());
    }

    private String claimant() {
        return instanceId + "/" + Thread.currentThread().getName();
    }
}

package com.acme.triage.domain;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Persisted classification of one message under one schema version. Immutable once written;
 * storage enforces one row per (messageId, schemaVersion) and per idempotency key.
 */
public record ClassificationResult(
    UUID id,
    UUID messagePk,
    String messageId,
    String schemaVersion,
    String idempotencyKey,
    String primaryCategory,
    List<String> secondaryCategories,
    Priority priority,
    Instant deadlineUtc,
    DeadlineConfidence deadlineConfidence,
    double confidence,
    String rationale,
    DetectedEntities detectedEntities,
    Sentiment sentiment,
    List<ActionItem> actionItems,
    ThreadContext threadContext,
    String suggestedFolder,
    List<String> contextIds,
    boolean manual,
    Instant createdAt) {

  public ClassificationResult {
    secondaryCategories = List.copyOf(secondaryCategories);
    actionItems = List.copyOf(actionItems);
    contextIds = List.copyOf(contextIds);
  }

  public static ClassificationResult of(
      Message message,
      String idempotencyKey,
      Classification c,
      List<String> contextIds,
      boolean manual) {
    return new ClassificationResult(
        UUID.randomUUID(),
        message.getId(),
        message.getMessageId(),
        c.schemaVersion(),
        idempotencyKey,
        c.primaryCategory(),
        c.secondaryCategories(),
        c.priority(),
        c.deadlineUtc(),
        c.deadlineConfidence(),
        c.confidence(),
        c.rationale(),
        c.detectedEntities(),
        c.sentiment(),
        c.actionItems(),
        c.threadContext(),
        c.suggestedFolder(),
        contextIds,
        manual,
        Instant.now());
  }
}

package com.acme.triage.domain;

import java.time.Instant;
import java.util.List;

/**
 * Structured judgment returned by the classifier, before validation and persistence. Only the
 * primary category, confidence and schema version are required; absent optional fields take
 * their neutral defaults.
 */
public record Classification(
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
    String schemaVersion) {

  public Classification {
    secondaryCategories = secondaryCategories == null ? List.of() : List.copyOf(secondaryCategories);
    priority = priority == null ? Priority.NORMAL : priority;
    deadlineConfidence = deadlineConfidence == null ? DeadlineConfidence.NONE : deadlineConfidence;
    detectedEntities = detectedEntities == null ? DetectedEntities.none() : detectedEntities;
    sentiment = sentiment == null ? Sentiment.NEUTRAL : sentiment;
    actionItems = actionItems == null ? List.of() : List.copyOf(actionItems);
    threadContext = threadContext == null ? ThreadContext.none() : threadContext;
  }

  /** Category, priority and action items only, with no deadline, entities or thread. */
  public Classification(
      String primaryCategory,
      List<String> secondaryCategories,
      Priority priority,
      double confidence,
      String rationale,
      List<ActionItem> actionItems,
      String schemaVersion) {
    this(
        primaryCategory,
        secondaryCategories,
        priority,
        null,
        null,
        confidence,
        rationale,
        null,
        null,
        actionItems,
        null,
        null,
        schemaVersion);
  }
}

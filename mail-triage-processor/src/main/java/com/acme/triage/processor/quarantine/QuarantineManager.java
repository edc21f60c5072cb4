package com.acme.triage.processor.quarantine;

import com.acme.triage.classification.ClassificationValidator;
import com.acme.triage.config.TriageConfig;
import com.acme.triage.domain.Classification;
import com.acme.triage.domain.ClassificationResult;
import com.acme.triage.domain.FailureTally;
import com.acme.triage.domain.Message;
import com.acme.triage.domain.MessageStatus;
import com.acme.triage.domain.ReleaseOutcome;
import com.acme.triage.idempotency.IdempotencyKeys;
import com.acme.triage.processor.metrics.MetricNames;
import com.acme.triage.repository.ClassificationResultRepository;
import com.acme.triage.repository.FailureTallyRepository;
import com.acme.triage.repository.IdempotencyKeyRepository;
import com.acme.triage.repository.MessageRepository;
import com.acme.triage.spi.MetricsSink;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks consecutive terminal failures per tally key and parks messages that keep failing. A
 * quarantined message leaves the quarantine only through {@link #release}.
 */
@Singleton
public class QuarantineManager {
  private static final Logger LOG = LoggerFactory.getLogger(QuarantineManager.class);

  private final FailureTallyRepository tallies;
  private final MessageRepository messages;
  private final ClassificationResultRepository results;
  private final IdempotencyKeyRepository keys;
  private final ClassificationValidator validator;
  private final MetricsSink metrics;
  private final TriageConfig config;

  public QuarantineManager(
      FailureTallyRepository tallies,
      MessageRepository messages,
      ClassificationResultRepository results,
      IdempotencyKeyRepository keys,
      ClassificationValidator validator,
      MetricsSink metrics,
      TriageConfig config) {
    this.tallies = tallies;
    this.messages = messages;
    this.results = results;
    this.keys = keys;
    this.validator = validator;
    this.metrics = metrics;
    this.config = config;
  }

  /** Called once per terminal failure of a processing attempt, never per retry. */
  public FailureTally recordFailure(String tallyKey, Throwable error) {
    return tallies.increment(tallyKey, error.getClass().getSimpleName(), error.getMessage());
  }

  public boolean shouldQuarantine(FailureTally tally) {
    return tally.consecutiveFailures() >= config.getQuarantineThreshold();
  }

  /** Whether one more failure under {@code tallyKey} would reach the threshold. */
  public boolean nextFailureQuarantines(String tallyKey) {
    int current = tallies.find(tallyKey).map(FailureTally::consecutiveFailures).orElse(0);
    return current + 1 >= config.getQuarantineThreshold();
  }

  public void reset(String tallyKey) {
    tallies.reset(tallyKey);
  }

  public String tallyKeyFor(Message message) {
    return IdempotencyKeys.tallyKey(
        config.getTallyScope(), message.getMessageId(), config.getSchemaVersion());
  }

  /**
   * Moves a message from {@code classifying} to {@code quarantined}.
   *
   * @return false if the message was no longer classifying
   */
  public boolean quarantine(Message message, Throwable error) {
    boolean moved =
        messages.transition(
            message.getId(),
            EnumSet.of(MessageStatus.CLASSIFYING),
            MessageStatus.QUARANTINED,
            error.getClass().getSimpleName(),
            error.getMessage());
    if (moved) {
      LOG.warn(
          "Quarantined messageId={} after repeated failures, last error {}: {}",
          message.getMessageId(),
          error.getClass().getSimpleName(),
          error.getMessage());
      metrics.increment(MetricNames.QUARANTINED);
    }
    return moved;
  }

  /**
   * Releases a quarantined message. With {@code manualReview} the supplied classification is
   * validated and stored as the result for the current schema version and the message becomes
   * {@code classified}; otherwise it goes back to {@code pending}. The failure tally is reset
   * either way.
   *
   * @throws IllegalArgumentException if manual review is requested without a classification
   * @throws com.acme.triage.core.SchemaValidationException if the manual classification is invalid
   */
  @Transactional
  public ReleaseOutcome release(
      UUID messagePk, boolean manualReview, Classification manualClassification) {
    if (manualReview && manualClassification == null) {
      throw new IllegalArgumentException("Manual review release requires a classification");
    }
    Optional<Message> found = messages.findById(messagePk);
    if (found.isEmpty()) {
      return ReleaseOutcome.NOT_FOUND;
    }
    Message message = found.get();
    if (!message.isQuarantined()) {
      return ReleaseOutcome.NOT_QUARANTINED;
    }

    String mode;
    ReleaseOutcome outcome;
    if (manualReview) {
      Classification valid = validator.validate(manualClassification);
      if (!messages.transition(
          messagePk, EnumSet.of(MessageStatus.QUARANTINED), MessageStatus.CLASSIFIED)) {
        return ReleaseOutcome.NOT_QUARANTINED;
      }
      String key = IdempotencyKeys.keyFor(message.getMessageId(), config.getSchemaVersion());
      results.insertIfAbsent(ClassificationResult.of(message, key, valid, List.of(), true));
      keys.upsertCompleted(key, message.getMessageId(), config.getSchemaVersion());
      mode = "manual";
      outcome = ReleaseOutcome.RELEASED_AS_CLASSIFIED;
    } else {
      if (!messages.transition(
          messagePk, EnumSet.of(MessageStatus.QUARANTINED), MessageStatus.PENDING)) {
        return ReleaseOutcome.NOT_QUARANTINED;
      }
      mode = "requeue";
      outcome = ReleaseOutcome.RELEASED_TO_PENDING;
    }

    tallies.reset(tallyKeyFor(message));
    LOG.info("Released messageId={} from quarantine ({})", message.getMessageId(), mode);
    metrics.increment(MetricNames.QUARANTINE_RELEASES, "mode", mode);
    return outcome;
  }
}

package com.acme.triage.processor.feedback;

import com.acme.triage.classification.ClassificationValidator;
import com.acme.triage.config.TriageConfig;
import com.acme.triage.core.PermanentException;
import com.acme.triage.core.SchemaValidationException;
import com.acme.triage.domain.ContextEntry;
import com.acme.triage.domain.FeedbackDrainReport;
import com.acme.triage.domain.FeedbackOutcome;
import com.acme.triage.domain.FeedbackRecord;
import com.acme.triage.domain.Message;
import com.acme.triage.processor.metrics.MetricNames;
import com.acme.triage.repository.FeedbackRepository;
import com.acme.triage.repository.MessageRepository;
import com.acme.triage.spi.ContextStore;
import com.acme.triage.spi.MetricsSink;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns user corrections into retrievable context. Each record yields one context entry with a
 * deterministic id, so re-running a record after a lost flag update overwrites rather than
 * duplicates. The {@code incorporated} flag on the record is the only "done" signal.
 */
@Singleton
public class FeedbackIncorporationLoop {
  private static final Logger LOG = LoggerFactory.getLogger(FeedbackIncorporationLoop.class);

  private final FeedbackRepository feedback;
  private final MessageRepository messages;
  private final ContextStore contextStore;
  private final ClassificationValidator validator;
  private final MetricsSink metrics;
  private final TriageConfig config;

  public FeedbackIncorporationLoop(
      FeedbackRepository feedback,
      MessageRepository messages,
      ContextStore contextStore,
      ClassificationValidator validator,
      MetricsSink metrics,
      TriageConfig config) {
    this.feedback = feedback;
    this.messages = messages;
    this.contextStore = contextStore;
    this.validator = validator;
    this.metrics = metrics;
    this.config = config;
  }

  /**
   * Stores a correction for later incorporation.
   *
   * @throws SchemaValidationException if the corrected category is malformed or outside the
   *     taxonomy
   * @throws PermanentException if the message does not exist
   */
  public FeedbackRecord submit(
      UUID messagePk, String originalCategory, String correctedCategory, String reason) {
    validator.checkCategory("correctedCategory", correctedCategory);
    if (messages.findById(messagePk).isEmpty()) {
      throw new PermanentException("Message not found: " + messagePk);
    }
    FeedbackRecord record =
        FeedbackRecord.newSubmission(messagePk, originalCategory, correctedCategory, reason);
    feedback.insert(record);
    LOG.debug("Feedback {} submitted for message {}", record.getId(), messagePk);
    return record;
  }

  public List<FeedbackRecord> pending(int limit) {
    return feedback.findPending(limit);
  }

  public FeedbackOutcome incorporate(FeedbackRecord record) {
    Optional<FeedbackRecord> current = feedback.findById(record.getId());
    if (current.isEmpty() || current.get().isIncorporated()) {
      return FeedbackOutcome.SKIPPED;
    }

    try {
      Instant now = Instant.now();
      contextStore.upsert(
          new ContextEntry(
              record.contextEntryId(),
              contextText(record),
              record.getCorrectedCategory(),
              ContextEntry.SOURCE_FEEDBACK,
              now,
              now));
    } catch (RuntimeException e) {
      LOG.warn("Failed to write context for feedback {}: {}", record.getId(), e.getMessage());
      return FeedbackOutcome.FAILED;
    }

    if (!feedback.markIncorporated(record.getId())) {
      // another drain flipped the flag first; the upsert above was a no-op overwrite
      return FeedbackOutcome.SKIPPED;
    }
    return FeedbackOutcome.INCORPORATED;
  }

  public FeedbackDrainReport drain() {
    long start = System.nanoTime();
    Map<FeedbackOutcome, Integer> counts = new EnumMap<>(FeedbackOutcome.class);
    for (FeedbackRecord record : pending(config.getFeedbackBatchSize())) {
      FeedbackOutcome outcome;
      try {
        outcome = incorporate(record);
      } catch (RuntimeException e) {
        LOG.error("Error incorporating feedback {}", record.getId(), e);
        outcome = FeedbackOutcome.FAILED;
      }
      counts.merge(outcome, 1, Integer::sum);
      metrics.increment(MetricNames.FEEDBACK_RECORDS, "outcome", outcome.tag());
    }
    Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
    FeedbackDrainReport report =
        new FeedbackDrainReport(
            counts.getOrDefault(FeedbackOutcome.INCORPORATED, 0),
            counts.getOrDefault(FeedbackOutcome.SKIPPED, 0),
            counts.getOrDefault(FeedbackOutcome.FAILED, 0),
            elapsed);

    metrics.recordDuration(MetricNames.FEEDBACK_LATENCY, elapsed);
    double seconds = Math.max(elapsed.toNanos(), 1) / 1_000_000_000.0;
    metrics.gauge(MetricNames.FEEDBACK_THROUGHPUT, report.total() / seconds);
    if (report.total() > 0) {
      LOG.info(
          "Feedback drain: incorporated={} skipped={} failed={} in {}ms",
          report.incorporated(),
          report.skipped(),
          report.failed(),
          elapsed.toMillis());
    }
    return report;
  }

  @Scheduled(fixedDelay = "${triage.feedback-interval:60s}")
  void scheduledDrain() {
    try {
      drain();
    } catch (Exception e) {
      LOG.error("Error in feedback drain", e);
    }
  }

  private String contextText(FeedbackRecord record) {
    Optional<Message> message = messages.findById(record.getMessagePk());
    String subject = message.map(Message::getSubject).orElse("");
    String domain = message.map(Message::getSenderDomain).orElse(Message.UNKNOWN_DOMAIN);
    StringBuilder text =
        new StringBuilder()
            .append("Messages like \"")
            .append(subject)
            .append("\" from ")
            .append(domain)
            .append(" should be classified as ")
            .append(record.getCorrectedCategory());
    if (record.getOriginalCategory() != null) {
      text.append(" (not ").append(record.getOriginalCategory()).append(")");
    }
    text.append('.');
    if (record.getReason() != null && !record.getReason().isBlank()) {
      text.append(" Reason: ").append(record.getReason());
    }
    return text.toString();
  }
}

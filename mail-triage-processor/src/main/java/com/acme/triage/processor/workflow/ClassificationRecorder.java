package com.acme.triage.processor.workflow;

import com.acme.triage.domain.ClassificationResult;
import com.acme.triage.domain.Message;
import com.acme.triage.domain.MessageStatus;
import com.acme.triage.repository.ClassificationResultRepository;
import com.acme.triage.repository.FailureTallyRepository;
import com.acme.triage.repository.IdempotencyKeyRepository;
import com.acme.triage.repository.MessageRepository;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
import java.util.EnumSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Commits a successful classification: result, status, claim and tally in one transaction. */
@Singleton
public class ClassificationRecorder {
  private static final Logger LOG = LoggerFactory.getLogger(ClassificationRecorder.class);

  private final ClassificationResultRepository results;
  private final MessageRepository messages;
  private final IdempotencyKeyRepository keys;
  private final FailureTallyRepository tallies;

  public ClassificationRecorder(
      ClassificationResultRepository results,
      MessageRepository messages,
      IdempotencyKeyRepository keys,
      FailureTallyRepository tallies) {
    this.results = results;
    this.messages = messages;
    this.keys = keys;
    this.tallies = tallies;
  }

  /**
   * Stores the result and moves the message to {@code classified}. If a result for the same
   * message and schema version was already stored (a claim lost to stale recovery), the stored
   * one stands and this one is dropped; the message is still marked classified.
   *
   * @return false if the result was a duplicate
   */
  @Transactional
  public boolean recordSuccess(Message message, ClassificationResult result, String tallyKey) {
    boolean inserted = results.insertIfAbsent(result) == 1;
    if (!inserted) {
      LOG.warn(
          "Result for messageId={} schemaVersion={} already stored, discarding duplicate",
          message.getMessageId(),
          result.schemaVersion());
    }
    messages.transition(
        message.getId(), EnumSet.of(MessageStatus.CLASSIFYING), MessageStatus.CLASSIFIED);
    keys.markCompleted(result.idempotencyKey());
    tallies.reset(tallyKey);
    return inserted;
  }
}

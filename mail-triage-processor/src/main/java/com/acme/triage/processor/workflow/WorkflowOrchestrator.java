package com.acme.triage.processor.workflow;

import com.acme.triage.classification.ClassificationValidator;
import com.acme.triage.config.TriageConfig;
import com.acme.triage.core.ErrorKind;
import com.acme.triage.core.StuckClassificationException;
import com.acme.triage.core.TransientException;
import com.acme.triage.domain.ClaimResult;
import com.acme.triage.domain.Classification;
import com.acme.triage.domain.ClassificationResult;
import com.acme.triage.domain.ContextSnippet;
import com.acme.triage.domain.FailureTally;
import com.acme.triage.domain.InboundMessage;
import com.acme.triage.domain.Message;
import com.acme.triage.domain.MessageStatus;
import com.acme.triage.domain.ProcessingCycle;
import com.acme.triage.idempotency.IdempotencyKeys;
import com.acme.triage.processor.metrics.MetricNames;
import com.acme.triage.processor.quarantine.QuarantineManager;
import com.acme.triage.repository.MessageRepository;
import com.acme.triage.repository.ProcessingCycleRepository;
import com.acme.triage.retry.CircuitBreakers;
import com.acme.triage.retry.RetryPolicy;
import com.acme.triage.service.IdempotencyService;
import com.acme.triage.spi.Classifier;
import com.acme.triage.spi.ContextRetriever;
import com.acme.triage.spi.MailboxPoller;
import com.acme.triage.spi.MetricsSink;
import io.micronaut.context.annotation.Requires;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the polling cycle: registers polled mail, picks up queued messages, and classifies each
 * on a bounded worker pool. Every message ends an attempt in exactly one of classified, failed or
 * quarantined, or is skipped without a state change.
 *
 * <p>Cycles never overlap. A cycle that exceeds the cycle timeout cancels its outstanding
 * workers and settles their messages as transient failures.
 */
@Singleton
@Requires(beans = {MailboxPoller.class, Classifier.class})
public class WorkflowOrchestrator {
  private static final Logger LOG = LoggerFactory.getLogger(WorkflowOrchestrator.class);

  enum Outcome {
    CLASSIFIED,
    FAILED,
    QUARANTINED,
    SKIPPED;

    String tag() {
      return name().toLowerCase();
    }
  }

  private final MailboxPoller poller;
  private final Classifier classifier;
  private final ContextRetriever retriever;
  private final MessageRepository messages;
  private final ProcessingCycleRepository cycles;
  private final IdempotencyService idempotency;
  private final QuarantineManager quarantine;
  private final ClassificationRecorder recorder;
  private final DependencyGateway gateway;
  private final ClassificationValidator validator;
  private final RetryPolicy classifierPolicy;
  private final RetryPolicy contextPolicy;
  private final MetricsSink metrics;
  private final TriageConfig config;

  private final AtomicBoolean running = new AtomicBoolean(false);

  public WorkflowOrchestrator(
      MailboxPoller poller,
      Classifier classifier,
      ContextRetriever retriever,
      MessageRepository messages,
      ProcessingCycleRepository cycles,
      IdempotencyService idempotency,
      QuarantineManager quarantine,
      ClassificationRecorder recorder,
      DependencyGateway gateway,
      ClassificationValidator validator,
      RetryPolicy retryPolicy,
      MetricsSink metrics,
      TriageConfig config) {
    this.poller = poller;
    this.classifier = classifier;
    this.retriever = retriever;
    this.messages = messages;
    this.cycles = cycles;
    this.idempotency = idempotency;
    this.quarantine = quarantine;
    this.recorder = recorder;
    this.gateway = gateway;
    this.validator = validator;
    this.classifierPolicy = retryPolicy;
    this.contextPolicy = retryPolicy.withMaxAttempts(config.getContextMaxAttempts());
    this.metrics = metrics;
    this.config = config;
  }

  /**
   * Runs one processing cycle.
   *
   * @return the finalized cycle, or empty if another cycle was still running
   */
  public Optional<ProcessingCycle> runCycle() {
    if (!running.compareAndSet(false, true)) {
      LOG.info("Previous processing cycle still running, skipping");
      return Optional.empty();
    }
    try {
      return Optional.of(doRunCycle());
    } finally {
      running.set(false);
    }
  }

  @Scheduled(fixedDelay = "${triage.poll-interval:30s}")
  void scheduledCycle() {
    try {
      runCycle();
    } catch (Exception e) {
      LOG.error("Error in processing cycle", e);
    }
  }

  private ProcessingCycle doRunCycle() {
    long deadline = System.nanoTime() + config.getCycleTimeout().toNanos();
    ProcessingCycle cycle = ProcessingCycle.start(queueDepth());
    cycles.insert(cycle);

    recoverAbandonedWork(cycle);
    List<Message> batch = buildBatch(pollMailbox(), cycle);
    cycle.setScanned(cycle.getScanned() + batch.size());
    if (!batch.isEmpty()) {
      process(batch, cycle, deadline);
    }

    long depth = queueDepth();
    cycle.finish(depth);
    cycles.finish(cycle);

    metrics.gauge(MetricNames.QUEUE_DEPTH, depth);
    metrics.recordDuration(MetricNames.CYCLE_DURATION, Duration.ofMillis(cycle.getDurationMs()));
    LOG.info(
        "Cycle {} done in {}ms: scanned={} classified={} failed={} quarantined={} skipped={}"
            + " queueDepth={}{}",
        cycle.getId(),
        cycle.getDurationMs(),
        cycle.getScanned(),
        cycle.getClassified(),
        cycle.getFailed(),
        cycle.getQuarantined(),
        cycle.getSkipped(),
        depth,
        cycle.isTimedOut() ? " (timed out)" : "");
    return cycle;
  }

  private long queueDepth() {
    return messages.countByStatus(MessageStatus.QUEUED);
  }

  private void recoverAbandonedWork(ProcessingCycle cycle) {
    try {
      int claims = idempotency.recoverStaleClaims();
      int stuck = 0;
      for (Message m : messages.findStuck(config.getClaimTimeout())) {
        if (settleStuck(m, cycle)) {
          stuck++;
        }
      }
      if (claims > 0 || stuck > 0) {
        LOG.warn("Recovered {} stale claims and {} stuck messages", claims, stuck);
      }
    } catch (RuntimeException e) {
      LOG.error("Failed to recover abandoned work, continuing with cycle", e);
    }
  }

  /**
   * An abandoned attempt is a transient failure and counts toward quarantine. The tally is only
   * incremented by the recovery whose status change wins.
   */
  private boolean settleStuck(Message message, ProcessingCycle cycle) {
    StuckClassificationException error =
        new StuckClassificationException(
            "Classification abandoned after " + config.getClaimTimeout().toMillis() + "ms");
    String tallyKey = quarantine.tallyKeyFor(message);
    boolean quarantining = quarantine.nextFailureQuarantines(tallyKey);
    boolean moved =
        quarantining
            ? quarantine.quarantine(message, error)
            : messages.transition(
                message.getId(),
                EnumSet.of(MessageStatus.CLASSIFYING),
                MessageStatus.FAILED,
                error.getClass().getSimpleName(),
                error.getMessage());
    if (!moved) {
      return false;
    }
    quarantine.recordFailure(tallyKey, error);
    if (quarantining) {
      count(cycle, Outcome.QUARANTINED);
    } else {
      metrics.increment(MetricNames.MESSAGES_FAILED, "error_kind", "transient");
    }
    return true;
  }

  private List<Message> pollMailbox() {
    List<InboundMessage> inbound;
    try {
      inbound = poller.poll();
    } catch (RuntimeException e) {
      LOG.warn("Mailbox poll failed, continuing with stored work: {}", e.getMessage());
      return List.of();
    }
    List<Message> registered = new ArrayList<>();
    for (InboundMessage in : inbound == null ? List.<InboundMessage>of() : inbound) {
      if (in.messageId() == null || in.messageId().isBlank()) {
        LOG.warn("Ignoring polled message without an id from sender={}", in.sender());
        continue;
      }
      try {
        register(in).ifPresent(registered::add);
      } catch (RuntimeException e) {
        LOG.error("Failed to register messageId={}", in.messageId(), e);
      }
    }
    return registered;
  }

  private Optional<Message> register(InboundMessage in) {
    Message fresh = Message.fromInbound(in, IdempotencyKeys.fingerprint(in.body()));
    if (messages.insertIfAbsent(fresh) == 1) {
      LOG.debug("Registered messageId={} as {}", in.messageId(), fresh.getId());
      return Optional.of(fresh);
    }
    Optional<Message> stored = messages.findByMessageId(in.messageId());
    stored.ifPresent(m -> m.setBody(in.body()));
    return stored;
  }

  /**
   * Polled messages first, then stored queued work. Polled messages already classified under the
   * current schema version are counted as scanned and skipped, and left out of the batch.
   */
  private List<Message> buildBatch(List<Message> polled, ProcessingCycle cycle) {
    int limit = config.getBatchSize();
    Map<UUID, Message> batch = new LinkedHashMap<>();
    for (Message m : polled) {
      if (batch.size() >= limit) {
        break;
      }
      if (m.isQuarantined() || batch.containsKey(m.getId())) {
        continue;
      }
      String key = idempotency.keyFor(m.getMessageId(), config.getSchemaVersion());
      if (idempotency.alreadyProcessed(key)) {
        cycle.setScanned(cycle.getScanned() + 1);
        count(cycle, Outcome.SKIPPED);
        continue;
      }
      batch.put(m.getId(), m);
    }
    if (batch.size() < limit) {
      for (Message m : messages.findEligibleForPickup(limit)) {
        if (batch.size() >= limit) {
          break;
        }
        batch.putIfAbsent(m.getId(), m);
      }
    }
    return new ArrayList<>(batch.values());
  }

  private void process(List<Message> batch, ProcessingCycle cycle, long deadline) {
    int threads = Math.min(config.getWorkerConcurrency(), batch.size());
    AtomicInteger seq = new AtomicInteger();
    ExecutorService pool =
        Executors.newFixedThreadPool(
            threads,
            r -> {
              Thread t = new Thread(r, "triage-worker-" + seq.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
    List<MessageAttempt> attempts = batch.stream().map(MessageAttempt::new).toList();
    try {
      long remaining = Math.max(0, deadline - System.nanoTime());
      List<Future<Outcome>> futures = pool.invokeAll(attempts, remaining, TimeUnit.NANOSECONDS);
      for (int i = 0; i < futures.size(); i++) {
        count(cycle, settle(attempts.get(i), futures.get(i), cycle));
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOG.warn("Processing cycle {} interrupted", cycle.getId());
    } finally {
      pool.shutdownNow();
    }
  }

  private Outcome settle(MessageAttempt attempt, Future<Outcome> future, ProcessingCycle cycle) {
    try {
      return future.get();
    } catch (CancellationException e) {
      cycle.setTimedOut(true);
      return attempt.timedOut();
    } catch (ExecutionException e) {
      LOG.error(
          "Processing messageId={} failed, leaving it for a later cycle",
          attempt.message.getMessageId(),
          e.getCause());
      return Outcome.FAILED;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return Outcome.SKIPPED;
    }
  }

  private void count(ProcessingCycle cycle, Outcome outcome) {
    switch (outcome) {
      case CLASSIFIED -> cycle.setClassified(cycle.getClassified() + 1);
      case FAILED -> cycle.setFailed(cycle.getFailed() + 1);
      case QUARANTINED -> cycle.setQuarantined(cycle.getQuarantined() + 1);
      case SKIPPED -> cycle.setSkipped(cycle.getSkipped() + 1);
    }
    metrics.increment(MetricNames.MESSAGES_PROCESSED, "outcome", outcome.tag());
  }

  /**
   * One attempt at one message. {@code settled} admits exactly one terminal transition, whether
   * it comes from the worker or from the cycle timing the worker out.
   */
  private final class MessageAttempt implements Callable<Outcome> {
    private final Message message;
    private final String tallyKey;
    private final AtomicBoolean settled = new AtomicBoolean(false);
    private volatile String key;
    private volatile boolean claimed;
    private volatile boolean classifying;

    MessageAttempt(Message message) {
      this.message = message;
      this.tallyKey = quarantine.tallyKeyFor(message);
    }

    @Override
    public Outcome call() {
      key = idempotency.keyFor(message.getMessageId(), config.getSchemaVersion());
      ClaimResult claim =
          idempotency.tryClaim(key, message.getMessageId(), config.getSchemaVersion());
      if (claim != ClaimResult.ACQUIRED) {
        LOG.debug("Skipping messageId={}: {}", message.getMessageId(), claim);
        return Outcome.SKIPPED;
      }
      claimed = true;

      if (!messages.transition(
          message.getId(), MessageStatus.CLAIMABLE, MessageStatus.CLASSIFYING)) {
        LOG.debug("Skipping messageId={}: status changed underneath", message.getMessageId());
        idempotency.release(key);
        return Outcome.SKIPPED;
      }
      classifying = true;
      if (settled.get()) {
        // timed out between the claim and the status change
        messages.transition(
            message.getId(),
            EnumSet.of(MessageStatus.CLASSIFYING),
            MessageStatus.FAILED,
            TransientException.class.getSimpleName(),
            "Processing cycle timed out");
        idempotency.release(key);
        return Outcome.FAILED;
      }

      long start = System.nanoTime();
      List<ContextSnippet> context;
      Classification classification;
      try {
        context = retrieveContext();
        classification =
            validator.validate(
                gateway.call(
                    CircuitBreakers.CLASSIFIER,
                    classifierPolicy,
                    () -> classifier.classify(message, context)));
      } catch (RuntimeException e) {
        if (!settled.compareAndSet(false, true)) {
          return Outcome.FAILED;
        }
        // a cancelled worker still records its failure
        boolean interrupted = Thread.interrupted();
        try {
          return abort(e);
        } finally {
          if (interrupted) {
            Thread.currentThread().interrupt();
          }
        }
      }

      if (!settled.compareAndSet(false, true)) {
        return Outcome.FAILED;
      }
      try {
        List<String> contextIds = context.stream().map(ContextSnippet::id).toList();
        boolean stored =
            recorder.recordSuccess(
                message,
                ClassificationResult.of(message, key, classification, contextIds, false),
                tallyKey);
        metrics.recordDuration(
            MetricNames.CLASSIFICATION_LATENCY, Duration.ofNanos(System.nanoTime() - start));
        LOG.debug(
            "Classified messageId={} as {} ({})",
            message.getMessageId(),
            classification.primaryCategory(),
            classification.priority());
        return stored ? Outcome.CLASSIFIED : Outcome.SKIPPED;
      } catch (RuntimeException e) {
        return abort(e);
      }
    }

    /** Called on the cycle thread for a worker the cycle timeout cancelled. */
    Outcome timedOut() {
      if (!settled.compareAndSet(false, true)) {
        return Outcome.FAILED;
      }
      if (!claimed) {
        return Outcome.SKIPPED;
      }
      try {
        return abort(
            new TransientException(
                "Processing cycle timed out after " + config.getCycleTimeout().toMillis() + "ms"));
      } catch (RuntimeException e) {
        LOG.error("Failed to settle timed out messageId={}", message.getMessageId(), e);
        return Outcome.FAILED;
      }
    }

    private List<ContextSnippet> retrieveContext() {
      try {
        List<ContextSnippet> snippets =
            gateway.call(
                CircuitBreakers.CONTEXT_RETRIEVER,
                contextPolicy,
                () -> retriever.retrieve(message, config.getContextLimit()));
        return snippets == null ? List.of() : snippets;
      } catch (RuntimeException e) {
        if (Thread.currentThread().isInterrupted()) {
          throw new TransientException("Context retrieval interrupted", e);
        }
        LOG.warn(
            "Context retrieval failed for messageId={}, classifying without context: {}",
            message.getMessageId(),
            e.getMessage());
        metrics.increment(MetricNames.CONTEXT_DEGRADED);
        return List.of();
      }
    }

    private Outcome abort(Throwable error) {
      ErrorKind kind = RetryPolicy.classify(error);
      if (claimed) {
        idempotency.release(key);
      }
      if (!classifying) {
        return Outcome.SKIPPED;
      }

      boolean quarantined = false;
      if (kind != ErrorKind.FAST_FAIL) {
        FailureTally tally = quarantine.recordFailure(tallyKey, error);
        if (quarantine.shouldQuarantine(tally)) {
          quarantined = quarantine.quarantine(message, error);
        }
      }
      if (!quarantined) {
        messages.transition(
            message.getId(),
            EnumSet.of(MessageStatus.CLASSIFYING),
            MessageStatus.FAILED,
            error.getClass().getSimpleName(),
            error.getMessage());
        LOG.warn(
            "Classification of messageId={} failed ({}): {}",
            message.getMessageId(),
            kind,
            error.getMessage());
      }

      if (kind == ErrorKind.PERMANENT) {
        metrics.increment(
            MetricNames.PERMANENT_ERRORS, "error_class", error.getClass().getSimpleName());
      } else {
        metrics.increment(MetricNames.MESSAGES_FAILED, "error_kind", kind.name().toLowerCase());
      }
      return quarantined ? Outcome.QUARANTINED : Outcome.FAILED;
    }
  }
}

package com.acme.triage.processor;

import com.acme.triage.classification.ClassificationValidator;
import com.acme.triage.config.TriageConfig;
import com.acme.triage.domain.Message;
import com.acme.triage.domain.MessageStatus;
import com.acme.triage.persistence.jdbc.H2ClassificationResultRepository;
import com.acme.triage.persistence.jdbc.H2ContextStore;
import com.acme.triage.persistence.jdbc.H2FailureTallyRepository;
import com.acme.triage.persistence.jdbc.H2FeedbackRepository;
import com.acme.triage.persistence.jdbc.H2IdempotencyKeyRepository;
import com.acme.triage.persistence.jdbc.H2MessageRepository;
import com.acme.triage.persistence.jdbc.H2ProcessingCycleRepository;
import com.acme.triage.persistence.jdbc.H2TagRepository;
import com.acme.triage.processor.context.ContextStoreRetriever;
import com.acme.triage.processor.metrics.MicrometerMetricsSink;
import com.acme.triage.processor.quarantine.QuarantineManager;
import com.acme.triage.processor.services.IdempotencyServiceImpl;
import com.acme.triage.processor.support.ScriptedClassifier;
import com.acme.triage.processor.support.StaticMailboxPoller;
import com.acme.triage.processor.workflow.ClassificationRecorder;
import com.acme.triage.processor.workflow.DependencyGateway;
import com.acme.triage.processor.workflow.WorkflowOrchestrator;
import com.acme.triage.repository.ClassificationResultRepository;
import com.acme.triage.repository.FailureTallyRepository;
import com.acme.triage.repository.FeedbackRepository;
import com.acme.triage.repository.IdempotencyKeyRepository;
import com.acme.triage.repository.MessageRepository;
import com.acme.triage.repository.ProcessingCycleRepository;
import com.acme.triage.repository.TagRepository;
import com.acme.triage.retry.CircuitBreakers;
import com.acme.triage.retry.RetryPolicy;
import com.acme.triage.spi.ContextRetriever;
import com.acme.triage.spi.ContextStore;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInstance;

/**
 * Wires the workflow by hand against an in-memory H2 database, with a scripted classifier and a
 * static mailbox. Backoffs are shortened so retry paths run in milliseconds.
 *
 * <p>Subclasses adjust settings in {@link #configure(TriageConfig)} before the beans are built.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class ProcessorTestBase {

  protected static HikariDataSource dataSource;

  protected TriageConfig config;
  protected MessageRepository messageRepository;
  protected ClassificationResultRepository resultRepository;
  protected IdempotencyKeyRepository keyRepository;
  protected FailureTallyRepository tallyRepository;
  protected ProcessingCycleRepository cycleRepository;
  protected FeedbackRepository feedbackRepository;
  protected TagRepository tagRepository;
  protected ContextStore contextStore;

  protected SimpleMeterRegistry meterRegistry;
  protected MicrometerMetricsSink metrics;
  protected CircuitBreakers breakers;
  protected DependencyGateway gateway;
  protected IdempotencyServiceImpl idempotency;
  protected QuarantineManager quarantine;
  protected ClassificationRecorder recorder;
  protected ClassificationValidator validator;

  protected StaticMailboxPoller poller;
  protected ScriptedClassifier classifier;
  protected ContextRetriever retriever;
  protected WorkflowOrchestrator orchestrator;

  @BeforeAll
  protected void setupSchema() {
    HikariConfig hikari = new HikariConfig();
    hikari.setJdbcUrl("jdbc:h2:mem:processordb;DB_CLOSE_DELAY=-1;DB_CLOSE_ON_EXIT=FALSE");
    hikari.setDriverClassName("org.h2.Driver");
    hikari.setUsername("sa");
    hikari.setPassword("");
    hikari.setMaximumPoolSize(20);
    dataSource = new HikariDataSource(hikari);

    Flyway.configure()
        .dataSource(dataSource)
        .locations("classpath:db/migration/h2")
        .load()
        .migrate();
  }

  @AfterAll
  void closeDataSource() {
    if (dataSource != null) {
      dataSource.close();
    }
  }

  @BeforeEach
  void wire() throws SQLException {
    truncateAll();

    config = new TriageConfig();
    config.setInitialBackoff(Duration.ofMillis(1));
    config.setMaxBackoff(Duration.ofMillis(5));
    config.setCallTimeout(Duration.ofSeconds(2));
    config.setCycleTimeout(Duration.ofSeconds(20));
    config.setBreakerFailureThreshold(50);
    config.setBreakerCooldown(Duration.ofMillis(100));
    configure(config);
    build();
  }

  /** Applies {@code change} to the settings and rebuilds every bean that reads them. */
  protected void reconfigure(Consumer<TriageConfig> change) {
    change.accept(config);
    gateway.close();
    build();
  }

  private void build() {
    messageRepository = new H2MessageRepository(dataSource);
    resultRepository = new H2ClassificationResultRepository(dataSource);
    keyRepository = new H2IdempotencyKeyRepository(dataSource);
    tallyRepository = new H2FailureTallyRepository(dataSource);
    cycleRepository = new H2ProcessingCycleRepository(dataSource);
    feedbackRepository = new H2FeedbackRepository(dataSource);
    tagRepository = new H2TagRepository(dataSource);
    contextStore = new H2ContextStore(dataSource);

    meterRegistry = new SimpleMeterRegistry();
    metrics = new MicrometerMetricsSink(meterRegistry);
    breakers = new CircuitBreakers(config);
    gateway = new DependencyGateway(breakers, metrics, config);
    idempotency = new IdempotencyServiceImpl(keyRepository, config);
    validator = new ClassificationValidator(config.getSchemaVersion());
    quarantine =
        new QuarantineManager(
            tallyRepository,
            messageRepository,
            resultRepository,
            keyRepository,
            validator,
            metrics,
            config);
    recorder =
        new ClassificationRecorder(
            resultRepository, messageRepository, keyRepository, tallyRepository);

    poller = new StaticMailboxPoller();
    classifier = new ScriptedClassifier(config.getSchemaVersion());
    retriever = new ContextStoreRetriever(contextStore);
    orchestrator = newOrchestrator();
  }

  @AfterEach
  void closeGateway() {
    if (gateway != null) {
      gateway.close();
    }
  }

  /** Hook for per-class settings. */
  protected void configure(TriageConfig config) {}

  protected WorkflowOrchestrator newOrchestrator() {
    return new WorkflowOrchestrator(
        poller,
        classifier,
        retriever,
        messageRepository,
        cycleRepository,
        idempotency,
        quarantine,
        recorder,
        gateway,
        validator,
        RetryPolicy.from(config),
        metrics,
        config);
  }

  protected void truncateAll() throws SQLException {
    try (Connection conn = dataSource.getConnection();
        Statement st = conn.createStatement()) {
      st.execute("DELETE FROM feedback");
      st.execute("DELETE FROM classification_result");
      st.execute("DELETE FROM idempotency_key");
      st.execute("DELETE FROM failure_tally");
      st.execute("DELETE FROM processing_cycle");
      st.execute("DELETE FROM context_entry");
      st.execute("DELETE FROM message");
    }
  }

  protected Message storedMessage(String messageId) {
    return messageRepository.findByMessageId(messageId).orElseThrow();
  }

  protected Message insertMessage(String messageId, MessageStatus status) {
    Message m = new Message();
    m.setId(UUID.randomUUID());
    m.setMessageId(messageId);
    m.setSender("ops@example.org");
    m.setSenderDomain(Message.domainOf(m.getSender()));
    m.setSubject("Server maintenance window");
    m.setBody("The cluster will be down on Saturday from 02:00 to 04:00.");
    m.setBodyHash("0".repeat(64));
    m.setStatus(MessageStatus.PENDING);
    m.setReceivedAt(Instant.now());
    messageRepository.insertIfAbsent(m);
    if (status != MessageStatus.PENDING) {
      updateStatus(m.getId(), status);
      m.setStatus(status);
    }
    return m;
  }

  protected void updateStatus(UUID id, MessageStatus status) {
    try (Connection conn = dataSource.getConnection();
        Statement st = conn.createStatement()) {
      st.executeUpdate(
          "UPDATE message SET status = '" + status.dbValue() + "' WHERE id = '" + id + "'");
    } catch (SQLException e) {
      throw new IllegalStateException(e);
    }
  }

  protected double counter(String name, String... tags) {
    return Optional.ofNullable(meterRegistry.find(name).tags(tags).counter())
        .map(Counter::count)
        .orElse(0.0);
  }
}

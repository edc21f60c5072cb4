package com.acme.triage.persistence.jdbc.message;

import static org.assertj.core.api.Assertions.assertThat;

import com.acme.triage.domain.Message;
import com.acme.triage.domain.MessageStatus;
import com.acme.triage.persistence.jdbc.H2MessageRepository;
import com.acme.triage.persistence.jdbc.H2RepositoryTestBase;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** H2 integration tests for message registration and compare-and-set transitions. */
class H2MessageRepositoryTest extends H2RepositoryTestBase {

  private H2MessageRepository repository;

  @BeforeEach
  void setUp() throws Exception {
    truncateAll();
    repository = new H2MessageRepository(dataSource);
  }

  @Nested
  @DisplayName("Registration")
  class Registration {

    @Test
    @DisplayName("insertIfAbsent registers a new message once")
    void testInsertOnce() {
      Message first = newMessage("<m1@example.com>");
      Message replay = newMessage("<m1@example.com>");

      assertThat(repository.insertIfAbsent(first)).isEqualTo(1);
      assertThat(repository.insertIfAbsent(replay)).isZero();

      Message stored = repository.findByMessageId("<m1@example.com>").orElseThrow();
      assertThat(stored.getId()).isEqualTo(first.getId());
      assertThat(stored.getStatus()).isEqualTo(MessageStatus.PENDING);
      assertThat(stored.getSender()).isEqualTo("alice@example.com");
      assertThat(stored.getUpdatedAt()).isNotNull();
    }

    @Test
    @DisplayName("body and sender domain are stored for later pickup")
    void testBodyStored() {
      Message m = newMessage("m-body");
      repository.insertIfAbsent(m);

      Message stored = repository.findEligibleForPickup(10).get(0);

      assertThat(stored.getBody()).isEqualTo("Your invoice for Q3 is attached.");
      assertThat(stored.getSenderDomain()).isEqualTo("example.com");
      assertThat(stored.getBodyHash()).isEqualTo(m.getBodyHash());
    }

    @Test
    @DisplayName("findById returns empty for unknown ids")
    void testFindUnknown() {
      assertThat(repository.findById(UUID.randomUUID())).isEmpty();
      assertThat(repository.findByMessageId("nope")).isEmpty();
    }
  }

  @Nested
  @DisplayName("Transitions")
  class Transitions {

    @Test
    @DisplayName("transition applies only from an allowed status")
    void testCompareAndSet() {
      Message m = newMessage("m-cas");
      repository.insertIfAbsent(m);

      assertThat(repository.transition(m.getId(), MessageStatus.CLAIMABLE, MessageStatus.CLASSIFYING))
          .isTrue();
      assertThat(repository.transition(m.getId(), MessageStatus.CLAIMABLE, MessageStatus.CLASSIFYING))
          .isFalse();
      assertThat(repository.findById(m.getId()).orElseThrow().getStatus())
          .isEqualTo(MessageStatus.CLASSIFYING);
    }

    @Test
    @DisplayName("quarantined messages cannot be moved to classifying")
    void testQuarantinedNotClaimable() {
      Message m = newMessage("m-q");
      repository.insertIfAbsent(m);
      repository.transition(m.getId(), Set.of(MessageStatus.PENDING), MessageStatus.QUARANTINED);

      assertThat(repository.transition(m.getId(), MessageStatus.CLAIMABLE, MessageStatus.CLASSIFYING))
          .isFalse();
    }

    @Test
    @DisplayName("error transition records last error class and message")
    void testErrorColumns() {
      Message m = newMessage("m-err");
      repository.insertIfAbsent(m);
      repository.transition(m.getId(), Set.of(MessageStatus.PENDING), MessageStatus.CLASSIFYING);

      boolean moved =
          repository.transition(
              m.getId(),
              Set.of(MessageStatus.CLASSIFYING),
              MessageStatus.FAILED,
              "com.acme.triage.core.TransientException",
              "x".repeat(3000));

      Message stored = repository.findById(m.getId()).orElseThrow();
      assertThat(moved).isTrue();
      assertThat(stored.getStatus()).isEqualTo(MessageStatus.FAILED);
      assertThat(stored.getLastErrorClass()).endsWith("TransientException");
      assertThat(stored.getLastErrorMessage()).hasSize(2000);
    }
  }

  @Nested
  @DisplayName("Queue queries")
  class QueueQueries {

    @Test
    @DisplayName("eligible pickup returns pending and failed only, honouring the limit")
    void testEligible() {
      Message pending = newMessage("a");
      Message failed = newMessage("b");
      Message quarantined = newMessage("c");
      Message classified = newMessage("d");
      for (Message m : List.of(pending, failed, quarantined, classified)) {
        repository.insertIfAbsent(m);
      }
      repository.transition(failed.getId(), Set.of(MessageStatus.PENDING), MessageStatus.FAILED);
      repository.transition(
          quarantined.getId(), Set.of(MessageStatus.PENDING), MessageStatus.QUARANTINED);
      repository.transition(
          classified.getId(), Set.of(MessageStatus.PENDING), MessageStatus.CLASSIFIED);

      assertThat(repository.findEligibleForPickup(10))
          .extracting(Message::getMessageId)
          .containsExactlyInAnyOrder("a", "b");
      assertThat(repository.findEligibleForPickup(1)).hasSize(1);
      assertThat(repository.countByStatus(MessageStatus.QUEUED)).isEqualTo(2);
      assertThat(repository.countByStatus(EnumSet.of(MessageStatus.QUARANTINED))).isEqualTo(1);
    }
  }

  @Nested
  @DisplayName("Recovery")
  class Recovery {

    @Test
    @DisplayName("only messages left in classifying past the cutoff are reported stuck")
    void testFindStuck() throws Exception {
      Message stuck = newMessage("stuck");
      Message active = newMessage("active");
      repository.insertIfAbsent(stuck);
      repository.insertIfAbsent(active);
      repository.transition(stuck.getId(), Set.of(MessageStatus.PENDING), MessageStatus.CLASSIFYING);
      repository.transition(active.getId(), Set.of(MessageStatus.PENDING), MessageStatus.CLASSIFYING);
      try (Connection conn = dataSource.getConnection();
          PreparedStatement ps =
              conn.prepareStatement("UPDATE message SET updated_at = ? WHERE id = ?")) {
        ps.setTimestamp(1, Timestamp.from(Instant.now().minus(Duration.ofHours(1))));
        ps.setObject(2, stuck.getId());
        ps.executeUpdate();
      }

      List<Message> found = repository.findStuck(Duration.ofMinutes(10));

      assertThat(found).extracting(Message::getId).containsExactly(stuck.getId());
      assertThat(found.get(0).getStatus()).isEqualTo(MessageStatus.CLASSIFYING);
      assertThat(repository.findById(stuck.getId()).orElseThrow().getStatus())
          .isEqualTo(MessageStatus.CLASSIFYING);
    }
  }
}

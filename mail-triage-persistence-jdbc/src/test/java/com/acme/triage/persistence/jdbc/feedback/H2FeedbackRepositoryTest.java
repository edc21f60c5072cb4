package com.acme.triage.persistence.jdbc.feedback;

import static org.assertj.core.api.Assertions.assertThat;

import com.acme.triage.domain.FeedbackRecord;
import com.acme.triage.domain.Message;
import com.acme.triage.persistence.jdbc.H2FeedbackRepository;
import com.acme.triage.persistence.jdbc.H2MessageRepository;
import com.acme.triage.persistence.jdbc.H2RepositoryTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class H2FeedbackRepositoryTest extends H2RepositoryTestBase {

  private H2FeedbackRepository repository;
  private Message message;

  @BeforeEach
  void setUp() throws Exception {
    truncateAll();
    repository = new H2FeedbackRepository(dataSource);
    message = newMessage("m-feedback");
    new H2MessageRepository(dataSource).insertIfAbsent(message);
  }

  @Test
  @DisplayName("new feedback is pending until incorporated")
  void testPending() {
    FeedbackRecord record =
        FeedbackRecord.newSubmission(message.getId(), "work.meeting", "personal.event", "family dinner");
    repository.insert(record);

    assertThat(repository.findPending(10)).extracting(FeedbackRecord::getId).containsExactly(record.getId());

    assertThat(repository.markIncorporated(record.getId())).isTrue();
    assertThat(repository.findPending(10)).isEmpty();
    FeedbackRecord stored = repository.findById(record.getId()).orElseThrow();
    assertThat(stored.isIncorporated()).isTrue();
    assertThat(stored.getIncorporatedAt()).isNotNull();
  }

  @Test
  @DisplayName("the incorporated flag flips only once")
  void testFlipOnce() {
    FeedbackRecord record =
        FeedbackRecord.newSubmission(message.getId(), "a.b", "c.d", null);
    repository.insert(record);

    assertThat(repository.markIncorporated(record.getId())).isTrue();
    assertThat(repository.markIncorporated(record.getId())).isFalse();
  }
}

package com.acme.triage.config;

import static org.assertj.core.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TriageConfigTest {

  @Nested
  @DisplayName("Defaults")
  class Defaults {

    @Test
    @DisplayName("should ship documented defaults")
    void testDefaults() {
      TriageConfig config = new TriageConfig();

      assertThat(config.getSchemaVersion()).isEqualTo("v2");
      assertThat(config.getMaxRetryAttempts()).isEqualTo(3);
      assertThat(config.getInitialBackoff()).isEqualTo(Duration.ofMillis(200));
      assertThat(config.getMaxBackoff()).isEqualTo(Duration.ofSeconds(10));
      assertThat(config.getBreakerFailureThreshold()).isEqualTo(5);
      assertThat(config.getBreakerCooldown()).isEqualTo(Duration.ofSeconds(30));
      assertThat(config.getQuarantineThreshold()).isEqualTo(3);
      assertThat(config.getTallyScope()).isEqualTo(TallyScope.MESSAGE);
      assertThat(config.getWorkerConcurrency()).isEqualTo(2);
      assertThat(config.getFeedbackBatchSize()).isEqualTo(100);
    }

    @Test
    @DisplayName("defaults should validate")
    void testDefaultsValidate() {
      assertThatCode(() -> new TriageConfig().validate()).doesNotThrowAnyException();
    }
  }

  @Nested
  @DisplayName("Validation")
  class Validation {

    @Test
    @DisplayName("call timeout must be shorter than cycle timeout")
    void testCallTimeoutVsCycle() {
      TriageConfig config = new TriageConfig();
      config.setCallTimeout(Duration.ofMinutes(5));
      config.setCycleTimeout(Duration.ofMinutes(5));

      assertThatThrownBy(config::validate)
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("call-timeout");
    }

    @Test
    @DisplayName("should reject zero worker concurrency")
    void testWorkers() {
      TriageConfig config = new TriageConfig();
      config.setWorkerConcurrency(0);

      assertThatThrownBy(config::validate).hasMessageContaining("worker-concurrency");
    }

    @Test
    @DisplayName("should reject max backoff below initial backoff")
    void testBackoffOrder() {
      TriageConfig config = new TriageConfig();
      config.setInitialBackoff(Duration.ofSeconds(5));
      config.setMaxBackoff(Duration.ofSeconds(1));

      assertThatThrownBy(config::validate).hasMessageContaining("max-backoff");
    }
  }
}

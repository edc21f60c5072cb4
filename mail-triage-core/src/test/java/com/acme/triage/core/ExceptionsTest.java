package com.acme.triage.core;

import static org.assertj.core.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for the error taxonomy */
class ExceptionsTest {

  @Nested
  @DisplayName("TransientException Tests")
  class TransientExceptionTests {

    @Test
    @DisplayName("Should keep message and cause")
    void testMessageAndCause() {
      Exception cause = new java.io.IOException("connection reset");
      TransientException exception = new TransientException("Classifier unreachable", cause);

      assertThat(exception).hasMessage("Classifier unreachable").hasCause(cause);
      assertThat(exception).isInstanceOf(RuntimeException.class);
    }

    @Test
    @DisplayName("RateLimitedException should be transient and carry retry-after")
    void testRateLimited() {
      RateLimitedException withHint = new RateLimitedException("429", Duration.ofSeconds(5));
      RateLimitedException withoutHint = new RateLimitedException("429");

      assertThat(withHint).isInstanceOf(TransientException.class);
      assertThat(withHint.getRetryAfter()).contains(Duration.ofSeconds(5));
      assertThat(withoutHint.getRetryAfter()).isEmpty();
    }
  }

  @Nested
  @DisplayName("PermanentException Tests")
  class PermanentExceptionTests {

    @Test
    @DisplayName("SchemaValidationException should be permanent and name the field")
    void testSchemaValidation() {
      SchemaValidationException exception =
          new SchemaValidationException("confidence", "Confidence must be within [0,1]: 1.2");

      assertThat(exception).isInstanceOf(PermanentException.class);
      assertThat(exception.getField()).isEqualTo("confidence");
      assertThat(exception).hasMessageContaining("1.2");
    }

    @Test
    @DisplayName("Should be throwable")
    void testThrowable() {
      assertThatThrownBy(
              () -> {
                throw new PermanentException("Malformed response");
              })
          .isInstanceOf(PermanentException.class)
          .hasMessage("Malformed response");
    }
  }

  @Nested
  @DisplayName("DependencyUnavailableException Tests")
  class DependencyUnavailableTests {

    @Test
    @DisplayName("Should name the dependency")
    void testDependencyName() {
      DependencyUnavailableException exception = new DependencyUnavailableException("classifier");

      assertThat(exception.getDependency()).isEqualTo("classifier");
      assertThat(exception).hasMessage("Circuit breaker open for dependency 'classifier'");
      assertThat(exception).isNotInstanceOf(TransientException.class);
      assertThat(exception).isNotInstanceOf(PermanentException.class);
    }
  }
}

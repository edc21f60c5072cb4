package com.acme.triage.processor.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MicrometerMetricsSinkTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsSink sink;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    sink = new MicrometerMetricsSink(registry);
  }

  @Test
  @DisplayName("counters are kept per tag set")
  void countersByTag() {
    sink.increment(MetricNames.MESSAGES_PROCESSED, "outcome", "classified");
    sink.increment(MetricNames.MESSAGES_PROCESSED, "outcome", "classified");
    sink.increment(MetricNames.MESSAGES_PROCESSED, "outcome", "failed");

    assertThat(registry.counter(MetricNames.MESSAGES_PROCESSED, "outcome", "classified").count())
        .isEqualTo(2.0);
    assertThat(registry.counter(MetricNames.MESSAGES_PROCESSED, "outcome", "failed").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("a gauge reports the last value set")
  void gaugeLastValue() {
    sink.gauge(MetricNames.QUEUE_DEPTH, 7);
    sink.gauge(MetricNames.QUEUE_DEPTH, 3);

    assertThat(registry.find(MetricNames.QUEUE_DEPTH).gauge().value()).isEqualTo(3.0);
  }

  @Test
  @DisplayName("durations are recorded on a timer")
  void durations() {
    sink.recordDuration(MetricNames.CYCLE_DURATION, Duration.ofMillis(40));

    assertThat(registry.find(MetricNames.CYCLE_DURATION).timer().totalTime(TimeUnit.MILLISECONDS))
        .isEqualTo(40.0);
  }

  @Test
  @DisplayName("registry failures are swallowed")
  void failuresSwallowed() {
    MeterRegistry broken = mock(MeterRegistry.class);
    when(broken.config()).thenThrow(new IllegalStateException("registry closed"));
    MicrometerMetricsSink brokenSink = new MicrometerMetricsSink(broken);

    assertThatCode(
            () -> {
              brokenSink.increment(MetricNames.MESSAGES_FAILED);
              brokenSink.gauge(MetricNames.QUEUE_DEPTH, 1);
              brokenSink.recordDuration(MetricNames.CYCLE_DURATION, Duration.ofMillis(1));
            })
        .doesNotThrowAnyException();
  }
}

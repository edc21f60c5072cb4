package com.acme.triage.processor.metrics;

import com.acme.triage.spi.MetricsSink;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MetricsSink} backed by a Micrometer registry. Meters are registered lazily on first use;
 * gauges hold the last value set. Emission failures are logged and dropped.
 */
@Singleton
public class MicrometerMetricsSink implements MetricsSink {
  private static final Logger LOG = LoggerFactory.getLogger(MicrometerMetricsSink.class);

  private final MeterRegistry registry;
  private final Map<String, AtomicLong> gaugeValues = new ConcurrentHashMap<>();

  public MicrometerMetricsSink(MeterRegistry registry) {
    this.registry = registry;
  }

  @Override
  public void increment(String name, String... tags) {
    try {
      Counter.builder(name).tags(Tags.of(tags)).register(registry).increment();
    } catch (RuntimeException e) {
      LOG.warn("Failed to increment metric {}: {}", name, e.getMessage());
    }
  }

  @Override
  public void gauge(String name, double value, String... tags) {
    try {
      Tags meterTags = Tags.of(tags);
      AtomicLong holder =
          gaugeValues.computeIfAbsent(
              name + meterTags,
              k -> {
                AtomicLong bits = new AtomicLong(Double.doubleToLongBits(0.0));
                Gauge.builder(name, bits, b -> Double.longBitsToDouble(b.get()))
                    .tags(meterTags)
                    .register(registry);
                return bits;
              });
      holder.set(Double.doubleToLongBits(value));
    } catch (RuntimeException e) {
      LOG.warn("Failed to set gauge {}: {}", name, e.getMessage());
    }
  }

  @Override
  public void recordDuration(String name, Duration duration, String... tags) {
    try {
      Timer.builder(name).tags(Tags.of(tags)).register(registry).record(duration);
    } catch (RuntimeException e) {
      LOG.warn("Failed to record timer {}: {}", name, e.getMessage());
    }
  }
}

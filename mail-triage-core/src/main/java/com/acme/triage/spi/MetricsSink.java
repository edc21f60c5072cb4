package com.acme.triage.spi;

import java.time.Duration;

/**
 * Best-effort metrics emission. Implementations must not throw; a failed emission is logged and
 * dropped.
 */
public interface MetricsSink {

  void increment(String name, String... tags);

  void gauge(String name, double value, String... tags);

  void recordDuration(String name, Duration duration, String... tags);

  MetricsSink NOOP =
      new MetricsSink() {
        @Override
        public void increment(String name, String... tags) {}

        @Override
        public void gauge(String name, double value, String... tags) {}

        @Override
        public void recordDuration(String name, Duration duration, String... tags) {}
      };
}

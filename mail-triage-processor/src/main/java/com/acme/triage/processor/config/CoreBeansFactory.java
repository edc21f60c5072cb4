package com.acme.triage.processor.config;

import com.acme.triage.classification.ClassificationValidator;
import com.acme.triage.classification.Taxonomy;
import com.acme.triage.config.TriageConfig;
import com.acme.triage.repository.TagRepository;
import com.acme.triage.retry.CircuitBreakers;
import com.acme.triage.retry.RetryPolicy;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Context;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating core domain beans with framework-specific configuration.
 *
 * <p>The core module stays free of Micronaut; this factory does the DI wiring.
 */
@Factory
public class CoreBeansFactory {
  private static final Logger LOG = LoggerFactory.getLogger(CoreBeansFactory.class);

  /** Creates TriageConfig bean populated from application.yml triage.* properties */
  @Singleton
  @ConfigurationProperties("triage")
  public TriageConfig triageConfig() {
    return new TriageConfig();
  }

  /** Eager so that inconsistent settings fail startup. */
  @Context
  public RetryPolicy retryPolicy(TriageConfig config) {
    config.validate();
    return RetryPolicy.from(config);
  }

  @Singleton
  public CircuitBreakers circuitBreakers(TriageConfig config) {
    return new CircuitBreakers(config);
  }

  /** Category parents are read from the active tags once, at startup. */
  @Singleton
  public ClassificationValidator classificationValidator(TriageConfig config, TagRepository tags) {
    Taxonomy taxonomy = Taxonomy.of(tags.findActive());
    LOG.info(
        "Validating schema {} against {}",
        config.getSchemaVersion(),
        taxonomy.isOpen() ? "an open taxonomy" : "taxonomy parents " + taxonomy.parents());
    return new ClassificationValidator(config.getSchemaVersion(), taxonomy);
  }

  /** In-memory registry unless a monitoring backend provides one */
  @Singleton
  @Requires(missingBeans = MeterRegistry.class)
  public MeterRegistry meterRegistry() {
    return new SimpleMeterRegistry();
  }
}

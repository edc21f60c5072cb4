package com.acme.triage.processor.config;

import com.acme.triage.config.TriageConfig;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.annotation.Value;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective configuration on application startup for visibility and troubleshooting.
 * Disabled in test environment.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<StartupEvent> {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

    private final TriageConfig config;

    @Value("${db.dialect:H2}")
    private String dialect;

    @Value("${datasources.default.url:}")
    private String datasourceUrl;

    @Value("${datasources.default.maximum-pool-size:10}")
    private int maxPoolSize;

    public ConfigurationLogger(TriageConfig config) {
        this.config = config;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("                         EFFECTIVE CONFIGURATION                                ");
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("");

        LOG.info("━━━ Database Configuration ━━━");
        LOG.info("  Dialect:            {} (Selects the repository SQL flavour)", dialect);
        LOG.info("  JDBC URL:           {}", datasourceUrl);
        LOG.info("  Max Pool Size:      {} (HikariCP maximum connections)", maxPoolSize);
        LOG.info("");

        LOG.info("━━━ Workflow Configuration ━━━");
        LOG.info("  Schema Version:     {} (Tag of every stored classification)", config.getSchemaVersion());
        LOG.info("  Poll Interval:      {} (Delay between processing cycles)", config.getPollInterval());
        LOG.info("  Batch Size:         {} (Messages picked up per cycle)", config.getBatchSize());
        LOG.info("  Worker Threads:     {} (Messages classified concurrently)", config.getWorkerConcurrency());
        LOG.info("  Cycle Timeout:      {} (Outstanding work is cancelled after this)", config.getCycleTimeout());
        LOG.info("  Claim Timeout:      {} (Age after which a CLAIMED key is reclaimed)", config.getClaimTimeout());
        LOG.info("");

        LOG.info("━━━ Dependency Calls ━━━");
        LOG.info("  Call Timeout:       {} (Per classifier / retriever call)", config.getCallTimeout());
        LOG.info("  Max Attempts:       {} (Classifier attempts per message)", config.getMaxRetryAttempts());
        LOG.info("  Context Attempts:   {} (Retriever attempts before degrading)", config.getContextMaxAttempts());
        LOG.info("  Backoff:            {} .. {}", config.getInitialBackoff(), config.getMaxBackoff());
        LOG.info("  Breaker Threshold:  {} (Consecutive failures that open a breaker)", config.getBreakerFailureThreshold());
        LOG.info("  Breaker Cooldown:   {}", config.getBreakerCooldown());
        LOG.info("");

        LOG.info("━━━ Quarantine & Feedback ━━━");
        LOG.info("  Quarantine After:   {} failures, counted per {}", config.getQuarantineThreshold(), config.getTallyScope());
        LOG.info("  Feedback Interval:  {} (Batch of {})", config.getFeedbackInterval(), config.getFeedbackBatchSize());
        LOG.info("");

        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    }
}

package com.aicommerce.retraining.config;

import com.aicommerce.retraining.domain.model.RetrainConfig;
import com.aicommerce.retraining.infrastructure.dataset.BehaviorDatasetProvider;
import com.aicommerce.retraining.infrastructure.dataset.DatasetSnapshotProvider;
import com.aicommerce.retraining.infrastructure.messaging.ModelEventPublisher;
import com.aicommerce.retraining.infrastructure.metrics.RetrainingMetricsService;
import com.aicommerce.retraining.infrastructure.persistence.ModelArtifactArchive;
import com.aicommerce.retraining.infrastructure.training.ModelSerializer;
import com.aicommerce.retraining.infrastructure.training.Trainer;
import com.aicommerce.retraining.infrastructure.training.WekaBehaviorTrainer;
import com.aicommerce.retraining.infrastructure.training.WekaModelSerializer;
import com.aicommerce.retraining.repository.UserBehaviorRepository;
import com.aicommerce.retraining.service.ModelStore;
import com.aicommerce.retraining.service.PerformanceHistory;
import com.aicommerce.retraining.service.PromotionValidator;
import com.aicommerce.retraining.service.RetrainingOrchestrator;
import com.aicommerce.retraining.service.TriggerEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import java.time.Clock;
import java.time.Duration;

/**
 * Retraining configuration.
 * Binds the {@code retraining.*} properties and wires the orchestrator with its collaborators.
 *
 * Properties:
 * - retraining.min-new-samples: new records that trigger a retrain (default 100)
 * - retraining.check-interval-hours: interval between checks (default 24)
 * - retraining.performance-improvement-threshold: required relative improvement (default 0.05)
 * - retraining.max-backup-versions: rollback history per task (default 5)
 * - retraining.poll-interval: background loop wake-up period (default PT1M)
 * - retraining.min-trainable-samples: rows below which training is skipped (default 50)
 * - retraining.auto-start: start the loop once the application is ready (default false)
 *
 * @author Retraining Team
 */
@Configuration
public class RetrainingConfig {

    private static final Logger logger = LoggerFactory.getLogger(RetrainingConfig.class);

    @Value("${retraining.min-new-samples:100}")
    private int minNewSamples;

    @Value("${retraining.check-interval-hours:24}")
    private double checkIntervalHours;

    @Value("${retraining.performance-improvement-threshold:0.05}")
    private double performanceImprovementThreshold;

    @Value("${retraining.max-backup-versions:5}")
    private int maxBackupVersions;

    @Value("${retraining.poll-interval:PT1M}")
    private Duration pollInterval;

    @Value("${retraining.min-trainable-samples:50}")
    private int minTrainableSamples;

    @Value("${retraining.auto-start:false}")
    private boolean autoStart;

    /**
     * Validated retraining options. Invalid values fail application startup.
     */
    @Bean
    public RetrainConfig retrainConfig() {
        return RetrainConfig.builder()
                .minNewSamples(minNewSamples)
                .checkIntervalHours(checkIntervalHours)
                .performanceImprovementThreshold(performanceImprovementThreshold)
                .maxBackupVersions(maxBackupVersions)
                .pollInterval(pollInterval)
                .minTrainableSamples(minTrainableSamples)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ModelSerializer modelSerializer() {
        return new WekaModelSerializer();
    }

    @Bean
    public Trainer trainer(ModelSerializer modelSerializer, RetrainConfig retrainConfig) {
        return new WekaBehaviorTrainer(modelSerializer, retrainConfig.getMinTrainableSamples());
    }

    @Bean
    public DatasetSnapshotProvider datasetSnapshotProvider(UserBehaviorRepository userBehaviorRepository, Clock clock) {
        return new BehaviorDatasetProvider(userBehaviorRepository, clock);
    }

    @Bean
    public ModelStore modelStore(
            RetrainConfig retrainConfig,
            ModelArtifactArchive modelArtifactArchive,
            RetrainingMetricsService metricsService
    ) {
        return new ModelStore(retrainConfig.getMaxBackupVersions(), modelArtifactArchive, metricsService);
    }

    @Bean(destroyMethod = "shutdown")
    public RetrainingOrchestrator retrainingOrchestrator(
            RetrainConfig retrainConfig,
            DatasetSnapshotProvider datasetSnapshotProvider,
            Trainer trainer,
            ModelStore modelStore,
            PerformanceHistory performanceHistory,
            TriggerEvaluator triggerEvaluator,
            PromotionValidator promotionValidator,
            RetrainingMetricsService metricsService,
            ModelEventPublisher modelEventPublisher,
            Clock clock
    ) {
        return new RetrainingOrchestrator(
                retrainConfig,
                datasetSnapshotProvider,
                trainer,
                modelStore,
                performanceHistory,
                triggerEvaluator,
                promotionValidator,
                metricsService,
                modelEventPublisher,
                clock
        );
    }

    /**
     * Restore archived models once the context is ready, then start the loop if configured.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady(ApplicationReadyEvent event) {
        RetrainingOrchestrator orchestrator = event.getApplicationContext().getBean(RetrainingOrchestrator.class);
        orchestrator.restore();

        if (autoStart) {
            logger.info("retraining.auto-start is enabled, starting retraining service");
            orchestrator.start();
        }
    }
}

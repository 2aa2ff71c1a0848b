package com.aicommerce.retraining.infrastructure.metrics;

import com.aicommerce.retraining.domain.model.ModelTask;
import com.aicommerce.retraining.domain.model.RetrainDecision;
import com.aicommerce.retraining.domain.model.RetrainTrigger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Retraining metrics published through Micrometer.
 * Exported to CloudWatch when the CloudWatch registry is enabled.
 *
 * Key Metrics:
 * - Retrain attempts by task, decision and trigger
 * - Training duration per task
 * - Busy rejections of forced retrains
 * - Audit and artifact persistence failures
 *
 * @author Retraining Team
 */
@Service
public class RetrainingMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(RetrainingMetricsService.class);

    private static final String METRIC_PREFIX = "retraining.";

    private final MeterRegistry meterRegistry;

    public RetrainingMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record the decision of a retrain attempt.
     *
     * @param task Model task
     * @param decision Recorded decision
     * @param trigger What started the attempt
     */
    public void recordAttempt(ModelTask task, RetrainDecision decision, RetrainTrigger trigger) {
        Counter.builder(METRIC_PREFIX + "attempt")
                .tag("task", task.name())
                .tag("decision", decision.name())
                .tag("trigger", trigger.name())
                .description("Retrain attempts by outcome")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded retrain attempt: task={}, decision={}, trigger={}", task, decision, trigger);
    }

    /**
     * Record how long a training call took.
     *
     * @param task Model task
     * @param durationMs Duration in milliseconds
     */
    public void recordTrainingDuration(ModelTask task, long durationMs) {
        Timer.builder(METRIC_PREFIX + "training.duration")
                .tag("task", task.name())
                .description("Time spent in the trainer")
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record a retrain or rollback rejected because the task was busy.
     *
     * @param task Model task
     */
    public void recordBusy(ModelTask task) {
        Counter.builder(METRIC_PREFIX + "busy")
                .tag("task", task.name())
                .description("Requests rejected because a retrain was in flight")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a write that failed after its retry.
     *
     * @param target "history" or "artifact"
     */
    public void recordPersistenceFailure(String target) {
        Counter.builder(METRIC_PREFIX + "persistence.failure")
                .tag("target", target)
                .description("Durable writes that failed after retry")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded persistence failure for target: {}", target);
    }

    /**
     * Record an error in the background loop.
     *
     * @param errorType Error type
     */
    public void recordLoopError(String errorType) {
        Counter.builder(METRIC_PREFIX + "loop.error")
                .tag("error_type", errorType)
                .description("Errors caught by the retraining loop")
                .register(meterRegistry)
                .increment();
    }
}

package com.aicommerce.retraining.service;

import com.aicommerce.retraining.domain.model.CandidateModel;
import com.aicommerce.retraining.domain.model.DatasetSnapshot;
import com.aicommerce.retraining.domain.model.LifecycleState;
import com.aicommerce.retraining.domain.model.ModelArtifact;
import com.aicommerce.retraining.domain.model.ModelTask;
import com.aicommerce.retraining.domain.model.PerformanceRecord;
import com.aicommerce.retraining.domain.model.RetrainConfig;
import com.aicommerce.retraining.domain.model.RetrainDecision;
import com.aicommerce.retraining.domain.model.RetrainOutcome;
import com.aicommerce.retraining.domain.model.RetrainTrigger;
import com.aicommerce.retraining.domain.model.RetrainingStatus;
import com.aicommerce.retraining.domain.model.RetrainingStatus.TaskProgress;
import com.aicommerce.retraining.domain.model.ServiceState;
import com.aicommerce.retraining.domain.model.ServiceState.TaskState;
import com.aicommerce.retraining.exception.DataUnavailableException;
import com.aicommerce.retraining.exception.NoRollbackTargetException;
import com.aicommerce.retraining.exception.RetrainInProgressException;
import com.aicommerce.retraining.infrastructure.dataset.DatasetSnapshotProvider;
import com.aicommerce.retraining.infrastructure.messaging.ModelEventPublisher;
import com.aicommerce.retraining.infrastructure.messaging.events.ModelLifecycleEvent;
import com.aicommerce.retraining.infrastructure.metrics.RetrainingMetricsService;
import com.aicommerce.retraining.infrastructure.training.InsufficientDataException;
import com.aicommerce.retraining.infrastructure.training.Trainer;
import com.aicommerce.retraining.infrastructure.training.TrainingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives periodic and forced retraining of the churn and spending models.
 *
 * Lifecycle: STOPPED --start()--> RUNNING --stop()--> STOPPED. Both transitions are idempotent.
 * While running, a single background thread wakes every {@code pollInterval} and runs a tick
 * ({@link #evaluateAndMaybeRetrain()}) once {@code checkIntervalHours} have elapsed since the last one.
 *
 * Locking:
 * - stateLock guards the lifecycle flag, lastCheckAt and per-task bookkeeping. It is never held
 *   while training, so stop() and status() stay responsive during long retrains.
 * - one lock per task serializes training and model store mutation for that task. Scheduled ticks
 *   skip a task whose lock is taken; forced retrains and rollbacks fail fast with
 *   {@link RetrainInProgressException}.
 * Lock order is always task lock, then state lock.
 *
 * Stopping is cooperative: the flag flips and the loop is woken, but a retrain already in
 * flight runs to completion before the loop exits.
 *
 * Retrain flow for one task:
 * 1. Snapshot the dataset since the task's last successful retrain
 * 2. Scheduled only: ask the trigger evaluator; record SKIPPED if not due
 * 3. Train a candidate
 * 4. Validate the candidate metric against production
 * 5. Promote (commit, record PROMOTED, advance the task's marker) or reject (record ROLLED_BACK)
 *
 * @author Retraining Team
 */
public class RetrainingOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(RetrainingOrchestrator.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final RetrainConfig config;
    private final DatasetSnapshotProvider datasetProvider;
    private final Trainer trainer;
    private final ModelStore modelStore;
    private final PerformanceHistory history;
    private final TriggerEvaluator triggerEvaluator;
    private final PromotionValidator validator;
    private final RetrainingMetricsService metricsService;
    private final ModelEventPublisher eventPublisher;
    private final Clock clock;

    private final Map<ModelTask, ReentrantLock> taskLocks = new EnumMap<>(ModelTask.class);

    private final ReentrantLock stateLock = new ReentrantLock();
    private final Condition wakeUp = stateLock.newCondition();
    private final Map<ModelTask, TaskState> taskStates = new EnumMap<>(ModelTask.class);
    private final ExecutorService loopExecutor;
    private LifecycleState lifecycle = LifecycleState.STOPPED;
    private Instant lastCheckAt;
    private long generation;

    public RetrainingOrchestrator(
            RetrainConfig config,
            DatasetSnapshotProvider datasetProvider,
            Trainer trainer,
            ModelStore modelStore,
            PerformanceHistory history,
            TriggerEvaluator triggerEvaluator,
            PromotionValidator validator,
            RetrainingMetricsService metricsService,
            ModelEventPublisher eventPublisher,
            Clock clock
    ) {
        this.config = config;
        this.datasetProvider = datasetProvider;
        this.trainer = trainer;
        this.modelStore = modelStore;
        this.history = history;
        this.triggerEvaluator = triggerEvaluator;
        this.validator = validator;
        this.metricsService = metricsService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;

        for (ModelTask task : ModelTask.values()) {
            taskLocks.put(task, new ReentrantLock());
            taskStates.put(task, TaskState.NEVER_TRAINED);
        }

        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("retraining-loop-");
        threadFactory.setDaemon(true);
        this.loopExecutor = Executors.newSingleThreadExecutor(threadFactory);

        logger.info("Retraining orchestrator initialized with {}", config);
    }

    // ========================================
    // Lifecycle
    // ========================================

    /**
     * Start the background loop. No-op if already running.
     *
     * @return state after the call
     */
    public ServiceState start() {
        stateLock.lock();
        try {
            if (lifecycle == LifecycleState.RUNNING) {
                logger.info("Retraining service already running");
                return snapshotLocked();
            }
            lifecycle = LifecycleState.RUNNING;
            long loopGeneration = ++generation;
            // A previous loop still finishing its retrain keeps the single thread until it exits
            loopExecutor.execute(() -> runLoop(loopGeneration));
            logger.info("Retraining service started (check every {}h, poll every {})",
                    config.getCheckIntervalHours(), config.getPollInterval());
            return snapshotLocked();
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Stop the background loop. No-op if already stopped. An in-flight retrain is not interrupted.
     *
     * @return state after the call
     */
    public ServiceState stop() {
        stateLock.lock();
        try {
            if (lifecycle == LifecycleState.STOPPED) {
                logger.info("Retraining service already stopped");
                return snapshotLocked();
            }
            lifecycle = LifecycleState.STOPPED;
            wakeUp.signalAll();
            logger.info("Retraining service stopped");
            return snapshotLocked();
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Stop the loop and release its thread. Waits briefly for an in-flight retrain.
     */
    public void shutdown() {
        stop();
        loopExecutor.shutdown();
        try {
            if (!loopExecutor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Retraining loop did not exit within {}s", SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Reload archived models and resume each task's bookkeeping from its production artifact,
     * so new samples are counted from the snapshot that model was trained on rather than from
     * the beginning of the dataset. Call before {@link #start()}.
     *
     * @return state after the call
     */
    public ServiceState restore() {
        modelStore.restore();

        stateLock.lock();
        try {
            for (ModelTask task : ModelTask.values()) {
                ModelArtifact production = modelStore.getProduction(task).orElse(null);
                if (production == null) {
                    continue;
                }
                // Artifacts archived without a marker fall back to their training time
                Instant marker = production.getDatasetMarker() != null
                        ? production.getDatasetMarker()
                        : production.getTrainedAt();
                taskStates.put(task, new TaskState(production.getTrainedAt(), marker));
                logger.info("Resumed {} from v{}, counting new samples since {}",
                        task, production.getVersion(), marker);
            }
            return snapshotLocked();
        } finally {
            stateLock.unlock();
        }
    }

    public ServiceState getState() {
        stateLock.lock();
        try {
            return snapshotLocked();
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Lifecycle state plus per-task data progress.
     * New sample counts are null when the dataset provider is unavailable.
     */
    public RetrainingStatus status() {
        ServiceState state = getState();
        Map<ModelTask, TaskProgress> tasks = new EnumMap<>(ModelTask.class);
        for (ModelTask task : ModelTask.values()) {
            Long newSamples;
            try {
                newSamples = datasetProvider.countNewSamples(state.task(task).lastDatasetMarker());
            } catch (DataUnavailableException e) {
                logger.warn("Could not count new samples for {}: {}", task, e.getMessage());
                newSamples = null;
            }
            Long productionVersion = modelStore.getProduction(task).map(ModelArtifact::getVersion).orElse(null);
            tasks.put(task, new TaskProgress(newSamples, config.getMinNewSamples(), productionVersion,
                    isRetraining(task)));
        }
        return new RetrainingStatus(state, tasks);
    }

    public boolean isRetraining(ModelTask task) {
        return taskLocks.get(task).isLocked();
    }

    // ========================================
    // Retraining
    // ========================================

    /**
     * Run one tick: evaluate the trigger for every task and retrain the ones that are due.
     * Tasks whose lock is held by a forced retrain are skipped until the next tick.
     * If the dataset cannot be read, the rest of the tick is abandoned.
     *
     * @return outcomes of the tasks that were evaluated
     */
    public List<RetrainOutcome> evaluateAndMaybeRetrain() {
        Instant now = clock.instant();
        stateLock.lock();
        try {
            lastCheckAt = now;
        } finally {
            stateLock.unlock();
        }

        List<RetrainOutcome> outcomes = new ArrayList<>();
        for (ModelTask task : ModelTask.values()) {
            ReentrantLock taskLock = taskLocks.get(task);
            if (!taskLock.tryLock()) {
                logger.info("Skipping {} this tick: a retrain is already in flight", task);
                continue;
            }
            try {
                outcomes.add(scheduledAttempt(task, now));
            } catch (DataUnavailableException e) {
                logger.warn("Dataset unavailable, skipping tick until next interval: {}", e.getMessage());
                metricsService.recordLoopError("DATA_UNAVAILABLE");
                break;
            } finally {
                taskLock.unlock();
            }
        }
        return outcomes;
    }

    /**
     * Retrain a task now, bypassing the trigger.
     *
     * @param task Model task
     * @return outcome of the attempt
     * @throws RetrainInProgressException if a retrain of the task is already in flight
     */
    public RetrainOutcome forceRetrain(ModelTask task) {
        ReentrantLock taskLock = taskLocks.get(task);
        if (!taskLock.tryLock()) {
            metricsService.recordBusy(task);
            throw new RetrainInProgressException(task);
        }
        try {
            logger.info("Forced retrain requested for {}", task);
            DatasetSnapshot snapshot;
            try {
                snapshot = datasetProvider.snapshot(taskState(task).lastDatasetMarker());
            } catch (DataUnavailableException e) {
                logger.warn("Forced retrain of {} skipped, dataset unavailable: {}", task, e.getMessage());
                return record(task, RetrainTrigger.FORCED, modelStore.getProduction(task).orElse(null),
                        null, null, RetrainDecision.SKIPPED, "Dataset unavailable: " + e.getMessage());
            }
            return trainAndValidate(task, RetrainTrigger.FORCED, snapshot);
        } finally {
            taskLock.unlock();
        }
    }

    /**
     * Restore the previous production artifact of a task.
     *
     * @param task Model task
     * @return outcome recording the rollback
     * @throws RetrainInProgressException if a retrain of the task is in flight
     * @throws NoRollbackTargetException if no backup is retained
     */
    public RetrainOutcome rollbackToPrevious(ModelTask task) {
        ReentrantLock taskLock = taskLocks.get(task);
        if (!taskLock.tryLock()) {
            metricsService.recordBusy(task);
            throw new RetrainInProgressException(task);
        }
        try {
            ModelArtifact current = modelStore.getProduction(task).orElse(null);
            ModelArtifact restored = modelStore.rollbackToPrevious(task);

            eventPublisher.publish(new ModelLifecycleEvent(task, ModelLifecycleEvent.EventType.ROLLED_BACK,
                    current == null ? null : current.getVersion(), restored.getVersion(), restored.getMetrics()));

            String reason = String.format("Manual rollback to v%d", restored.getVersion());
            return record(task, RetrainTrigger.MANUAL_ROLLBACK, current, restored.getVersion(),
                    restored.getPrimaryMetric(), RetrainDecision.ROLLED_BACK, reason);
        } finally {
            taskLock.unlock();
        }
    }

    private RetrainOutcome scheduledAttempt(ModelTask task, Instant now) {
        ServiceState state = getState();
        DatasetSnapshot snapshot = datasetProvider.snapshot(state.task(task).lastDatasetMarker());

        if (!triggerEvaluator.shouldRetrain(state, task, snapshot, config, now)) {
            String reason = triggerEvaluator.explain(state, task, snapshot, config, now);
            logger.debug("Retrain of {} not due: {}", task, reason);
            return record(task, RetrainTrigger.SCHEDULED, modelStore.getProduction(task).orElse(null),
                    null, null, RetrainDecision.SKIPPED, reason);
        }

        logger.info("Retrain of {} triggered: {}", task, triggerEvaluator.explain(state, task, snapshot, config, now));
        return trainAndValidate(task, RetrainTrigger.SCHEDULED, snapshot);
    }

    // Caller holds the task lock
    private RetrainOutcome trainAndValidate(ModelTask task, RetrainTrigger trigger, DatasetSnapshot snapshot) {
        ModelArtifact production = modelStore.getProduction(task).orElse(null);

        CandidateModel candidate;
        long startTime = System.currentTimeMillis();
        try {
            candidate = trainer.train(task, snapshot);
        } catch (InsufficientDataException e) {
            logger.info("Retrain of {} skipped: {}", task, e.getMessage());
            return record(task, trigger, production, null, null, RetrainDecision.SKIPPED, e.getMessage());
        } catch (TrainingException e) {
            logger.warn("Training {} failed: {}", task, e.getMessage(), e);
            return record(task, trigger, production, null, null, RetrainDecision.ROLLED_BACK,
                    "Training failed: " + e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected error training {}", task, e);
            return record(task, trigger, production, null, null, RetrainDecision.ROLLED_BACK,
                    "Training failed: " + e);
        } finally {
            metricsService.recordTrainingDuration(task, System.currentTimeMillis() - startTime);
        }

        if (candidate == null || candidate.task() != task) {
            return record(task, trigger, production, null, null, RetrainDecision.ROLLED_BACK,
                    "Training failed: trainer returned no candidate for " + task);
        }

        long candidateVersion = modelStore.nextVersion(task);
        double candidateMetric = candidate.primaryMetric();

        String unusable = validator.checkUsable(task, candidateMetric);
        if (unusable != null) {
            logger.warn("Rejecting {} v{}: {}", task, candidateVersion, unusable);
            return record(task, trigger, production, candidateVersion, candidateMetric,
                    RetrainDecision.ROLLED_BACK, unusable);
        }

        Double productionMetric = production == null ? null : production.getPrimaryMetric();
        double threshold = config.getPerformanceImprovementThreshold();

        if (!validator.shouldPromote(task, candidateMetric, productionMetric, threshold)) {
            double improvement = validator.relativeImprovement(task, candidateMetric, productionMetric);
            String reason = String.format("Insufficient improvement: %s %.4f vs production %.4f "
                            + "(relative %.2f%%, required %.2f%%)",
                    task.getPrimaryMetric(), candidateMetric, productionMetric,
                    improvement * 100, threshold * 100);
            logger.info("Rejecting {} v{}: {}", task, candidateVersion, reason);
            return record(task, trigger, production, candidateVersion, candidateMetric,
                    RetrainDecision.ROLLED_BACK, reason);
        }

        Instant trainedAt = clock.instant();
        ModelArtifact artifact = ModelArtifact.fromCandidate(candidate, candidateVersion, trainedAt,
                snapshot.getMarker());
        modelStore.commit(task, artifact);

        stateLock.lock();
        try {
            taskStates.put(task, new TaskState(trainedAt, snapshot.getMarker()));
        } finally {
            stateLock.unlock();
        }

        eventPublisher.publish(new ModelLifecycleEvent(task, ModelLifecycleEvent.EventType.PROMOTED,
                production == null ? null : production.getVersion(), candidateVersion, artifact.getMetrics()));

        String reason = production == null
                ? String.format("First model for %s, %s %.4f", task, task.getPrimaryMetric(), candidateMetric)
                : String.format("Improved %s from %.4f to %.4f (relative %.2f%%)", task.getPrimaryMetric(),
                        productionMetric, candidateMetric,
                        validator.relativeImprovement(task, candidateMetric, productionMetric) * 100);
        return record(task, trigger, production, candidateVersion, candidateMetric, RetrainDecision.PROMOTED, reason);
    }

    private RetrainOutcome record(ModelTask task, RetrainTrigger trigger, ModelArtifact production,
                                  Long candidateVersion, Double candidateMetric,
                                  RetrainDecision decision, String reason) {
        PerformanceRecord record = PerformanceRecord.of(
                clock.instant(),
                task,
                trigger,
                production == null ? null : production.getVersion(),
                candidateVersion,
                production == null ? null : production.getPrimaryMetric(),
                candidateMetric,
                decision,
                reason
        );

        boolean persisted = history.append(record);
        metricsService.recordAttempt(task, decision, trigger);

        if (decision == RetrainDecision.SKIPPED) {
            logger.debug("{} {} {}: {}", trigger, task, decision, reason);
        } else {
            logger.info("{} {} {}: {}", trigger, task, decision, reason);
        }
        return new RetrainOutcome(record, persisted);
    }

    // ========================================
    // Background loop
    // ========================================

    private void runLoop(long loopGeneration) {
        logger.info("Retraining loop started");
        while (true) {
            boolean due;
            stateLock.lock();
            try {
                if (!isCurrentLoop(loopGeneration)) {
                    break;
                }
                due = lastCheckAt == null
                        || !clock.instant().isBefore(lastCheckAt.plus(config.getCheckInterval()));
            } finally {
                stateLock.unlock();
            }

            if (due) {
                try {
                    evaluateAndMaybeRetrain();
                } catch (RuntimeException e) {
                    logger.error("Error in retraining loop", e);
                    metricsService.recordLoopError("TICK_FAILED");
                }
            }

            stateLock.lock();
            try {
                if (!isCurrentLoop(loopGeneration)) {
                    break;
                }
                wakeUp.await(config.getPollInterval().toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Retraining loop interrupted");
                break;
            } finally {
                stateLock.unlock();
            }
        }
        logger.info("Retraining loop exited");
    }

    // Caller holds stateLock
    private boolean isCurrentLoop(long loopGeneration) {
        return lifecycle == LifecycleState.RUNNING && generation == loopGeneration;
    }

    private TaskState taskState(ModelTask task) {
        stateLock.lock();
        try {
            return taskStates.get(task);
        } finally {
            stateLock.unlock();
        }
    }

    // Caller holds stateLock
    private ServiceState snapshotLocked() {
        return new ServiceState(lifecycle, lastCheckAt, taskStates);
    }
}

package com.aicommerce.retraining.service;

import com.aicommerce.retraining.domain.model.DatasetSnapshot;
import com.aicommerce.retraining.domain.model.ModelArtifact;
import com.aicommerce.retraining.domain.model.ModelTask;
import com.aicommerce.retraining.domain.model.PerformanceRecord;
import com.aicommerce.retraining.domain.model.RetrainDecision;
import com.aicommerce.retraining.domain.model.RetrainOutcome;
import com.aicommerce.retraining.domain.model.RetrainTrigger;
import com.aicommerce.retraining.domain.model.RetrainingStatus;
import com.aicommerce.retraining.domain.model.ServiceState;
import com.aicommerce.retraining.exception.DataUnavailableException;
import com.aicommerce.retraining.exception.NoRollbackTargetException;
import com.aicommerce.retraining.infrastructure.dataset.DatasetSnapshotProvider;
import com.aicommerce.retraining.infrastructure.messaging.ModelEventPublisher;
import com.aicommerce.retraining.infrastructure.messaging.events.ModelLifecycleEvent;
import com.aicommerce.retraining.infrastructure.metrics.RetrainingMetricsService;
import com.aicommerce.retraining.infrastructure.persistence.ModelArtifactArchive;
import com.aicommerce.retraining.infrastructure.persistence.ModelArtifactArchive.ArchivedArtifact;
import com.aicommerce.retraining.infrastructure.training.InsufficientDataException;
import com.aicommerce.retraining.infrastructure.training.Trainer;
import com.aicommerce.retraining.infrastructure.training.TrainingException;
import com.aicommerce.retraining.testutil.TestDataBuilder.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.aicommerce.retraining.testutil.TestDataBuilder.NOW;
import static com.aicommerce.retraining.testutil.TestDataBuilder.artifact;
import static com.aicommerce.retraining.testutil.TestDataBuilder.candidate;
import static com.aicommerce.retraining.testutil.TestDataBuilder.config;
import static com.aicommerce.retraining.testutil.TestDataBuilder.snapshot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for RetrainingOrchestrator.
 * Drives ticks, forced retrains and rollbacks directly, without the background loop.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RetrainingOrchestrator Unit Tests")
class RetrainingOrchestratorTest {

    @Mock
    private DatasetSnapshotProvider datasetProvider;

    @Mock
    private Trainer trainer;

    @Mock
    private PerformanceHistory history;

    @Mock
    private ModelArtifactArchive archive;

    @Mock
    private RetrainingMetricsService metricsService;

    @Mock
    private ModelEventPublisher eventPublisher;

    private MutableClock clock;
    private ModelStore modelStore;
    private RetrainingOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        modelStore = new ModelStore(5, archive, metricsService);
        orchestrator = new RetrainingOrchestrator(
                config(),
                datasetProvider,
                trainer,
                modelStore,
                history,
                new TriggerEvaluator(),
                new PromotionValidator(),
                metricsService,
                eventPublisher,
                clock
        );
        lenient().when(history.append(any())).thenReturn(true);
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
    }

    private DatasetSnapshot snapshotAt(Instant marker, long newSamples) {
        return new DatasetSnapshot(marker, null, newSamples, newSamples, List.of());
    }

    private RetrainOutcome outcomeFor(List<RetrainOutcome> outcomes, ModelTask task) {
        return outcomes.stream()
                .filter(outcome -> outcome.record().getTask() == task)
                .findFirst()
                .orElseThrow();
    }

    // ========================================
    // evaluateAndMaybeRetrain() Tests
    // ========================================

    @Test
    @DisplayName("tick - No new samples records SKIPPED for every task without training")
    void tick_NoNewSamples_Skipped() throws Exception {
        // Given
        when(datasetProvider.snapshot(isNull())).thenReturn(snapshot(0));

        // When
        List<RetrainOutcome> outcomes = orchestrator.evaluateAndMaybeRetrain();

        // Then
        assertThat(outcomes).hasSize(2);
        assertThat(outcomes).allSatisfy(outcome -> {
            assertThat(outcome.decision()).isEqualTo(RetrainDecision.SKIPPED);
            assertThat(outcome.record().getTrigger()).isEqualTo(RetrainTrigger.SCHEDULED);
            assertThat(outcome.record().getReason()).isEqualTo("No new samples since last retrain");
        });
        verify(trainer, never()).train(any(), any());
        verify(history, times(2)).append(any());
        assertThat(orchestrator.getState().getLastCheckAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("tick - First trained candidates are promoted regardless of metrics")
    void tick_FirstTrain_Promoted() throws Exception {
        // Given
        Instant marker = NOW.minusSeconds(5);
        DatasetSnapshot data = snapshotAt(marker, 150);
        when(datasetProvider.snapshot(isNull())).thenReturn(data);
        when(trainer.train(ModelTask.CHURN, data)).thenReturn(candidate(ModelTask.CHURN, 0.55));
        when(trainer.train(ModelTask.SPENDING, data)).thenReturn(candidate(ModelTask.SPENDING, 250.0));

        // When
        List<RetrainOutcome> outcomes = orchestrator.evaluateAndMaybeRetrain();

        // Then
        assertThat(outcomes).extracting(RetrainOutcome::decision)
                .containsExactly(RetrainDecision.PROMOTED, RetrainDecision.PROMOTED);

        PerformanceRecord churn = outcomeFor(outcomes, ModelTask.CHURN).record();
        assertThat(churn.getPreviousVersion()).isNull();
        assertThat(churn.getCandidateVersion()).isEqualTo(1L);
        assertThat(churn.getCandidateMetric()).isEqualTo(0.55);
        assertThat(churn.getReason()).startsWith("First model for CHURN");

        assertThat(modelStore.getProduction(ModelTask.CHURN).get().getVersion()).isEqualTo(1);
        assertThat(modelStore.getProduction(ModelTask.SPENDING).get().getPrimaryMetric()).isEqualTo(250.0);

        ServiceState state = orchestrator.getState();
        assertThat(state.task(ModelTask.CHURN).lastRetrainAt()).isEqualTo(NOW);
        assertThat(state.task(ModelTask.CHURN).lastDatasetMarker()).isEqualTo(marker);
        assertThat(state.getLastRetrainAt()).isEqualTo(NOW);

        ArgumentCaptor<ModelLifecycleEvent> events = ArgumentCaptor.forClass(ModelLifecycleEvent.class);
        verify(eventPublisher, times(2)).publish(events.capture());
        assertThat(events.getAllValues()).allSatisfy(event -> {
            assertThat(event.getEventType()).isEqualTo(ModelLifecycleEvent.EventType.PROMOTED);
            assertThat(event.getProductionVersion()).isEqualTo(1L);
        });
    }

    @Test
    @DisplayName("tick - Next snapshot counts new samples from the promoted snapshot's marker")
    void tick_UsesMarkerOfLastSuccessfulRetrain() throws Exception {
        // Given
        Instant marker = NOW.minusSeconds(5);
        DatasetSnapshot data = snapshotAt(marker, 150);
        when(datasetProvider.snapshot(isNull())).thenReturn(data);
        when(trainer.train(eq(ModelTask.CHURN), any())).thenReturn(candidate(ModelTask.CHURN, 0.7));
        when(trainer.train(eq(ModelTask.SPENDING), any())).thenReturn(candidate(ModelTask.SPENDING, 100.0));
        orchestrator.evaluateAndMaybeRetrain();

        when(datasetProvider.snapshot(marker)).thenReturn(snapshot(0));
        clock.advance(Duration.ofHours(1));

        // When
        List<RetrainOutcome> outcomes = orchestrator.evaluateAndMaybeRetrain();

        // Then
        verify(datasetProvider, times(2)).snapshot(marker);
        assertThat(outcomes).extracting(RetrainOutcome::decision)
                .containsOnly(RetrainDecision.SKIPPED);
        assertThat(modelStore.getProduction(ModelTask.CHURN).orElseThrow().getDatasetMarker()).isEqualTo(marker);
    }

    @Test
    @DisplayName("tick - Candidate below the improvement threshold is rolled back, production untouched")
    void tick_InsufficientImprovement_RolledBack() throws Exception {
        // Given
        when(datasetProvider.snapshot(any())).thenReturn(snapshot(150));
        when(trainer.train(eq(ModelTask.CHURN), any()))
                .thenReturn(candidate(ModelTask.CHURN, 0.80))
                .thenReturn(candidate(ModelTask.CHURN, 0.82));
        when(trainer.train(eq(ModelTask.SPENDING), any()))
                .thenReturn(candidate(ModelTask.SPENDING, 10.0))
                .thenReturn(candidate(ModelTask.SPENDING, 9.0));
        orchestrator.evaluateAndMaybeRetrain();
        clock.advance(Duration.ofHours(1));

        // When
        List<RetrainOutcome> outcomes = orchestrator.evaluateAndMaybeRetrain();

        // Then
        RetrainOutcome churn = outcomeFor(outcomes, ModelTask.CHURN);
        assertThat(churn.decision()).isEqualTo(RetrainDecision.ROLLED_BACK);
        assertThat(churn.record().getPreviousVersion()).isEqualTo(1L);
        assertThat(churn.record().getCandidateVersion()).isEqualTo(2L);
        assertThat(churn.record().getReason()).startsWith("Insufficient improvement");
        assertThat(modelStore.getProduction(ModelTask.CHURN).get().getVersion()).isEqualTo(1);
        assertThat(orchestrator.getState().task(ModelTask.CHURN).lastRetrainAt()).isEqualTo(NOW);

        // 10.0 -> 9.0 is a 10% MSE reduction
        RetrainOutcome spending = outcomeFor(outcomes, ModelTask.SPENDING);
        assertThat(spending.decision()).isEqualTo(RetrainDecision.PROMOTED);
        assertThat(modelStore.getProduction(ModelTask.SPENDING).get().getVersion()).isEqualTo(2);
        assertThat(modelStore.backups(ModelTask.SPENDING)).hasSize(1);
    }

    @Test
    @DisplayName("tick - Insufficient data is SKIPPED, training failures are ROLLED_BACK, tick continues")
    void tick_TrainerFailures() throws Exception {
        // Given
        when(datasetProvider.snapshot(any())).thenReturn(snapshot(150));
        when(trainer.train(eq(ModelTask.CHURN), any()))
                .thenThrow(new InsufficientDataException(ModelTask.CHURN, 10, 50));
        when(trainer.train(eq(ModelTask.SPENDING), any()))
                .thenThrow(new TrainingException(ModelTask.SPENDING, "singular matrix"));

        // When
        List<RetrainOutcome> outcomes = orchestrator.evaluateAndMaybeRetrain();

        // Then
        assertThat(outcomeFor(outcomes, ModelTask.CHURN).decision()).isEqualTo(RetrainDecision.SKIPPED);
        RetrainOutcome spending = outcomeFor(outcomes, ModelTask.SPENDING);
        assertThat(spending.decision()).isEqualTo(RetrainDecision.ROLLED_BACK);
        assertThat(spending.record().getReason()).contains("singular matrix");
        assertThat(modelStore.getProduction(ModelTask.SPENDING)).isEmpty();
        assertThat(orchestrator.getState().task(ModelTask.SPENDING).lastRetrainAt()).isNull();
        verify(eventPublisher, never()).publish(any());
    }

    @Test
    @DisplayName("tick - Unexpected runtime error in the trainer is ROLLED_BACK")
    void tick_TrainerRuntimeError() throws Exception {
        when(datasetProvider.snapshot(any())).thenReturn(snapshot(150));
        when(trainer.train(eq(ModelTask.CHURN), any())).thenThrow(new IllegalStateException("boom"));
        when(trainer.train(eq(ModelTask.SPENDING), any())).thenReturn(candidate(ModelTask.SPENDING, 5.0));

        List<RetrainOutcome> outcomes = orchestrator.evaluateAndMaybeRetrain();

        assertThat(outcomeFor(outcomes, ModelTask.CHURN).decision()).isEqualTo(RetrainDecision.ROLLED_BACK);
        assertThat(outcomeFor(outcomes, ModelTask.SPENDING).decision()).isEqualTo(RetrainDecision.PROMOTED);
    }

    @Test
    @DisplayName("tick - NaN metric is rolled back even for the first model")
    void tick_NaNMetric_RolledBack() throws Exception {
        when(datasetProvider.snapshot(any())).thenReturn(snapshot(150));
        when(trainer.train(eq(ModelTask.CHURN), any())).thenReturn(candidate(ModelTask.CHURN, Double.NaN));
        when(trainer.train(eq(ModelTask.SPENDING), any())).thenReturn(candidate(ModelTask.SPENDING, -1.0));

        List<RetrainOutcome> outcomes = orchestrator.evaluateAndMaybeRetrain();

        RetrainOutcome churn = outcomeFor(outcomes, ModelTask.CHURN);
        assertThat(churn.decision()).isEqualTo(RetrainDecision.ROLLED_BACK);
        assertThat(churn.record().getCandidateMetric()).isNull();
        assertThat(churn.record().getReason()).contains("not a finite number");
        assertThat(outcomeFor(outcomes, ModelTask.SPENDING).decision()).isEqualTo(RetrainDecision.ROLLED_BACK);
        assertThat(modelStore.getProduction(ModelTask.CHURN)).isEmpty();
        assertThat(modelStore.getProduction(ModelTask.SPENDING)).isEmpty();
    }

    @Test
    @DisplayName("tick - Unavailable dataset ends the tick without records")
    void tick_DataUnavailable() throws Exception {
        when(datasetProvider.snapshot(any())).thenThrow(new DataUnavailableException("db down", null));

        List<RetrainOutcome> outcomes = orchestrator.evaluateAndMaybeRetrain();

        assertThat(outcomes).isEmpty();
        verify(history, never()).append(any());
        verify(trainer, never()).train(any(), any());
        verify(metricsService).recordLoopError("DATA_UNAVAILABLE");
        assertThat(orchestrator.getState().getLastCheckAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("tick - Audit write failure does not block promotion")
    void tick_AuditFailure_StillPromotes() throws Exception {
        when(history.append(any())).thenReturn(false);
        when(datasetProvider.snapshot(any())).thenReturn(snapshot(150));
        when(trainer.train(eq(ModelTask.CHURN), any())).thenReturn(candidate(ModelTask.CHURN, 0.7));
        when(trainer.train(eq(ModelTask.SPENDING), any())).thenReturn(candidate(ModelTask.SPENDING, 5.0));

        List<RetrainOutcome> outcomes = orchestrator.evaluateAndMaybeRetrain();

        assertThat(outcomes).allSatisfy(outcome -> {
            assertThat(outcome.promoted()).isTrue();
            assertThat(outcome.auditPersisted()).isFalse();
        });
        assertThat(modelStore.getProduction(ModelTask.CHURN)).isPresent();
    }

    // ========================================
    // forceRetrain() Tests
    // ========================================

    @Test
    @DisplayName("forceRetrain - Bypasses the trigger and records a FORCED attempt")
    void forceRetrain_BypassesTrigger() throws Exception {
        // Given
        when(datasetProvider.snapshot(isNull())).thenReturn(snapshot(0));
        when(trainer.train(eq(ModelTask.SPENDING), any())).thenReturn(candidate(ModelTask.SPENDING, 42.0));

        // When
        RetrainOutcome outcome = orchestrator.forceRetrain(ModelTask.SPENDING);

        // Then
        assertThat(outcome.decision()).isEqualTo(RetrainDecision.PROMOTED);
        assertThat(outcome.record().getTrigger()).isEqualTo(RetrainTrigger.FORCED);
        assertThat(outcome.auditPersisted()).isTrue();
        verify(trainer, never()).train(eq(ModelTask.CHURN), any());
        verify(metricsService).recordAttempt(ModelTask.SPENDING, RetrainDecision.PROMOTED, RetrainTrigger.FORCED);
    }

    @Test
    @DisplayName("forceRetrain - Unavailable dataset is recorded as SKIPPED")
    void forceRetrain_DataUnavailable() {
        when(datasetProvider.snapshot(any())).thenThrow(new DataUnavailableException("db down", null));

        RetrainOutcome outcome = orchestrator.forceRetrain(ModelTask.CHURN);

        assertThat(outcome.decision()).isEqualTo(RetrainDecision.SKIPPED);
        assertThat(outcome.record().getReason()).contains("db down");
    }

    // ========================================
    // rollbackToPrevious() Tests
    // ========================================

    @Test
    @DisplayName("rollbackToPrevious - Restores previous version and records MANUAL_ROLLBACK")
    void rollback_RestoresPrevious() throws Exception {
        // Given
        when(datasetProvider.snapshot(any())).thenReturn(snapshot(150));
        when(trainer.train(eq(ModelTask.CHURN), any()))
                .thenReturn(candidate(ModelTask.CHURN, 0.70))
                .thenReturn(candidate(ModelTask.CHURN, 0.90));
        orchestrator.forceRetrain(ModelTask.CHURN);
        orchestrator.forceRetrain(ModelTask.CHURN);

        // When
        RetrainOutcome outcome = orchestrator.rollbackToPrevious(ModelTask.CHURN);

        // Then
        assertThat(outcome.decision()).isEqualTo(RetrainDecision.ROLLED_BACK);
        assertThat(outcome.record().getTrigger()).isEqualTo(RetrainTrigger.MANUAL_ROLLBACK);
        assertThat(outcome.record().getPreviousVersion()).isEqualTo(2L);
        assertThat(outcome.record().getCandidateVersion()).isEqualTo(1L);
        assertThat(modelStore.getProduction(ModelTask.CHURN).get().getVersion()).isEqualTo(1);

        ArgumentCaptor<ModelLifecycleEvent> events = ArgumentCaptor.forClass(ModelLifecycleEvent.class);
        verify(eventPublisher, times(3)).publish(events.capture());
        ModelLifecycleEvent last = events.getAllValues().get(2);
        assertThat(last.getEventType()).isEqualTo(ModelLifecycleEvent.EventType.ROLLED_BACK);
        assertThat(last.getPreviousVersion()).isEqualTo(2L);
        assertThat(last.getProductionVersion()).isEqualTo(1L);
    }

    @Test
    @DisplayName("rollbackToPrevious - No backup throws and records nothing")
    void rollback_NoBackup() {
        assertThatThrownBy(() -> orchestrator.rollbackToPrevious(ModelTask.SPENDING))
                .isInstanceOf(NoRollbackTargetException.class);

        verify(history, never()).append(any());
    }

    // ========================================
    // restore() Tests
    // ========================================

    @Test
    @DisplayName("restore - Tick after restart counts from the restored marker and does not retrain")
    void restore_ThenTick_NoNewSamples() throws Exception {
        // Given: CHURN v3 archived as production, trained on a snapshot taken at its marker
        ModelArtifact v3 = artifact(ModelTask.CHURN, 3, 0.9);
        Instant marker = v3.getDatasetMarker();
        when(archive.load(ModelTask.CHURN)).thenReturn(List.of(
                new ArchivedArtifact(v3, true),
                new ArchivedArtifact(artifact(ModelTask.CHURN, 2, 0.85), false)));
        when(archive.load(ModelTask.SPENDING)).thenReturn(List.of());
        when(datasetProvider.snapshot(marker)).thenReturn(snapshotAt(NOW, 0));
        when(datasetProvider.snapshot(isNull())).thenReturn(snapshot(0));

        // When
        ServiceState restored = orchestrator.restore();
        List<RetrainOutcome> outcomes = orchestrator.evaluateAndMaybeRetrain();

        // Then
        assertThat(restored.task(ModelTask.CHURN).lastDatasetMarker()).isEqualTo(marker);
        assertThat(restored.task(ModelTask.CHURN).lastRetrainAt()).isEqualTo(v3.getTrainedAt());
        assertThat(restored.task(ModelTask.SPENDING)).isEqualTo(ServiceState.TaskState.NEVER_TRAINED);

        verify(datasetProvider).snapshot(marker);
        verify(datasetProvider).snapshot(isNull());
        verify(trainer, never()).train(any(), any());
        assertThat(outcomeFor(outcomes, ModelTask.CHURN).decision()).isEqualTo(RetrainDecision.SKIPPED);
        assertThat(outcomeFor(outcomes, ModelTask.CHURN).record().getPreviousVersion()).isEqualTo(3L);
        assertThat(orchestrator.getState().getLastRetrainAt()).isEqualTo(v3.getTrainedAt());
    }

    @Test
    @DisplayName("restore - Artifact archived without a marker resumes from its training time")
    void restore_MissingMarker_FallsBackToTrainedAt() {
        // Given
        Instant trainedAt = NOW.minusSeconds(600);
        ModelArtifact legacy = new ModelArtifact(ModelTask.SPENDING, 7, new byte[] {7},
                Map.of("mse", 9.0), 120, trainedAt, null);
        when(archive.load(ModelTask.CHURN)).thenReturn(List.of());
        when(archive.load(ModelTask.SPENDING)).thenReturn(List.of(new ArchivedArtifact(legacy, true)));

        // When
        ServiceState restored = orchestrator.restore();

        // Then
        assertThat(restored.task(ModelTask.SPENDING).lastDatasetMarker()).isEqualTo(trainedAt);
        assertThat(restored.task(ModelTask.SPENDING).lastRetrainAt()).isEqualTo(trainedAt);
        assertThat(modelStore.getProduction(ModelTask.SPENDING)).contains(legacy);
    }

    // ========================================
    // status() Tests
    // ========================================

    @Test
    @DisplayName("status - Reports new samples, production version and progress per task")
    void status_ReportsProgress() throws Exception {
        // Given
        when(datasetProvider.snapshot(any())).thenReturn(snapshot(150));
        when(trainer.train(eq(ModelTask.CHURN), any())).thenReturn(candidate(ModelTask.CHURN, 0.7));
        orchestrator.forceRetrain(ModelTask.CHURN);

        when(datasetProvider.countNewSamples(NOW)).thenReturn(40L);
        when(datasetProvider.countNewSamples(isNull())).thenThrow(new DataUnavailableException("db down", null));

        // When
        RetrainingStatus status = orchestrator.status();

        // Then
        assertThat(status.state().isRunning()).isFalse();
        RetrainingStatus.TaskProgress churn = status.tasks().get(ModelTask.CHURN);
        assertThat(churn.newSampleCount()).isEqualTo(40L);
        assertThat(churn.progress()).isEqualTo(0.4);
        assertThat(churn.productionVersion()).isEqualTo(1L);
        assertThat(churn.retraining()).isFalse();

        RetrainingStatus.TaskProgress spending = status.tasks().get(ModelTask.SPENDING);
        assertThat(spending.newSampleCount()).isNull();
        assertThat(spending.progress()).isNull();
        assertThat(spending.productionVersion()).isNull();
    }
}

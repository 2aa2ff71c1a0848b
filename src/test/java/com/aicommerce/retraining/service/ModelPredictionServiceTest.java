package com.aicommerce.retraining.service;

import com.aicommerce.retraining.domain.model.BehaviorFeatures;
import com.aicommerce.retraining.domain.model.CandidateModel;
import com.aicommerce.retraining.domain.model.ModelArtifact;
import com.aicommerce.retraining.domain.model.ModelTask;
import com.aicommerce.retraining.domain.model.Prediction;
import com.aicommerce.retraining.exception.ModelLoadException;
import com.aicommerce.retraining.exception.ResourceNotFoundException;
import com.aicommerce.retraining.infrastructure.metrics.RetrainingMetricsService;
import com.aicommerce.retraining.infrastructure.persistence.ModelArtifactArchive;
import com.aicommerce.retraining.infrastructure.training.WekaBehaviorTrainer;
import com.aicommerce.retraining.infrastructure.training.WekaModelSerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.aicommerce.retraining.testutil.TestDataBuilder.NOW;
import static com.aicommerce.retraining.testutil.TestDataBuilder.artifact;
import static com.aicommerce.retraining.testutil.TestDataBuilder.behaviorRows;
import static com.aicommerce.retraining.testutil.TestDataBuilder.snapshot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

/**
 * Tests for ModelPredictionService against real Weka models.
 */
@DisplayName("ModelPredictionService Tests")
class ModelPredictionServiceTest {

    private static final BehaviorFeatures ENGAGED = new BehaviorFeatures(1, 24, 36, 5, 0, 1000.0, 41.0);
    private static final BehaviorFeatures IDLE = new BehaviorFeatures(2, 3, 4, 0, 0, 60.0, 20.0);

    private ModelStore modelStore;
    private WekaBehaviorTrainer trainer;
    private ModelPredictionService predictionService;

    @BeforeEach
    void setUp() {
        WekaModelSerializer serializer = new WekaModelSerializer();
        modelStore = new ModelStore(5, mock(ModelArtifactArchive.class), mock(RetrainingMetricsService.class));
        trainer = new WekaBehaviorTrainer(serializer, 50);
        predictionService = new ModelPredictionService(modelStore, serializer);
    }

    private ModelArtifact promote(ModelTask task, List<BehaviorFeatures> rows) throws Exception {
        CandidateModel candidate = trainer.train(task, snapshot(NOW, rows.size(), rows));
        ModelArtifact artifact = ModelArtifact.fromCandidate(candidate, modelStore.nextVersion(task), NOW, NOW);
        modelStore.commit(task, artifact);
        return artifact;
    }

    @Test
    @DisplayName("predict - No production model is reported as not found")
    void predict_NoProduction() {
        assertThatThrownBy(() -> predictionService.predict(ModelTask.CHURN, ENGAGED))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("CHURN - Scores a churn probability, lower for engaged users")
    void predict_Churn() throws Exception {
        // Given
        promote(ModelTask.CHURN, behaviorRows(200));

        // When
        Prediction engaged = predictionService.predict(ModelTask.CHURN, ENGAGED);
        Prediction idle = predictionService.predict(ModelTask.CHURN, IDLE);

        // Then
        assertThat(engaged.task()).isEqualTo(ModelTask.CHURN);
        assertThat(engaged.version()).isEqualTo(1L);
        assertThat(engaged.score()).isBetween(0.0, 1.0);
        assertThat(idle.score()).isBetween(0.0, 1.0);
        assertThat(engaged.score()).isLessThan(idle.score());
    }

    @Test
    @DisplayName("SPENDING - Scores a numeric spending estimate")
    void predict_Spending() throws Exception {
        promote(ModelTask.SPENDING, behaviorRows(200));

        Prediction prediction = predictionService.predict(ModelTask.SPENDING, ENGAGED);

        assertThat(prediction.version()).isEqualTo(1L);
        assertThat(Double.isFinite(prediction.score())).isTrue();
    }

    @Test
    @DisplayName("predict - Switches to the new version after promotion and back after rollback")
    void predict_FollowsProductionVersion() throws Exception {
        // Given
        promote(ModelTask.CHURN, behaviorRows(200));
        assertThat(predictionService.predict(ModelTask.CHURN, ENGAGED).version()).isEqualTo(1L);

        // When
        promote(ModelTask.CHURN, behaviorRows(240));

        // Then
        assertThat(predictionService.predict(ModelTask.CHURN, ENGAGED).version()).isEqualTo(2L);

        modelStore.rollbackToPrevious(ModelTask.CHURN);
        assertThat(predictionService.predict(ModelTask.CHURN, ENGAGED).version()).isEqualTo(1L);
    }

    @Test
    @DisplayName("predict - Unreadable model state fails with ModelLoadException")
    void predict_CorruptState() {
        // Given: artifact bytes that are not a serialized classifier
        modelStore.commit(ModelTask.SPENDING, artifact(ModelTask.SPENDING, 1, 10.0));

        // When / Then
        assertThatThrownBy(() -> predictionService.predict(ModelTask.SPENDING, ENGAGED))
                .isInstanceOf(ModelLoadException.class)
                .satisfies(ex -> {
                    ModelLoadException loadException = (ModelLoadException) ex;
                    assertThat(loadException.getTask()).isEqualTo(ModelTask.SPENDING);
                    assertThat(loadException.getVersion()).isEqualTo(1L);
                });
    }
}

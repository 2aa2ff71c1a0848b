package com.aicommerce.retraining.api.controller;

import com.aicommerce.retraining.api.dto.ModelInfoResponse;
import com.aicommerce.retraining.api.dto.PerformanceRecordResponse;
import com.aicommerce.retraining.api.dto.PredictionRequest;
import com.aicommerce.retraining.api.dto.PredictionResponse;
import com.aicommerce.retraining.domain.model.ModelArtifact;
import com.aicommerce.retraining.domain.model.ModelTask;
import com.aicommerce.retraining.exception.InvalidRequestException;
import com.aicommerce.retraining.exception.ResourceNotFoundException;
import com.aicommerce.retraining.service.ModelPredictionService;
import com.aicommerce.retraining.service.ModelStore;
import com.aicommerce.retraining.service.RetrainingOrchestrator;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for production models, their rollback history and scoring.
 *
 * @author Retraining Team
 */
@RestController
@RequestMapping("/api/v1/models")
public class ModelController {

    private static final Logger logger = LoggerFactory.getLogger(ModelController.class);

    private final ModelStore modelStore;
    private final RetrainingOrchestrator orchestrator;
    private final ModelPredictionService predictionService;

    public ModelController(
            ModelStore modelStore,
            RetrainingOrchestrator orchestrator,
            ModelPredictionService predictionService
    ) {
        this.modelStore = modelStore;
        this.orchestrator = orchestrator;
        this.predictionService = predictionService;
    }

    /**
     * Production models of all tasks that have one.
     */
    @GetMapping
    public ResponseEntity<List<ModelInfoResponse>> getProductionModels() {
        List<ModelInfoResponse> models = new ArrayList<>();
        for (ModelTask task : ModelTask.values()) {
            modelStore.getProduction(task).ifPresent(artifact -> models.add(ModelInfoResponse.fromArtifact(artifact)));
        }
        return ResponseEntity.ok(models);
    }

    @GetMapping("/{task}")
    public ResponseEntity<ModelInfoResponse> getProductionModel(@PathVariable String task) {
        ModelTask modelTask = parseTask(task);
        ModelArtifact production = modelStore.getProduction(modelTask)
                .orElseThrow(() -> new ResourceNotFoundException("ProductionModel", modelTask.name()));
        return ResponseEntity.ok(ModelInfoResponse.fromArtifact(production));
    }

    /**
     * Retained rollback targets of a task, newest first.
     */
    @GetMapping("/{task}/backups")
    public ResponseEntity<List<ModelInfoResponse>> getBackups(@PathVariable String task) {
        ModelTask modelTask = parseTask(task);
        List<ModelInfoResponse> backups = modelStore.backups(modelTask).stream()
                .map(ModelInfoResponse::fromArtifact)
                .collect(Collectors.toList());
        return ResponseEntity.ok(backups);
    }

    /**
     * Restore the previous production model of a task.
     *
     * @param task Model task
     * @return record of the rollback; 409 if no backup exists or the task is retraining
     */
    @PostMapping("/{task}/rollback")
    public ResponseEntity<PerformanceRecordResponse> rollback(@PathVariable String task) {
        ModelTask modelTask = parseTask(task);
        logger.info("Manual rollback requested for {}", modelTask);
        return ResponseEntity.ok(PerformanceRecordResponse.fromOutcome(orchestrator.rollbackToPrevious(modelTask)));
    }

    /**
     * Score one user with the production model of a task.
     */
    @PostMapping("/{task}/predict")
    public ResponseEntity<PredictionResponse> predict(
            @PathVariable String task,
            @Valid @RequestBody PredictionRequest request
    ) {
        ModelTask modelTask = parseTask(task);
        return ResponseEntity.ok(PredictionResponse.fromPrediction(
                predictionService.predict(modelTask, request.toFeatures())));
    }

    private static ModelTask parseTask(String value) {
        try {
            return ModelTask.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage(), e);
        }
    }
}
